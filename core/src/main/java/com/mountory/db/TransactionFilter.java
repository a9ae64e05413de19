package com.mountory.db;

import java.util.Collection;
import java.util.UUID;

/**
 * Filter dimensions for {@link Transactions#query}. A null or empty collection skips the
 * dimension. A null element matches transactions without that reference.
 */
public record TransactionFilter(
    Collection<UUID> userIds, Collection<UUID> activityIds, Collection<UUID> locationIds) {

  /** A filter matching every transaction. */
  public static TransactionFilter all() {
    return new TransactionFilter(null, null, null);
  }

  public TransactionFilter withUserIds(Collection<UUID> userIds) {
    return new TransactionFilter(userIds, activityIds, locationIds);
  }

  public TransactionFilter withActivityIds(Collection<UUID> activityIds) {
    return new TransactionFilter(userIds, activityIds, locationIds);
  }

  public TransactionFilter withLocationIds(Collection<UUID> locationIds) {
    return new TransactionFilter(userIds, activityIds, locationIds);
  }
}

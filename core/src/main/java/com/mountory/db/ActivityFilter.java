package com.mountory.db;

import java.util.Collection;
import java.util.UUID;

/**
 * Filter dimensions for {@link Activities#query}. A null or empty collection skips the dimension.
 * A null element in {@code locationIds} or {@code parentIds} matches activities without a
 * location or parent.
 *
 * @param userIds participants; matches activities with at least one of them
 * @param locationIds locations, may contain null
 * @param parentIds parent activities, may contain null
 * @param types activity types; matches activities with at least one of them
 */
public record ActivityFilter(
    Collection<UUID> userIds,
    Collection<UUID> locationIds,
    Collection<UUID> parentIds,
    Collection<ActivityType> types) {

  /** A filter matching every activity. */
  public static ActivityFilter all() {
    return new ActivityFilter(null, null, null, null);
  }

  public ActivityFilter withUserIds(Collection<UUID> userIds) {
    return new ActivityFilter(userIds, locationIds, parentIds, types);
  }

  public ActivityFilter withLocationIds(Collection<UUID> locationIds) {
    return new ActivityFilter(userIds, locationIds, parentIds, types);
  }

  public ActivityFilter withParentIds(Collection<UUID> parentIds) {
    return new ActivityFilter(userIds, locationIds, parentIds, types);
  }

  public ActivityFilter withTypes(Collection<ActivityType> types) {
    return new ActivityFilter(userIds, locationIds, parentIds, types);
  }
}

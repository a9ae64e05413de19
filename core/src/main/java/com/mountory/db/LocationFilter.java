package com.mountory.db;

import java.util.Collection;
import java.util.UUID;

/**
 * Filter dimensions for {@link Locations#query}. A null or empty collection skips the dimension;
 * a null element in {@code parentIds} matches top-level locations.
 */
public record LocationFilter(Collection<LocationType> types, Collection<UUID> parentIds) {

  /** A filter matching every location. */
  public static LocationFilter all() {
    return new LocationFilter(null, null);
  }
}

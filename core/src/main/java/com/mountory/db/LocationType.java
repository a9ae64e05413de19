package com.mountory.db;

import com.mountory.db.util.DatabaseEnum;
import java.util.Locale;

/**
 * Kinds of locations.
 *
 * <p>IMPORTANT: Keep this enum in sync with the location_type CHECK constraint in 01-schema.sql.
 */
public enum LocationType implements DatabaseEnum {
  OTHER,
  REGION,
  AREA,
  CRAG,
  /** Point of interest, e.g. a hut or a peak. */
  POI,
  CITY,
  GYM;

  @Override
  public String toDatabaseValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Creates an enum value from its database string representation.
   *
   * @throws IllegalArgumentException If the value doesn't match any enum constant
   */
  public static LocationType fromDatabaseValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}

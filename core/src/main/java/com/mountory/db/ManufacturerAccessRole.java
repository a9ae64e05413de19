package com.mountory.db;

import com.mountory.db.util.DatabaseEnum;
import java.util.Locale;

/**
 * Roles a user can hold for a manufacturer, strongest first.
 *
 * <p>IMPORTANT: Keep this enum in sync with the role CHECK constraint in 01-schema.sql.
 */
public enum ManufacturerAccessRole implements DatabaseEnum {
  OWNER,
  ADMIN,
  EDITOR,
  SHARED;

  @Override
  public String toDatabaseValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Creates an enum value from its database string representation.
   *
   * @throws IllegalArgumentException If the value doesn't match any enum constant
   */
  public static ManufacturerAccessRole fromDatabaseValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}

package com.mountory.db;

import com.mountory.db.util.DatabaseEnum;
import java.util.Locale;

/**
 * Categories of financial transactions.
 *
 * <p>IMPORTANT: Keep this enum in sync with the category CHECK constraint in 01-schema.sql.
 */
public enum TransactionCategory implements DatabaseEnum {
  TRAVEL,
  ACCOMMODATION,
  FOOD,
  EQUIPMENT,
  FEES,
  OTHER;

  @Override
  public String toDatabaseValue() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Creates an enum value from its database string representation.
   *
   * @throws IllegalArgumentException If the value doesn't match any enum constant
   */
  public static TransactionCategory fromDatabaseValue(String value) {
    return valueOf(value.toUpperCase(Locale.ROOT));
  }
}

package com.mountory.db.util;

/**
 * An enum stored as a string column.
 *
 * <p>IMPORTANT: the database values are part of the schema. Keep implementations in sync with the
 * CHECK constraints in 01-schema.sql.
 */
public interface DatabaseEnum {

  /** Returns the string stored in the database for this constant. */
  String toDatabaseValue();
}

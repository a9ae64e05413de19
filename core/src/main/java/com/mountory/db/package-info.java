/**
 * The database layer of the tracker.
 *
 * <p>The layer follows a consistent pattern:
 *
 * <ul>
 *   <li>Each table has a Java record class (e.g., {@code Activity}, {@code Location})
 *   <li>Each record class has a corresponding helper class with a plural name (e.g., {@code
 *       Activities}, {@code Locations})
 *   <li>Helper classes provide static methods taking an open {@code java.sql.Connection}
 *   <li>Database operations return {@code StatusOr<T>} to handle either success with a value or
 *       failure with a status
 * </ul>
 *
 * <p>Partial updates are described with {@code FieldUpdate} values and resolved by {@code
 * UpdateResolver}; list operations go through {@code EntityQueryAssembler} and return a page
 * together with the total count.
 */
package com.mountory.db;

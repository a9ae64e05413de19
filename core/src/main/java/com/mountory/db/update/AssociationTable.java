package com.mountory.db.update;

import java.util.Objects;

/**
 * A join table keyed by {@code (ownerColumn, targetColumn)}.
 *
 * @param table the table name
 * @param ownerColumn the column referencing the owning entity
 * @param targetColumn the column holding the associated value or identifier
 */
public record AssociationTable(String table, String ownerColumn, String targetColumn) {
  public AssociationTable {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(ownerColumn, "ownerColumn");
    Objects.requireNonNull(targetColumn, "targetColumn");
  }
}

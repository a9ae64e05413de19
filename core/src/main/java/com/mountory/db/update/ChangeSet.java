package com.mountory.db.update;

import com.google.common.base.Joiner;
import com.mountory.common.status.StatusOr;
import com.mountory.db.util.DbUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * The column assignments of one resolved partial update, in the order they were added. A column
 * is either absent or assigned a value, where the value may be {@code null}.
 */
public final class ChangeSet {
  private static final ChangeSet EMPTY = new ChangeSet(Collections.emptyMap());

  private final Map<String, Object> assignments;

  ChangeSet(Map<String, Object> assignments) {
    this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
  }

  /** Returns a change-set without assignments. */
  public static ChangeSet empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return assignments.isEmpty();
  }

  public int size() {
    return assignments.size();
  }

  /** Returns true if the column is assigned, including assignments to null. */
  public boolean contains(String column) {
    return assignments.containsKey(column);
  }

  /** Returns the value assigned to the column, or null if it is unassigned or assigned null. */
  @Nullable
  public Object get(String column) {
    return assignments.get(column);
  }

  /** Returns the assignments as an unmodifiable, ordered map. Values may be null. */
  @Nonnull
  public Map<String, Object> asMap() {
    return assignments;
  }

  /** Returns the SQL for the update statement, without executing it. */
  @Nonnull
  String toUpdateSql(String table, String idColumn) {
    List<String> setClauses = new ArrayList<>();
    for (String column : assignments.keySet()) {
      setClauses.add(column + " = ?");
    }
    return "UPDATE " + table + " SET " + Joiner.on(", ").join(setClauses)
        + " WHERE " + idColumn + " = ?";
  }

  /**
   * Applies the change-set to one row as a single {@code UPDATE} statement. An empty change-set
   * issues no statement at all. A missing row is not an error: the statement affects zero rows.
   *
   * @param conn an open JDBC connection
   * @param table the table to update
   * @param idColumn the primary key column
   * @param id the primary key of the row
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public StatusOr<Integer> executeUpdate(
      Connection conn, String table, String idColumn, UUID id) {
    if (assignments.isEmpty()) {
      return StatusOr.ofValue(0);
    }
    String sql = toUpdateSql(table, idColumn);
    Logger.debug("Updating {} {} with columns {}", table, id, assignments.keySet());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      int next = DbUtil.setParameters(stmt, 1, new ArrayList<>(assignments.values()));
      stmt.setObject(next, id);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ChangeSet)) {
      return false;
    }
    return assignments.equals(((ChangeSet) obj).assignments);
  }

  @Override
  public int hashCode() {
    return assignments.hashCode();
  }

  @Override
  public String toString() {
    return "ChangeSet" + assignments;
  }
}

package com.mountory.db.update;

import com.google.common.collect.ImmutableList;
import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import com.mountory.db.util.DbUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Keeps the rows of an {@link AssociationTable} for one owner in line with a desired set.
 *
 * <p>None of these methods commit. They are meant to run inside the caller's transaction (see
 * {@link DbUtil#inTransaction}), so a failure half way leaves the previous rows in place once the
 * transaction is rolled back.
 */
public final class AssociationSetSynchronizer {

  private AssociationSetSynchronizer() {
    // Utility class
  }

  /** Reads one association value from column 1 of the current row. */
  @FunctionalInterface
  public interface TargetReader<T> {
    T read(ResultSet rs) throws SQLException;
  }

  /**
   * Replaces all association rows of the owner with the given targets.
   *
   * <p>A {@code null} collection means "leave the association alone" and issues no statement. An
   * empty collection removes every row. Duplicate targets are inserted once.
   *
   * @param conn an open JDBC connection, inside a transaction
   * @param table the association table
   * @param ownerId the owning row
   * @param targets the desired targets, or null
   * @return OK, or the status of the failing statement
   */
  @Nonnull
  public static Status replaceAll(
      Connection conn, AssociationTable table, UUID ownerId, @Nullable Collection<?> targets) {
    if (targets == null) {
      return Status.ok();
    }
    Set<Object> distinct = new LinkedHashSet<>(targets);
    if (distinct.contains(null)) {
      return Status.invalidArgument(table.targetColumn() + " values cannot contain null");
    }

    StatusOr<Integer> deletedOr = removeAll(conn, table, ownerId);
    if (deletedOr.isNotOk()) {
      return deletedOr.getStatus();
    }
    if (distinct.isEmpty()) {
      return Status.ok();
    }

    String sql =
        "INSERT INTO " + table.table()
            + " (" + table.ownerColumn() + ", " + table.targetColumn() + ") VALUES (?, ?)";
    Logger.debug(
        "Replacing {} rows of {} {}: {} removed, {} to insert",
        table.table(), table.ownerColumn(), ownerId, deletedOr.getValue(), distinct.size());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      for (Object target : distinct) {
        stmt.setObject(1, ownerId);
        DbUtil.setParameter(stmt, 2, target);
        stmt.addBatch();
      }
      stmt.executeBatch();
      return Status.ok();
    } catch (SQLException e) {
      return Status.fromException(e);
    }
  }

  /**
   * Inserts one association row, or updates its value column if the row already exists.
   *
   * @param conn an open JDBC connection
   * @param table the association table
   * @param ownerId the owning row
   * @param targetId the associated row
   * @param valueColumn the column carrying the value of the association
   * @param value the value to store
   * @return OK, or the status of the failing statement
   */
  @Nonnull
  public static Status upsert(
      Connection conn,
      AssociationTable table,
      UUID ownerId,
      Object targetId,
      String valueColumn,
      Object value) {
    String sql =
        """
        INSERT INTO %1$s (%2$s, %3$s, %4$s)
        VALUES (?, ?, ?)
        ON CONFLICT (%2$s, %3$s)
        DO UPDATE SET %4$s = excluded.%4$s
        """
            .formatted(table.table(), table.ownerColumn(), table.targetColumn(), valueColumn);
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, ownerId);
      DbUtil.setParameter(stmt, 2, targetId);
      DbUtil.setParameter(stmt, 3, value);
      stmt.executeUpdate();
      return Status.ok();
    } catch (SQLException e) {
      return Status.fromException(e);
    }
  }

  /**
   * Removes the association row between the owner and one target.
   *
   * @return StatusOr containing the number of removed rows (0 or 1) or an error
   */
  @Nonnull
  public static StatusOr<Integer> remove(
      Connection conn, AssociationTable table, UUID ownerId, Object targetId) {
    String sql =
        "DELETE FROM " + table.table()
            + " WHERE " + table.ownerColumn() + " = ? AND " + table.targetColumn() + " = ?";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, ownerId);
      DbUtil.setParameter(stmt, 2, targetId);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Removes all association rows of the owner.
   *
   * @return StatusOr containing the number of removed rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> removeAll(
      Connection conn, AssociationTable table, UUID ownerId) {
    String sql = "DELETE FROM " + table.table() + " WHERE " + table.ownerColumn() + " = ?";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, ownerId);
      return StatusOr.ofValue(stmt.executeUpdate());
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads the targets currently associated with the owner, in target order.
   *
   * @param reader reads the target from column 1
   * @return StatusOr containing the targets or an error
   */
  @Nonnull
  public static <T> StatusOr<List<T>> loadTargets(
      Connection conn, AssociationTable table, UUID ownerId, TargetReader<T> reader) {
    String sql =
        "SELECT " + table.targetColumn() + " FROM " + table.table()
            + " WHERE " + table.ownerColumn() + " = ? ORDER BY " + table.targetColumn();
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, ownerId);
      try (ResultSet rs = stmt.executeQuery()) {
        List<T> result = new ArrayList<>();
        while (rs.next()) {
          result.add(reader.read(rs));
        }
        return StatusOr.ofValue(ImmutableList.copyOf(result));
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }
}

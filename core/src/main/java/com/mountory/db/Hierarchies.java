package com.mountory.db;

import com.google.common.collect.ImmutableList;
import com.mountory.common.status.StatusOr;
import com.mountory.db.update.AssociationTable;
import com.mountory.db.util.DbUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import javax.annotation.Nonnull;

/**
 * Recursive queries over the self-referencing {@code parent_id} column of the location and
 * activity tables.
 *
 * <p>Parent links are not checked for cycles on write. Every walk keeps the ids it has visited
 * and stops when it reaches one of them again, so a cycle ends the walk instead of looping.
 */
final class Hierarchies {

  private Hierarchies() {
    // Utility class
  }

  /**
   * Loads the ancestors of a row, nearest first. A row that is its own parent has no ancestors.
   *
   * @param conn an open JDBC connection
   * @param table the self-referencing table
   * @param labelColumn the column reported as the ancestor's name
   * @param id the row whose ancestors to load
   * @return StatusOr containing the ancestors, empty for a root or an unknown id
   */
  @Nonnull
  static StatusOr<List<ParentPathEntry>> loadParentPath(
      Connection conn, String table, String labelColumn, UUID id) {
    String sql =
        """
        WITH RECURSIVE ancestors (id, label, parent_id, depth, visited) AS (
          SELECT p.id, p.%2$s, p.parent_id, 1, ARRAY[c.id, p.id]
            FROM %1$s c
            JOIN %1$s p ON p.id = c.parent_id
           WHERE c.id = ? AND p.id <> c.id
          UNION ALL
          SELECT p.id, p.%2$s, p.parent_id, a.depth + 1, a.visited || p.id
            FROM ancestors a
            JOIN %1$s p ON p.id = a.parent_id
           WHERE NOT p.id = ANY(a.visited)
        )
        SELECT id, label
          FROM ancestors
         ORDER BY depth
        """
            .formatted(table, labelColumn);
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        List<ParentPathEntry> path = new ArrayList<>();
        while (rs.next()) {
          StatusOr<UUID> idOr = DbUtil.getUuid(rs, "id");
          if (idOr.isNotOk()) {
            return StatusOr.ofStatus(idOr.getStatus());
          }
          path.add(new ParentPathEntry(idOr.getValue(), rs.getString("label")));
        }
        return StatusOr.ofValue(ImmutableList.copyOf(path));
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads the distinct activity types of all descendants of a row: its children, their
   * children, and so on. The types of the row itself are not included.
   *
   * @param conn an open JDBC connection
   * @param table the self-referencing table
   * @param types the type association table of {@code table}
   * @param id the row whose descendants to inspect
   * @return StatusOr containing the types in database value order
   */
  @Nonnull
  static StatusOr<List<ActivityType>> loadDescendantTypes(
      Connection conn, String table, AssociationTable types, UUID id) {
    String sql =
        """
        WITH RECURSIVE descendants (id, visited) AS (
          SELECT c.id, ARRAY[c.parent_id, c.id]
            FROM %1$s c
           WHERE c.parent_id = ? AND c.id <> c.parent_id
          UNION ALL
          SELECT c.id, d.visited || c.id
            FROM descendants d
            JOIN %1$s c ON c.parent_id = d.id
           WHERE NOT c.id = ANY(d.visited)
        )
        SELECT DISTINCT t.%4$s
          FROM %2$s t
          JOIN descendants d ON d.id = t.%3$s
         ORDER BY t.%4$s
        """
            .formatted(table, types.table(), types.ownerColumn(), types.targetColumn());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        List<ActivityType> result = new ArrayList<>();
        while (rs.next()) {
          result.add(ActivityType.fromDatabaseValue(rs.getString(1)));
        }
        return StatusOr.ofValue(ImmutableList.copyOf(result));
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }
}

package com.mountory.db;

import com.google.common.collect.ImmutableList;
import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import com.mountory.db.query.EntityQueryAssembler;
import com.mountory.db.query.NullableInFilterBuilder;
import com.mountory.db.query.QueryResult;
import com.mountory.db.query.SqlPredicate;
import com.mountory.db.update.AssociationSetSynchronizer;
import com.mountory.db.update.AssociationTable;
import com.mountory.db.update.ChangeSet;
import com.mountory.db.update.UpdateResolver;
import com.mountory.db.util.DbUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/** DAO helper class for the 'equipment_manufacturer' table and its access roles. */
public final class Manufacturers {

  static final AssociationTable ACCESS =
      new AssociationTable("equipment_manufacturer_access", "manufacturer_id", "user_id");

  private static final String COLUMNS =
      """
      equipment_manufacturer.id, equipment_manufacturer.name,
      equipment_manufacturer.short_name, equipment_manufacturer.description,
      equipment_manufacturer.website, equipment_manufacturer.hidden""";

  private static final String SELECT = "SELECT " + COLUMNS + " FROM equipment_manufacturer";

  private Manufacturers() {
    // Utility class
  }

  /**
   * Creates a manufacturer.
   *
   * @param conn an open JDBC connection
   * @param create the fields of the new manufacturer
   * @return StatusOr containing the stored manufacturer, INVALID_ARGUMENT if the name is missing
   */
  @Nonnull
  public static StatusOr<Manufacturer> create(Connection conn, ManufacturerCreate create) {
    if (create.name() == null || create.name().isEmpty()) {
      return StatusOr.ofStatus(Status.emptyField("name"));
    }
    Manufacturer manufacturer =
        new Manufacturer(
            UUID.randomUUID(),
            create.name(),
            DbUtil.emptyToNull(create.shortName()),
            DbUtil.emptyToNull(create.description()),
            DbUtil.emptyToNull(create.website()),
            create.hidden());
    String sql =
        """
        INSERT INTO equipment_manufacturer
               (id, name, short_name, description, website, hidden)
        VALUES (?, ?, ?, ?, ?, ?)
        """;
    Logger.info("Creating manufacturer {} '{}'", manufacturer.id(), manufacturer.name());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, manufacturer.id());
      stmt.setString(2, manufacturer.name());
      DbUtil.setParameter(stmt, 3, manufacturer.shortName());
      DbUtil.setParameter(stmt, 4, manufacturer.description());
      DbUtil.setParameter(stmt, 5, manufacturer.website());
      stmt.setBoolean(6, manufacturer.hidden());
      stmt.executeUpdate();
      return StatusOr.ofValue(manufacturer);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads a single manufacturer by ID.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the manufacturer to load
   * @return StatusOr containing an Optional Manufacturer or an error
   */
  @Nonnull
  public static StatusOr<Optional<Manufacturer>> loadById(Connection conn, UUID id) {
    return loadOne(conn, SqlPredicate.eq("equipment_manufacturer.id", id));
  }

  /**
   * Loads a manufacturer by its exact name. Names are not unique; if several manufacturers match,
   * the one with the lowest ID is returned.
   *
   * @param conn an open JDBC connection
   * @param name the name to look for
   * @param hidden if present, only manufacturers with this visibility match
   * @return StatusOr containing an Optional Manufacturer or an error
   */
  @Nonnull
  public static StatusOr<Optional<Manufacturer>> loadByName(
      Connection conn, String name, Optional<Boolean> hidden) {
    SqlPredicate predicate = SqlPredicate.eq("equipment_manufacturer.name", name);
    if (hidden.isPresent()) {
      predicate = predicate.and(SqlPredicate.eq("equipment_manufacturer.hidden", hidden.get()));
    }
    return loadOne(conn, predicate);
  }

  private static StatusOr<Optional<Manufacturer>> loadOne(
      Connection conn, SqlPredicate predicate) {
    String sql =
        SELECT + " WHERE " + predicate.sql() + " ORDER BY equipment_manufacturer.id LIMIT 1";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      DbUtil.setParameters(stmt, 1, predicate.params());
      try (ResultSet rs = stmt.executeQuery()) {
        if (rs.next()) {
          StatusOr<Manufacturer> manufacturerOr = extractManufacturer(rs);
          if (manufacturerOr.isNotOk()) {
            return StatusOr.ofStatus(manufacturerOr.getStatus());
          }
          return StatusOr.ofValue(Optional.of(manufacturerOr.getValue()));
        }
        return StatusOr.ofValue(Optional.empty());
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Queries manufacturers ordered by name, case-insensitively, together with the role of the
   * filter's user. See {@link ManufacturerFilter} for how the filter fields combine.
   *
   * @param conn an open JDBC connection
   * @param filter the user, visibility and roles to filter by
   * @param skip the number of matching manufacturers to skip
   * @param limit the maximum number of manufacturers to return
   * @return StatusOr containing the page and the total count, or an error
   */
  @Nonnull
  public static StatusOr<QueryResult<ManufacturerWithRole>> query(
      Connection conn, ManufacturerFilter filter, int skip, int limit) {
    EntityQueryAssembler<ManufacturerWithRole> assembler;
    if (filter.userId() == null) {
      assembler =
          EntityQueryAssembler.select(
              "SELECT " + COLUMNS + ", CAST(NULL AS VARCHAR) AS access_role"
                  + " FROM equipment_manufacturer",
              Manufacturers::extractManufacturerWithRole);
    } else {
      assembler =
          EntityQueryAssembler.select(
              "SELECT " + COLUMNS + ", user_access.role AS access_role"
                  + " FROM equipment_manufacturer"
                  + " LEFT JOIN equipment_manufacturer_access user_access"
                  + " ON user_access.manufacturer_id = equipment_manufacturer.id"
                  + " AND user_access.user_id = ?",
              List.of(filter.userId()),
              Manufacturers::extractManufacturerWithRole);
    }
    accessPredicate(filter).ifPresent(assembler::where);
    assembler.orderBy("lower(equipment_manufacturer.name)", "equipment_manufacturer.id");
    return assembler.execute(conn, skip, limit);
  }

  /**
   * Builds the visibility and role predicate. All dimensions combine with AND, except for a user
   * without visibility and role filter: then public manufacturers OR those with a role match.
   */
  @Nonnull
  static Optional<SqlPredicate> accessPredicate(ManufacturerFilter filter) {
    Optional<SqlPredicate> hidden =
        Optional.ofNullable(filter.hidden())
            .map(h -> SqlPredicate.eq("equipment_manufacturer.hidden", h));
    if (filter.userId() == null) {
      return hidden;
    }

    SqlPredicate isPublic = SqlPredicate.of("equipment_manufacturer.hidden = FALSE");
    SqlPredicate hasRole = SqlPredicate.of("user_access.role IS NOT NULL");
    Collection<ManufacturerAccessRole> roles = filter.accessRoles();
    if (roles == null || roles.isEmpty()) {
      if (filter.hidden() == null) {
        return Optional.of(isPublic.or(hasRole));
      }
      if (filter.hidden()) {
        return Optional.of(hidden.get().and(hasRole));
      }
      return hidden;
    }

    List<SqlPredicate> roleMatches = new ArrayList<>();
    List<ManufacturerAccessRole> concrete =
        roles.stream().filter(Objects::nonNull).distinct().toList();
    NullableInFilterBuilder.build("user_access.role", concrete).ifPresent(roleMatches::add);
    if (roles.stream().anyMatch(Objects::isNull)) {
      roleMatches.add(SqlPredicate.of("user_access.role IS NULL").and(isPublic));
    }
    SqlPredicate rolePredicate = SqlPredicate.or(roleMatches).orElseThrow();
    return Optional.of(hidden.map(h -> h.and(rolePredicate)).orElse(rolePredicate));
  }

  /**
   * Applies a partial update. Clearing the name or the visibility flag is rejected.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the manufacturer to update
   * @param update the fields to change
   * @return OK, INVALID_ARGUMENT for a rejected field, or the status of the failing statement
   */
  @Nonnull
  public static Status update(Connection conn, UUID id, ManufacturerUpdate update) {
    StatusOr<ChangeSet> changesOr =
        UpdateResolver.create()
            .requiredText("name", update.name())
            .optionalText("short_name", update.shortName())
            .optionalText("description", update.description())
            .optionalText("website", update.website())
            .requiredValue("hidden", update.hidden())
            .resolve();
    if (changesOr.isNotOk()) {
      return changesOr.getStatus();
    }
    ChangeSet changes = changesOr.getValue();
    if (changes.isEmpty()) {
      return Status.ok();
    }
    Logger.info("Updating manufacturer {}: {}", id, changes);
    return changes.executeUpdate(conn, "equipment_manufacturer", "id", id).getStatus();
  }

  /**
   * Deletes a manufacturer by ID, together with its access roles.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the manufacturer to delete
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> delete(Connection conn, UUID id) {
    String sql =
        """
        DELETE FROM equipment_manufacturer
         WHERE id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      int rowsAffected = stmt.executeUpdate();
      return StatusOr.ofValue(rowsAffected);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Grants a role to a user. An existing role of the user is replaced.
   *
   * @param conn an open JDBC connection
   * @param manufacturerId the manufacturer
   * @param userId the user
   * @param role the role to grant
   * @return OK, or the status of the failing statement
   */
  @Nonnull
  public static Status setAccess(
      Connection conn, UUID manufacturerId, UUID userId, ManufacturerAccessRole role) {
    Logger.info("Granting {} on manufacturer {} to user {}", role, manufacturerId, userId);
    return AssociationSetSynchronizer.upsert(conn, ACCESS, manufacturerId, userId, "role", role);
  }

  /**
   * Grants several roles in one transaction. If one grant fails, none is applied.
   *
   * @param conn an open JDBC connection
   * @param accesses the grants
   * @return OK, or the status of the first failing grant
   */
  @Nonnull
  public static Status setAccesses(Connection conn, Collection<ManufacturerAccess> accesses) {
    return DbUtil.inTransactionStatus(
        conn,
        c -> {
          for (ManufacturerAccess access : accesses) {
            Status status = setAccess(c, access.manufacturerId(), access.userId(), access.role());
            if (status.isError()) {
              Logger.error("Failed to grant access {}: {}", access, status);
              return StatusOr.ofStatus(status);
            }
          }
          return DbUtil.done();
        });
  }

  /**
   * Loads the role of a user for a manufacturer.
   *
   * @return StatusOr containing the role if the user has one, or an error
   */
  @Nonnull
  public static StatusOr<Optional<ManufacturerAccessRole>> loadUserAccess(
      Connection conn, UUID manufacturerId, UUID userId) {
    String sql =
        """
        SELECT role
          FROM equipment_manufacturer_access
         WHERE manufacturer_id = ? AND user_id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, manufacturerId);
      stmt.setObject(2, userId);
      try (ResultSet rs = stmt.executeQuery()) {
        if (rs.next()) {
          return StatusOr.ofValue(
              Optional.of(ManufacturerAccessRole.fromDatabaseValue(rs.getString("role"))));
        }
        return StatusOr.ofValue(Optional.empty());
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads all users with a role for a manufacturer, ordered by email.
   *
   * @return StatusOr containing the roles and users, or an error
   */
  @Nonnull
  public static StatusOr<List<UserAccess>> loadUserAccesses(
      Connection conn, UUID manufacturerId) {
    String sql =
        """
        SELECT a.role, u.id, u.email, u.hashed_password, u.full_name, u.is_active, u.is_superuser
          FROM equipment_manufacturer_access a
          JOIN "user" u ON u.id = a.user_id
         WHERE a.manufacturer_id = ?
         ORDER BY u.email, u.id
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, manufacturerId);
      try (ResultSet rs = stmt.executeQuery()) {
        List<UserAccess> result = new ArrayList<>();
        while (rs.next()) {
          StatusOr<User> userOr = Users.extractUser(rs);
          if (userOr.isNotOk()) {
            return StatusOr.ofStatus(userOr.getStatus());
          }
          result.add(
              new UserAccess(
                  ManufacturerAccessRole.fromDatabaseValue(rs.getString("role")),
                  userOr.getValue()));
        }
        return StatusOr.ofValue(ImmutableList.copyOf(result));
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Removes the role of a user for a manufacturer.
   *
   * @return StatusOr containing the number of removed roles or an error
   */
  @Nonnull
  public static StatusOr<Integer> removeAccess(
      Connection conn, UUID manufacturerId, UUID userId) {
    Logger.info("Removing access of user {} to manufacturer {}", userId, manufacturerId);
    return AssociationSetSynchronizer.remove(conn, ACCESS, manufacturerId, userId);
  }

  /**
   * Removes all roles for a manufacturer.
   *
   * @return StatusOr containing the number of removed roles or an error
   */
  @Nonnull
  public static StatusOr<Integer> removeAccesses(Connection conn, UUID manufacturerId) {
    Logger.info("Removing all accesses to manufacturer {}", manufacturerId);
    return AssociationSetSynchronizer.removeAll(conn, ACCESS, manufacturerId);
  }

  /** Extracts a Manufacturer from the current row of a ResultSet. */
  @Nonnull
  static StatusOr<Manufacturer> extractManufacturer(ResultSet rs) throws SQLException {
    StatusOr<UUID> idOr = DbUtil.getUuid(rs, "id");
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }
    return StatusOr.ofValue(
        new Manufacturer(
            idOr.getValue(),
            rs.getString("name"),
            rs.getString("short_name"),
            rs.getString("description"),
            rs.getString("website"),
            rs.getBoolean("hidden")));
  }

  private static StatusOr<ManufacturerWithRole> extractManufacturerWithRole(ResultSet rs)
      throws SQLException {
    StatusOr<Manufacturer> manufacturerOr = extractManufacturer(rs);
    if (manufacturerOr.isNotOk()) {
      return StatusOr.ofStatus(manufacturerOr.getStatus());
    }
    String role = rs.getString("access_role");
    return StatusOr.ofValue(
        new ManufacturerWithRole(
            manufacturerOr.getValue(),
            role == null ? null : ManufacturerAccessRole.fromDatabaseValue(role)));
  }
}

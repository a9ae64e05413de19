package com.mountory.db;

import com.google.common.collect.ImmutableSet;
import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import com.mountory.db.query.EntityQueryAssembler;
import com.mountory.db.query.NullableInFilterBuilder;
import com.mountory.db.query.QueryResult;
import com.mountory.db.query.SqlPredicate;
import com.mountory.db.update.AssociationSetSynchronizer;
import com.mountory.db.update.AssociationTable;
import com.mountory.db.update.ChangeSet;
import com.mountory.db.update.Reference;
import com.mountory.db.update.UpdateResolver;
import com.mountory.db.util.DbUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/** DAO helper class for the 'location' table, its activity types and user favorites. */
public final class Locations {

  static final AssociationTable ACTIVITY_TYPES =
      new AssociationTable("location_activity_type", "location_id", "activity_type");
  static final AssociationTable FAVORITES =
      new AssociationTable("location_user_favorite", "location_id", "user_id");

  private static final String SELECT =
      """
      SELECT location.id, location.name, location.abbreviation, location.website,
             location.location_type, location.parent_id
        FROM location
      """;

  private Locations() {
    // Utility class
  }

  /**
   * Creates a location together with its activity types in one transaction.
   *
   * @param conn an open JDBC connection
   * @param create the fields of the new location
   * @return StatusOr containing the stored location, INVALID_ARGUMENT if the name is missing
   */
  @Nonnull
  public static StatusOr<Location> create(Connection conn, LocationCreate create) {
    if (create.name() == null || create.name().isEmpty()) {
      return StatusOr.ofStatus(Status.emptyField("name"));
    }
    UUID id = UUID.randomUUID();
    Location location =
        new Location(
            id,
            create.name(),
            DbUtil.emptyToNull(create.abbreviation()),
            DbUtil.emptyToNull(create.website()),
            create.locationType(),
            Reference.idOrNull(create.parent()),
            ImmutableSet.copyOf(create.activityTypes()));
    Logger.info("Creating location {} '{}'", id, create.name());
    StatusOr<Location> createdOr =
        DbUtil.inTransaction(
            conn,
            c -> {
              String sql =
                  """
                  INSERT INTO location
                         (id, name, abbreviation, website, location_type, parent_id)
                  VALUES (?, ?, ?, ?, ?, ?)
                  """;
              try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setObject(1, id);
                stmt.setString(2, location.name());
                DbUtil.setParameter(stmt, 3, location.abbreviation());
                DbUtil.setParameter(stmt, 4, location.website());
                DbUtil.setParameter(stmt, 5, location.locationType());
                DbUtil.setParameter(stmt, 6, location.parentId());
                stmt.executeUpdate();
              }
              Status typesStatus =
                  AssociationSetSynchronizer.replaceAll(
                      c, ACTIVITY_TYPES, id, location.activityTypes());
              if (typesStatus.isError()) {
                return StatusOr.ofStatus(typesStatus);
              }
              return StatusOr.ofValue(location);
            });
    if (createdOr.isNotOk()) {
      Logger.error("Failed to create location {}: {}", id, createdOr.getStatus());
    }
    return createdOr;
  }

  /**
   * Loads a single location by ID, with its activity types.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the location to load
   * @return StatusOr containing an Optional Location or an error
   */
  @Nonnull
  public static StatusOr<Optional<Location>> loadById(Connection conn, UUID id) {
    String sql = SELECT + " WHERE location.id = ?";
    return DbUtil.inReadSnapshot(
        conn,
        c -> {
          try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setObject(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
              if (!rs.next()) {
                return StatusOr.ofValue(Optional.empty());
              }
              StatusOr<Location> locationOr = extractLocation(rs);
              if (locationOr.isNotOk()) {
                return StatusOr.ofStatus(locationOr.getStatus());
              }
              return withActivityTypes(c, locationOr.getValue()).map(Optional::of);
            }
          }
        });
  }

  /**
   * Queries locations ordered by name, case-insensitively.
   *
   * @param conn an open JDBC connection
   * @param filter the filter dimensions
   * @param skip the number of matching locations to skip
   * @param limit the maximum number of locations to return
   * @return StatusOr containing the page of locations and the total count, or an error
   */
  @Nonnull
  public static StatusOr<QueryResult<Location>> query(
      Connection conn, LocationFilter filter, int skip, int limit) {
    EntityQueryAssembler<Location> assembler =
        EntityQueryAssembler.select(SELECT, Locations::extractLocation)
            .where(NullableInFilterBuilder.build("location.location_type", filter.types()))
            .where(NullableInFilterBuilder.build("location.parent_id", filter.parentIds()));
    return execute(conn, assembler, skip, limit);
  }

  /** Queries locations matching a predicate, ordered by name. */
  @Nonnull
  static StatusOr<QueryResult<Location>> queryWhere(
      Connection conn, SqlPredicate predicate, int skip, int limit) {
    return execute(
        conn,
        EntityQueryAssembler.select(SELECT, Locations::extractLocation).where(predicate),
        skip,
        limit);
  }

  private static StatusOr<QueryResult<Location>> execute(
      Connection conn, EntityQueryAssembler<Location> assembler, int skip, int limit) {
    assembler.orderBy("lower(location.name)", "location.id");
    return DbUtil.inReadSnapshot(
        conn, c -> assembler.execute(c, skip, limit).flatMap(page -> withActivityTypes(c, page)));
  }

  /**
   * Applies a partial update, see {@link Activities#update} for the general rules.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the location to update
   * @param update the fields to change
   * @return OK, INVALID_ARGUMENT if name or type is cleared, or the status of the failing
   *     statement
   */
  @Nonnull
  public static Status update(Connection conn, UUID id, LocationUpdate update) {
    StatusOr<ChangeSet> changesOr =
        UpdateResolver.create()
            .requiredText("name", update.name())
            .optionalText("abbreviation", update.abbreviation())
            .optionalText("website", update.website())
            .requiredEnumValue("location_type", update.locationType())
            .reference("parent_id", update.parent())
            .resolve();
    if (changesOr.isNotOk()) {
      return changesOr.getStatus();
    }
    ChangeSet changes = changesOr.getValue();
    if (changes.isEmpty() && update.activityTypes().isEmpty()) {
      return Status.ok();
    }

    Logger.info("Updating location {}: {}", id, changes);
    Status status =
        DbUtil.inTransactionStatus(
            conn,
            c -> {
              StatusOr<Integer> updatedOr = changes.executeUpdate(c, "location", "id", id);
              if (updatedOr.isNotOk()) {
                return StatusOr.ofStatus(updatedOr.getStatus());
              }
              if (update.activityTypes().isEmpty() || !exists(c, id)) {
                return DbUtil.done();
              }
              return DbUtil.done(
                  AssociationSetSynchronizer.replaceAll(
                      c, ACTIVITY_TYPES, id, update.activityTypes().get()));
            });
    if (status.isError()) {
      Logger.error("Failed to update location {}: {}", id, status);
    }
    return status;
  }

  /**
   * Deletes a location by ID. Child locations, activities and transactions keep existing with
   * their reference set to null.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the location to delete
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> delete(Connection conn, UUID id) {
    String sql =
        """
        DELETE FROM location
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
   * Marks a location as a favorite of a user. Marking it twice is not an error.
   *
   * @param conn an open JDBC connection
   * @param locationId the location
   * @param userId the user
   * @return StatusOr containing the favorite or an error
   */
  @Nonnull
  public static StatusOr<LocationFavorite> addFavorite(
      Connection conn, UUID locationId, UUID userId) {
    String sql =
        """
        INSERT INTO location_user_favorite (location_id, user_id)
        VALUES (?, ?)
        ON CONFLICT (location_id, user_id) DO NOTHING
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, locationId);
      stmt.setObject(2, userId);
      stmt.executeUpdate();
      return StatusOr.ofValue(new LocationFavorite(locationId, userId));
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads the favorite marker of a user for a location.
   *
   * @return StatusOr containing the favorite if the user marked the location, or an error
   */
  @Nonnull
  public static StatusOr<Optional<LocationFavorite>> loadFavorite(
      Connection conn, UUID locationId, UUID userId) {
    String sql =
        """
        SELECT location_id, user_id
          FROM location_user_favorite
         WHERE location_id = ? AND user_id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, locationId);
      stmt.setObject(2, userId);
      try (ResultSet rs = stmt.executeQuery()) {
        if (rs.next()) {
          return StatusOr.ofValue(Optional.of(new LocationFavorite(locationId, userId)));
        }
        return StatusOr.ofValue(Optional.empty());
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Removes the favorite marker of a user for a location.
   *
   * @return StatusOr containing the number of removed rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> removeFavorite(Connection conn, UUID locationId, UUID userId) {
    return AssociationSetSynchronizer.remove(conn, FAVORITES, locationId, userId);
  }

  /**
   * Loads the favorite locations of a user, ordered by name.
   *
   * @param conn an open JDBC connection
   * @param userId the user
   * @return StatusOr containing the locations or an error
   */
  @Nonnull
  public static StatusOr<List<Location>> loadFavoritesByUserId(Connection conn, UUID userId) {
    SqlPredicate isFavorite =
        SqlPredicate.of(
            "EXISTS (SELECT 1 FROM location_user_favorite f"
                + " WHERE f.location_id = location.id AND f.user_id = ?)",
            userId);
    return queryWhere(conn, isFavorite, 0, Integer.MAX_VALUE).map(QueryResult::getItems);
  }

  /**
   * Loads the ancestors of a location, nearest first. A cycle in the parent chain ends the path
   * at the first repeated location.
   *
   * @param conn an open JDBC connection
   * @param id the location whose ancestors to load
   * @return StatusOr containing the ancestors, empty for a top-level or unknown location
   */
  @Nonnull
  public static StatusOr<List<ParentPathEntry>> loadParentPath(Connection conn, UUID id) {
    return Hierarchies.loadParentPath(conn, "location", "name", id);
  }

  /**
   * Loads the distinct activity types offered anywhere below a location, collected recursively
   * from its child locations. The location's own types are not included.
   *
   * @param conn an open JDBC connection
   * @param id the location whose sub-locations to inspect
   * @return StatusOr containing the types in database value order, empty for a leaf location
   */
  @Nonnull
  public static StatusOr<List<ActivityType>> loadSubLocationTypes(Connection conn, UUID id) {
    return Hierarchies.loadDescendantTypes(conn, "location", ACTIVITY_TYPES, id);
  }

  static boolean exists(Connection conn, UUID id) throws SQLException {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM location WHERE id = ?")) {
      stmt.setObject(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next();
      }
    }
  }

  private static StatusOr<QueryResult<Location>> withActivityTypes(
      Connection conn, QueryResult<Location> page) {
    List<Location> items = new ArrayList<>(page.getItems().size());
    for (Location location : page.getItems()) {
      StatusOr<Location> loadedOr = withActivityTypes(conn, location);
      if (loadedOr.isNotOk()) {
        return StatusOr.ofStatus(loadedOr.getStatus());
      }
      items.add(loadedOr.getValue());
    }
    return StatusOr.ofValue(new QueryResult<>(items, page.getTotalCount()));
  }

  private static StatusOr<Location> withActivityTypes(Connection conn, Location location) {
    StatusOr<List<ActivityType>> typesOr =
        AssociationSetSynchronizer.loadTargets(
            conn,
            ACTIVITY_TYPES,
            location.id(),
            rs -> ActivityType.fromDatabaseValue(rs.getString(1)));
    if (typesOr.isNotOk()) {
      return StatusOr.ofStatus(typesOr.getStatus());
    }
    return StatusOr.ofValue(
        new Location(
            location.id(),
            location.name(),
            location.abbreviation(),
            location.website(),
            location.locationType(),
            location.parentId(),
            ImmutableSet.copyOf(typesOr.getValue())));
  }

  /** Extracts a Location without activity types from the current row of a ResultSet. */
  @Nonnull
  static StatusOr<Location> extractLocation(ResultSet rs) throws SQLException {
    StatusOr<UUID> idOr = DbUtil.getUuid(rs, "id");
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }

    String name = rs.getString("name");
    String abbreviation = rs.getString("abbreviation");
    String website = rs.getString("website");
    LocationType locationType = LocationType.fromDatabaseValue(rs.getString("location_type"));

    StatusOr<Optional<UUID>> parentIdOr = DbUtil.getOptionalUuid(rs, "parent_id");
    if (parentIdOr.isNotOk()) {
      return StatusOr.ofStatus(parentIdOr.getStatus());
    }

    return StatusOr.ofValue(
        new Location(
            idOr.getValue(),
            name,
            abbreviation,
            website,
            locationType,
            parentIdOr.getValue().orElse(null),
            Set.of()));
  }
}

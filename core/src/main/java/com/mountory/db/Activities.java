package com.mountory.db;

import com.google.common.collect.ImmutableList;
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
import com.mountory.db.update.DateTimes;
import com.mountory.db.update.Reference;
import com.mountory.db.update.UpdateResolver;
import com.mountory.db.util.DbUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/** DAO helper class for the 'activity' table and its association tables. */
public final class Activities {

  static final AssociationTable TYPES =
      new AssociationTable("activity_type_association", "activity_id", "activity_type");
  static final AssociationTable USERS =
      new AssociationTable("activity_user_link", "activity_id", "user_id");

  private static final String SELECT =
      """
      SELECT activity.id, activity.title, activity.description, activity.start,
             activity.duration_micros, activity.location_id, activity.parent_id
        FROM activity
      """;

  private Activities() {
    // Utility class
  }

  /**
   * Creates an activity together with its types and participants in one transaction.
   *
   * @param conn an open JDBC connection
   * @param create the fields of the new activity
   * @return StatusOr containing the stored activity as {@link #loadById} reads it back, or
   *     INVALID_ARGUMENT if the title is missing or the duration is negative
   */
  @Nonnull
  public static StatusOr<Activity> create(Connection conn, ActivityCreate create) {
    if (create.title() == null || create.title().isEmpty()) {
      return StatusOr.ofStatus(Status.emptyField("title"));
    }
    Instant start = null;
    if (create.start() != null) {
      StatusOr<Instant> startOr = DateTimes.toUtc("start", create.start());
      if (startOr.isNotOk()) {
        return StatusOr.ofStatus(startOr.getStatus());
      }
      start = startOr.getValue();
    }
    Duration duration = null;
    if (create.duration() != null) {
      StatusOr<Duration> durationOr = DateTimes.toStoredDuration("duration", create.duration());
      if (durationOr.isNotOk()) {
        return StatusOr.ofStatus(durationOr.getStatus());
      }
      duration = durationOr.getValue();
    }

    UUID id = UUID.randomUUID();
    Instant normalizedStart = start;
    Duration normalizedDuration = duration;
    Logger.info("Creating activity {} '{}'", id, create.title());
    StatusOr<Activity> createdOr =
        DbUtil.inTransaction(
            conn,
            c -> {
              String sql =
                  """
                  INSERT INTO activity
                         (id, title, description, start, duration_micros, location_id, parent_id)
                  VALUES (?, ?, ?, ?, ?, ?, ?)
                  """;
              try (PreparedStatement stmt = c.prepareStatement(sql)) {
                stmt.setObject(1, id);
                stmt.setString(2, create.title());
                DbUtil.setParameter(stmt, 3, DbUtil.emptyToNull(create.description()));
                DbUtil.setParameter(stmt, 4, normalizedStart);
                DbUtil.setParameter(stmt, 5, normalizedDuration);
                DbUtil.setParameter(stmt, 6, Reference.idOrNull(create.location()));
                DbUtil.setParameter(stmt, 7, Reference.idOrNull(create.parent()));
                stmt.executeUpdate();
              }

              Status typesStatus =
                  AssociationSetSynchronizer.replaceAll(c, TYPES, id, create.types());
              if (typesStatus.isError()) {
                return StatusOr.ofStatus(typesStatus);
              }
              Status usersStatus =
                  AssociationSetSynchronizer.replaceAll(c, USERS, id, create.userIds());
              if (usersStatus.isError()) {
                return StatusOr.ofStatus(usersStatus);
              }

              return StatusOr.ofValue(
                  new Activity(
                      id,
                      create.title(),
                      DbUtil.emptyToNull(create.description()),
                      normalizedStart,
                      normalizedDuration,
                      Reference.idOrNull(create.location()),
                      Reference.idOrNull(create.parent()),
                      ImmutableSet.copyOf(create.types()),
                      ImmutableSet.copyOf(create.userIds())));
            });
    if (createdOr.isNotOk()) {
      Logger.error("Failed to create activity {}: {}", id, createdOr.getStatus());
    }
    return createdOr;
  }

  /**
   * Loads a single activity by ID, with its types and participants.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the activity to load
   * @return StatusOr containing an Optional Activity or an error
   */
  @Nonnull
  public static StatusOr<Optional<Activity>> loadById(Connection conn, UUID id) {
    String sql = SELECT + " WHERE activity.id = ?";
    return DbUtil.inReadSnapshot(
        conn,
        c -> {
          try (PreparedStatement stmt = c.prepareStatement(sql)) {
            stmt.setObject(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
              if (!rs.next()) {
                return StatusOr.ofValue(Optional.empty());
              }
              StatusOr<Activity> activityOr = extractActivity(rs);
              if (activityOr.isNotOk()) {
                return StatusOr.ofStatus(activityOr.getStatus());
              }
              return withAssociations(c, activityOr.getValue()).map(Optional::of);
            }
          }
        });
  }

  /**
   * Queries activities, most recent first.
   *
   * @param conn an open JDBC connection
   * @param filter the filter dimensions
   * @param skip the number of matching activities to skip
   * @param limit the maximum number of activities to return
   * @return StatusOr containing the page of activities and the total count, or an error
   */
  @Nonnull
  public static StatusOr<QueryResult<Activity>> query(
      Connection conn, ActivityFilter filter, int skip, int limit) {
    EntityQueryAssembler<Activity> assembler =
        EntityQueryAssembler.select(SELECT, Activities::extractActivity)
            .where(NullableInFilterBuilder.buildExists(USERS, "activity.id", filter.userIds()))
            .where(NullableInFilterBuilder.build("activity.location_id", filter.locationIds()))
            .where(NullableInFilterBuilder.build("activity.parent_id", filter.parentIds()))
            .where(NullableInFilterBuilder.buildExists(TYPES, "activity.id", filter.types()))
            .orderBy("activity.start DESC NULLS LAST", "activity.id");
    return DbUtil.inReadSnapshot(
        conn,
        c ->
            assembler
                .execute(c, skip, limit)
                .flatMap(page -> withAssociations(c, page)));
  }

  /** Queries the activities a user participates in. */
  @Nonnull
  public static StatusOr<QueryResult<Activity>> queryByUserId(
      Connection conn, UUID userId, int skip, int limit) {
    return query(conn, ActivityFilter.all().withUserIds(List.of(userId)), skip, limit);
  }

  /** Queries the activities at a location. */
  @Nonnull
  public static StatusOr<QueryResult<Activity>> queryByLocationId(
      Connection conn, UUID locationId, int skip, int limit) {
    return query(conn, ActivityFilter.all().withLocationIds(List.of(locationId)), skip, limit);
  }

  /**
   * Queries the distinct locations at which any of the given users has an activity, ordered by
   * name.
   *
   * @param conn an open JDBC connection
   * @param userIds the participants; null or empty means all activities
   * @return StatusOr containing the page of locations and the total count, or an error
   */
  @Nonnull
  public static StatusOr<QueryResult<Location>> queryLocationsByUserIds(
      Connection conn, Collection<UUID> userIds, int skip, int limit) {
    List<SqlPredicate> activityFilter = new ArrayList<>();
    NullableInFilterBuilder.buildExists(USERS, "activity.id", userIds)
        .ifPresent(activityFilter::add);
    String activities = "SELECT activity.location_id FROM activity";
    List<Object> params = new ArrayList<>();
    Optional<SqlPredicate> combined = SqlPredicate.and(activityFilter);
    if (combined.isPresent()) {
      activities += " WHERE " + combined.get().sql();
      params.addAll(combined.get().params());
    }
    return Locations.queryWhere(
        conn, new SqlPredicate("location.id IN (" + activities + ")", params), skip, limit);
  }

  /**
   * Loads the distinct activity types of the activities the given users participate in.
   *
   * @param conn an open JDBC connection
   * @param userIds the participants; null or empty means all activities
   * @return StatusOr containing the types in database value order, or an error
   */
  @Nonnull
  public static StatusOr<List<ActivityType>> loadTypesByUserIds(
      Connection conn, Collection<UUID> userIds) {
    StringBuilder sql =
        new StringBuilder(
            """
            SELECT DISTINCT activity_type_association.activity_type
              FROM activity_type_association
              JOIN activity ON activity.id = activity_type_association.activity_id
            """);
    Optional<SqlPredicate> users =
        NullableInFilterBuilder.buildExists(USERS, "activity.id", userIds);
    users.ifPresent(p -> sql.append(" WHERE ").append(p.sql()));
    sql.append(" ORDER BY activity_type_association.activity_type");
    try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
      if (users.isPresent()) {
        DbUtil.setParameters(stmt, 1, users.get().params());
      }
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

  /**
   * Applies a partial update. Scalar fields are written with one UPDATE statement, association
   * sets are replaced as a whole; all of it runs in one transaction. An update without any field
   * performs no write, and an unknown ID is not an error.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the activity to update
   * @param update the fields to change
   * @return OK, INVALID_ARGUMENT if the title is cleared, or the status of the failing statement
   */
  @Nonnull
  public static Status update(Connection conn, UUID id, ActivityUpdate update) {
    StatusOr<ChangeSet> changesOr =
        UpdateResolver.create()
            .requiredText("title", update.title())
            .optionalText("description", update.description())
            .dateTime("start", update.start())
            .duration("duration_micros", update.duration())
            .reference("location_id", update.location())
            .reference("parent_id", update.parent())
            .resolve();
    if (changesOr.isNotOk()) {
      return changesOr.getStatus();
    }
    ChangeSet changes = changesOr.getValue();
    if (changes.isEmpty() && update.types().isEmpty() && update.userIds().isEmpty()) {
      return Status.ok();
    }

    Logger.info("Updating activity {}: {}", id, changes);
    Status status =
        DbUtil.inTransactionStatus(
            conn,
            c -> {
              StatusOr<Integer> updatedOr = changes.executeUpdate(c, "activity", "id", id);
              if (updatedOr.isNotOk()) {
                return StatusOr.ofStatus(updatedOr.getStatus());
              }
              if (!exists(c, id)) {
                return DbUtil.done();
              }
              Status typesStatus =
                  AssociationSetSynchronizer.replaceAll(c, TYPES, id, update.types().orElse(null));
              if (typesStatus.isError()) {
                return StatusOr.ofStatus(typesStatus);
              }
              return DbUtil.done(
                  AssociationSetSynchronizer.replaceAll(
                      c, USERS, id, update.userIds().orElse(null)));
            });
    if (status.isError()) {
      Logger.error("Failed to update activity {}: {}", id, status);
    }
    return status;
  }

  /**
   * Deletes an activity by ID. Association rows are removed by cascade; child activities and
   * transactions keep existing with their reference set to null.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the activity to delete
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> delete(Connection conn, UUID id) {
    String sql =
        """
        DELETE FROM activity
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
   * Loads the ancestors of an activity, nearest first, named by their titles. A cycle in the
   * parent chain ends the path at the first repeated activity.
   *
   * @param conn an open JDBC connection
   * @param id the activity whose ancestors to load
   * @return StatusOr containing the ancestors, empty for a top-level or unknown activity
   */
  @Nonnull
  public static StatusOr<List<ParentPathEntry>> loadParentPath(Connection conn, UUID id) {
    return Hierarchies.loadParentPath(conn, "activity", "title", id);
  }

  /**
   * Loads the distinct types of all sub-activities of an activity, collected recursively. The
   * activity's own types are not included.
   *
   * @param conn an open JDBC connection
   * @param id the activity whose sub-activities to inspect
   * @return StatusOr containing the types in database value order, empty without sub-activities
   */
  @Nonnull
  public static StatusOr<List<ActivityType>> loadSubActivityTypes(Connection conn, UUID id) {
    return Hierarchies.loadDescendantTypes(conn, "activity", TYPES, id);
  }

  /**
   * Sums the amounts of the transactions booked on an activity. Transactions without an amount
   * count as zero, same as {@link Transactions#total}.
   *
   * @param conn an open JDBC connection
   * @param id the activity
   * @param userIds restricts the sum to transactions of these users; null or empty means all, a
   *     null element matches transactions without a user
   * @return StatusOr containing the total, 0 for an activity without transactions
   */
  @Nonnull
  public static StatusOr<Long> loadTransactionsTotal(
      Connection conn, UUID id, @Nullable Collection<UUID> userIds) {
    StringBuilder sql =
        new StringBuilder(
            """
            SELECT COALESCE(SUM(transactions.amount), 0)
              FROM transactions
             WHERE transactions.activity_id = ?
            """);
    Optional<SqlPredicate> users = NullableInFilterBuilder.build("transactions.user_id", userIds);
    users.ifPresent(p -> sql.append(" AND ").append(p.sql()));
    try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
      stmt.setObject(1, id);
      if (users.isPresent()) {
        DbUtil.setParameters(stmt, 2, users.get().params());
      }
      try (ResultSet rs = stmt.executeQuery()) {
        rs.next();
        return StatusOr.ofValue(rs.getLong(1));
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  static boolean exists(Connection conn, UUID id) throws SQLException {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM activity WHERE id = ?")) {
      stmt.setObject(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next();
      }
    }
  }

  private static StatusOr<QueryResult<Activity>> withAssociations(
      Connection conn, QueryResult<Activity> page) {
    List<Activity> items = new ArrayList<>(page.getItems().size());
    for (Activity activity : page.getItems()) {
      StatusOr<Activity> loadedOr = withAssociations(conn, activity);
      if (loadedOr.isNotOk()) {
        return StatusOr.ofStatus(loadedOr.getStatus());
      }
      items.add(loadedOr.getValue());
    }
    return StatusOr.ofValue(new QueryResult<>(items, page.getTotalCount()));
  }

  private static StatusOr<Activity> withAssociations(Connection conn, Activity activity) {
    StatusOr<List<ActivityType>> typesOr =
        AssociationSetSynchronizer.loadTargets(
            conn, TYPES, activity.id(), rs -> ActivityType.fromDatabaseValue(rs.getString(1)));
    if (typesOr.isNotOk()) {
      return StatusOr.ofStatus(typesOr.getStatus());
    }
    StatusOr<List<UUID>> userIdsOr =
        AssociationSetSynchronizer.loadTargets(
            conn, USERS, activity.id(), rs -> rs.getObject(1, UUID.class));
    if (userIdsOr.isNotOk()) {
      return StatusOr.ofStatus(userIdsOr.getStatus());
    }
    return StatusOr.ofValue(
        new Activity(
            activity.id(),
            activity.title(),
            activity.description(),
            activity.start(),
            activity.duration(),
            activity.locationId(),
            activity.parentId(),
            ImmutableSet.copyOf(typesOr.getValue()),
            ImmutableSet.copyOf(userIdsOr.getValue())));
  }

  /** Extracts an Activity without associations from the current row of a ResultSet. */
  @Nonnull
  static StatusOr<Activity> extractActivity(ResultSet rs) throws SQLException {
    StatusOr<UUID> idOr = DbUtil.getUuid(rs, "id");
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }

    String title = rs.getString("title");
    String description = rs.getString("description");

    StatusOr<Optional<Instant>> startOr = DbUtil.getOptionalInstant(rs, "start");
    if (startOr.isNotOk()) {
      return StatusOr.ofStatus(startOr.getStatus());
    }

    StatusOr<Optional<Duration>> durationOr = DbUtil.getOptionalDuration(rs, "duration_micros");
    if (durationOr.isNotOk()) {
      return StatusOr.ofStatus(durationOr.getStatus());
    }

    StatusOr<Optional<UUID>> locationIdOr = DbUtil.getOptionalUuid(rs, "location_id");
    if (locationIdOr.isNotOk()) {
      return StatusOr.ofStatus(locationIdOr.getStatus());
    }

    StatusOr<Optional<UUID>> parentIdOr = DbUtil.getOptionalUuid(rs, "parent_id");
    if (parentIdOr.isNotOk()) {
      return StatusOr.ofStatus(parentIdOr.getStatus());
    }

    return StatusOr.ofValue(
        new Activity(
            idOr.getValue(),
            title,
            description,
            startOr.getValue().orElse(null),
            durationOr.getValue().orElse(null),
            locationIdOr.getValue().orElse(null),
            parentIdOr.getValue().orElse(null),
            Set.of(),
            Set.of()));
  }
}

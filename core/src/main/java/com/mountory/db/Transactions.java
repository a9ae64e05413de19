package com.mountory.db;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import com.mountory.db.query.EntityQueryAssembler;
import com.mountory.db.query.NullableInFilterBuilder;
import com.mountory.db.query.QueryResult;
import com.mountory.db.update.ChangeSet;
import com.mountory.db.update.DateTimes;
import com.mountory.db.update.Reference;
import com.mountory.db.update.UpdateResolver;
import com.mountory.db.util.DbUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/** DAO helper class for the 'transactions' table. */
public final class Transactions {

  private static final String SELECT =
      """
      SELECT transactions.id, transactions.activity_id, transactions.location_id,
             transactions.user_id, transactions.date, transactions.amount,
             transactions.category, transactions.description, transactions.note
        FROM transactions
      """;

  private Transactions() {
    // Utility class
  }

  /**
   * Creates a transaction.
   *
   * @param conn an open JDBC connection
   * @param create the fields of the new transaction
   * @return StatusOr containing the stored transaction or an error
   */
  @Nonnull
  public static StatusOr<Transaction> create(Connection conn, TransactionCreate create) {
    Instant date = null;
    if (create.date() != null) {
      StatusOr<Instant> dateOr = DateTimes.toUtc("date", create.date());
      if (dateOr.isNotOk()) {
        return StatusOr.ofStatus(dateOr.getStatus());
      }
      date = dateOr.getValue();
    }
    Transaction transaction =
        new Transaction(
            UUID.randomUUID(),
            Reference.idOrNull(create.activity()),
            Reference.idOrNull(create.location()),
            Reference.idOrNull(create.user()),
            date,
            create.amount(),
            create.category(),
            DbUtil.emptyToNull(create.description()),
            DbUtil.emptyToNull(create.note()));
    String sql =
        """
        INSERT INTO transactions
               (id, activity_id, location_id, user_id, date, amount, category, description, note)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        """;
    Logger.info("Creating transaction {} for user {}", transaction.id(), transaction.userId());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, transaction.id());
      DbUtil.setParameter(stmt, 2, transaction.activityId());
      DbUtil.setParameter(stmt, 3, transaction.locationId());
      DbUtil.setParameter(stmt, 4, transaction.userId());
      DbUtil.setParameter(stmt, 5, transaction.date());
      DbUtil.setParameter(stmt, 6, transaction.amount());
      DbUtil.setParameter(stmt, 7, transaction.category());
      DbUtil.setParameter(stmt, 8, transaction.description());
      DbUtil.setParameter(stmt, 9, transaction.note());
      stmt.executeUpdate();
      return StatusOr.ofValue(transaction);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads a single transaction by ID.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the transaction to load
   * @return StatusOr containing an Optional Transaction or an error
   */
  @Nonnull
  public static StatusOr<Optional<Transaction>> loadById(Connection conn, UUID id) {
    String sql = SELECT + " WHERE transactions.id = ?";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        if (rs.next()) {
          StatusOr<Transaction> transactionOr = extractTransaction(rs);
          if (transactionOr.isNotOk()) {
            return StatusOr.ofStatus(transactionOr.getStatus());
          }
          return StatusOr.ofValue(Optional.of(transactionOr.getValue()));
        }
        return StatusOr.ofValue(Optional.empty());
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Queries transactions, most recent first.
   *
   * @param conn an open JDBC connection
   * @param filter the filter dimensions
   * @param skip the number of matching transactions to skip
   * @param limit the maximum number of transactions to return
   * @return StatusOr containing the page of transactions and the total count, or an error
   */
  @Nonnull
  public static StatusOr<QueryResult<Transaction>> query(
      Connection conn, TransactionFilter filter, int skip, int limit) {
    return EntityQueryAssembler.select(SELECT, Transactions::extractTransaction)
        .where(NullableInFilterBuilder.build("transactions.user_id", filter.userIds()))
        .where(NullableInFilterBuilder.build("transactions.activity_id", filter.activityIds()))
        .where(NullableInFilterBuilder.build("transactions.location_id", filter.locationIds()))
        .orderBy("transactions.date DESC NULLS LAST", "transactions.id")
        .execute(conn, skip, limit);
  }

  /**
   * Applies a partial update. Every field may be cleared.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the transaction to update
   * @param update the fields to change
   * @return OK, INVALID_ARGUMENT for an invalid date, or the status of the failing statement
   */
  @Nonnull
  public static Status update(Connection conn, UUID id, TransactionUpdate update) {
    StatusOr<ChangeSet> changesOr =
        UpdateResolver.create()
            .reference("activity_id", update.activity())
            .reference("location_id", update.location())
            .reference("user_id", update.user())
            .dateTime("date", update.date())
            .value("amount", update.amount())
            .enumValue("category", update.category())
            .optionalText("description", update.description())
            .optionalText("note", update.note())
            .resolve();
    if (changesOr.isNotOk()) {
      return changesOr.getStatus();
    }
    ChangeSet changes = changesOr.getValue();
    if (changes.isEmpty()) {
      return Status.ok();
    }
    Logger.info("Updating transaction {}: {}", id, changes);
    return changes.executeUpdate(conn, "transactions", "id", id).getStatus();
  }

  /**
   * Deletes a transaction by ID.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the transaction to delete
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> delete(Connection conn, UUID id) {
    String sql =
        """
        DELETE FROM transactions
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
   * Sums the amounts of the given transactions. Transactions without an amount count as zero.
   *
   * @param transactions the transactions to sum
   * @param userIds if neither null nor empty, only transactions of these users are summed
   * @return the total
   */
  public static long total(
      Collection<Transaction> transactions, @Nullable Collection<UUID> userIds) {
    Set<UUID> users = userIds == null ? Set.of() : new HashSet<>(userIds);
    long total = 0;
    for (Transaction transaction : transactions) {
      if (!users.isEmpty() && !users.contains(transaction.userId())) {
        continue;
      }
      if (transaction.amount() != null) {
        total += transaction.amount();
      }
    }
    return total;
  }

  /** Extracts a Transaction from the current row of a ResultSet. */
  @Nonnull
  static StatusOr<Transaction> extractTransaction(ResultSet rs) throws SQLException {
    StatusOr<UUID> idOr = DbUtil.getUuid(rs, "id");
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }

    StatusOr<Optional<UUID>> activityIdOr = DbUtil.getOptionalUuid(rs, "activity_id");
    if (activityIdOr.isNotOk()) {
      return StatusOr.ofStatus(activityIdOr.getStatus());
    }

    StatusOr<Optional<UUID>> locationIdOr = DbUtil.getOptionalUuid(rs, "location_id");
    if (locationIdOr.isNotOk()) {
      return StatusOr.ofStatus(locationIdOr.getStatus());
    }

    StatusOr<Optional<UUID>> userIdOr = DbUtil.getOptionalUuid(rs, "user_id");
    if (userIdOr.isNotOk()) {
      return StatusOr.ofStatus(userIdOr.getStatus());
    }

    StatusOr<Optional<Instant>> dateOr = DbUtil.getOptionalInstant(rs, "date");
    if (dateOr.isNotOk()) {
      return StatusOr.ofStatus(dateOr.getStatus());
    }

    StatusOr<Optional<Long>> amountOr = DbUtil.getOptionalLong(rs, "amount");
    if (amountOr.isNotOk()) {
      return StatusOr.ofStatus(amountOr.getStatus());
    }

    String category = rs.getString("category");

    return StatusOr.ofValue(
        new Transaction(
            idOr.getValue(),
            activityIdOr.getValue().orElse(null),
            locationIdOr.getValue().orElse(null),
            userIdOr.getValue().orElse(null),
            dateOr.getValue().orElse(null),
            amountOr.getValue().orElse(null),
            category == null ? null : TransactionCategory.fromDatabaseValue(category),
            rs.getString("description"),
            rs.getString("note")));
  }
}

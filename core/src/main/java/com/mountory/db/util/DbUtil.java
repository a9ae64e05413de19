package com.mountory.db.util;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/** Utility methods for database operations. */
public final class DbUtil {

  private DbUtil() {
    // Utility class, no instances
  }

  /**
   * A unit of work executed on a connection inside a transaction. A non-OK result rolls the
   * transaction back, exactly like a thrown {@link SQLException}.
   */
  @FunctionalInterface
  public interface TransactionalWork<T> {
    StatusOr<T> run(Connection conn) throws SQLException;
  }

  /** Converts a java.sql.Timestamp to java.time.Instant. */
  @Nonnull
  public static Instant toInstant(Timestamp timestamp) {
    if (timestamp == null) {
      throw new IllegalArgumentException("Timestamp cannot be null");
    }
    return timestamp.toInstant();
  }

  /** Converts a java.time.Instant to java.sql.Timestamp. */
  @Nonnull
  public static Timestamp toSqlTimestamp(Instant instant) {
    if (instant == null) {
      throw new IllegalArgumentException("Instant cannot be null");
    }
    return Timestamp.from(instant);
  }

  /** Returns null for a null or empty string, the string otherwise. */
  public static String emptyToNull(String value) {
    return value == null || value.isEmpty() ? null : value;
  }

  /** Gets a non-null UUID from a ResultSet column. */
  @Nonnull
  public static StatusOr<UUID> getUuid(ResultSet rs, String columnName) {
    try {
      UUID uuid = rs.getObject(columnName, UUID.class);
      if (rs.wasNull() || uuid == null) {
        return StatusOr.ofStatus(Status.invalidArgument("Column " + columnName + " is null"));
      }
      return StatusOr.ofValue(uuid);
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get UUID: " + e.getMessage(), e));
    }
  }

  /**
   * Gets an optional UUID from a ResultSet column, returning Optional.empty() if the column is
   * null.
   */
  @Nonnull
  public static StatusOr<Optional<UUID>> getOptionalUuid(ResultSet rs, String columnName) {
    try {
      UUID uuid = rs.getObject(columnName, UUID.class);
      if (rs.wasNull() || uuid == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(uuid));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get UUID: " + e.getMessage(), e));
    }
  }

  /**
   * Gets an optional Instant from a TIMESTAMPTZ column, returning Optional.empty() if the column
   * is null.
   */
  @Nonnull
  public static StatusOr<Optional<Instant>> getOptionalInstant(ResultSet rs, String columnName) {
    try {
      Timestamp timestamp = rs.getTimestamp(columnName);
      if (rs.wasNull() || timestamp == null) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(timestamp.toInstant()));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get Instant: " + e.getMessage(), e));
    }
  }

  /** Gets an optional BIGINT column as a Long. */
  @Nonnull
  public static StatusOr<Optional<Long>> getOptionalLong(ResultSet rs, String columnName) {
    try {
      long value = rs.getLong(columnName);
      if (rs.wasNull()) {
        return StatusOr.ofValue(Optional.empty());
      }
      return StatusOr.ofValue(Optional.of(value));
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to get long: " + e.getMessage(), e));
    }
  }

  /** Gets an optional duration stored as microseconds in a BIGINT column. */
  @Nonnull
  public static StatusOr<Optional<Duration>> getOptionalDuration(
      ResultSet rs, String columnName) {
    return getOptionalLong(rs, columnName)
        .map(micros -> micros.map(m -> Duration.of(m, ChronoUnit.MICROS)));
  }

  /**
   * Converts a duration to whole microseconds, the precision of the BIGINT duration columns.
   *
   * @throws ArithmeticException if the duration does not fit into a long of microseconds
   */
  public static long toMicros(Duration duration) {
    return Math.addExact(
        Math.multiplyExact(duration.getSeconds(), 1_000_000L), duration.getNano() / 1_000);
  }

  /**
   * Binds a single statement parameter. {@code null} is bound as an untyped SQL NULL, an {@link
   * Instant} as a timestamp, a {@link Duration} as microseconds and a {@link DatabaseEnum} as its
   * database value; everything else goes through
   * {@link PreparedStatement#setObject(int, Object)}.
   */
  public static void setParameter(PreparedStatement stmt, int index, Object value)
      throws SQLException {
    if (value == null) {
      stmt.setNull(index, Types.NULL);
    } else if (value instanceof Instant) {
      stmt.setTimestamp(index, toSqlTimestamp((Instant) value));
    } else if (value instanceof Duration) {
      stmt.setLong(index, toMicros((Duration) value));
    } else if (value instanceof DatabaseEnum) {
      stmt.setString(index, ((DatabaseEnum) value).toDatabaseValue());
    } else {
      stmt.setObject(index, value);
    }
  }

  /**
   * Binds parameters in order, starting at the given index.
   *
   * @return the next free parameter index
   */
  public static int setParameters(PreparedStatement stmt, int startIndex, List<?> values)
      throws SQLException {
    int index = startIndex;
    for (Object value : values) {
      setParameter(stmt, index++, value);
    }
    return index;
  }

  /**
   * Runs the given work inside a transaction.
   *
   * <p>If the connection is in auto-commit mode a new transaction is started and committed when
   * the work returns an OK result; auto-commit is restored afterwards. If the connection is
   * already inside a transaction the work joins it and the caller stays responsible for the
   * commit. In both cases a non-OK result or an exception rolls back the whole transaction, so a
   * partially applied change is never visible.
   *
   * @param conn an open JDBC connection
   * @param work the work to run
   * @return the result of the work, or an INTERNAL status if the transaction itself failed
   */
  @Nonnull
  public static <T> StatusOr<T> inTransaction(Connection conn, TransactionalWork<T> work) {
    boolean ownsTransaction;
    try {
      ownsTransaction = conn.getAutoCommit();
      if (ownsTransaction) {
        conn.setAutoCommit(false);
      }
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }

    StatusOr<T> result;
    try {
      result = work.run(conn);
    } catch (SQLException e) {
      result = StatusOr.ofException(e);
    }

    try {
      if (result.isOk() && ownsTransaction) {
        conn.commit();
      } else if (result.isNotOk()) {
        Logger.debug("Rolling back transaction: {}", result.getStatus());
        conn.rollback();
      }
    } catch (SQLException e) {
      Logger.error(e, "Failed to finish transaction");
      result = StatusOr.ofException(e);
    } finally {
      if (ownsTransaction) {
        try {
          conn.setAutoCommit(true);
        } catch (SQLException e) {
          Logger.error(e, "Failed to restore auto-commit");
        }
      }
    }
    return result;
  }

  /**
   * Runs read-only work against one consistent snapshot.
   *
   * <p>A connection in auto-commit mode gets its own read-only {@code REPEATABLE READ} transaction
   * for the duration of the work, so every statement sees the same data; isolation level and
   * read-only flag are restored afterwards. A connection that is already inside a transaction
   * keeps the caller's transaction and isolation level.
   */
  @Nonnull
  public static <T> StatusOr<T> inReadSnapshot(Connection conn, TransactionalWork<T> work) {
    boolean autoCommit;
    int isolation;
    boolean readOnly;
    try {
      autoCommit = conn.getAutoCommit();
      if (!autoCommit) {
        return inTransaction(conn, work);
      }
      isolation = conn.getTransactionIsolation();
      readOnly = conn.isReadOnly();
      conn.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
      conn.setReadOnly(true);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
    try {
      return inTransaction(conn, work);
    } finally {
      try {
        conn.setReadOnly(readOnly);
        conn.setTransactionIsolation(isolation);
      } catch (SQLException e) {
        Logger.error(e, "Failed to restore connection settings after read snapshot");
      }
    }
  }

  /** Same as {@link #inTransaction(Connection, TransactionalWork)} for work without a value. */
  @Nonnull
  public static Status inTransactionStatus(Connection conn, TransactionalWork<Boolean> work) {
    return inTransaction(conn, work).getStatus();
  }

  /** Returns {@code StatusOr.ofValue(true)}, the result of successful work without a value. */
  @Nonnull
  public static StatusOr<Boolean> done() {
    return StatusOr.ofValue(Boolean.TRUE);
  }

  /** Converts a status into the result of work without a value. */
  @Nonnull
  public static StatusOr<Boolean> done(Status status) {
    return status.isOk() ? done() : StatusOr.ofStatus(status);
  }
}

package com.mountory.db.update;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import com.mountory.db.util.DbUtil;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.Temporal;
import javax.annotation.Nonnull;

/**
 * Normalization of date-time and duration inputs to what the database stores: UTC instants and
 * durations, both with microsecond precision.
 */
public final class DateTimes {

  /** Precision of TIMESTAMPTZ columns and of the microsecond duration columns. */
  public static final ChronoUnit STORED_PRECISION = ChronoUnit.MICROS;

  private DateTimes() {
    // Utility class
  }

  /**
   * Converts a date-time to a UTC {@link Instant} truncated to microseconds. A {@link
   * LocalDateTime} has no zone and is taken to be UTC; zoned and offset values are converted.
   *
   * @param field the field name used in the error message
   * @param value the value to convert
   * @return the instant, or INVALID_ARGUMENT for temporal types without a time of day
   */
  @Nonnull
  public static StatusOr<Instant> toUtc(String field, @Nonnull Temporal value) {
    Instant instant;
    if (value instanceof Instant) {
      instant = (Instant) value;
    } else if (value instanceof LocalDateTime) {
      instant = ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    } else if (value instanceof OffsetDateTime) {
      instant = ((OffsetDateTime) value).toInstant();
    } else if (value instanceof ZonedDateTime) {
      instant = ((ZonedDateTime) value).toInstant();
    } else {
      return StatusOr.ofStatus(
          Status.invalidArgument(
              field + " must be a date-time, got " + value.getClass().getSimpleName()));
    }
    return StatusOr.ofValue(instant.truncatedTo(STORED_PRECISION));
  }

  /**
   * Truncates a duration to microseconds.
   *
   * @param field the field name used in the error message
   * @param value the value to normalize
   * @return the duration, or INVALID_ARGUMENT if it is negative or does not fit into a BIGINT of
   *     microseconds
   */
  @Nonnull
  public static StatusOr<Duration> toStoredDuration(String field, @Nonnull Duration value) {
    if (value.isNegative()) {
      return StatusOr.ofStatus(Status.invalidArgument(field + " cannot be negative"));
    }
    try {
      DbUtil.toMicros(value);
    } catch (ArithmeticException e) {
      return StatusOr.ofStatus(Status.invalidArgument(field + " is too long: " + value));
    }
    return StatusOr.ofValue(value.truncatedTo(STORED_PRECISION));
  }
}

package com.mountory.db.update;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import com.mountory.db.util.DatabaseEnum;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.Temporal;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * Resolves the fields of a partial update into a {@link ChangeSet}.
 *
 * <p>Each field is given as a {@link FieldUpdate}:
 *
 * <ul>
 *   <li>{@code unset()} leaves the column out of the change-set;
 *   <li>{@code clear()} assigns null, except for required columns where it is rejected with an
 *       INVALID_ARGUMENT status;
 *   <li>{@code of(value)} assigns the normalized value.
 * </ul>
 *
 * <p>Validation failures are collected and the first one is reported by {@link #resolve()}, so a
 * rejected update never reaches the database.
 *
 * <pre>{@code
 * StatusOr<ChangeSet> changesOr =
 *     UpdateResolver.create()
 *         .requiredText("title", update.title())
 *         .optionalText("description", update.description())
 *         .dateTime("start", update.start())
 *         .reference("location_id", update.location())
 *         .resolve();
 * }</pre>
 */
public final class UpdateResolver {
  private final Map<String, Object> assignments = new LinkedHashMap<>();
  private Status failure = Status.ok();

  private UpdateResolver() {}

  /** Starts a new, empty resolution. */
  public static UpdateResolver create() {
    return new UpdateResolver();
  }

  /**
   * A text column that must not be null or empty. Clearing it, or setting it to the empty string,
   * is a validation error.
   */
  @Nonnull
  public UpdateResolver requiredText(String column, FieldUpdate<String> update) {
    if (update.isUnset()) {
      return this;
    }
    if (update.isClear() || update.getValue().isEmpty()) {
      return fail(Status.emptyField(column));
    }
    assignments.put(column, update.getValue());
    return this;
  }

  /**
   * A nullable text column. Clearing it and setting the empty string both store null.
   */
  @Nonnull
  public UpdateResolver optionalText(String column, FieldUpdate<String> update) {
    if (update.isUnset()) {
      return this;
    }
    if (update.isClear() || update.getValue().isEmpty()) {
      assignments.put(column, null);
    } else {
      assignments.put(column, update.getValue());
    }
    return this;
  }

  /** A nullable column bound as-is. */
  @Nonnull
  public UpdateResolver value(String column, FieldUpdate<?> update) {
    if (update.isUnset()) {
      return this;
    }
    assignments.put(column, update.isClear() ? null : update.getValue());
    return this;
  }

  /** A column that must not be null. Clearing it is a validation error. */
  @Nonnull
  public UpdateResolver requiredValue(String column, FieldUpdate<?> update) {
    if (update.isClear()) {
      return fail(Status.emptyField(column));
    }
    return value(column, update);
  }

  /** A nullable enum column, stored as its database value. */
  @Nonnull
  public UpdateResolver enumValue(String column, FieldUpdate<? extends DatabaseEnum> update) {
    return value(column, update.map(DatabaseEnum::toDatabaseValue));
  }

  /** An enum column that must not be null. */
  @Nonnull
  public UpdateResolver requiredEnumValue(
      String column, FieldUpdate<? extends DatabaseEnum> update) {
    return requiredValue(column, update.map(DatabaseEnum::toDatabaseValue));
  }

  /**
   * A nullable timestamp column. Values are normalized to UTC, see {@link DateTimes#toUtc}.
   */
  @Nonnull
  public UpdateResolver dateTime(String column, FieldUpdate<? extends Temporal> update) {
    if (update.isUnset()) {
      return this;
    }
    if (update.isClear()) {
      assignments.put(column, null);
      return this;
    }
    StatusOr<Instant> instantOr = DateTimes.toUtc(column, update.getValue());
    if (instantOr.isNotOk()) {
      return fail(instantOr.getStatus());
    }
    assignments.put(column, instantOr.getValue());
    return this;
  }

  /** A nullable duration column, see {@link DateTimes#toStoredDuration}. */
  @Nonnull
  public UpdateResolver duration(String column, FieldUpdate<Duration> update) {
    if (update.isUnset()) {
      return this;
    }
    if (update.isClear()) {
      assignments.put(column, null);
      return this;
    }
    StatusOr<Duration> durationOr = DateTimes.toStoredDuration(column, update.getValue());
    if (durationOr.isNotOk()) {
      return fail(durationOr.getStatus());
    }
    assignments.put(column, durationOr.getValue());
    return this;
  }

  /** A nullable foreign-key column. The reference is stored as its identifier. */
  @Nonnull
  public UpdateResolver reference(String column, FieldUpdate<Reference> update) {
    return value(column, update.map(Reference::id));
  }

  private UpdateResolver fail(Status status) {
    if (failure.isOk()) {
      failure = status;
    }
    return this;
  }

  /**
   * Returns the resolved change-set, or the first validation failure.
   */
  @Nonnull
  public StatusOr<ChangeSet> resolve() {
    if (failure.isError()) {
      return StatusOr.ofStatus(failure);
    }
    if (assignments.isEmpty()) {
      return StatusOr.ofValue(ChangeSet.empty());
    }
    return StatusOr.ofValue(new ChangeSet(assignments));
  }
}

package com.mountory.common.status;

import java.sql.SQLException;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Outcome of a data-access operation that produces no value. Modelled on the gRPC status: a code,
 * an optional message and, for store failures, the exception that caused it.
 */
public final class Status {
  private static final Status OK = new Status(StatusCode.OK, null, null);

  /** SQLSTATE class of integrity constraint violations (unique, foreign key, check). */
  private static final String CONSTRAINT_VIOLATION_CLASS = "23";

  private final StatusCode code;
  @Nullable private final String message;
  @Nullable private final Throwable cause;

  private Status(StatusCode code, @Nullable String message, @Nullable Throwable cause) {
    this.code = Objects.requireNonNull(code);
    this.message = message;
    this.cause = cause;
  }

  public static Status ok() {
    return OK;
  }

  public static Status notFound(String message) {
    return new Status(StatusCode.NOT_FOUND, message, null);
  }

  public static Status invalidArgument(String message) {
    return new Status(StatusCode.INVALID_ARGUMENT, message, null);
  }

  /** INVALID_ARGUMENT for a required field that is missing or was explicitly cleared. */
  public static Status emptyField(String field) {
    return invalidArgument(field + " cannot be empty");
  }

  public static Status internal(String message, @Nullable Throwable cause) {
    return new Status(StatusCode.INTERNAL, message, cause);
  }

  /** Wraps a store failure. The exception is kept unchanged as the cause. */
  public static Status fromException(@Nonnull Throwable throwable) {
    return internal("Exception: " + throwable.getMessage(), throwable);
  }

  @Nonnull
  public StatusCode getCode() {
    return code;
  }

  @Nullable
  public String getMessage() {
    return message;
  }

  @Nullable
  public Throwable getCause() {
    return cause;
  }

  /** Returns the SQLSTATE of the wrapped {@link SQLException}, or null if there is none. */
  @Nullable
  public String getSqlState() {
    return cause instanceof SQLException ? ((SQLException) cause).getSQLState() : null;
  }

  /** True when the store rejected a write because of an integrity constraint. */
  public boolean isConstraintViolation() {
    String sqlState = getSqlState();
    return sqlState != null && sqlState.startsWith(CONSTRAINT_VIOLATION_CLASS);
  }

  public boolean isOk() {
    return !code.isError();
  }

  public boolean isError() {
    return code.isError();
  }

  @Override
  public String toString() {
    return message == null ? code.toString() : code + ": " + message;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Status)) {
      return false;
    }
    Status other = (Status) obj;
    return code == other.code
        && Objects.equals(message, other.message)
        && Objects.equals(cause, other.cause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, message, cause);
  }
}

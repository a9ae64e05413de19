package com.mountory.common.status;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Either a value or a non-OK {@link Status}. DAO methods return this instead of throwing, so every
 * caller has to look at the status before touching the value.
 *
 * @param <T> the type of the value in case of success
 */
public final class StatusOr<T> {
  private final Status status;
  @Nullable private final T value;

  private StatusOr(Status status, @Nullable T value) {
    this.status = status;
    this.value = value;
  }

  /** Wraps a successful result. The value must not be null. */
  public static <T> StatusOr<T> ofValue(@Nonnull T value) {
    return new StatusOr<>(Status.ok(), Objects.requireNonNull(value, "value"));
  }

  /**
   * Wraps a failure.
   *
   * @throws IllegalArgumentException if the status is OK
   */
  public static <T> StatusOr<T> ofStatus(@Nonnull Status status) {
    if (status.isOk()) {
      throw new IllegalArgumentException("Status must not be OK when using ofStatus");
    }
    return new StatusOr<>(status, null);
  }

  /** INTERNAL failure keeping the exception as the status cause. */
  public static <T> StatusOr<T> ofException(@Nonnull Throwable throwable) {
    return ofStatus(Status.fromException(throwable));
  }

  /** The value of a present Optional, NOT_FOUND with the given message otherwise. */
  public static <T> StatusOr<T> fromOptional(Optional<T> optional, String errorMessage) {
    return optional.isPresent()
        ? ofValue(optional.get())
        : ofStatus(Status.notFound(errorMessage));
  }

  @Nonnull
  public Status getStatus() {
    return status;
  }

  /**
   * Returns the value.
   *
   * @throws IllegalStateException if the status is not OK
   */
  @Nonnull
  public T getValue() {
    if (value == null) {
      throw new IllegalStateException("Cannot get value from failed StatusOr: " + status);
    }
    return value;
  }

  public boolean isOk() {
    return value != null;
  }

  public boolean isNotOk() {
    return value == null;
  }

  /** Applies the mapper to a value; a failure is passed through unchanged. */
  @Nonnull
  public <U> StatusOr<U> map(@Nonnull Function<T, U> mapper) {
    return value != null ? ofValue(mapper.apply(value)) : ofStatus(status);
  }

  /** Chains another fallible step; a failure is passed through unchanged. */
  @Nonnull
  public <U> StatusOr<U> flatMap(@Nonnull Function<T, StatusOr<U>> mapper) {
    return value != null ? mapper.apply(value) : ofStatus(status);
  }

  /** The value, or empty for a failure. */
  @Nonnull
  public Optional<T> asOptional() {
    return Optional.ofNullable(value);
  }

  @Override
  public String toString() {
    return value != null ? "StatusOr{value=" + value + "}" : "StatusOr{status=" + status + "}";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StatusOr)) {
      return false;
    }
    StatusOr<?> other = (StatusOr<?>) obj;
    return status.equals(other.status) && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, value);
  }
}

package com.mountory.db.update;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One position of a partial update: the field is either left untouched, explicitly cleared, or
 * set to a new value.
 *
 * <p>The three states are kept apart at the call boundary so that "not provided" and "set to
 * null" can never be confused. {@link UpdateResolver} collapses them into a {@link ChangeSet}
 * where only "absent" and "value-or-null" remain.
 *
 * @param <T> the type of the field value
 */
public final class FieldUpdate<T> {

  /** The state of a {@link FieldUpdate}. */
  public enum State {
    UNSET,
    CLEAR,
    SET
  }

  private static final FieldUpdate<?> UNSET = new FieldUpdate<>(State.UNSET, null);
  private static final FieldUpdate<?> CLEAR = new FieldUpdate<>(State.CLEAR, null);

  private final State state;
  private final T value;

  private FieldUpdate(State state, T value) {
    this.state = state;
    this.value = value;
  }

  /** The field is left untouched. */
  @SuppressWarnings("unchecked")
  public static <T> FieldUpdate<T> unset() {
    return (FieldUpdate<T>) UNSET;
  }

  /** The field is cleared (stored as null). */
  @SuppressWarnings("unchecked")
  public static <T> FieldUpdate<T> clear() {
    return (FieldUpdate<T>) CLEAR;
  }

  /** The field is set to the given, non-null value. */
  public static <T> FieldUpdate<T> of(@Nonnull T value) {
    return new FieldUpdate<>(State.SET, Objects.requireNonNull(value, "value"));
  }

  /**
   * Maps the text convention used by clients: {@code null} means "not provided", the empty
   * string means "clear", anything else is the new value.
   */
  public static FieldUpdate<String> fromText(@Nullable String text) {
    if (text == null) {
      return unset();
    }
    if (text.isEmpty()) {
      return clear();
    }
    return of(text);
  }

  /** Maps {@code null} to "clear" and anything else to a value. */
  public static <T> FieldUpdate<T> ofNullable(@Nullable T value) {
    return value == null ? clear() : of(value);
  }

  @Nonnull
  public State state() {
    return state;
  }

  public boolean isUnset() {
    return state == State.UNSET;
  }

  public boolean isClear() {
    return state == State.CLEAR;
  }

  public boolean isSet() {
    return state == State.SET;
  }

  /**
   * Returns the new value.
   *
   * @throws IllegalStateException if the update is not in state {@link State#SET}
   */
  @Nonnull
  public T getValue() {
    if (state != State.SET) {
      throw new IllegalStateException("FieldUpdate has no value in state " + state);
    }
    return value;
  }

  /** Maps the value, keeping UNSET and CLEAR as they are. */
  @Nonnull
  public <U> FieldUpdate<U> map(@Nonnull Function<? super T, ? extends U> mapper) {
    if (state != State.SET) {
      @SuppressWarnings("unchecked")
      FieldUpdate<U> self = (FieldUpdate<U>) this;
      return self;
    }
    return of(mapper.apply(value));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FieldUpdate)) {
      return false;
    }
    FieldUpdate<?> other = (FieldUpdate<?>) obj;
    return state == other.state && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("state", state)
        .add("value", value)
        .omitNullValues()
        .toString();
  }
}

package com.mountory.db.update;

import java.util.Objects;
import java.util.UUID;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A foreign-key value given either as a raw identifier or as the related entity itself. Writes
 * only ever see the identifier; {@link #id()} resolves both forms.
 */
public final class Reference {
  private final UUID id;
  private final Identifiable entity;

  private Reference(UUID id, Identifiable entity) {
    this.id = id;
    this.entity = entity;
  }

  /** A reference by raw identifier. */
  public static Reference toId(@Nonnull UUID id) {
    return new Reference(Objects.requireNonNull(id, "id"), null);
  }

  /** A reference to a loaded entity. */
  public static Reference to(@Nonnull Identifiable entity) {
    return new Reference(null, Objects.requireNonNull(entity, "entity"));
  }

  /** Returns the referenced identifier. */
  @Nonnull
  public UUID id() {
    return entity != null ? Objects.requireNonNull(entity.id(), "entity id") : id;
  }

  /** Returns the referenced entity if this reference was created from one. */
  @Nullable
  public Identifiable entity() {
    return entity;
  }

  /** Returns the identifier of an optional reference, or null. */
  @Nullable
  public static UUID idOrNull(@Nullable Reference reference) {
    return reference == null ? null : reference.id();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Reference)) {
      return false;
    }
    return id().equals(((Reference) obj).id());
  }

  @Override
  public int hashCode() {
    return id().hashCode();
  }

  @Override
  public String toString() {
    return "Reference{" + id() + "}";
  }
}

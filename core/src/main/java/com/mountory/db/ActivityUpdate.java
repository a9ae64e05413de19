package com.mountory.db;

import com.mountory.db.update.FieldUpdate;
import com.mountory.db.update.Reference;
import java.time.Duration;
import java.time.temporal.Temporal;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A partial update of an activity.
 *
 * <p>Scalar fields use {@link FieldUpdate}. The association sets are replaced as a whole: an empty
 * Optional leaves them untouched, an empty set removes every row.
 */
public record ActivityUpdate(
    FieldUpdate<String> title,
    FieldUpdate<String> description,
    FieldUpdate<? extends Temporal> start,
    FieldUpdate<Duration> duration,
    FieldUpdate<Reference> location,
    FieldUpdate<Reference> parent,
    Optional<Set<ActivityType>> types,
    Optional<Set<UUID>> userIds) {

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link ActivityUpdate}; every field starts out untouched. */
  public static final class Builder {
    private FieldUpdate<String> title = FieldUpdate.unset();
    private FieldUpdate<String> description = FieldUpdate.unset();
    private FieldUpdate<? extends Temporal> start = FieldUpdate.unset();
    private FieldUpdate<Duration> duration = FieldUpdate.unset();
    private FieldUpdate<Reference> location = FieldUpdate.unset();
    private FieldUpdate<Reference> parent = FieldUpdate.unset();
    private Optional<Set<ActivityType>> types = Optional.empty();
    private Optional<Set<UUID>> userIds = Optional.empty();

    private Builder() {}

    public Builder title(FieldUpdate<String> title) {
      this.title = title;
      return this;
    }

    public Builder description(FieldUpdate<String> description) {
      this.description = description;
      return this;
    }

    public Builder start(FieldUpdate<? extends Temporal> start) {
      this.start = start;
      return this;
    }

    public Builder duration(FieldUpdate<Duration> duration) {
      this.duration = duration;
      return this;
    }

    public Builder location(FieldUpdate<Reference> location) {
      this.location = location;
      return this;
    }

    public Builder parent(FieldUpdate<Reference> parent) {
      this.parent = parent;
      return this;
    }

    public Builder types(Collection<ActivityType> types) {
      this.types = Optional.of(Set.copyOf(types));
      return this;
    }

    public Builder userIds(Collection<UUID> userIds) {
      this.userIds = Optional.of(Set.copyOf(userIds));
      return this;
    }

    public ActivityUpdate build() {
      return new ActivityUpdate(
          title, description, start, duration, location, parent, types, userIds);
    }
  }
}

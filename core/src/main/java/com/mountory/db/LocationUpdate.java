package com.mountory.db;

import com.mountory.db.update.FieldUpdate;
import com.mountory.db.update.Reference;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/** A partial update of a location. */
public record LocationUpdate(
    FieldUpdate<String> name,
    FieldUpdate<String> abbreviation,
    FieldUpdate<String> website,
    FieldUpdate<LocationType> locationType,
    FieldUpdate<Reference> parent,
    Optional<Set<ActivityType>> activityTypes) {

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link LocationUpdate}; every field starts out untouched. */
  public static final class Builder {
    private FieldUpdate<String> name = FieldUpdate.unset();
    private FieldUpdate<String> abbreviation = FieldUpdate.unset();
    private FieldUpdate<String> website = FieldUpdate.unset();
    private FieldUpdate<LocationType> locationType = FieldUpdate.unset();
    private FieldUpdate<Reference> parent = FieldUpdate.unset();
    private Optional<Set<ActivityType>> activityTypes = Optional.empty();

    private Builder() {}

    public Builder name(FieldUpdate<String> name) {
      this.name = name;
      return this;
    }

    public Builder abbreviation(FieldUpdate<String> abbreviation) {
      this.abbreviation = abbreviation;
      return this;
    }

    public Builder website(FieldUpdate<String> website) {
      this.website = website;
      return this;
    }

    public Builder locationType(FieldUpdate<LocationType> locationType) {
      this.locationType = locationType;
      return this;
    }

    public Builder parent(FieldUpdate<Reference> parent) {
      this.parent = parent;
      return this;
    }

    public Builder activityTypes(Collection<ActivityType> activityTypes) {
      this.activityTypes = Optional.of(Set.copyOf(activityTypes));
      return this;
    }

    public LocationUpdate build() {
      return new LocationUpdate(name, abbreviation, website, locationType, parent, activityTypes);
    }
  }
}

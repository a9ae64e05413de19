package com.mountory.db;

import com.mountory.db.update.Reference;
import java.util.Set;

/**
 * Fields of a new location. Empty abbreviation and website are stored as null; a missing type
 * is stored as {@link LocationType#OTHER}.
 */
public record LocationCreate(
    String name,
    String abbreviation,
    String website,
    LocationType locationType,
    Reference parent,
    Set<ActivityType> activityTypes) {

  public LocationCreate {
    locationType = locationType == null ? LocationType.OTHER : locationType;
    activityTypes = activityTypes == null ? Set.of() : Set.copyOf(activityTypes);
  }

  /** A location with only a name. */
  public static LocationCreate named(String name) {
    return new LocationCreate(name, null, null, null, null, null);
  }

  public LocationCreate withAbbreviation(String abbreviation) {
    return new LocationCreate(name, abbreviation, website, locationType, parent, activityTypes);
  }

  public LocationCreate withLocationType(LocationType locationType) {
    return new LocationCreate(name, abbreviation, website, locationType, parent, activityTypes);
  }

  public LocationCreate withParent(Reference parent) {
    return new LocationCreate(name, abbreviation, website, locationType, parent, activityTypes);
  }

  public LocationCreate withActivityTypes(Set<ActivityType> activityTypes) {
    return new LocationCreate(name, abbreviation, website, locationType, parent, activityTypes);
  }
}

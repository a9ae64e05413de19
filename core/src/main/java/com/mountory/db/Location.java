package com.mountory.db;

import com.mountory.db.update.Identifiable;
import java.util.Set;
import java.util.UUID;

/**
 * Represents a row in the 'location' table together with its activity types.
 *
 * @param id The unique identifier of the location
 * @param name The name
 * @param abbreviation A short name (optional)
 * @param website The website (optional)
 * @param locationType The kind of location
 * @param parentId The enclosing location (optional)
 * @param activityTypes The activity types possible at this location
 */
public record Location(
    UUID id,
    String name,
    String abbreviation,
    String website,
    LocationType locationType,
    UUID parentId,
    Set<ActivityType> activityTypes)
    implements Identifiable {}

package com.mountory.db;

import com.mountory.db.update.Reference;
import java.time.Duration;
import java.time.temporal.Temporal;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;

/**
 * Fields of a new activity. Everything except the title may be null; an empty description is
 * stored as null.
 *
 * @param start a date-time; a value without zone is taken to be UTC
 */
public record ActivityCreate(
    String title,
    String description,
    Temporal start,
    Duration duration,
    Reference location,
    Reference parent,
    Set<ActivityType> types,
    Set<UUID> userIds) {

  public ActivityCreate {
    types = types == null ? Set.of() : Set.copyOf(types);
    userIds = userIds == null ? Set.of() : Set.copyOf(userIds);
  }

  /** An activity with only a title. */
  public static ActivityCreate titled(String title) {
    return new ActivityCreate(title, null, null, null, null, null, null, null);
  }

  public ActivityCreate withStart(Temporal start) {
    return new ActivityCreate(
        title, description, start, duration, location, parent, types, userIds);
  }

  public ActivityCreate withDuration(Duration duration) {
    return new ActivityCreate(
        title, description, start, duration, location, parent, types, userIds);
  }

  public ActivityCreate withLocation(Reference location) {
    return new ActivityCreate(
        title, description, start, duration, location, parent, types, userIds);
  }

  public ActivityCreate withParent(Reference parent) {
    return new ActivityCreate(
        title, description, start, duration, location, parent, types, userIds);
  }

  public ActivityCreate withTypes(Collection<ActivityType> types) {
    return new ActivityCreate(
        title, description, start, duration, location, parent, Set.copyOf(types), userIds);
  }

  public ActivityCreate withUserIds(Collection<UUID> userIds) {
    return new ActivityCreate(
        title, description, start, duration, location, parent, types, Set.copyOf(userIds));
  }
}

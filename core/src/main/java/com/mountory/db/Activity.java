package com.mountory.db;

import com.mountory.db.update.Identifiable;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Represents a row in the 'activity' table together with its association rows.
 *
 * @param id The unique identifier of the activity
 * @param title The title
 * @param description The description (optional)
 * @param start When the activity started, in UTC (optional)
 * @param duration How long the activity took (optional)
 * @param locationId The location the activity took place at (optional)
 * @param parentId The enclosing activity (optional)
 * @param types The activity types from 'activity_type_association'
 * @param userIds The participants from 'activity_user_link'
 */
public record Activity(
    UUID id,
    String title,
    String description,
    Instant start,
    Duration duration,
    UUID locationId,
    UUID parentId,
    Set<ActivityType> types,
    Set<UUID> userIds)
    implements Identifiable {}

package com.mountory.db;

import com.mountory.db.update.Identifiable;
import java.time.Instant;
import java.util.UUID;

/**
 * Represents a row in the 'transactions' table. Every field except the ID is optional.
 *
 * @param id The unique identifier of the transaction
 * @param activityId The activity the transaction belongs to
 * @param locationId The location the transaction took place at
 * @param userId The owner of the transaction
 * @param date When the transaction took place, in UTC
 * @param amount The amount in minor currency units; negative values are expenses
 * @param category The category
 * @param description A description
 * @param note A short note
 */
public record Transaction(
    UUID id,
    UUID activityId,
    UUID locationId,
    UUID userId,
    Instant date,
    Long amount,
    TransactionCategory category,
    String description,
    String note)
    implements Identifiable {}

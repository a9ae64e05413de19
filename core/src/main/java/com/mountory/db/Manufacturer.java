package com.mountory.db;

import com.mountory.db.update.Identifiable;
import java.util.UUID;

/**
 * Represents a row in the 'equipment_manufacturer' table.
 *
 * @param id The unique identifier of the manufacturer
 * @param name The name
 * @param shortName A short name (optional)
 * @param description The description (optional)
 * @param website The website (optional)
 * @param hidden Whether the manufacturer is only visible to users with an access role
 */
public record Manufacturer(
    UUID id, String name, String shortName, String description, String website, boolean hidden)
    implements Identifiable {}

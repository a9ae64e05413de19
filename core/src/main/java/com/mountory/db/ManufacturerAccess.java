package com.mountory.db;

import java.util.Objects;
import java.util.UUID;

/**
 * Represents a row in the 'equipment_manufacturer_access' table.
 *
 * @param manufacturerId The manufacturer
 * @param userId The user holding the role
 * @param role The access role
 */
public record ManufacturerAccess(UUID manufacturerId, UUID userId, ManufacturerAccessRole role) {
  public ManufacturerAccess {
    Objects.requireNonNull(manufacturerId, "manufacturerId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(role, "role");
  }
}

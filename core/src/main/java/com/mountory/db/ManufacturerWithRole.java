package com.mountory.db;

import java.util.Optional;
import javax.annotation.Nullable;

/**
 * A manufacturer together with the access role of the querying user.
 *
 * @param manufacturer the manufacturer
 * @param role the role of the user, null if the user has none or no user was given
 */
public record ManufacturerWithRole(
    Manufacturer manufacturer, @Nullable ManufacturerAccessRole role) {

  public Optional<ManufacturerAccessRole> roleIfPresent() {
    return Optional.ofNullable(role);
  }
}

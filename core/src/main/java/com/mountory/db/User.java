package com.mountory.db;

import com.google.common.base.MoreObjects;
import com.mountory.db.update.Identifiable;
import java.util.UUID;

/**
 * Represents a row in the 'user' table.
 *
 * @param id The unique identifier of the user
 * @param email The email address, unique
 * @param hashedPassword The password hash
 * @param fullName The full name (optional)
 * @param active Whether the user may log in
 * @param superuser Whether the user has administrative rights
 */
public record User(
    UUID id,
    String email,
    String hashedPassword,
    String fullName,
    boolean active,
    boolean superuser)
    implements Identifiable {

  @Override
  public String toString() {
    // Leave the password hash out of logs.
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("email", email)
        .add("fullName", fullName)
        .add("active", active)
        .add("superuser", superuser)
        .toString();
  }
}

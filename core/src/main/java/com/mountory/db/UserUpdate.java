package com.mountory.db;

import com.mountory.db.update.FieldUpdate;

/**
 * A partial update of a user. Email, password and flags cannot be cleared; the full name can.
 */
public record UserUpdate(
    FieldUpdate<String> email,
    FieldUpdate<String> password,
    FieldUpdate<String> fullName,
    FieldUpdate<Boolean> active,
    FieldUpdate<Boolean> superuser) {

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link UserUpdate}; every field starts out untouched. */
  public static final class Builder {
    private FieldUpdate<String> email = FieldUpdate.unset();
    private FieldUpdate<String> password = FieldUpdate.unset();
    private FieldUpdate<String> fullName = FieldUpdate.unset();
    private FieldUpdate<Boolean> active = FieldUpdate.unset();
    private FieldUpdate<Boolean> superuser = FieldUpdate.unset();

    private Builder() {}

    public Builder email(FieldUpdate<String> email) {
      this.email = email;
      return this;
    }

    public Builder password(FieldUpdate<String> password) {
      this.password = password;
      return this;
    }

    public Builder fullName(FieldUpdate<String> fullName) {
      this.fullName = fullName;
      return this;
    }

    public Builder active(FieldUpdate<Boolean> active) {
      this.active = active;
      return this;
    }

    public Builder superuser(FieldUpdate<Boolean> superuser) {
      this.superuser = superuser;
      return this;
    }

    public UserUpdate build() {
      return new UserUpdate(email, password, fullName, active, superuser);
    }
  }
}

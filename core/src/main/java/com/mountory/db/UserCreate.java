package com.mountory.db;

/**
 * Fields of a new user. The password is hashed before it is stored. A missing active flag means
 * active, a missing superuser flag means a regular user.
 */
public record UserCreate(
    String email, String password, String fullName, Boolean active, Boolean superuser) {

  public UserCreate {
    active = active == null ? Boolean.TRUE : active;
    superuser = superuser == null ? Boolean.FALSE : superuser;
  }

  /** An active regular user. */
  public static UserCreate of(String email, String password) {
    return new UserCreate(email, password, null, null, null);
  }

  public UserCreate withFullName(String fullName) {
    return new UserCreate(email, password, fullName, active, superuser);
  }

  public UserCreate withSuperuser(boolean superuser) {
    return new UserCreate(email, password, fullName, active, superuser);
  }

  @Override
  public String toString() {
    return "UserCreate[email=" + email + ", fullName=" + fullName + ", active=" + active
        + ", superuser=" + superuser + "]";
  }
}

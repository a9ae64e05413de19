package com.mountory.security;

/** Turns plain passwords into stored hashes and checks passwords against them. */
public interface PasswordHasher {

  /** Returns the hash to store for a password. */
  String hash(String password);

  /** Returns true if the password matches the stored hash. */
  boolean verify(String password, String hashedPassword);

  /** Returns true if a stored hash should be replaced with a fresh {@link #hash(String)}. */
  default boolean needsRehash(String hashedPassword) {
    return false;
  }
}

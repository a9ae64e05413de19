package com.mountory.security;

import javax.annotation.Nullable;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * Argon2id password hashes in the PHC string format ({@code $argon2id$v=19$m=...,t=...,p=...$
 * salt$hash}). New hashes are always Argon2id; bcrypt hashes ({@code $2a$}, {@code $2b$}, {@code
 * $2y$}) are still accepted by {@link #verify} and reported by {@link #needsRehash}.
 *
 * <p>The default parameters are those of argon2-cffi, so hashes written by pwdlib and similar
 * libraries verify unchanged.
 */
public final class Argon2PasswordHasher implements PasswordHasher {

  public static final int DEFAULT_PARALLELISM = 4;
  public static final int DEFAULT_MEMORY_KIB = 65_536;
  public static final int DEFAULT_ITERATIONS = 3;
  private static final int SALT_LENGTH = 16;
  private static final int HASH_LENGTH = 32;

  private static final String ARGON2_PREFIX = "$argon2";
  private static final String BCRYPT_PREFIX = "$2";

  private final Argon2PasswordEncoder argon2;
  private final BCryptPasswordEncoder bcrypt = new BCryptPasswordEncoder();

  public Argon2PasswordHasher(int parallelism, int memoryKib, int iterations) {
    if (parallelism <= 0 || memoryKib <= 0 || iterations <= 0) {
      throw new IllegalArgumentException("Argon2 parameters must be positive.");
    }
    this.argon2 =
        new Argon2PasswordEncoder(SALT_LENGTH, HASH_LENGTH, parallelism, memoryKib, iterations);
  }

  public Argon2PasswordHasher() {
    this(DEFAULT_PARALLELISM, DEFAULT_MEMORY_KIB, DEFAULT_ITERATIONS);
  }

  @Override
  public String hash(String password) {
    if (password == null) {
      throw new NullPointerException("password must not be null");
    }
    return argon2.encode(password);
  }

  @Override
  public boolean verify(@Nullable String password, @Nullable String hashedPassword) {
    if (password == null || hashedPassword == null) {
      return false;
    }
    if (hashedPassword.startsWith(ARGON2_PREFIX)) {
      return argon2.matches(password, hashedPassword);
    }
    if (hashedPassword.startsWith(BCRYPT_PREFIX)) {
      return bcrypt.matches(password, hashedPassword);
    }
    return false;
  }

  /**
   * True for anything but an Argon2 hash at least as strong as this hasher's memory and iteration
   * settings.
   */
  @Override
  public boolean needsRehash(String hashedPassword) {
    if (hashedPassword == null || !hashedPassword.startsWith(ARGON2_PREFIX)) {
      return true;
    }
    try {
      return argon2.upgradeEncoding(hashedPassword);
    } catch (IllegalArgumentException e) {
      // Unparseable Argon2 parameters.
      return true;
    }
  }
}

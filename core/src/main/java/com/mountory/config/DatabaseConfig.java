package com.mountory.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import java.util.Map;

/**
 * Configuration record for the PostgreSQL connection pool.
 *
 * @param url The JDBC URL (e.g., "jdbc:postgresql://localhost:5432/mountory")
 * @param user The database user
 * @param password The password of the database user
 * @param maximumPoolSize The maximum number of pooled connections
 */
public record DatabaseConfig(String url, String user, String password, int maximumPoolSize) {

  public static final int DEFAULT_POOL_SIZE = 10;

  /** Reads the configuration from the process environment. */
  public static StatusOr<DatabaseConfig> fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Reads the configuration from {@code DB_URL}, {@code DB_USER}, {@code DB_PASSWORD} and the
   * optional {@code DB_POOL_SIZE}.
   *
   * @param env the environment variables
   * @return the configuration, or INVALID_ARGUMENT if {@code DB_URL} is missing or the pool size
   *     is not a positive number
   */
  public static StatusOr<DatabaseConfig> fromEnvironment(Map<String, String> env) {
    String url = env.get("DB_URL");
    if (Strings.isNullOrEmpty(url)) {
      return StatusOr.ofStatus(Status.invalidArgument("DB_URL is not set"));
    }
    int poolSize = DEFAULT_POOL_SIZE;
    String poolSizeValue = env.get("DB_POOL_SIZE");
    if (!Strings.isNullOrEmpty(poolSizeValue)) {
      try {
        poolSize = Integer.parseInt(poolSizeValue.trim());
      } catch (NumberFormatException e) {
        return StatusOr.ofStatus(
            Status.invalidArgument("DB_POOL_SIZE is not a number: " + poolSizeValue));
      }
      if (poolSize <= 0) {
        return StatusOr.ofStatus(
            Status.invalidArgument("DB_POOL_SIZE must be positive: " + poolSize));
      }
    }
    return StatusOr.ofValue(
        new DatabaseConfig(url, env.get("DB_USER"), env.get("DB_PASSWORD"), poolSize));
  }

  /**
   * Returns a string representation of this object without the password, safe to use in logs.
   */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("url", url())
        .add("user", user())
        .add("maximumPoolSize", maximumPoolSize())
        .toString();
  }

  @Override
  public String toString() {
    return toSecureString();
  }
}

package com.mountory.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.tinylog.Logger;

/** Creates the pooled data source handed to the DAO helpers. */
public final class DataSources {

  private DataSources() {
    // Utility class
  }

  /** Builds the HikariCP settings for the given configuration. */
  static HikariConfig toHikariConfig(DatabaseConfig databaseConfig) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(databaseConfig.url());
    config.setUsername(databaseConfig.user());
    config.setPassword(databaseConfig.password());
    config.setMaximumPoolSize(databaseConfig.maximumPoolSize());
    config.setMinimumIdle(Math.min(2, databaseConfig.maximumPoolSize()));
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    // DAO helpers open their own transactions when they find auto-commit on.
    config.setAutoCommit(true);
    config.setPoolName("MountoryPool");
    config.addDataSourceProperty("cachePrepStmts", "true");
    config.addDataSourceProperty("prepStmtCacheSize", "250");
    config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");
    return config;
  }

  /**
   * Creates a connection pool.
   *
   * @param databaseConfig the connection settings
   * @return the pool; the caller closes it on shutdown
   */
  public static HikariDataSource create(DatabaseConfig databaseConfig) {
    Logger.info("Initializing database connection pool: {}", databaseConfig.toSecureString());
    return new HikariDataSource(toHikariConfig(databaseConfig));
  }
}

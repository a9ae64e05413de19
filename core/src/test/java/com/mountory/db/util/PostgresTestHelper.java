package com.mountory.db.util;

import com.mountory.common.status.Status;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;
import org.tinylog.Logger;

/** Starts a throwaway PostgreSQL for the DAO tests and loads the Mountory schema into it. */
public final class PostgresTestHelper {

  private static final DockerImageName POSTGRES_IMAGE = DockerImageName.parse("postgres:16-alpine");

  /** Entity tables; join tables are emptied through their ON DELETE CASCADE foreign keys. */
  private static final String TRUNCATE_ALL =
      """
      TRUNCATE TABLE transactions, activity, location, equipment_manufacturer, "user" CASCADE
      """;

  private PostgresTestHelper() {}

  public static PostgreSQLContainer<?> createPostgresContainer(String databaseName) {
    return new PostgreSQLContainer<>(POSTGRES_IMAGE)
        .withDatabaseName(databaseName)
        .withUsername("mountory")
        .withPassword("mountory");
  }

  public static Connection createConnection(PostgreSQLContainer<?> container) throws SQLException {
    return DriverManager.getConnection(
        container.getJdbcUrl(), container.getUsername(), container.getPassword());
  }

  /**
   * Applies {@code db/01-schema.sql} through {@link Schema#apply(Connection)}.
   *
   * @throws IllegalStateException if the schema could not be applied
   */
  public static void initializeSchema(Connection connection) {
    Status status = Schema.apply(connection);
    if (status.isError()) {
      throw new IllegalStateException(
          "Failed to initialize database schema: " + status, status.getCause());
    }
  }

  /**
   * Starts a container, connects to it and loads the schema.
   *
   * @param databaseName name of the test database, one per test class
   */
  public static PostgresContext setupPostgres(String databaseName) throws SQLException {
    PostgreSQLContainer<?> container = createPostgresContainer(databaseName);
    container.start();
    Logger.debug("Started {} for {}", POSTGRES_IMAGE, databaseName);

    Connection connection = createConnection(container);
    initializeSchema(connection);
    return new PostgresContext(container, connection);
  }

  /** Removes every row so each test starts from an empty schema. */
  public static void clearTables(Connection connection) throws SQLException {
    try (var stmt = connection.createStatement()) {
      stmt.execute(TRUNCATE_ALL);
    }
  }

  /** The running container together with the one connection the tests share. */
  public static final class PostgresContext implements AutoCloseable {
    private final PostgreSQLContainer<?> container;
    private final Connection connection;

    PostgresContext(PostgreSQLContainer<?> container, Connection connection) {
      this.container = container;
      this.connection = connection;
    }

    public PostgreSQLContainer<?> getContainer() {
      return container;
    }

    public Connection getConnection() {
      return connection;
    }

    /** Closes the connection and stops the container. A failing close still stops the container. */
    @Override
    public void close() {
      try {
        if (!connection.isClosed()) {
          connection.close();
        }
      } catch (SQLException e) {
        Logger.warn(e, "Error closing test connection");
      }
      if (container.isRunning()) {
        container.stop();
      }
    }
  }
}

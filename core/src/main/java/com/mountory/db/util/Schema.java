package com.mountory.db.util;

import com.google.common.io.Resources;
import com.mountory.common.status.Status;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/** The database schema shipped on the classpath. */
public final class Schema {

  /** Classpath location of the schema script. */
  public static final String SCHEMA_SQL_PATH = "/db/01-schema.sql";

  private Schema() {
    // Utility class
  }

  /** Reads the schema script. */
  @Nonnull
  public static String load() throws IOException {
    URL url = Schema.class.getResource(SCHEMA_SQL_PATH);
    if (url == null) {
      throw new IOException("Schema file not found: " + SCHEMA_SQL_PATH);
    }
    return Resources.toString(url, StandardCharsets.UTF_8);
  }

  /**
   * Creates all tables that do not exist yet. The script only uses {@code IF NOT EXISTS}, so
   * applying it to an initialized database changes nothing.
   *
   * @param conn an open JDBC connection
   * @return OK, or the status of the failure
   */
  @Nonnull
  public static Status apply(Connection conn) {
    String script;
    try {
      script = load();
    } catch (IOException e) {
      return Status.internal("Failed to read schema: " + e.getMessage(), e);
    }
    Logger.info("Applying database schema {}", SCHEMA_SQL_PATH);
    Status status =
        DbUtil.inTransactionStatus(
            conn,
            c -> {
              try (Statement stmt = c.createStatement()) {
                stmt.execute(script);
              }
              return DbUtil.done();
            });
    if (status.isError()) {
      Logger.error("Failed to apply database schema: {}", status);
    }
    return status;
  }
}

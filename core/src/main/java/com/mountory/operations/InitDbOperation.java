package com.mountory.operations;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import com.mountory.db.User;
import com.mountory.db.UserCreate;
import com.mountory.db.Users;
import com.mountory.db.util.DbUtil;
import com.mountory.db.util.Schema;
import com.mountory.security.PasswordHasher;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.tinylog.Logger;

/**
 * Operation class for initializing a database. It optionally creates the schema and makes sure a
 * set of initial users exists; users are matched by email, so running it again is harmless.
 */
public class InitDbOperation {
  private final Connection dbConnection;
  private final PasswordHasher passwordHasher;

  /**
   * Creates a new InitDbOperation.
   *
   * @param dbConnection the database connection to use
   * @param passwordHasher hashes the passwords of created users
   */
  public InitDbOperation(Connection dbConnection, PasswordHasher passwordHasher) {
    this.dbConnection = dbConnection;
    this.passwordHasher = passwordHasher;
  }

  /** Result of the initialization. */
  public record InitResult(List<UUID> createdUserIds, int existingUsers, String errorMessage) {

    public static InitResult success(List<UUID> createdUserIds, int existingUsers) {
      return new InitResult(List.copyOf(createdUserIds), existingUsers, null);
    }

    public static InitResult error(String errorMessage) {
      return new InitResult(List.of(), 0, errorMessage);
    }

    public boolean isSuccess() {
      return errorMessage == null;
    }
  }

  /**
   * Initializes the database.
   *
   * @param initialUsers users that should exist afterwards
   * @param createSchema whether to create missing tables first
   * @return the initialization result
   */
  public InitResult execute(List<UserCreate> initialUsers, boolean createSchema) {
    Logger.info("Executing database initialization for {} initial users", initialUsers.size());

    if (createSchema) {
      Status schemaStatus = Schema.apply(dbConnection);
      if (schemaStatus.isError()) {
        Logger.error("Failed to create schema: {}", schemaStatus);
        return InitResult.error("Schema creation failed.");
      }
    }

    List<UUID> created = new ArrayList<>();
    int[] existing = {0};
    StatusOr<Boolean> resultOr =
        DbUtil.inTransaction(
            dbConnection,
            conn -> {
              for (UserCreate initialUser : initialUsers) {
                StatusOr<Optional<User>> userOr = Users.loadByEmail(conn, initialUser.email());
                if (userOr.isNotOk()) {
                  return StatusOr.ofStatus(userOr.getStatus());
                }
                if (userOr.getValue().isPresent()) {
                  existing[0]++;
                  continue;
                }
                StatusOr<User> createdOr = Users.create(conn, initialUser, passwordHasher);
                if (createdOr.isNotOk()) {
                  return StatusOr.ofStatus(createdOr.getStatus());
                }
                created.add(createdOr.getValue().id());
              }
              return DbUtil.done();
            });

    if (resultOr.isNotOk()) {
      Logger.error("Failed to create initial users: {}", resultOr.getStatus().getMessage());
      return InitResult.error(
          "Initial user creation failed: " + resultOr.getStatus().getMessage());
    }
    Logger.info("Database initialized: {} users created, {} already present",
        created.size(), existing[0]);
    return InitResult.success(created, existing[0]);
  }
}

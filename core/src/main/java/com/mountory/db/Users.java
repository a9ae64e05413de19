package com.mountory.db;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import com.mountory.db.query.EntityQueryAssembler;
import com.mountory.db.query.QueryResult;
import com.mountory.db.update.ChangeSet;
import com.mountory.db.update.FieldUpdate;
import com.mountory.db.update.UpdateResolver;
import com.mountory.db.util.DbUtil;
import com.mountory.security.PasswordHasher;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.UUID;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/** DAO helper class for the 'user' table. */
public final class Users {

  private static final String SELECT =
      """
      SELECT id, email, hashed_password, full_name, is_active, is_superuser
        FROM "user"
      """;

  private Users() {
    // Utility class
  }

  /**
   * Creates a user, storing the hash of the given password.
   *
   * @param conn an open JDBC connection
   * @param create the fields of the new user
   * @param hasher hashes the password
   * @return StatusOr containing the stored user, INVALID_ARGUMENT if email or password is missing
   */
  @Nonnull
  public static StatusOr<User> create(Connection conn, UserCreate create, PasswordHasher hasher) {
    if (create.email() == null || create.email().isEmpty()) {
      return StatusOr.ofStatus(Status.emptyField("email"));
    }
    if (create.password() == null || create.password().isEmpty()) {
      return StatusOr.ofStatus(Status.emptyField("password"));
    }
    User user =
        new User(
            UUID.randomUUID(),
            create.email(),
            hasher.hash(create.password()),
            DbUtil.emptyToNull(create.fullName()),
            create.active(),
            create.superuser());
    String sql =
        """
        INSERT INTO "user"
               (id, email, hashed_password, full_name, is_active, is_superuser)
        VALUES (?, ?, ?, ?, ?, ?)
        """;
    Logger.info("Creating user {} <{}>", user.id(), user.email());
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, user.id());
      stmt.setString(2, user.email());
      stmt.setString(3, user.hashedPassword());
      DbUtil.setParameter(stmt, 4, user.fullName());
      stmt.setBoolean(5, user.active());
      stmt.setBoolean(6, user.superuser());
      stmt.executeUpdate();
      return StatusOr.ofValue(user);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads a single user by ID.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the user to load
   * @return StatusOr containing an Optional User or an error
   */
  @Nonnull
  public static StatusOr<Optional<User>> loadById(Connection conn, UUID id) {
    String sql = SELECT + " WHERE id = ?";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      return loadOne(stmt);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /**
   * Loads a single user by email.
   *
   * @param conn an open JDBC connection
   * @param email the email address to load
   * @return StatusOr containing an Optional User or an error
   */
  @Nonnull
  public static StatusOr<Optional<User>> loadByEmail(Connection conn, String email) {
    String sql = SELECT + " WHERE email = ?";
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, email);
      return loadOne(stmt);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  private static StatusOr<Optional<User>> loadOne(PreparedStatement stmt) throws SQLException {
    try (ResultSet rs = stmt.executeQuery()) {
      if (rs.next()) {
        StatusOr<User> userOr = extractUser(rs);
        if (userOr.isNotOk()) {
          return StatusOr.ofStatus(userOr.getStatus());
        }
        return StatusOr.ofValue(Optional.of(userOr.getValue()));
      }
      return StatusOr.ofValue(Optional.empty());
    }
  }

  /**
   * Queries all users ordered by email.
   *
   * @param conn an open JDBC connection
   * @param skip the number of users to skip
   * @param limit the maximum number of users to return
   * @return StatusOr containing the page of users and the total count, or an error
   */
  @Nonnull
  public static StatusOr<QueryResult<User>> query(Connection conn, int skip, int limit) {
    return EntityQueryAssembler.select(SELECT, Users::extractUser)
        .orderBy("email", "id")
        .execute(conn, skip, limit);
  }

  /**
   * Applies a partial update. A new password is hashed before it is stored.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the user to update
   * @param update the fields to change
   * @param hasher hashes a new password
   * @return OK, INVALID_ARGUMENT for a rejected field, or the status of the failing statement
   */
  @Nonnull
  public static Status update(
      Connection conn, UUID id, UserUpdate update, PasswordHasher hasher) {
    FieldUpdate<String> password = update.password();
    if (password.isClear() || (password.isSet() && password.getValue().isEmpty())) {
      return Status.emptyField("password");
    }
    FieldUpdate<String> hashedPassword = password.map(hasher::hash);
    StatusOr<ChangeSet> changesOr =
        UpdateResolver.create()
            .requiredText("email", update.email())
            .requiredText("hashed_password", hashedPassword)
            .optionalText("full_name", update.fullName())
            .requiredValue("is_active", update.active())
            .requiredValue("is_superuser", update.superuser())
            .resolve();
    if (changesOr.isNotOk()) {
      return changesOr.getStatus();
    }
    ChangeSet changes = changesOr.getValue();
    if (changes.isEmpty()) {
      return Status.ok();
    }
    Logger.info("Updating user {}: columns {}", id, changes.asMap().keySet());
    return changes.executeUpdate(conn, "\"user\"", "id", id).getStatus();
  }

  /**
   * Checks an email and password. After a successful check, a stored hash that {@link
   * PasswordHasher#needsRehash} reports is replaced with a fresh hash of the password.
   *
   * @param conn an open JDBC connection
   * @param email the email of the user
   * @param password the plain password
   * @param hasher verifies the password against the stored hash
   * @return StatusOr containing the user if email and password match, empty otherwise
   */
  @Nonnull
  public static StatusOr<Optional<User>> authenticate(
      Connection conn, String email, String password, PasswordHasher hasher) {
    StatusOr<Optional<User>> userOr = loadByEmail(conn, email);
    if (userOr.isNotOk()) {
      return userOr;
    }
    Optional<User> user = userOr.getValue();
    if (user.isEmpty() || !hasher.verify(password, user.get().hashedPassword())) {
      Logger.info("Authentication failed for <{}>", email);
      return StatusOr.ofValue(Optional.empty());
    }
    User found = user.get();
    if (!hasher.needsRehash(found.hashedPassword())) {
      return userOr;
    }
    String rehashed = hasher.hash(password);
    Status status = storeHashedPassword(conn, found.id(), rehashed);
    if (status.isError()) {
      // The old hash still verifies; the next login tries again.
      Logger.warn("Failed to rehash password of user {}: {}", found.id(), status);
      return userOr;
    }
    return StatusOr.ofValue(
        Optional.of(
            new User(
                found.id(),
                found.email(),
                rehashed,
                found.fullName(),
                found.active(),
                found.superuser())));
  }

  private static Status storeHashedPassword(Connection conn, UUID id, String hashedPassword) {
    String sql =
        """
        UPDATE "user" SET hashed_password = ? WHERE id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, hashedPassword);
      stmt.setObject(2, id);
      stmt.executeUpdate();
      Logger.info("Rehashed password of user {}", id);
      return Status.ok();
    } catch (SQLException e) {
      return Status.fromException(e);
    }
  }

  /**
   * Deletes a user by ID. Favorites, participations and access roles are removed; transactions
   * keep existing without an owner.
   *
   * @param conn an open JDBC connection
   * @param id the UUID of the user to delete
   * @return StatusOr containing the number of affected rows or an error
   */
  @Nonnull
  public static StatusOr<Integer> delete(Connection conn, UUID id) {
    String sql =
        """
        DELETE FROM "user"
         WHERE id = ?
        """;
    try (PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setObject(1, id);
      int rowsAffected = stmt.executeUpdate();
      return StatusOr.ofValue(rowsAffected);
    } catch (SQLException e) {
      return StatusOr.ofException(e);
    }
  }

  /** Extracts a User from the current row of a ResultSet. */
  @Nonnull
  static StatusOr<User> extractUser(ResultSet rs) throws SQLException {
    StatusOr<UUID> idOr = DbUtil.getUuid(rs, "id");
    if (idOr.isNotOk()) {
      return StatusOr.ofStatus(idOr.getStatus());
    }
    return StatusOr.ofValue(
        new User(
            idOr.getValue(),
            rs.getString("email"),
            rs.getString("hashed_password"),
            rs.getString("full_name"),
            rs.getBoolean("is_active"),
            rs.getBoolean("is_superuser")));
  }
}

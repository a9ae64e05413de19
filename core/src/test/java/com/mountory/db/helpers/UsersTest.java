package com.mountory.db.helpers;

import static org.junit.jupiter.api.Assertions.*;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusCode;
import com.mountory.common.status.StatusOr;
import com.mountory.db.User;
import com.mountory.db.UserCreate;
import com.mountory.db.UserUpdate;
import com.mountory.db.Users;
import com.mountory.db.query.QueryResult;
import com.mountory.db.update.FieldUpdate;
import com.mountory.db.util.PostgresTestHelper;
import com.mountory.security.Argon2PasswordHasher;
import com.mountory.security.PasswordHasher;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public class UsersTest {

  private static final PasswordHasher HASHER = new Argon2PasswordHasher(1, 1024, 1);

  private static PostgresTestHelper.PostgresContext postgresContext;
  private static Connection connection;

  @BeforeAll
  static void setUp() throws SQLException {
    postgresContext = PostgresTestHelper.setupPostgres("mountory_users_test");
    connection = postgresContext.getConnection();
  }

  @AfterAll
  static void tearDown() {
    if (postgresContext != null) {
      postgresContext.close();
    }
  }

  @BeforeEach
  void clearData() throws SQLException {
    PostgresTestHelper.clearTables(connection);
  }

  private static User create(UserCreate create) {
    return EntityHelper.valueOrThrow(Users.create(connection, create, HASHER));
  }

  @Test
  void testCreate_StoresHashNotPassword() {
    // Given
    UserCreate create = UserCreate.of("anna@example.com", "correct horse").withFullName("Anna");

    // When
    User created = create(create);

    // Then
    User loaded = Users.loadById(connection, created.id()).getValue().orElseThrow();
    assertEquals(created, loaded);
    assertNotEquals("correct horse", loaded.hashedPassword());
    assertTrue(HASHER.verify("correct horse", loaded.hashedPassword()));
    assertTrue(loaded.active());
    assertFalse(loaded.superuser());
    assertEquals("Anna", loaded.fullName());
    assertFalse(loaded.toString().contains(loaded.hashedPassword()));
  }

  @Test
  void testCreate_RequiresEmailAndPassword() {
    StatusOr<User> noEmail = Users.create(connection, UserCreate.of("", "secret"), HASHER);
    StatusOr<User> noPassword =
        Users.create(connection, UserCreate.of("anna@example.com", null), HASHER);

    assertEquals("email cannot be empty", noEmail.getStatus().getMessage());
    assertEquals("password cannot be empty", noPassword.getStatus().getMessage());
  }

  @Test
  void testCreate_DuplicateEmailIsAConstraintViolation() {
    create(UserCreate.of("anna@example.com", "secret"));

    StatusOr<User> duplicateOr =
        Users.create(connection, UserCreate.of("anna@example.com", "other"), HASHER);

    assertEquals(StatusCode.INTERNAL, duplicateOr.getStatus().getCode());
    assertEquals("23505", duplicateOr.getStatus().getSqlState());
  }

  @Test
  void testLoadByEmail() {
    User created = create(UserCreate.of("anna@example.com", "secret"));

    assertEquals(
        Optional.of(created), Users.loadByEmail(connection, "anna@example.com").getValue());
    assertEquals(Optional.empty(), Users.loadByEmail(connection, "nobody@example.com").getValue());
  }

  @Test
  void testAuthenticate() {
    User created = create(UserCreate.of("anna@example.com", "secret"));

    assertEquals(
        Optional.of(created),
        Users.authenticate(connection, "anna@example.com", "secret", HASHER).getValue());
    assertTrue(
        Users.authenticate(connection, "anna@example.com", "wrong", HASHER).getValue().isEmpty());
    assertTrue(
        Users.authenticate(connection, "nobody@example.com", "secret", HASHER)
            .getValue()
            .isEmpty());
  }

  @Test
  void testAuthenticate_WeakerHash_IsReplaced() {
    PasswordHasher weaker = new Argon2PasswordHasher(1, 512, 1);
    User created =
        EntityHelper.valueOrThrow(
            Users.create(connection, UserCreate.of("anna@example.com", "secret"), weaker));

    User authenticated =
        Users.authenticate(connection, "anna@example.com", "secret", HASHER)
            .getValue()
            .orElseThrow();

    assertTrue(authenticated.hashedPassword().startsWith("$argon2id$v=19$m=1024,t=1,p=1$"));
    User loaded = Users.loadById(connection, created.id()).getValue().orElseThrow();
    assertEquals(authenticated, loaded);
    assertNotEquals(created.hashedPassword(), loaded.hashedPassword());
    assertTrue(HASHER.verify("secret", loaded.hashedPassword()));
  }

  @Test
  void testAuthenticate_BcryptHashFromEarlierSystem() throws SQLException {
    User created = create(UserCreate.of("anna@example.com", "secret"));
    try (var stmt =
        connection.prepareStatement("UPDATE \"user\" SET hashed_password = ? WHERE id = ?")) {
      stmt.setString(1, "$2b$04$MountoryFixtureSalt12uDzjWj1932.2nHboTB3sA2AxDXefuKxi");
      stmt.setObject(2, created.id());
      stmt.executeUpdate();
    }

    assertTrue(
        Users.authenticate(connection, "anna@example.com", "secret", HASHER).getValue().isEmpty());
    User authenticated =
        Users.authenticate(connection, "anna@example.com", "correct horse battery staple", HASHER)
            .getValue()
            .orElseThrow();

    assertTrue(authenticated.hashedPassword().startsWith("$argon2id$"));
    assertEquals(authenticated, Users.loadById(connection, created.id()).getValue().orElseThrow());
  }

  @Test
  void testUpdate_NewPasswordIsHashed() {
    User created = create(UserCreate.of("anna@example.com", "secret"));

    Status status =
        Users.update(
            connection,
            created.id(),
            UserUpdate.builder()
                .password(FieldUpdate.of("new secret"))
                .fullName(FieldUpdate.of("Anna A."))
                .superuser(FieldUpdate.of(true))
                .build(),
            HASHER);

    assertTrue(status.isOk());
    User loaded = Users.loadById(connection, created.id()).getValue().orElseThrow();
    assertTrue(HASHER.verify("new secret", loaded.hashedPassword()));
    assertFalse(HASHER.verify("secret", loaded.hashedPassword()));
    assertEquals("Anna A.", loaded.fullName());
    assertTrue(loaded.superuser());
  }

  @Test
  void testUpdate_RejectedFieldsWriteNothing() {
    User created = create(UserCreate.of("anna@example.com", "secret").withFullName("Anna"));

    Status clearedPassword =
        Users.update(
            connection,
            created.id(),
            UserUpdate.builder()
                .fullName(FieldUpdate.clear())
                .password(FieldUpdate.fromText(""))
                .build(),
            HASHER);
    Status clearedEmail =
        Users.update(
            connection, created.id(), UserUpdate.builder().email(FieldUpdate.clear()).build(),
            HASHER);
    Status clearedActive =
        Users.update(
            connection, created.id(), UserUpdate.builder().active(FieldUpdate.clear()).build(),
            HASHER);

    assertEquals("password cannot be empty", clearedPassword.getMessage());
    assertEquals("email cannot be empty", clearedEmail.getMessage());
    assertEquals(StatusCode.INVALID_ARGUMENT, clearedActive.getCode());
    assertEquals(created, Users.loadById(connection, created.id()).getValue().orElseThrow());
  }

  @Test
  void testQuery_OrderedByEmailWithTotal() {
    create(UserCreate.of("carl@example.com", "secret"));
    create(UserCreate.of("anna@example.com", "secret"));
    create(UserCreate.of("bert@example.com", "secret"));

    QueryResult<User> page = Users.query(connection, 1, 1).getValue();
    QueryResult<User> all = Users.query(connection, 0, 10).getValue();

    assertEquals(List.of("bert@example.com"),
        page.getItems().stream().map(User::email).collect(Collectors.toList()));
    assertEquals(3, page.getTotalCount());
    assertEquals(List.of("anna@example.com", "bert@example.com", "carl@example.com"),
        all.getItems().stream().map(User::email).collect(Collectors.toList()));
  }

  @Test
  void testDelete() {
    User created = create(UserCreate.of("anna@example.com", "secret"));

    assertEquals(1, Users.delete(connection, created.id()).getValue());
    assertEquals(0, Users.delete(connection, UUID.randomUUID()).getValue());
    assertTrue(Users.loadById(connection, created.id()).getValue().isEmpty());
  }
}

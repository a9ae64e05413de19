package com.mountory.db.helpers;

import static org.junit.jupiter.api.Assertions.*;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusCode;
import com.mountory.db.Activities;
import com.mountory.db.Activity;
import com.mountory.db.Location;
import com.mountory.db.Transaction;
import com.mountory.db.TransactionCategory;
import com.mountory.db.TransactionCreate;
import com.mountory.db.TransactionFilter;
import com.mountory.db.TransactionUpdate;
import com.mountory.db.Transactions;
import com.mountory.db.User;
import com.mountory.db.query.QueryResult;
import com.mountory.db.update.FieldUpdate;
import com.mountory.db.update.Reference;
import com.mountory.db.util.PostgresTestHelper;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public class TransactionsTest {

  private static PostgresTestHelper.PostgresContext postgresContext;
  private static Connection connection;

  @BeforeAll
  static void setUp() throws SQLException {
    postgresContext = PostgresTestHelper.setupPostgres("mountory_transactions_test");
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

  private static Transaction create(TransactionCreate create) {
    return EntityHelper.valueOrThrow(Transactions.create(connection, create));
  }

  private static Transaction load(UUID id) {
    return Transactions.loadById(connection, id).getValue().orElseThrow();
  }

  @Test
  void testCreate_RoundTrip() {
    // Given
    User user = EntityHelper.createTestUser(connection);
    Activity activity = EntityHelper.createTestActivity(connection, "Tour");
    Location location = EntityHelper.createTestLocation(connection, "Hut");
    TransactionCreate create =
        new TransactionCreate(
            Reference.to(activity),
            Reference.to(location),
            Reference.to(user),
            OffsetDateTime.of(2024, 8, 3, 19, 0, 0, 0, ZoneOffset.ofHours(2)),
            -4500L,
            TransactionCategory.ACCOMMODATION,
            "Half board",
            "");

    // When
    Transaction created = create(create);

    // Then
    Transaction loaded = load(created.id());
    assertEquals(created, loaded);
    assertEquals(Instant.parse("2024-08-03T17:00:00Z"), loaded.date());
    assertEquals(TransactionCategory.ACCOMMODATION, loaded.category());
    assertNull(loaded.note(), "Empty note should be stored as null");
  }

  @Test
  void testCreate_EveryFieldMayBeMissing() {
    Transaction created =
        create(new TransactionCreate(null, null, null, null, null, null, null, null));

    Transaction loaded = load(created.id());
    assertNull(loaded.userId());
    assertNull(loaded.amount());
    assertNull(loaded.category());
  }

  @Test
  void testCreate_DateWithoutTimeIsRejected() {
    User user = EntityHelper.createTestUser(connection);

    Status status =
        Transactions.create(
                connection, TransactionCreate.of(Reference.to(user), 10).withDate(LocalDate.now()))
            .getStatus();

    assertEquals(StatusCode.INVALID_ARGUMENT, status.getCode());
  }

  @Test
  void testQuery_FiltersAndTotal() {
    // Given
    User alice = EntityHelper.createTestUser(connection);
    User bob = EntityHelper.createTestUser(connection);
    Activity tour = EntityHelper.createTestActivity(connection, "Tour");
    create(TransactionCreate.of(Reference.to(alice), -1200).withActivity(Reference.to(tour)));
    create(TransactionCreate.of(Reference.to(alice), -300));
    create(TransactionCreate.of(Reference.to(bob), -800).withActivity(Reference.to(tour)));

    // When
    QueryResult<Transaction> ofTour =
        Transactions.query(
                connection, TransactionFilter.all().withActivityIds(List.of(tour.id())), 0, 10)
            .getValue();
    QueryResult<Transaction> ofAliceWithoutActivity =
        Transactions.query(
                connection,
                TransactionFilter.all()
                    .withUserIds(List.of(alice.id()))
                    .withActivityIds(Arrays.asList((UUID) null)),
                0,
                10)
            .getValue();

    // Then
    assertEquals(2, ofTour.getTotalCount());
    assertEquals(-2000L, Transactions.total(ofTour.getItems(), null));
    assertEquals(-1200L, Transactions.total(ofTour.getItems(), List.of(alice.id())));
    assertEquals(1, ofAliceWithoutActivity.getTotalCount());
    assertEquals(-300L, ofAliceWithoutActivity.getItems().get(0).amount());
  }

  @Test
  void testQuery_MostRecentFirst() {
    User user = EntityHelper.createTestUser(connection);
    create(
        TransactionCreate.of(Reference.to(user), 1)
            .withDate(Instant.parse("2024-01-01T00:00:00Z")));
    create(TransactionCreate.of(Reference.to(user), 2));
    create(
        TransactionCreate.of(Reference.to(user), 3)
            .withDate(Instant.parse("2024-02-01T00:00:00Z")));

    List<Transaction> items =
        Transactions.query(connection, TransactionFilter.all(), 0, 10).getValue().getItems();

    assertEquals(List.of(3L, 1L, 2L), items.stream().map(Transaction::amount).toList());
  }

  @Test
  void testUpdate_ClearsAndSetsFields() {
    User user = EntityHelper.createTestUser(connection);
    Transaction created =
        create(
            new TransactionCreate(
                null, null, Reference.to(user), null, -500L, TransactionCategory.FOOD, "Lunch",
                "cash"));

    Status status =
        Transactions.update(
            connection,
            created.id(),
            TransactionUpdate.builder()
                .amount(FieldUpdate.clear())
                .category(FieldUpdate.of(TransactionCategory.FEES))
                .note(FieldUpdate.fromText(""))
                .user(FieldUpdate.clear())
                .build());

    assertTrue(status.isOk());
    Transaction loaded = load(created.id());
    assertNull(loaded.amount());
    assertEquals(TransactionCategory.FEES, loaded.category());
    assertEquals("Lunch", loaded.description());
    assertNull(loaded.note());
    assertNull(loaded.userId());
  }

  @Test
  void testUpdate_NoFieldsChangesNothing() {
    User user = EntityHelper.createTestUser(connection);
    Transaction created = create(TransactionCreate.of(Reference.to(user), 42));

    assertTrue(
        Transactions.update(connection, created.id(), TransactionUpdate.builder().build()).isOk());

    assertEquals(created, load(created.id()));
  }

  @Test
  void testDeletingTheActivityKeepsTheTransaction() {
    User user = EntityHelper.createTestUser(connection);
    Activity tour = EntityHelper.createTestActivity(connection, "Tour");
    Transaction created =
        create(TransactionCreate.of(Reference.to(user), -10).withActivity(Reference.to(tour)));

    assertEquals(1, Activities.delete(connection, tour.id()).getValue());

    assertNull(load(created.id()).activityId());
  }

  @Test
  void testDelete() {
    User user = EntityHelper.createTestUser(connection);
    Transaction created = create(TransactionCreate.of(Reference.to(user), 1));

    assertEquals(1, Transactions.delete(connection, created.id()).getValue());
    assertTrue(Transactions.loadById(connection, created.id()).getValue().isEmpty());
  }
}

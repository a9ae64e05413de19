package com.mountory.db;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusCode;
import com.mountory.common.status.StatusOr;
import com.mountory.db.update.FieldUpdate;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** A statement failing inside a multi-step write is returned unchanged and rolled back. */
@ExtendWith(MockitoExtension.class)
class FailedWriteTest {

  @Mock private Connection connection;

  @BeforeEach
  void failEveryStatement() throws SQLException {
    when(connection.getAutoCommit()).thenReturn(true);
    when(connection.prepareStatement(anyString()))
        .thenThrow(new SQLException("insert or update violates foreign key", "23503"));
  }

  private void assertRolledBack(Status status) throws SQLException {
    assertEquals(StatusCode.INTERNAL, status.getCode());
    assertEquals("23503", status.getSqlState());
    assertTrue(status.isConstraintViolation());
    verify(connection).setAutoCommit(false);
    verify(connection).rollback();
    verify(connection, never()).commit();
    verify(connection).setAutoCommit(true);
  }

  @Test
  void testActivitiesUpdate_ReturnsTheStatementFailure() throws SQLException {
    Status status =
        Activities.update(
            connection,
            UUID.randomUUID(),
            ActivityUpdate.builder().title(FieldUpdate.of("Trip")).build());

    assertRolledBack(status);
  }

  @Test
  void testLocationsUpdate_ReturnsTheStatementFailure() throws SQLException {
    Status status =
        Locations.update(
            connection,
            UUID.randomUUID(),
            LocationUpdate.builder().name(FieldUpdate.of("Alps")).build());

    assertRolledBack(status);
  }

  @Test
  void testActivitiesCreate_ReturnsTheStatementFailure() throws SQLException {
    StatusOr<Activity> createdOr = Activities.create(connection, ActivityCreate.titled("Trip"));

    assertRolledBack(createdOr.getStatus());
  }

  @Test
  void testLocationsCreate_ReturnsTheStatementFailure() throws SQLException {
    StatusOr<Location> createdOr = Locations.create(connection, LocationCreate.named("Alps"));

    assertRolledBack(createdOr.getStatus());
  }
}

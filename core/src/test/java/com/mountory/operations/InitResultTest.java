package com.mountory.operations;

import static org.junit.jupiter.api.Assertions.*;

import com.mountory.operations.InitDbOperation.InitResult;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/** Tests the result class of the InitDbOperation. */
class InitResultTest {

  @Test
  void testInitResultSuccess() {
    // Arrange
    UUID userId = UUID.randomUUID();

    // Act
    InitResult result = InitResult.success(List.of(userId), 1);

    // Assert
    assertTrue(result.isSuccess());
    assertEquals(List.of(userId), result.createdUserIds());
    assertEquals(1, result.existingUsers());
    assertNull(result.errorMessage());
  }

  @Test
  void testInitResultError() {
    // Act
    InitResult result = InitResult.error("Test error message");

    // Assert
    assertFalse(result.isSuccess());
    assertTrue(result.createdUserIds().isEmpty());
    assertEquals("Test error message", result.errorMessage());
  }
}

package com.mountory.db.query;

import static org.junit.jupiter.api.Assertions.*;

import com.mountory.db.update.AssociationTable;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class NullableInFilterBuilderTest {

  private static final AssociationTable TYPES =
      new AssociationTable("activity_type_association", "activity_id", "activity_type");

  @Test
  void testBuild_NullOrEmpty_SkipsDimension() {
    assertEquals(Optional.empty(), NullableInFilterBuilder.build("location_id", null));
    assertEquals(Optional.empty(), NullableInFilterBuilder.build("location_id", List.of()));
  }

  @Test
  void testBuild_ConcreteValuesOnly() {
    UUID a = UUID.randomUUID();
    UUID b = UUID.randomUUID();

    SqlPredicate predicate = NullableInFilterBuilder.build("location_id", List.of(a, b)).get();

    assertEquals("location_id IN (?, ?)", predicate.sql());
    assertEquals(List.of(a, b), predicate.params());
  }

  @Test
  void testBuild_ValueAndNull() {
    UUID loc1 = UUID.randomUUID();

    SqlPredicate predicate =
        NullableInFilterBuilder.build("activity.location_id", Arrays.asList(loc1, null)).get();

    assertEquals(
        "(activity.location_id IN (?) OR activity.location_id IS NULL)", predicate.sql());
    assertEquals(List.of(loc1), predicate.params());
  }

  @Test
  void testBuild_OnlyNull() {
    SqlPredicate predicate =
        NullableInFilterBuilder.build("parent_id", Collections.singletonList(null)).get();

    assertEquals("parent_id IS NULL", predicate.sql());
    assertTrue(predicate.params().isEmpty());
  }

  @Test
  void testBuild_DuplicatesAreBoundOnce() {
    UUID a = UUID.randomUUID();

    SqlPredicate predicate =
        NullableInFilterBuilder.build("location_id", Arrays.asList(a, null, a, null)).get();

    assertEquals("(location_id IN (?) OR location_id IS NULL)", predicate.sql());
    assertEquals(List.of(a), predicate.params());
  }

  @Test
  void testBuildExists_ConcreteValues() {
    SqlPredicate predicate =
        NullableInFilterBuilder.buildExists(TYPES, "activity.id", List.of("Running/Jogging"))
            .get();

    assertEquals(
        "EXISTS (SELECT 1 FROM activity_type_association"
            + " WHERE activity_type_association.activity_id = activity.id"
            + " AND activity_type_association.activity_type IN (?))",
        predicate.sql());
    assertEquals(List.of("Running/Jogging"), predicate.params());
  }

  @Test
  void testBuildExists_NullMatchesOwnersWithoutRows() {
    SqlPredicate onlyNull =
        NullableInFilterBuilder.buildExists(TYPES, "activity.id", Collections.singletonList(null))
            .get();
    SqlPredicate withValue =
        NullableInFilterBuilder.buildExists(
                TYPES, "activity.id", Arrays.asList("Running/Jogging", null))
            .get();

    assertEquals(
        "NOT EXISTS (SELECT 1 FROM activity_type_association"
            + " WHERE activity_type_association.activity_id = activity.id)",
        onlyNull.sql());
    assertTrue(withValue.sql().startsWith("(EXISTS ("));
    assertTrue(withValue.sql().contains(" OR NOT EXISTS ("));
    assertEquals(List.of("Running/Jogging"), withValue.params());
  }

  @Test
  void testSqlPredicate_CombineWrapsParts() {
    SqlPredicate a = SqlPredicate.eq("a", 1);
    SqlPredicate b = SqlPredicate.of("b IS NULL");

    assertEquals("(a = ?) AND (b IS NULL)", a.and(b).sql());
    assertEquals("(a = ?) OR (b IS NULL)", a.or(b).sql());
    assertEquals(List.of(1), a.and(b).params());
    assertEquals(Optional.of(a), SqlPredicate.and(List.of(a)));
    assertEquals(Optional.empty(), SqlPredicate.or(List.of()));
  }
}

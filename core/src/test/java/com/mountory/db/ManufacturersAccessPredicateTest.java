package com.mountory.db;

import static org.junit.jupiter.api.Assertions.*;

import com.mountory.db.query.SqlPredicate;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

/** Tests the visibility and role predicate of manufacturer queries. */
class ManufacturersAccessPredicateTest {

  private static final UUID USER = UUID.randomUUID();

  @Test
  void testNoUser_NoFilter() {
    assertEquals(Optional.empty(), Manufacturers.accessPredicate(ManufacturerFilter.all()));
  }

  @Test
  void testNoUser_HiddenOnly() {
    SqlPredicate predicate =
        Manufacturers.accessPredicate(new ManufacturerFilter(null, true, null)).get();

    assertEquals("equipment_manufacturer.hidden = ?", predicate.sql());
    assertEquals(List.of(true), predicate.params());
  }

  @Test
  void testUser_NoFilter_PublicOrWithRole() {
    SqlPredicate predicate =
        Manufacturers.accessPredicate(ManufacturerFilter.visibleTo(USER)).get();

    assertEquals(
        "(equipment_manufacturer.hidden = FALSE) OR (user_access.role IS NOT NULL)",
        predicate.sql());
    assertTrue(predicate.params().isEmpty());
  }

  @Test
  void testUser_EmptyRolesBehaveLikeNoRoles() {
    assertEquals(
        Manufacturers.accessPredicate(ManufacturerFilter.visibleTo(USER)),
        Manufacturers.accessPredicate(new ManufacturerFilter(USER, null, List.of())));
  }

  @Test
  void testUser_HiddenTrue_RequiresRole() {
    SqlPredicate predicate =
        Manufacturers.accessPredicate(new ManufacturerFilter(USER, true, null)).get();

    assertEquals(
        "(equipment_manufacturer.hidden = ?) AND (user_access.role IS NOT NULL)",
        predicate.sql());
  }

  @Test
  void testUser_HiddenFalse_PublicOnly() {
    SqlPredicate predicate =
        Manufacturers.accessPredicate(new ManufacturerFilter(USER, false, null)).get();

    assertEquals("equipment_manufacturer.hidden = ?", predicate.sql());
    assertEquals(List.of(false), predicate.params());
  }

  @Test
  void testUser_RolesWithNull() {
    SqlPredicate predicate =
        Manufacturers.accessPredicate(
                new ManufacturerFilter(
                    USER, null, Arrays.asList(ManufacturerAccessRole.OWNER, null)))
            .get();

    assertEquals(
        "(user_access.role IN (?)) OR "
            + "((user_access.role IS NULL) AND (equipment_manufacturer.hidden = FALSE))",
        predicate.sql());
    assertEquals(List.of(ManufacturerAccessRole.OWNER), predicate.params());
  }

  @Test
  void testUser_RolesAndHidden_CombinedWithAnd() {
    SqlPredicate predicate =
        Manufacturers.accessPredicate(
                new ManufacturerFilter(USER, false, List.of(ManufacturerAccessRole.EDITOR)))
            .get();

    assertEquals(
        "(equipment_manufacturer.hidden = ?) AND (user_access.role IN (?))", predicate.sql());
    assertEquals(List.of(false, ManufacturerAccessRole.EDITOR), predicate.params());
  }
}

package com.mountory.db.helpers;

import static org.junit.jupiter.api.Assertions.*;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusCode;
import com.mountory.common.status.StatusOr;
import com.mountory.db.ActivityType;
import com.mountory.db.Location;
import com.mountory.db.LocationCreate;
import com.mountory.db.LocationFavorite;
import com.mountory.db.LocationFilter;
import com.mountory.db.LocationType;
import com.mountory.db.LocationUpdate;
import com.mountory.db.Locations;
import com.mountory.db.ParentPathEntry;
import com.mountory.db.User;
import com.mountory.db.query.QueryResult;
import com.mountory.db.update.FieldUpdate;
import com.mountory.db.update.Reference;
import com.mountory.db.util.PostgresTestHelper;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public class LocationsTest {

  private static PostgresTestHelper.PostgresContext postgresContext;
  private static Connection connection;

  @BeforeAll
  static void setUp() throws SQLException {
    postgresContext = PostgresTestHelper.setupPostgres("mountory_locations_test");
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

  private static Location load(UUID id) {
    return Locations.loadById(connection, id).getValue().orElseThrow();
  }

  private static List<String> names(QueryResult<Location> result) {
    return result.getItems().stream().map(Location::name).collect(Collectors.toList());
  }

  private static Location create(LocationCreate create) {
    return EntityHelper.valueOrThrow(Locations.create(connection, create));
  }

  @Test
  void testCreate_EmptyAbbreviationIsStoredAsNull() {
    // Given
    LocationCreate create = LocationCreate.named("Base Camp").withAbbreviation("");

    // When
    Location created = create(create);

    // Then
    Location loaded = load(created.id());
    assertNull(loaded.abbreviation());
    assertEquals("Base Camp", loaded.name());
    assertEquals(LocationType.OTHER, loaded.locationType());
    assertEquals(created, loaded);
  }

  @Test
  void testUpdate_UnsetAbbreviationStaysNull() {
    Location created = create(LocationCreate.named("Base Camp").withAbbreviation(""));

    Status status =
        Locations.update(
            connection,
            created.id(),
            LocationUpdate.builder()
                .name(FieldUpdate.of("Base Camp II"))
                .abbreviation(FieldUpdate.fromText(null))
                .build());

    assertTrue(status.isOk());
    Location loaded = load(created.id());
    assertEquals("Base Camp II", loaded.name());
    assertNull(loaded.abbreviation());
  }

  @Test
  void testCreate_WithTypesAndParent() {
    Location region =
        create(LocationCreate.named("Dolomites").withLocationType(LocationType.REGION));
    Location crag =
        create(
            LocationCreate.named("Sella")
                .withLocationType(LocationType.CRAG)
                .withParent(Reference.to(region))
                .withActivityTypes(
                    Set.of(ActivityType.CLIMBING_ALPINE, ActivityType.CLIMBING_VIA_FERRATA)));

    Location loaded = load(crag.id());

    assertEquals(region.id(), loaded.parentId());
    assertEquals(LocationType.CRAG, loaded.locationType());
    assertEquals(
        Set.of(ActivityType.CLIMBING_ALPINE, ActivityType.CLIMBING_VIA_FERRATA),
        loaded.activityTypes());
  }

  @Test
  void testCreate_MissingName_IsRejected() {
    StatusOr<Location> createdOr = Locations.create(connection, LocationCreate.named(null));

    assertEquals(StatusCode.INVALID_ARGUMENT, createdOr.getStatus().getCode());
    assertEquals("name cannot be empty", createdOr.getStatus().getMessage());
  }

  @Test
  void testUpdate_ClearingRequiredFieldsIsRejected() {
    Location created = create(LocationCreate.named("Arco"));

    Status clearedName =
        Locations.update(
            connection, created.id(), LocationUpdate.builder().name(FieldUpdate.clear()).build());
    Status clearedType =
        Locations.update(
            connection,
            created.id(),
            LocationUpdate.builder()
                .website(FieldUpdate.of("https://arco.example"))
                .locationType(FieldUpdate.clear())
                .build());

    assertEquals(StatusCode.INVALID_ARGUMENT, clearedName.getCode());
    assertEquals(StatusCode.INVALID_ARGUMENT, clearedType.getCode());
    assertEquals(created, load(created.id()));
  }

  @Test
  void testUpdate_ActivityTypesAndOptionalText() {
    Location created =
        create(
            LocationCreate.named("Gym")
                .withAbbreviation("G")
                .withActivityTypes(Set.of(ActivityType.INDOOR_BOULDERING)));

    Status status =
        Locations.update(
            connection,
            created.id(),
            LocationUpdate.builder()
                .abbreviation(FieldUpdate.fromText(""))
                .locationType(FieldUpdate.of(LocationType.GYM))
                .activityTypes(
                    List.of(ActivityType.INDOOR_SPORT_CLIMBING, ActivityType.INDOOR_BOULDERING))
                .build());

    assertTrue(status.isOk());
    Location loaded = load(created.id());
    assertNull(loaded.abbreviation());
    assertEquals(LocationType.GYM, loaded.locationType());
    assertEquals(
        Set.of(ActivityType.INDOOR_SPORT_CLIMBING, ActivityType.INDOOR_BOULDERING),
        loaded.activityTypes());
  }

  @Test
  void testQuery_OrderedByNameCaseInsensitively() {
    create(LocationCreate.named("bleau"));
    create(LocationCreate.named("Arco"));
    create(LocationCreate.named("Ceuse"));

    QueryResult<Location> result =
        Locations.query(connection, LocationFilter.all(), 0, 10).getValue();

    assertEquals(List.of("Arco", "bleau", "Ceuse"), names(result));
    assertEquals(3, result.getTotalCount());
  }

  @Test
  void testQuery_ByTypeAndParent() {
    Location region = create(LocationCreate.named("Valais").withLocationType(LocationType.REGION));
    create(
        LocationCreate.named("Saas")
            .withLocationType(LocationType.AREA)
            .withParent(Reference.to(region)));
    create(LocationCreate.named("Zermatt").withLocationType(LocationType.CITY));

    QueryResult<Location> topLevel =
        Locations.query(
                connection, new LocationFilter(null, Arrays.asList((UUID) null)), 0, 10)
            .getValue();
    QueryResult<Location> areasAndCities =
        Locations.query(
                connection,
                new LocationFilter(List.of(LocationType.AREA, LocationType.CITY), null),
                0,
                10)
            .getValue();
    QueryResult<Location> children =
        Locations.query(connection, new LocationFilter(null, List.of(region.id())), 0, 10)
            .getValue();

    assertEquals(List.of("Valais", "Zermatt"), names(topLevel));
    assertEquals(List.of("Saas", "Zermatt"), names(areasAndCities));
    assertEquals(List.of("Saas"), names(children));
  }

  @Test
  void testFavorites() {
    // Given
    User user = EntityHelper.createTestUser(connection);
    Location arco = create(LocationCreate.named("Arco"));
    Location bleau = create(LocationCreate.named("Bleau"));
    create(LocationCreate.named("Ceuse"));

    // When
    StatusOr<LocationFavorite> favoriteOr =
        Locations.addFavorite(connection, bleau.id(), user.id());
    Locations.addFavorite(connection, arco.id(), user.id());
    StatusOr<LocationFavorite> againOr = Locations.addFavorite(connection, arco.id(), user.id());

    // Then
    assertEquals(new LocationFavorite(bleau.id(), user.id()), favoriteOr.getValue());
    assertTrue(againOr.isOk(), "Marking a favorite twice is not an error");
    assertEquals(
        List.of("Arco", "Bleau"),
        Locations.loadFavoritesByUserId(connection, user.id()).getValue().stream()
            .map(Location::name)
            .collect(Collectors.toList()));
    assertTrue(Locations.loadFavorite(connection, arco.id(), user.id()).getValue().isPresent());

    assertEquals(1, Locations.removeFavorite(connection, arco.id(), user.id()).getValue());
    assertEquals(0, Locations.removeFavorite(connection, arco.id(), user.id()).getValue());
    assertEquals(
        Optional.empty(), Locations.loadFavorite(connection, arco.id(), user.id()).getValue());
  }

  @Test
  void testLoadParentPath_NearestFirst() {
    Location region = create(LocationCreate.named("Alps"));
    Location area =
        create(LocationCreate.named("Valais").withParent(Reference.to(region)));
    Location crag = create(LocationCreate.named("Saas").withParent(Reference.to(area)));

    List<ParentPathEntry> path = Locations.loadParentPath(connection, crag.id()).getValue();

    assertEquals(
        List.of(
            new ParentPathEntry(area.id(), "Valais"), new ParentPathEntry(region.id(), "Alps")),
        path);
    assertTrue(Locations.loadParentPath(connection, region.id()).getValue().isEmpty());
    assertTrue(Locations.loadParentPath(connection, UUID.randomUUID()).getValue().isEmpty());
  }

  @Test
  void testLoadParentPath_StopsAtCycle() {
    Location a = create(LocationCreate.named("A"));
    Location b = create(LocationCreate.named("B").withParent(Reference.to(a)));
    assertTrue(
        Locations.update(
                connection,
                a.id(),
                LocationUpdate.builder().parent(FieldUpdate.of(Reference.to(b))).build())
            .isOk());

    List<ParentPathEntry> path = Locations.loadParentPath(connection, b.id()).getValue();

    assertEquals(List.of(new ParentPathEntry(a.id(), "A")), path);
  }

  @Test
  void testLoadSubLocationTypes_IncludesGrandchildrenButNotOwnTypes() {
    Location region =
        create(
            LocationCreate.named("Alps")
                .withActivityTypes(Set.of(ActivityType.WINTER_SKI_TOURING)));
    Location area =
        create(
            LocationCreate.named("Valais")
                .withParent(Reference.to(region))
                .withActivityTypes(Set.of(ActivityType.HIKING_TRAIL)));
    create(
        LocationCreate.named("Saas")
            .withParent(Reference.to(area))
            .withActivityTypes(
                Set.of(ActivityType.CLIMBING_BOULDERING, ActivityType.HIKING_TRAIL)));
    create(LocationCreate.named("Bern").withParent(Reference.to(region)));

    assertEquals(
        List.of(ActivityType.CLIMBING_BOULDERING, ActivityType.HIKING_TRAIL),
        Locations.loadSubLocationTypes(connection, region.id()).getValue());
    assertEquals(
        List.of(ActivityType.CLIMBING_BOULDERING, ActivityType.HIKING_TRAIL),
        Locations.loadSubLocationTypes(connection, area.id()).getValue());
    assertTrue(Locations.loadSubLocationTypes(connection, UUID.randomUUID()).getValue().isEmpty());
  }

  @Test
  void testDelete_KeepsChildrenWithoutParent() {
    Location region = create(LocationCreate.named("Alps"));
    Location child = create(LocationCreate.named("Valais").withParent(Reference.to(region)));

    assertEquals(1, Locations.delete(connection, region.id()).getValue());

    assertNull(load(child.id()).parentId());
    assertTrue(Locations.loadById(connection, region.id()).getValue().isEmpty());
  }
}

package com.mountory.db;

import com.mountory.db.util.DatabaseEnum;

/**
 * Kinds of activities, grouped by the prefix before the slash.
 *
 * <p>IMPORTANT: Keep the database values in sync with the activity_type CHECK constraints in
 * 01-schema.sql.
 */
public enum ActivityType implements DatabaseEnum {
  INDOOR_SPORT_CLIMBING("Indoor/Sport Climbing"),
  INDOOR_BOULDERING("Indoor/Bouldering"),
  RUNNING_JOGGING("Running/Jogging"),
  RUNNING_TRAIL_RUNNING("Running/Trail Running"),
  HIKING_CITY_WALKING("Hiking/City Walking"),
  HIKING_TRAIL("Hiking/Hiking Trail"),
  HIKING_LONG_DISTANCE("Hiking/Long Distance Hiking"),
  MOUNTAINEERING_HIKE("Mountaineering/Mountain Hike"),
  MOUNTAINEERING_ALPINE("Mountaineering/Alpine Tour"),
  CLIMBING_BOULDERING("Climbing/Bouldering"),
  CLIMBING_SPORT_CLIMBING("Climbing/Sport Climbing"),
  CLIMBING_ALPINE("Climbing/Alpine Climbing"),
  CLIMBING_ICE("Climbing/Ice Climbing"),
  CLIMBING_VIA_FERRATA("Climbing/Via Ferrata"),
  WINTER_HIKE("Winter/Winter Hiking"),
  WINTER_SNOWSHOEING("Winter/Snow Shoeing"),
  WINTER_SKI_TOURING("Winter/Ski Touring"),
  WINTER_SKI_ALPINE("Winter/Ski Alpine"),
  CYCLING_BIKE("Cycling/Bike Riding"),
  CYCLING_MOUNTAIN("Cycling/Mountain Biking"),
  CYCLING_ROAD("Cycling/Road Cycling"),
  CYCLING_GRAVEL("Cycling/Gravel Biking");

  private final String databaseValue;

  ActivityType(String databaseValue) {
    this.databaseValue = databaseValue;
  }

  @Override
  public String toDatabaseValue() {
    return databaseValue;
  }

  /** Returns the group of this type, e.g. {@code Climbing}. */
  public String group() {
    return databaseValue.substring(0, databaseValue.indexOf('/'));
  }

  /**
   * Creates an enum value from its database string representation.
   *
   * @param value The database string value
   * @return The corresponding enum value
   * @throws IllegalArgumentException If the value doesn't match any enum constant
   */
  public static ActivityType fromDatabaseValue(String value) {
    for (ActivityType type : values()) {
      if (type.databaseValue.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown activity type: " + value);
  }
}

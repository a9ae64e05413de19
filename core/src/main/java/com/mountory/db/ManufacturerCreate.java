package com.mountory.db;

/**
 * Fields of a new manufacturer. Empty optional text is stored as null; a missing visibility
 * flag means hidden.
 */
public record ManufacturerCreate(
    String name, String shortName, String description, String website, Boolean hidden) {

  public ManufacturerCreate {
    hidden = hidden == null ? Boolean.TRUE : hidden;
  }

  /** A hidden manufacturer with only a name. */
  public static ManufacturerCreate named(String name) {
    return new ManufacturerCreate(name, null, null, null, null);
  }

  public ManufacturerCreate withHidden(boolean hidden) {
    return new ManufacturerCreate(name, shortName, description, website, hidden);
  }
}

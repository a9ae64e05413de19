package com.mountory.db;

import com.mountory.db.update.FieldUpdate;

/** A partial update of a manufacturer. Access roles are changed through their own operations. */
public record ManufacturerUpdate(
    FieldUpdate<String> name,
    FieldUpdate<String> shortName,
    FieldUpdate<String> description,
    FieldUpdate<String> website,
    FieldUpdate<Boolean> hidden) {

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link ManufacturerUpdate}; every field starts out untouched. */
  public static final class Builder {
    private FieldUpdate<String> name = FieldUpdate.unset();
    private FieldUpdate<String> shortName = FieldUpdate.unset();
    private FieldUpdate<String> description = FieldUpdate.unset();
    private FieldUpdate<String> website = FieldUpdate.unset();
    private FieldUpdate<Boolean> hidden = FieldUpdate.unset();

    private Builder() {}

    public Builder name(FieldUpdate<String> name) {
      this.name = name;
      return this;
    }

    public Builder shortName(FieldUpdate<String> shortName) {
      this.shortName = shortName;
      return this;
    }

    public Builder description(FieldUpdate<String> description) {
      this.description = description;
      return this;
    }

    public Builder website(FieldUpdate<String> website) {
      this.website = website;
      return this;
    }

    public Builder hidden(FieldUpdate<Boolean> hidden) {
      this.hidden = hidden;
      return this;
    }

    public ManufacturerUpdate build() {
      return new ManufacturerUpdate(name, shortName, description, website, hidden);
    }
  }
}

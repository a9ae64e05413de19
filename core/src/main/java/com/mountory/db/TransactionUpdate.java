package com.mountory.db;

import com.mountory.db.update.FieldUpdate;
import com.mountory.db.update.Reference;
import java.time.temporal.Temporal;

/** A partial update of a transaction. Every field may be cleared. */
public record TransactionUpdate(
    FieldUpdate<Reference> activity,
    FieldUpdate<Reference> location,
    FieldUpdate<Reference> user,
    FieldUpdate<? extends Temporal> date,
    FieldUpdate<Long> amount,
    FieldUpdate<TransactionCategory> category,
    FieldUpdate<String> description,
    FieldUpdate<String> note) {

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link TransactionUpdate}; every field starts out untouched. */
  public static final class Builder {
    private FieldUpdate<Reference> activity = FieldUpdate.unset();
    private FieldUpdate<Reference> location = FieldUpdate.unset();
    private FieldUpdate<Reference> user = FieldUpdate.unset();
    private FieldUpdate<? extends Temporal> date = FieldUpdate.unset();
    private FieldUpdate<Long> amount = FieldUpdate.unset();
    private FieldUpdate<TransactionCategory> category = FieldUpdate.unset();
    private FieldUpdate<String> description = FieldUpdate.unset();
    private FieldUpdate<String> note = FieldUpdate.unset();

    private Builder() {}

    public Builder activity(FieldUpdate<Reference> activity) {
      this.activity = activity;
      return this;
    }

    public Builder location(FieldUpdate<Reference> location) {
      this.location = location;
      return this;
    }

    public Builder user(FieldUpdate<Reference> user) {
      this.user = user;
      return this;
    }

    public Builder date(FieldUpdate<? extends Temporal> date) {
      this.date = date;
      return this;
    }

    public Builder amount(FieldUpdate<Long> amount) {
      this.amount = amount;
      return this;
    }

    public Builder category(FieldUpdate<TransactionCategory> category) {
      this.category = category;
      return this;
    }

    public Builder description(FieldUpdate<String> description) {
      this.description = description;
      return this;
    }

    public Builder note(FieldUpdate<String> note) {
      this.note = note;
      return this;
    }

    public TransactionUpdate build() {
      return new TransactionUpdate(
          activity, location, user, date, amount, category, description, note);
    }
  }
}

package com.mountory.db;

import com.mountory.db.update.Reference;
import java.time.temporal.Temporal;

/**
 * Fields of a new transaction. All fields may be null; empty description and note are stored as
 * null.
 *
 * @param date a date-time; a value without zone is taken to be UTC
 */
public record TransactionCreate(
    Reference activity,
    Reference location,
    Reference user,
    Temporal date,
    Long amount,
    TransactionCategory category,
    String description,
    String note) {

  /** A transaction of a user with only an amount. */
  public static TransactionCreate of(Reference user, long amount) {
    return new TransactionCreate(null, null, user, null, amount, null, null, null);
  }

  public TransactionCreate withActivity(Reference activity) {
    return new TransactionCreate(
        activity, location, user, date, amount, category, description, note);
  }

  public TransactionCreate withLocation(Reference location) {
    return new TransactionCreate(
        activity, location, user, date, amount, category, description, note);
  }

  public TransactionCreate withDate(Temporal date) {
    return new TransactionCreate(
        activity, location, user, date, amount, category, description, note);
  }
}

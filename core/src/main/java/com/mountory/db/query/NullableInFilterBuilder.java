package com.mountory.db.query;

import com.google.common.base.Joiner;
import com.google.common.collect.Collections2;
import com.mountory.db.update.AssociationTable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Builds membership predicates from a collection of accepted values, where a {@code null} element
 * stands for "the column is unset".
 *
 * <table>
 *   <caption>Resulting predicate</caption>
 *   <tr><th>values</th><th>predicate</th></tr>
 *   <tr><td>null or empty</td><td>none, the dimension is skipped</td></tr>
 *   <tr><td>{a, b}</td><td>{@code col IN (?, ?)}</td></tr>
 *   <tr><td>{a, null}</td><td>{@code (col IN (?) OR col IS NULL)}</td></tr>
 *   <tr><td>{null}</td><td>{@code col IS NULL}</td></tr>
 * </table>
 *
 * <p>An empty collection is never read as "match nothing".
 */
public final class NullableInFilterBuilder {

  private NullableInFilterBuilder() {
    // Utility class
  }

  /**
   * Builds a predicate over a column of the queried table.
   *
   * @param column the (qualified) column name
   * @param values the accepted values, may contain null
   * @return the predicate, or empty if the dimension should be skipped
   */
  @Nonnull
  public static Optional<SqlPredicate> build(String column, @Nullable Collection<?> values) {
    if (values == null || values.isEmpty()) {
      return Optional.empty();
    }
    Split split = split(values);
    if (split.concrete.isEmpty()) {
      return Optional.of(SqlPredicate.of(column + " IS NULL"));
    }
    String in = column + " IN (" + placeholders(split.concrete.size()) + ")";
    if (split.includesNull) {
      return Optional.of(
          new SqlPredicate("(" + in + " OR " + column + " IS NULL)", split.concrete));
    }
    return Optional.of(new SqlPredicate(in, split.concrete));
  }

  /**
   * Builds a predicate over an association table: the owner matches when it has at least one
   * association row whose target is one of the values. A null element also matches owners without
   * any association row. Owners are tested with {@code EXISTS}, so a page never contains the same
   * owner twice.
   *
   * @param table the association table
   * @param ownerReference the (qualified) primary key column of the queried table
   * @param values the accepted targets, may contain null
   * @return the predicate, or empty if the dimension should be skipped
   */
  @Nonnull
  public static Optional<SqlPredicate> buildExists(
      AssociationTable table, String ownerReference, @Nullable Collection<?> values) {
    if (values == null || values.isEmpty()) {
      return Optional.empty();
    }
    Split split = split(values);
    String ownerMatch =
        "SELECT 1 FROM " + table.table()
            + " WHERE " + table.table() + "." + table.ownerColumn() + " = " + ownerReference;
    String noRows = "NOT EXISTS (" + ownerMatch + ")";
    if (split.concrete.isEmpty()) {
      return Optional.of(SqlPredicate.of(noRows));
    }
    String exists =
        "EXISTS (" + ownerMatch
            + " AND " + table.table() + "." + table.targetColumn()
            + " IN (" + placeholders(split.concrete.size()) + "))";
    if (split.includesNull) {
      return Optional.of(new SqlPredicate("(" + exists + " OR " + noRows + ")", split.concrete));
    }
    return Optional.of(new SqlPredicate(exists, split.concrete));
  }

  private static String placeholders(int count) {
    return Joiner.on(", ").join(Collections.nCopies(count, "?"));
  }

  private static Split split(Collection<?> values) {
    Set<Object> distinct = new LinkedHashSet<>(values);
    boolean includesNull = distinct.contains(null);
    List<Object> concrete = new ArrayList<>(Collections2.filter(distinct, Objects::nonNull));
    return new Split(concrete, includesNull);
  }

  private record Split(List<Object> concrete, boolean includesNull) {}
}

package com.mountory.db.query;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * A boolean SQL fragment together with the values for its {@code ?} placeholders, in order.
 *
 * @param sql the SQL fragment
 * @param params the placeholder values
 */
public record SqlPredicate(String sql, List<Object> params) {

  public SqlPredicate {
    Objects.requireNonNull(sql, "sql");
    params = Collections.unmodifiableList(new ArrayList<>(params));
  }

  /** A predicate with the given placeholder values. */
  public static SqlPredicate of(String sql, Object... params) {
    return new SqlPredicate(sql, Arrays.asList(params));
  }

  /** {@code column = ?} */
  public static SqlPredicate eq(String column, Object value) {
    return of(column + " = ?", value);
  }

  /** Combines the predicates with AND. Returns empty if there is nothing to combine. */
  @Nonnull
  public static Optional<SqlPredicate> and(Collection<SqlPredicate> predicates) {
    return combine(" AND ", predicates);
  }

  /** Combines the predicates with OR. Returns empty if there is nothing to combine. */
  @Nonnull
  public static Optional<SqlPredicate> or(Collection<SqlPredicate> predicates) {
    return combine(" OR ", predicates);
  }

  /** Combines this predicate with another one using OR. */
  @Nonnull
  public SqlPredicate or(SqlPredicate other) {
    return combine(" OR ", List.of(this, other)).orElseThrow();
  }

  /** Combines this predicate with another one using AND. */
  @Nonnull
  public SqlPredicate and(SqlPredicate other) {
    return combine(" AND ", List.of(this, other)).orElseThrow();
  }

  private static Optional<SqlPredicate> combine(
      String operator, Collection<SqlPredicate> predicates) {
    if (predicates.isEmpty()) {
      return Optional.empty();
    }
    if (predicates.size() == 1) {
      return Optional.of(predicates.iterator().next());
    }
    List<String> parts = new ArrayList<>();
    List<Object> params = new ArrayList<>();
    for (SqlPredicate predicate : predicates) {
      parts.add("(" + predicate.sql() + ")");
      params.addAll(predicate.params());
    }
    return Optional.of(new SqlPredicate(Joiner.on(operator).join(parts), params));
  }
}

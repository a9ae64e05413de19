package com.mountory.db.query;

import com.mountory.common.status.Status;
import com.mountory.common.status.StatusOr;
import com.mountory.db.util.DbUtil;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Assembles a paged read with a total count over the same predicate.
 *
 * <pre>{@code
 * EntityQueryAssembler.select("SELECT id, name FROM location", Locations::extractLocation)
 *     .where(NullableInFilterBuilder.build("location_type", filter.types()))
 *     .where(NullableInFilterBuilder.build("parent_id", filter.parentIds()))
 *     .orderBy("lower(name)", "id")
 *     .execute(conn, skip, limit);
 * }</pre>
 *
 * <p>All added predicates are combined with AND. The page and the count are read from one
 * snapshot, see {@link DbUtil#inReadSnapshot}.
 *
 * @param <T> the type of the mapped rows
 */
public final class EntityQueryAssembler<T> {

  /** Maps the current row of a result set. */
  @FunctionalInterface
  public interface RowMapper<T> {
    StatusOr<T> map(ResultSet rs) throws SQLException;
  }

  private final String select;
  private final List<Object> selectParams;
  private final RowMapper<T> mapper;
  private final List<SqlPredicate> predicates = new ArrayList<>();
  private String ordering;
  private String tieBreaker;

  private EntityQueryAssembler(String select, List<Object> selectParams, RowMapper<T> mapper) {
    this.select = Objects.requireNonNull(select, "select");
    this.selectParams = selectParams;
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Starts a query.
   *
   * @param select the {@code SELECT ... FROM ...} part, without a WHERE clause
   * @param mapper maps one row
   */
  public static <T> EntityQueryAssembler<T> select(String select, RowMapper<T> mapper) {
    return new EntityQueryAssembler<>(select, List.of(), mapper);
  }

  /** Starts a query whose select part has placeholders of its own. */
  public static <T> EntityQueryAssembler<T> select(
      String select, List<Object> selectParams, RowMapper<T> mapper) {
    return new EntityQueryAssembler<>(select, new ArrayList<>(selectParams), mapper);
  }

  /** Adds a predicate. */
  @Nonnull
  public EntityQueryAssembler<T> where(SqlPredicate predicate) {
    predicates.add(Objects.requireNonNull(predicate, "predicate"));
    return this;
  }

  /** Adds a predicate if present; an empty dimension is skipped. */
  @Nonnull
  public EntityQueryAssembler<T> where(Optional<SqlPredicate> predicate) {
    predicate.ifPresent(predicates::add);
    return this;
  }

  /**
   * Sets the ordering.
   *
   * @param ordering the ORDER BY expression, e.g. {@code start DESC NULLS LAST}
   * @param tieBreaker the primary key column, appended so that paging is stable
   */
  @Nonnull
  public EntityQueryAssembler<T> orderBy(String ordering, String tieBreaker) {
    this.ordering = Objects.requireNonNull(ordering, "ordering");
    this.tieBreaker = Objects.requireNonNull(tieBreaker, "tieBreaker");
    return this;
  }

  /** Returns the combined filter, if any dimension is active. */
  @Nonnull
  Optional<SqlPredicate> filter() {
    return SqlPredicate.and(predicates);
  }

  /** Returns the SQL of the count statement. */
  @Nonnull
  String countSql() {
    return "SELECT COUNT(*) FROM (" + filteredSql() + ") AS filtered";
  }

  /** Returns the SQL of the page statement. */
  @Nonnull
  String pageSql() {
    StringBuilder sql = new StringBuilder(filteredSql());
    if (ordering != null) {
      sql.append(" ORDER BY ").append(ordering).append(", ").append(tieBreaker);
    }
    sql.append(" LIMIT ? OFFSET ?");
    return sql.toString();
  }

  private String filteredSql() {
    String base = select.strip();
    return filter().map(p -> base + " WHERE " + p.sql()).orElse(base);
  }

  private List<Object> filterParams() {
    List<Object> params = new ArrayList<>(selectParams);
    filter().ifPresent(p -> params.addAll(p.params()));
    return params;
  }

  /**
   * Executes the count and page statements.
   *
   * @param conn an open JDBC connection
   * @param skip the number of matching rows to skip, at least 0
   * @param limit the maximum number of rows to return, at least 0
   * @return StatusOr containing the page and the total count, or an error
   */
  @Nonnull
  public StatusOr<QueryResult<T>> execute(Connection conn, int skip, int limit) {
    if (skip < 0) {
      return StatusOr.ofStatus(Status.invalidArgument("skip must not be negative: " + skip));
    }
    if (limit < 0) {
      return StatusOr.ofStatus(Status.invalidArgument("limit must not be negative: " + limit));
    }
    return DbUtil.inReadSnapshot(conn, c -> run(c, skip, limit));
  }

  private StatusOr<QueryResult<T>> run(Connection conn, int skip, int limit)
      throws SQLException {
    List<Object> params = filterParams();
    String countSql = countSql();
    String pageSql = pageSql();
    Logger.debug("Query: {} {}", pageSql, params);

    long totalCount = 0;
    try (PreparedStatement countStmt = conn.prepareStatement(countSql)) {
      DbUtil.setParameters(countStmt, 1, params);
      try (ResultSet countRs = countStmt.executeQuery()) {
        if (countRs.next()) {
          totalCount = countRs.getLong(1);
        }
      }
    }

    List<T> items = new ArrayList<>();
    try (PreparedStatement pageStmt = conn.prepareStatement(pageSql)) {
      int next = DbUtil.setParameters(pageStmt, 1, params);
      pageStmt.setInt(next, limit);
      pageStmt.setInt(next + 1, skip);
      try (ResultSet rs = pageStmt.executeQuery()) {
        while (rs.next()) {
          StatusOr<T> itemOr = mapper.map(rs);
          if (itemOr.isNotOk()) {
            return StatusOr.ofStatus(itemOr.getStatus());
          }
          items.add(itemOr.getValue());
        }
      }
    }
    return StatusOr.ofValue(new QueryResult<>(items, totalCount));
  }
}

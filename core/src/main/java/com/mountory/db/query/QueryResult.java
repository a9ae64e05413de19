package com.mountory.db.query;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Container for query results with pagination information.
 *
 * @param <T> the type of the items
 */
public final class QueryResult<T> {
  private final List<T> items;
  private final long totalCount;

  public QueryResult(List<T> items, long totalCount) {
    this.items = ImmutableList.copyOf(items);
    this.totalCount = totalCount;
  }

  /** Returns the items of this page. */
  public List<T> getItems() {
    return items;
  }

  /** Returns the number of matching rows, ignoring skip and limit. */
  public long getTotalCount() {
    return totalCount;
  }

  /**
   * Determines if there are more results beyond this page.
   *
   * @param offset The starting position of this page
   * @return True if there are more results beyond this page
   */
  public boolean hasMore(int offset) {
    return offset + items.size() < totalCount;
  }

  /**
   * Gets the next offset position for pagination.
   *
   * @param offset The current offset
   * @param limit The current limit
   * @return The next offset position, or -1 if there are no more results
   */
  public int getNextOffset(int offset, int limit) {
    if (hasMore(offset)) {
      return offset + Math.min(limit, items.size());
    }
    return -1;
  }

  /** Maps the items, keeping the total count. */
  public <U> QueryResult<U> map(Function<? super T, ? extends U> mapper) {
    List<U> mapped = new ArrayList<>(items.size());
    for (T item : items) {
      mapped.add(mapper.apply(item));
    }
    return new QueryResult<>(mapped, totalCount);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof QueryResult)) {
      return false;
    }
    QueryResult<?> other = (QueryResult<?>) obj;
    return totalCount == other.totalCount && items.equals(other.items);
  }

  @Override
  public int hashCode() {
    return Objects.hash(items, totalCount);
  }

  @Override
  public String toString() {
    return "QueryResult{items=" + items + ", totalCount=" + totalCount + "}";
  }
}

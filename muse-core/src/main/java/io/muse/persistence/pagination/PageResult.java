package io.muse.persistence.pagination;

import java.util.List;

/** Pagination metadata together with the rows of the current page. */
public record PageResult<T>(PaginationInfo info, List<T> items) {
  public PageResult {
    items = items == null ? List.of() : List.copyOf(items);
  }
}

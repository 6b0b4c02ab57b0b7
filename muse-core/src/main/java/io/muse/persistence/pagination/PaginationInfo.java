package io.muse.persistence.pagination;

import io.muse.persistence.query.Query;

import java.util.List;
import java.util.Objects;

/**
 * Result of a pagination request.
 *
 * @param collectionSize filtered row count, independent of the cursor
 * @param cursorRow 0-based offset of the first row of the current page
 * @param cursorPage 1-based number of the current page
 * @param surroundingPages pages near the current one, ascending, never containing the current page
 * @param lastPage final page; page 1 itself when everything fits on one page
 * @param pageItemsQuery filter, sort and offset/limit selecting the rows of the current page
 */
public record PaginationInfo(
    long collectionSize,
    long cursorRow,
    long cursorPage,
    List<PageInfo> surroundingPages,
    PageInfo lastPage,
    Query pageItemsQuery
) {
  public PaginationInfo {
    if (collectionSize < 0) throw new IllegalArgumentException("collectionSize must be >= 0");
    if (cursorRow < 0) throw new IllegalArgumentException("cursorRow must be >= 0");
    if (cursorPage < 1) throw new IllegalArgumentException("cursorPage must be >= 1");
    surroundingPages = surroundingPages == null ? List.of() : List.copyOf(surroundingPages);
    Objects.requireNonNull(pageItemsQuery, "pageItemsQuery");
  }

  public boolean isLastPage() {
    return lastPage == null || lastPage.page() == cursorPage;
  }
}

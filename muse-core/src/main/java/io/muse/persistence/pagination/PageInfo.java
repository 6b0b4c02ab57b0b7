package io.muse.persistence.pagination;

/**
 * A navigable page.
 *
 * @param cursor key of the last row before the page; {@code null} for the first page
 * @param page 1-based page number
 * @param row 1-based index of the first row on the page ({@code 0} for the single-page sentinel)
 */
public record PageInfo(Object cursor, long page, long row) {
  public PageInfo {
    if (page < 1) throw new IllegalArgumentException("page must be >= 1");
    if (row < 0) throw new IllegalArgumentException("row must be >= 0");
  }
}

package io.muse.persistence.pagination;

import io.muse.persistence.query.Query;

import java.util.*;

/**
 * Page arithmetic for one pagination request.
 *
 * <p>Row numbers are 1-based ranks in the filtered, sorted collection. A row number {@code b} starts
 * a page (as the last row before it) when {@code b % pageSize} equals the cursor's alignment
 * {@code cursorRow % pageSize}. Page numbers are {@code b / pageSize + pageOffset}, where the offset is
 * 1 for aligned cursors and 2 otherwise (a short leading page exists before the first boundary).
 */
public final class PageWindow {
  private final long collectionSize;
  private final int pageSize;
  private final int surroundingPages;
  private final long cursorRow;

  private PageWindow(long collectionSize, int pageSize, int surroundingPages, long cursorRow) {
    this.collectionSize = collectionSize;
    this.pageSize = pageSize;
    this.surroundingPages = surroundingPages;
    this.cursorRow = cursorRow;
  }

  /**
   * @param requestedRow offset derived from the cursor (0 without cursor); offsets at or past the last
   *                     row snap to the start of the last aligned page
   */
  public static PageWindow of(long collectionSize, int pageSize, int surroundingPages, long requestedRow) {
    if (collectionSize < 0) throw new IllegalArgumentException("collectionSize must be >= 0");
    if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
    if (surroundingPages < 0) throw new IllegalArgumentException("surroundingPages must be >= 0");
    long r = Math.max(0L, requestedRow);
    if (collectionSize > 0 && r >= collectionSize) {
      r = ((collectionSize - 1) / pageSize) * pageSize;
    }
    return new PageWindow(collectionSize, pageSize, surroundingPages, r);
  }

  /** Everything fits on page 1; no row numbering needed. */
  public static boolean isSinglePage(long collectionSize, int pageSize) {
    return collectionSize <= pageSize;
  }

  /**
   * Result when the whole collection fits on page 1: cursor row 0, no surrounding pages, and a last
   * page of {@code PageInfo(null, 1, 0)}. The last page carries a {@code null} cursor rather than 0
   * because page 1 is reached without any cursor, and 0 could be a real key value.
   */
  public static PaginationInfo singlePage(long collectionSize, Query pageItemsQuery) {
    return new PaginationInfo(collectionSize, 0, 1, List.of(), new PageInfo(null, 1, 0), pageItemsQuery);
  }

  public long collectionSize() { return collectionSize; }
  public int pageSize() { return pageSize; }
  public int surroundingPages() { return surroundingPages; }
  public long cursorRow() { return cursorRow; }

  public long alignment() {
    return cursorRow % pageSize;
  }

  public int pageOffset() {
    return alignment() == 0 ? 1 : 2;
  }

  public long cursorPage() {
    return pageNumber(cursorRow);
  }

  public long pageIndex(long rowNumber) {
    return rowNumber / pageSize;
  }

  public long pageNumber(long rowNumber) {
    return pageIndex(rowNumber) + pageOffset();
  }

  /** First page index of the window around the cursor (may be negative). */
  public long windowFrom() {
    return pageIndex(cursorRow) - surroundingPages;
  }

  /** Last page index of the window around the cursor. */
  public long windowTo() {
    return pageIndex(cursorRow) + surroundingPages;
  }

  /** Page indices from here on are always candidates, so the last page is never missed. */
  public long tailFrom() {
    return collectionSize / pageSize - 1;
  }

  public boolean isCandidate(long rowNumber) {
    if (rowNumber < 1 || rowNumber % pageSize != alignment()) return false;
    long idx = pageIndex(rowNumber);
    return (idx >= windowFrom() && idx <= windowTo()) || idx >= tailFrom();
  }

  /**
   * Turns boundary rows into navigation pages. Rows that are not candidates, phantom rows at or past
   * the collection size and duplicates are ignored. The highest surviving row is the last page; all
   * others, except the current page, are surrounding pages in ascending order.
   */
  public PaginationInfo toInfo(Collection<BoundaryRow> boundaryRows, Query pageItemsQuery) {
    TreeMap<Long, BoundaryRow> byRow = new TreeMap<>();
    for (BoundaryRow b : boundaryRows) {
      if (b.rowNumber() >= collectionSize || !isCandidate(b.rowNumber())) continue;
      byRow.putIfAbsent(b.rowNumber(), b);
    }

    PageInfo last = null;
    if (!byRow.isEmpty()) {
      BoundaryRow l = byRow.pollLastEntry().getValue();
      last = toPage(l);
    }

    List<PageInfo> surrounding = new ArrayList<>(byRow.size());
    for (BoundaryRow b : byRow.values()) {
      if (b.rowNumber() == cursorRow) continue;
      surrounding.add(toPage(b));
    }

    return new PaginationInfo(collectionSize, cursorRow, cursorPage(), surrounding, last, pageItemsQuery);
  }

  private PageInfo toPage(BoundaryRow b) {
    return new PageInfo(b.key(), pageNumber(b.rowNumber()), b.rowNumber() + 1);
  }

  @Override
  public String toString() {
    return "PageWindow{size=" + collectionSize + ", pageSize=" + pageSize + ", surrounding=" + surroundingPages
        + ", cursorRow=" + cursorRow + ", alignment=" + alignment() + "}";
  }
}

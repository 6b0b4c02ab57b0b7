package io.muse.persistence.pagination;

import io.muse.persistence.query.SortField;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller-supplied pagination parameters. The {@code cursor}, {@code item-count} and {@code sort}
 * query parameters are the complete contract for requesting a page; resubmitting them reproduces the
 * same page.
 *
 * @param itemCount page size
 * @param cursor raw cursor (key of the row before the page), {@code null} for the first page
 * @param sort {@code [+|-]column}, {@code null} for the collection default
 * @param surroundingPages how many pages on each side of the current page to report
 */
public record PaginationOptions(int itemCount, Object cursor, String sort, int surroundingPages) {
  public static final int DEFAULT_ITEM_COUNT = 25;
  public static final int DEFAULT_SURROUNDING_PAGES = 5;

  public static final String CURSOR = "cursor";
  public static final String ITEM_COUNT = "item-count";
  public static final String SORT = "sort";

  public PaginationOptions {
    if (itemCount <= 0) throw new IllegalArgumentException("item-count must be > 0");
    if (surroundingPages < 0) throw new IllegalArgumentException("surroundingPages must be >= 0");
    if (cursor instanceof String s && s.isBlank()) cursor = null;
    sort = (sort == null || sort.isBlank()) ? null : sort.trim();
  }

  public static PaginationOptions defaults() {
    return new PaginationOptions(DEFAULT_ITEM_COUNT, null, null, DEFAULT_SURROUNDING_PAGES);
  }

  public static PaginationOptions fromQueryParams(Map<String, String> params, String defaultSort) {
    return fromQueryParams(params, defaultSort, defaults());
  }

  /**
   * Parses {@code cursor}, {@code item-count} and {@code sort}; missing values come from {@code base},
   * a missing sort from {@code defaultSort}.
   */
  public static PaginationOptions fromQueryParams(Map<String, String> params, String defaultSort, PaginationOptions base) {
    Map<String, String> p = params == null ? Map.of() : params;
    int itemCount = base.itemCount();
    String rawCount = p.get(ITEM_COUNT);
    if (rawCount != null && !rawCount.isBlank()) {
      try {
        itemCount = Integer.parseInt(rawCount.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("item-count must be a positive integer: " + rawCount, e);
      }
    }
    String sort = p.get(SORT);
    if (sort == null || sort.isBlank()) sort = defaultSort;
    Object cursor = p.containsKey(CURSOR) ? p.get(CURSOR) : base.cursor();
    return new PaginationOptions(itemCount, cursor, sort, base.surroundingPages());
  }

  public PaginationOptions withCursor(Object cursor) {
    return new PaginationOptions(itemCount, cursor, sort, surroundingPages);
  }

  public PaginationOptions withSort(String sort) {
    return new PaginationOptions(itemCount, cursor, sort, surroundingPages);
  }

  public PaginationOptions withItemCount(int itemCount) {
    return new PaginationOptions(itemCount, cursor, sort, surroundingPages);
  }

  public PaginationOptions withSurroundingPages(int surroundingPages) {
    return new PaginationOptions(itemCount, cursor, sort, surroundingPages);
  }

  /** Sort column without direction prefix, or {@code null}. */
  public String sortColumn() {
    if (sort == null) return null;
    String c = sort.replaceFirst("^[+-]", "").trim();
    return c.isEmpty() ? null : c;
  }

  public SortField.Direction sortDirection() {
    return (sort != null && sort.startsWith("-")) ? SortField.Direction.DESC : SortField.Direction.ASC;
  }

  /** Query parameters for this request, keeping the current cursor. */
  public Map<String, String> toQueryParams() {
    return toQueryParams(cursor);
  }

  /** Query parameters for a page starting after {@code cursor}; {@code null} links to the first page. */
  public Map<String, String> toQueryParams(Object cursor) {
    Map<String, String> out = new LinkedHashMap<>();
    if (cursor != null) out.put(CURSOR, String.valueOf(cursor));
    out.put(ITEM_COUNT, String.valueOf(itemCount));
    if (sortColumn() != null) {
      out.put(SORT, sortDirection() == SortField.Direction.DESC ? "-" + sortColumn() : sortColumn());
    }
    return out;
  }
}

package io.muse.persistence.pagination;

/**
 * Where the cursor row sits once located in the filtered collection extended by the cursor row.
 *
 * @param rowNumber 1-based rank of the cursor row
 * @param inFilter whether the cursor row itself matches the caller's filter
 */
public record CursorPosition(long rowNumber, boolean inFilter) {
  public CursorPosition {
    if (rowNumber < 1) throw new IllegalArgumentException("rowNumber must be >= 1");
  }

  /** Number of filtered rows at or before the cursor row, i.e. the offset of the page that follows it. */
  public long offset() {
    return inFilter ? rowNumber : rowNumber - 1;
  }
}

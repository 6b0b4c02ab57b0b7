package io.muse.persistence.spi.sql;

public enum StatementKind {
  /** Filtered row count. */
  COUNT,
  /** Row number of the cursor row within filter-or-cursor. */
  CURSOR_ROW,
  /** Rows on page boundaries inside the page window. */
  BOUNDARY_ROWS,
  /** Filter, sort and offset/limit. */
  SELECT
}

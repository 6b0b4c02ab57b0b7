package io.muse.persistence.query;

public record OffsetPage(long offset, int limit) implements Page {
  public OffsetPage {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }
}

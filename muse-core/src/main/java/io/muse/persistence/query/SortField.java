package io.muse.persistence.query;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  /** Renders the {@code [-]field} form used by the {@code sort} query parameter. */
  public String toSortString() {
    return direction == Direction.DESC ? "-" + field : field;
  }

  public enum Direction { ASC, DESC }
}

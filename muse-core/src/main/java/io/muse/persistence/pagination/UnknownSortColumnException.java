package io.muse.persistence.pagination;

import io.muse.persistence.query.QueryValidationException;

/** Requested sort column is neither a sortable property nor the key of the collection. */
public class UnknownSortColumnException extends QueryValidationException {
  private final String collection;
  private final String column;

  public UnknownSortColumnException(String collection, String column) {
    super("Unknown sort column '" + column + "' for collection '" + collection + "'");
    this.collection = collection;
    this.column = column;
  }

  public String collection() { return collection; }
  public String column() { return column; }
}

package io.muse.persistence.spi.sql;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.pagination.PageWindow;
import io.muse.persistence.pagination.ResolvedSort;
import io.muse.persistence.query.Page;
import io.muse.persistence.query.QueryElement;
import io.muse.persistence.query.SortField;

import java.util.List;

/** Backend-agnostic SPI: renders the statements a pagination request needs. */
public interface Dialect<S extends NativeStatement> {
  String id();

  S renderCount(CollectionDefinition collection, QueryElement filter);

  /**
   * Locates {@code cursor} (a key value) in the rows matching {@code filter} or having that key,
   * numbered under {@code sort}.
   */
  S renderCursorRow(CollectionDefinition collection, QueryElement filter, ResolvedSort sort, Object cursor);

  /** Selects key and row number of every candidate boundary row of {@code window}. */
  S renderBoundaryRows(CollectionDefinition collection, QueryElement filter, ResolvedSort sort, PageWindow window);

  S renderSelect(CollectionDefinition collection, QueryElement filter, List<SortField> sort, Page page);
}

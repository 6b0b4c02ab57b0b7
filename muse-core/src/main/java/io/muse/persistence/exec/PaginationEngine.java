package io.muse.persistence.exec;

import io.muse.persistence.exec.handle.EngineHandle;
import io.muse.persistence.mapping.RowReader;
import io.muse.persistence.pagination.PageResult;
import io.muse.persistence.pagination.PaginationInfo;
import io.muse.persistence.pagination.PaginationOptions;
import io.muse.persistence.query.Query;
import io.muse.persistence.query.QueryElement;

import java.util.List;

/** Read-only keyset pagination over registered collections. */
public interface PaginationEngine<H extends EngineHandle<?>> {
  /** Returns the engine handle used by this instance. */
  H handle();

  /**
   * Computes the current page, its neighbours and the last page of {@code collection}.
   *
   * <p>An unresolvable cursor is treated as absent. An unknown sort column raises
   * {@link io.muse.persistence.pagination.UnknownSortColumnException}.
   */
  PaginationInfo paginate(String collection, QueryElement filter, PaginationOptions options);

  /** Runs a query (typically {@link PaginationInfo#pageItemsQuery()}) and maps every row. */
  <T> List<T> select(String collection, Query query, RowReader<T> reader);

  long count(String collection, QueryElement filter);

  /** {@link #paginate} and {@link #select} of the current page's rows. */
  default <T> PageResult<T> page(String collection, QueryElement filter, PaginationOptions options, RowReader<T> reader) {
    PaginationInfo info = paginate(collection, filter, options);
    return new PageResult<>(info, select(collection, info.pageItemsQuery(), reader));
  }
}

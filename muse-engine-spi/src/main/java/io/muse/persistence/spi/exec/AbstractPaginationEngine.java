package io.muse.persistence.spi.exec;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.CollectionRegistry;
import io.muse.persistence.exec.PaginationEngine;
import io.muse.persistence.exec.handle.EngineHandle;
import io.muse.persistence.mapping.RowReader;
import io.muse.persistence.pagination.*;
import io.muse.persistence.query.OffsetPage;
import io.muse.persistence.query.Query;
import io.muse.persistence.query.QueryElement;
import io.muse.persistence.spi.sql.Dialect;
import io.muse.persistence.spi.sql.NativeStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Template-method orchestrator for pagination.
 *
 * Responsibilities:
 * - Resolve the collection, the sort order and validate/normalize the filter
 * - Scope every request to one backend read session via {@link #inReadSession(Function)}
 * - Count, locate the cursor, fetch boundary rows using statements built by the {@link Dialect}
 * - Delegate execution to backend-specific hooks
 *
 * @param <S> native statement type
 * @param <H> engine handle type
 * @param <R> read session type (connection, client session, snapshot)
 */
public abstract class AbstractPaginationEngine<S extends NativeStatement, H extends EngineHandle<?>, R>
    implements PaginationEngine<H> {
  private static final Logger log = LoggerFactory.getLogger(AbstractPaginationEngine.class);

  private final H handle;
  private final Dialect<S> dialect;
  private final CollectionRegistry collections;
  private final QueryValidationStrategy queryValidation;

  protected AbstractPaginationEngine(Dialect<S> dialect,
                                     H handle,
                                     CollectionRegistry collections,
                                     QueryValidationStrategy queryValidation) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.collections = Objects.requireNonNull(collections, "collections");
    this.queryValidation = (queryValidation == null) ? new DefaultQueryValidationStrategy() : queryValidation;
  }

  protected AbstractPaginationEngine(Dialect<S> dialect, H handle, CollectionRegistry collections) {
    this(dialect, handle, collections, new DefaultQueryValidationStrategy());
  }

  protected final Dialect<S> dialect() { return dialect; }
  @Override
  public final H handle() { return handle; }
  protected final CollectionRegistry collections() { return collections; }
  protected QueryValidationStrategy queryValidation() { return queryValidation; }

  @Override
  public final PaginationInfo paginate(String collection, QueryElement filter, PaginationOptions options) {
    Prepared p = prepare(collection, filter, options);
    return inReadSession(session -> paginate(session, p));
  }

  @Override
  public final <T> PageResult<T> page(String collection, QueryElement filter, PaginationOptions options, RowReader<T> reader) {
    Objects.requireNonNull(reader, "reader");
    Prepared p = prepare(collection, filter, options);
    return inReadSession(session -> {
      PaginationInfo info = paginate(session, p);
      S stmt = buildSelectStatement(p.collection(), info.pageItemsQuery());
      return new PageResult<>(info, executeSelect(session, p.collection(), stmt, reader));
    });
  }

  @Override
  public final <T> List<T> select(String collection, Query query, RowReader<T> reader) {
    Objects.requireNonNull(reader, "reader");
    CollectionDefinition c = collections.get(collection);
    Query effective = (query == null) ? new Query() : query;
    queryValidation().validate(c, effective, effective.filter());
    Query normalized = effective.copy().withFilter(FilterNormalizer.normalize(c, effective.filter()));
    S stmt = buildSelectStatement(c, normalized);
    return inReadSession(session -> executeSelect(session, c, stmt, reader));
  }

  @Override
  public final long count(String collection, QueryElement filter) {
    CollectionDefinition c = collections.get(collection);
    queryValidation().validate(c, null, filter);
    S stmt = dialect.renderCount(c, FilterNormalizer.normalize(c, filter));
    return inReadSession(session -> executeCount(session, stmt));
  }

  private record Prepared(CollectionDefinition collection, QueryElement filter, ResolvedSort sort, PaginationOptions options) {}

  private Prepared prepare(String collection, QueryElement filter, PaginationOptions options) {
    CollectionDefinition c = collections.get(collection);
    PaginationOptions o = (options == null) ? PaginationOptions.defaults() : options;
    ResolvedSort sort = SortResolver.resolve(c, o.sort());
    queryValidation().validate(c, null, filter);
    return new Prepared(c, FilterNormalizer.normalize(c, filter), sort, o);
  }

  private PaginationInfo paginate(R session, Prepared p) {
    long t0 = System.nanoTime();
    CollectionDefinition c = p.collection();
    int pageSize = p.options().itemCount();

    long size = executeCount(session, dialect.renderCount(c, p.filter()));
    if (PageWindow.isSinglePage(size, pageSize)) {
      log.debug("muse.paginate collection={} size={} pageSize={} singlePage=true tookMs={}",
          c.name(), size, pageSize, (System.nanoTime() - t0) / 1_000_000);
      return PageWindow.singlePage(size, pageItemsQuery(p, 0));
    }

    long requestedRow = locateCursor(session, p);
    PageWindow window = PageWindow.of(size, pageSize, p.options().surroundingPages(), requestedRow);
    List<BoundaryRow> rows = executeBoundaryRows(session, dialect.renderBoundaryRows(c, p.filter(), p.sort(), window));
    PaginationInfo info = window.toInfo(rows, pageItemsQuery(p, window.cursorRow()));

    if (log.isDebugEnabled()) {
      log.debug("muse.paginate collection={} sort={} size={} cursorRow={} cursorPage={} surrounding={} lastPage={} tookMs={}",
          c.name(), p.sort().sortString(), size, info.cursorRow(), info.cursorPage(), info.surroundingPages().size(),
          info.lastPage() == null ? null : info.lastPage().page(), (System.nanoTime() - t0) / 1_000_000);
    }
    return info;
  }

  /** Offset of the page following the cursor row; 0 when the cursor is absent or cannot be located. */
  private long locateCursor(R session, Prepared p) {
    Object raw = p.options().cursor();
    if (raw == null) return 0;
    CollectionDefinition c = p.collection();

    Object key;
    try {
      key = c.coerceKey(raw);
    } catch (IllegalArgumentException e) {
      log.debug("muse.paginate collection={} cursor={} unparsable, falling back to first page", c.name(), raw);
      return 0;
    }

    Optional<CursorPosition> pos = executeCursorRow(session, dialect.renderCursorRow(c, p.filter(), p.sort(), key));
    if (pos.isEmpty()) {
      log.debug("muse.paginate collection={} cursor={} not found, falling back to first page", c.name(), key);
      return 0;
    }
    return pos.get().offset();
  }

  private static Query pageItemsQuery(Prepared p, long offset) {
    return new Query()
        .withFilter(p.filter())
        .withSort(p.sort().order())
        .withPage(new OffsetPage(offset, p.options().itemCount()));
  }

  /** Template hook: build select statement (default delegates to dialect.renderSelect). */
  protected S buildSelectStatement(CollectionDefinition c, Query query) {
    return dialect.renderSelect(c, query.filter(), query.sort(), query.page());
  }

  // --- Backend-specific hooks ---

  /** Runs {@code work} against one read session; every statement of a request shares it. */
  protected abstract <T> T inReadSession(Function<R, T> work);

  protected abstract long executeCount(R session, S stmt);

  protected abstract Optional<CursorPosition> executeCursorRow(R session, S stmt);

  protected abstract List<BoundaryRow> executeBoundaryRows(R session, S stmt);

  protected abstract <T> List<T> executeSelect(R session, CollectionDefinition collection, S stmt, RowReader<T> reader);
}

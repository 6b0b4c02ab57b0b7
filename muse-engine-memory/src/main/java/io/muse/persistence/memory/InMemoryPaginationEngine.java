package io.muse.persistence.memory;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.CollectionRegistry;
import io.muse.persistence.mapping.RowAdapters;
import io.muse.persistence.mapping.RowReader;
import io.muse.persistence.pagination.BoundaryRow;
import io.muse.persistence.pagination.CursorPosition;
import io.muse.persistence.spi.exec.AbstractPaginationEngine;
import io.muse.persistence.spi.exec.QueryValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Pagination over an {@link InMemoryStore}. Each request reads from one {@link InMemorySnapshot}, so
 * concurrent writes never skew count and row numbering within a request.
 */
public final class InMemoryPaginationEngine
    extends AbstractPaginationEngine<InMemoryStatement, InMemoryHandle, InMemorySnapshot> {
  private static final Logger log = LoggerFactory.getLogger(InMemoryPaginationEngine.class);

  public InMemoryPaginationEngine(InMemoryHandle handle, CollectionRegistry collections) {
    super(new InMemoryDialect(), handle, collections);
  }

  public InMemoryPaginationEngine(InMemoryHandle handle, CollectionRegistry collections, QueryValidationStrategy validation) {
    super(new InMemoryDialect(), handle, collections, validation);
  }

  @Override
  protected <T> T inReadSession(Function<InMemorySnapshot, T> work) {
    return work.apply(new InMemorySnapshot(handle().client()));
  }

  @Override
  protected long executeCount(InMemorySnapshot session, InMemoryStatement stmt) {
    long n = session.rows(stmt.source()).stream().filter(stmt.filter()).count();
    log.debug("muse.memory op=count source={} count={}", stmt.source(), n);
    return n;
  }

  @Override
  protected Optional<CursorPosition> executeCursorRow(InMemorySnapshot session, InMemoryStatement stmt) {
    String key = stmt.keyProperty();
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map<String, Object> r : session.rows(stmt.source())) {
      if (stmt.filter().test(r) || isCursor(r.get(key), stmt.cursor())) rows.add(r);
    }
    rows.sort(stmt.order());
    for (int i = 0; i < rows.size(); i++) {
      Map<String, Object> r = rows.get(i);
      if (isCursor(r.get(key), stmt.cursor())) {
        CursorPosition pos = new CursorPosition(i + 1, stmt.filter().test(r));
        log.debug("muse.memory op=cursorRow source={} cursor={} row={} inFilter={}",
            stmt.source(), stmt.cursor(), pos.rowNumber(), pos.inFilter());
        return Optional.of(pos);
      }
    }
    return Optional.empty();
  }

  @Override
  protected List<BoundaryRow> executeBoundaryRows(InMemorySnapshot session, InMemoryStatement stmt) {
    List<BoundaryRow> out = new ArrayList<>();
    long rowNumber = 0;
    for (Map<String, Object> r : sorted(session, stmt)) {
      rowNumber++;
      if (stmt.window().isCandidate(rowNumber)) {
        out.add(new BoundaryRow(r.get(stmt.keyProperty()), rowNumber));
      }
    }
    log.debug("muse.memory op=boundaryRows source={} window={} rows={}", stmt.source(), stmt.window(), out.size());
    return out;
  }

  @Override
  protected <T> List<T> executeSelect(InMemorySnapshot session, CollectionDefinition collection,
                                      InMemoryStatement stmt, RowReader<T> reader) {
    List<Map<String, Object>> rows = sorted(session, stmt);
    int from = (int) Math.min(stmt.offset(), rows.size());
    int to = stmt.limit() < 0 ? rows.size() : (int) Math.min((long) from + stmt.limit(), rows.size());
    List<T> out = new ArrayList<>(to - from);
    for (Map<String, Object> r : rows.subList(from, to)) {
      out.add(reader.read(RowAdapters.fromMap(r)));
    }
    log.debug("muse.memory op=select source={} offset={} limit={} rows={}",
        stmt.source(), stmt.offset(), stmt.limit(), out.size());
    return out;
  }

  private static List<Map<String, Object>> sorted(InMemorySnapshot session, InMemoryStatement stmt) {
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map<String, Object> r : session.rows(stmt.source())) {
      if (stmt.filter().test(r)) rows.add(r);
    }
    rows.sort(stmt.order());
    return rows;
  }

  private static boolean isCursor(Object key, Object cursor) {
    return key != null && Values.equal(key, cursor);
  }
}

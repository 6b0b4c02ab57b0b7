package io.muse.persistence.memory;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.pagination.PageWindow;
import io.muse.persistence.pagination.ResolvedSort;
import io.muse.persistence.query.OffsetPage;
import io.muse.persistence.query.Page;
import io.muse.persistence.query.QueryElement;
import io.muse.persistence.query.SortField;
import io.muse.persistence.spi.sql.Dialect;
import io.muse.persistence.spi.sql.StatementKind;

import java.util.List;

/** Compiles filters and sort orders into predicates and comparators over property-keyed rows. */
public final class InMemoryDialect implements Dialect<InMemoryStatement> {

  @Override
  public String id() {
    return "memory";
  }

  @Override
  public InMemoryStatement renderCount(CollectionDefinition c, QueryElement filter) {
    return InMemoryStatement.count(c.source(), FilterEvaluator.compile(filter));
  }

  @Override
  public InMemoryStatement renderCursorRow(CollectionDefinition c, QueryElement filter, ResolvedSort sort, Object cursor) {
    return new InMemoryStatement(StatementKind.CURSOR_ROW, c.source(), FilterEvaluator.compile(filter),
        RowOrdering.of(c, sort.order()), c.key(), cursor, null, 0, -1);
  }

  @Override
  public InMemoryStatement renderBoundaryRows(CollectionDefinition c, QueryElement filter, ResolvedSort sort, PageWindow window) {
    return new InMemoryStatement(StatementKind.BOUNDARY_ROWS, c.source(), FilterEvaluator.compile(filter),
        RowOrdering.of(c, sort.order()), c.key(), null, window, 0, -1);
  }

  @Override
  public InMemoryStatement renderSelect(CollectionDefinition c, QueryElement filter, List<SortField> sort, Page page) {
    long offset = (page instanceof OffsetPage op) ? op.offset() : 0;
    int limit = (page == null) ? -1 : page.limit();
    return new InMemoryStatement(StatementKind.SELECT, c.source(), FilterEvaluator.compile(filter),
        RowOrdering.of(c, sort), c.key(), null, null, offset, limit);
  }
}

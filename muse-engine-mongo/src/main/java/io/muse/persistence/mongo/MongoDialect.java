package io.muse.persistence.mongo;

import com.mongodb.client.model.Collation;
import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.pagination.PageWindow;
import io.muse.persistence.pagination.ResolvedSort;
import io.muse.persistence.query.OffsetPage;
import io.muse.persistence.query.Page;
import io.muse.persistence.query.QueryElement;
import io.muse.persistence.query.SortField;
import io.muse.persistence.spi.sql.Dialect;
import io.muse.persistence.spi.sql.StatementKind;
import org.bson.Document;

import java.util.List;

/** Mongo dialect: renders filters to BSON and sort orders to sort documents with an optional collation. */
public final class MongoDialect implements Dialect<MongoStatement> {
  @Override public String id() { return "mongo"; }

  @Override
  public MongoStatement renderCount(CollectionDefinition c, QueryElement filter) {
    return new MongoStatement(StatementKind.COUNT, c.source(), MongoQueryRenderer.toBson(c, filter),
        null, null, null, null, null, null, null, null);
  }

  @Override
  public MongoStatement renderCursorRow(CollectionDefinition c, QueryElement filter, ResolvedSort sort, Object cursor) {
    String keyPath = c.keyField().column();
    Document f = MongoQueryRenderer.toBson(c, filter);
    Document atCursor = new Document(keyPath, cursor);
    Document match = f.isEmpty() ? f : new Document("$or", List.of(f, atCursor));
    Document cursorInFilter = f.isEmpty() ? null : new Document("$and", List.of(f, atCursor));
    return new MongoStatement(StatementKind.CURSOR_ROW, c.source(), match, cursorInFilter,
        sortDoc(c, sort.order()), collation(c, sort.order()), keyPath, cursor, null, null, null);
  }

  @Override
  public MongoStatement renderBoundaryRows(CollectionDefinition c, QueryElement filter, ResolvedSort sort, PageWindow window) {
    return new MongoStatement(StatementKind.BOUNDARY_ROWS, c.source(), MongoQueryRenderer.toBson(c, filter), null,
        sortDoc(c, sort.order()), collation(c, sort.order()), c.keyField().column(), null, window, null, null);
  }

  @Override
  public MongoStatement renderSelect(CollectionDefinition c, QueryElement filter, List<SortField> sort, Page page) {
    return new MongoStatement(StatementKind.SELECT, c.source(), MongoQueryRenderer.toBson(c, filter), null,
        sortDoc(c, sort), collation(c, sort), c.keyField().column(), null, null, skip(page), limit(page));
  }

  private static Integer skip(Page page) {
    if (page instanceof OffsetPage op) return Math.toIntExact(op.offset());
    return null;
  }

  private static Integer limit(Page page) {
    if (page == null) return null;
    return page.limit();
  }

  static Document sortDoc(CollectionDefinition c, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return null;
    Document d = new Document();
    for (SortField sf : sort) {
      d.put(c.field(sf.field()).column(), sf.direction() == SortField.Direction.DESC ? -1 : 1);
    }
    return d;
  }

  /**
   * Mongo applies one collation per query; the collation of the first sort field wins.
   */
  static Collation collation(CollectionDefinition c, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return null;
    FieldDef f = c.field(sort.get(0).field());
    if (f.collation() == null) return null;
    return Collation.builder().locale(f.collation().replace('-', '_')).build();
  }
}

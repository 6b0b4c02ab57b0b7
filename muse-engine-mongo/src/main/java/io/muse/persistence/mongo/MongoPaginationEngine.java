package io.muse.persistence.mongo;

import com.mongodb.ClientSessionOptions;
import com.mongodb.client.ClientSession;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.Projections;
import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.CollectionRegistry;
import io.muse.persistence.mapping.RowAdapters;
import io.muse.persistence.mapping.RowReader;
import io.muse.persistence.pagination.BoundaryRow;
import io.muse.persistence.pagination.CursorPosition;
import io.muse.persistence.spi.exec.AbstractPaginationEngine;
import io.muse.persistence.spi.exec.QueryValidationStrategy;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/**
 * Mongo backend engine using the official MongoDB Java sync driver.
 *
 * <p>Row numbers are counted while streaming the sorted key projection, so memory stays constant in
 * the collection size. With {@code causalSessions} every request reads through one causally
 * consistent {@link ClientSession}.
 */
public final class MongoPaginationEngine
    extends AbstractPaginationEngine<MongoStatement, MongoHandle, MongoReadSession> {
  private static final Logger log = LoggerFactory.getLogger(MongoPaginationEngine.class);

  private final boolean causalSessions;

  public MongoPaginationEngine(MongoHandle handle,
                               CollectionRegistry collections,
                               QueryValidationStrategy validation,
                               boolean causalSessions) {
    super(new MongoDialect(), handle, collections, validation);
    this.causalSessions = causalSessions;
  }

  public MongoPaginationEngine(MongoHandle handle, CollectionRegistry collections) {
    this(handle, collections, null, false);
  }

  @Override
  protected <T> T inReadSession(Function<MongoReadSession, T> work) {
    var db = handle().client().getDatabase(handle().database());
    if (!causalSessions) return work.apply(new MongoReadSession(db, null));
    try (ClientSession s = handle().client().startSession(ClientSessionOptions.builder().causallyConsistent(true).build())) {
      return work.apply(new MongoReadSession(db, s));
    }
  }

  @Override
  protected long executeCount(MongoReadSession rs, MongoStatement st) {
    MongoCollection<Document> col = rs.db().getCollection(st.collection());
    long n = (rs.session() == null) ? col.countDocuments(st.filter()) : col.countDocuments(rs.session(), st.filter());
    log.debug("muse.mongo op=COUNT collection={} filter={} result={}", st.collection(), st.filter().toJson(), n);
    return n;
  }

  @Override
  protected Optional<CursorPosition> executeCursorRow(MongoReadSession rs, MongoStatement st) {
    long rowNumber = 0;
    boolean found = false;
    try (MongoCursor<Document> it = keys(rs, st).iterator()) {
      while (it.hasNext()) {
        rowNumber++;
        if (sameKey(keyOf(it.next(), st.keyPath()), st.cursor())) {
          found = true;
          break;
        }
      }
    }
    if (!found) {
      log.debug("muse.mongo op=CURSOR_ROW collection={} cursor={} result=empty", st.collection(), st.cursor());
      return Optional.empty();
    }

    boolean inFilter = true;
    if (st.cursorInFilter() != null) {
      MongoCollection<Document> col = rs.db().getCollection(st.collection());
      CountOptions one = new CountOptions().limit(1);
      long hits = (rs.session() == null) ? col.countDocuments(st.cursorInFilter(), one) : col.countDocuments(rs.session(), st.cursorInFilter(), one);
      inFilter = hits > 0;
    }
    log.debug("muse.mongo op=CURSOR_ROW collection={} cursor={} row={} inFilter={}",
        st.collection(), st.cursor(), rowNumber, inFilter);
    return Optional.of(new CursorPosition(rowNumber, inFilter));
  }

  @Override
  protected List<BoundaryRow> executeBoundaryRows(MongoReadSession rs, MongoStatement st) {
    List<BoundaryRow> out = new ArrayList<>();
    long rowNumber = 0;
    long size = st.window().collectionSize();
    try (MongoCursor<Document> it = keys(rs, st).iterator()) {
      while (it.hasNext() && rowNumber < size) {
        Document d = it.next();
        rowNumber++;
        if (st.window().isCandidate(rowNumber)) out.add(new BoundaryRow(keyOf(d, st.keyPath()), rowNumber));
      }
    }
    log.debug("muse.mongo op=BOUNDARY_ROWS collection={} window={} rows={}", st.collection(), st.window(), out.size());
    return out;
  }

  @Override
  protected <T> List<T> executeSelect(MongoReadSession rs, CollectionDefinition collection, MongoStatement st, RowReader<T> reader) {
    FindIterable<Document> find = find(rs, st);
    if (st.skip() != null) find = find.skip(st.skip());
    if (st.limit() != null) find = find.limit(st.limit());

    Map<String, String> paths = new LinkedHashMap<>();
    collection.fields().forEach((property, f) -> paths.put(property, f.column()));

    List<T> out = new ArrayList<>();
    for (Document d : find) out.add(reader.read(RowAdapters.mapped(d, paths)));
    log.debug("muse.mongo op=SELECT collection={} skip={} limit={} rows={}", st.collection(), st.skip(), st.limit(), out.size());
    return out;
  }

  private static FindIterable<Document> find(MongoReadSession rs, MongoStatement st) {
    MongoCollection<Document> col = rs.db().getCollection(st.collection());
    FindIterable<Document> find = (rs.session() == null) ? col.find(st.filter()) : col.find(rs.session(), st.filter());
    if (st.sort() != null && !st.sort().isEmpty()) find = find.sort(st.sort());
    if (st.collation() != null) find = find.collation(st.collation());
    return find;
  }

  /** Sorted key projection of the statement's documents. */
  private static FindIterable<Document> keys(MongoReadSession rs, MongoStatement st) {
    return find(rs, st).projection(Projections.include(st.keyPath()));
  }

  private static Object keyOf(Document d, String path) {
    Object cur = d;
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(p);
    }
    return cur;
  }

  private static boolean sameKey(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y && !(a instanceof java.math.BigDecimal)) {
      return x.longValue() == y.longValue();
    }
    return Objects.equals(a, b);
  }
}

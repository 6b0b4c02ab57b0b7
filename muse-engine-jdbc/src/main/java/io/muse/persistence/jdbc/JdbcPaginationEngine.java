package io.muse.persistence.jdbc;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.CollectionRegistry;
import io.muse.persistence.jdbc.bind.JdbcBinders;
import io.muse.persistence.jdbc.dialect.JdbcDialect;
import io.muse.persistence.mapping.RowReader;
import io.muse.persistence.pagination.BoundaryRow;
import io.muse.persistence.pagination.CursorPosition;
import io.muse.persistence.spi.exec.AbstractPaginationEngine;
import io.muse.persistence.spi.exec.QueryValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;
import java.util.function.Function;

/**
 * Pagination over a JDBC {@link DataSource}. Every request borrows one read-only connection and runs
 * its statements in one transaction, at the configured isolation level when one is given.
 */
public final class JdbcPaginationEngine extends AbstractPaginationEngine<SqlStatement, JdbcHandle, Connection> {
  private static final Logger log = LoggerFactory.getLogger(JdbcPaginationEngine.class);

  private final DataSource ds;
  private final JdbcBinders binders;
  private final Integer isolationLevel;

  public JdbcPaginationEngine(JdbcHandle handle,
                              CollectionRegistry collections,
                              JdbcDialect dialect,
                              QueryValidationStrategy validation,
                              Integer isolationLevel) {
    super(dialect, handle, collections, validation);
    this.ds = handle.client();
    this.binders = new JdbcBinders(dialect.binders());
    this.isolationLevel = isolationLevel;
  }

  public JdbcPaginationEngine(JdbcHandle handle, CollectionRegistry collections, JdbcDialect dialect) {
    this(handle, collections, dialect, null, null);
  }

  @Override
  protected <T> T inReadSession(Function<Connection, T> work) {
    try (Connection c = ds.getConnection()) {
      c.setReadOnly(true);
      if (isolationLevel != null) c.setTransactionIsolation(isolationLevel);
      c.setAutoCommit(false);
      try {
        T out = work.apply(c);
        c.commit();
        return out;
      } catch (RuntimeException e) {
        try {
          c.rollback();
        } catch (SQLException re) {
          e.addSuppressed(re);
        }
        throw e;
      }
    } catch (SQLException e) {
      throw new RuntimeException("muse.jdbc read session failed", e);
    }
  }

  @Override
  protected long executeCount(Connection c, SqlStatement ss) {
    return query(c, ss, rs -> rs.next() ? rs.getLong(1) : 0L);
  }

  @Override
  protected Optional<CursorPosition> executeCursorRow(Connection c, SqlStatement ss) {
    return query(c, ss, rs -> rs.next()
        ? Optional.of(new CursorPosition(rs.getLong(1), rs.getInt(2) == 1))
        : Optional.<CursorPosition>empty());
  }

  @Override
  protected List<BoundaryRow> executeBoundaryRows(Connection c, SqlStatement ss) {
    return query(c, ss, rs -> {
      List<BoundaryRow> out = new ArrayList<>();
      while (rs.next()) out.add(new BoundaryRow(rs.getObject(1), rs.getLong(2)));
      return out;
    });
  }

  @Override
  protected <T> List<T> executeSelect(Connection c, CollectionDefinition collection, SqlStatement ss, RowReader<T> reader) {
    return query(c, ss, rs -> {
      List<T> out = new ArrayList<>();
      JdbcRowAdapter row = new JdbcRowAdapter(rs);
      while (rs.next()) out.add(reader.read(row));
      return out;
    });
  }

  @FunctionalInterface
  private interface ResultHandler<T> {
    T handle(ResultSet rs) throws SQLException;
  }

  private <T> T query(Connection c, SqlStatement ss, ResultHandler<T> handler) {
    String jdbcSql = NamedParamCompiler.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql(ss, jdbcSql);
    try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      binders.bindAll(ps, ss.binds());
      try (ResultSet rs = ps.executeQuery()) {
        T out = handler.handle(rs);
        debugDone(ss, out, System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new RuntimeException("muse.jdbc op=" + ss.kind() + " failed", e);
    }
  }

  private void debugSql(SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("muse.jdbc op={} bindCount={} handleId={} schema={} sql={}",
        ss.kind(), ss.binds().size(), h.id(), h.schema(), jdbcSql);

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("muse.jdbc bind index={} fieldType={} valueType={} valueLen={}", idx++, b.type(), vType, vLen);
      }
    }
  }

  private void debugDone(SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("muse.jdbc_done op={} durationMs={} result={}", ss.kind(), durationNanos / 1_000_000.0, safeResult(result));
  }

  private static String safeResult(Object r) {
    if (r == null) return "null";
    if (r instanceof Number n) return String.valueOf(n);
    if (r instanceof Collection<?> c) return "rows=" + c.size();
    if (r instanceof Optional<?> o) return o.isPresent() ? "found" : "empty";
    return r.getClass().getSimpleName();
  }
}

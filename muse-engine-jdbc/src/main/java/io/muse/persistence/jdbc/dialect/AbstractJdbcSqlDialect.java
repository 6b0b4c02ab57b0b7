package io.muse.persistence.jdbc.dialect;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.jdbc.Bind;
import io.muse.persistence.jdbc.SqlStatement;
import io.muse.persistence.pagination.PageWindow;
import io.muse.persistence.pagination.ResolvedSort;
import io.muse.persistence.query.*;
import io.muse.persistence.spi.sql.StatementKind;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.
 *
 * Provides common rendering for:
 * - count and page selects: table + filter + sort + paging
 * - cursor lookup and boundary rows, numbered with {@code ROW_NUMBER() OVER (ORDER BY ...)}
 *
 * DB-specific dialects override hooks for quoting, paging and collations.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();
    public String add(Bind b) {
      binds.add(b);
      return ":b" + (n++);
    }
  }

  @Override
  public final SqlStatement renderCount(CollectionDefinition c, QueryElement filter) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT COUNT(1) FROM (SELECT 1 FROM " + table(c) + where(c, filter, ctx) + ") muse_count";
    return new SqlStatement(StatementKind.COUNT, sql, ctx.binds);
  }

  /**
   * Numbers the rows matching the filter plus the cursor row itself, then picks the cursor row.
   * {@code muse_in_filter} tells whether the filter alone would have kept it.
   */
  @Override
  public final SqlStatement renderCursorRow(CollectionDefinition c, QueryElement filter, ResolvedSort sort, Object cursor) {
    RenderCtx ctx = new RenderCtx();
    FieldDef key = c.keyField();
    String keyExpr = key.column();

    String inFilter = "1";
    String where = "";
    String pred = predicateSql(c, filter, ctx);
    if (!pred.isBlank()) {
      inFilter = "CASE WHEN " + pred + " THEN 1 ELSE 0 END";
      where = " WHERE (" + predicateSql(c, filter, ctx) + ") OR " + keyExpr + " = " + ctx.add(new Bind(cursor, key.type()));
    }

    String sql = "SELECT muse_row, muse_in_filter FROM ("
        + "SELECT " + keyExpr + " AS muse_key, ROW_NUMBER() OVER (" + orderBy(c, sort.order()) + ") AS muse_row, "
        + inFilter + " AS muse_in_filter FROM " + table(c) + where
        + ") muse_cursor WHERE muse_key = " + ctx.add(new Bind(cursor, key.type()));
    return new SqlStatement(StatementKind.CURSOR_ROW, sql, ctx.binds);
  }

  /**
   * Keys and row numbers of the candidate boundary rows of {@code window}: rows aligned with the
   * cursor, inside the surrounding window or in the tail that holds the last page. Page arithmetic
   * is inlined as integer literals.
   */
  @Override
  public final SqlStatement renderBoundaryRows(CollectionDefinition c, QueryElement filter, ResolvedSort sort, PageWindow window) {
    RenderCtx ctx = new RenderCtx();
    int p = window.pageSize();
    String sql = "WITH muse_rows AS ("
        + "SELECT " + c.keyField().column() + " AS muse_key, ROW_NUMBER() OVER (" + orderBy(c, sort.order()) + ") AS muse_row"
        + " FROM " + table(c) + where(c, filter, ctx)
        + "), muse_pages AS ("
        + "SELECT muse_key, muse_row, muse_row / " + p + " AS muse_page FROM muse_rows"
        + " WHERE MOD(muse_row, " + p + ") = " + window.alignment() + " AND muse_row < " + window.collectionSize()
        + ") SELECT muse_key, muse_row FROM muse_pages"
        + " WHERE muse_page BETWEEN " + window.windowFrom() + " AND " + window.windowTo()
        + " OR muse_page >= " + window.tailFrom()
        + " ORDER BY muse_row";
    return new SqlStatement(StatementKind.BOUNDARY_ROWS, sql, ctx.binds);
  }

  @Override
  public final SqlStatement renderSelect(CollectionDefinition c, QueryElement filter, List<SortField> sort, Page page) {
    RenderCtx ctx = new RenderCtx();
    List<String> items = new ArrayList<>();
    for (var e : c.fields().entrySet()) {
      items.add(e.getValue().column() + " AS " + quoteIdent(e.getKey()));
    }
    String sql = "SELECT " + String.join(", ", items) + " FROM " + table(c) + where(c, filter, ctx);
    if (sort != null && !sort.isEmpty()) sql += " " + orderBy(c, sort);
    if (page instanceof OffsetPage op) sql = applyOffsetPage(sql, op);
    return new SqlStatement(StatementKind.SELECT, sql, ctx.binds);
  }

  /** ANSI paging; dialects override (Postgres LIMIT/OFFSET). */
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " OFFSET " + page.offset() + " ROWS FETCH NEXT " + page.limit() + " ROWS ONLY";
  }

  /** Sort expression for a field. Default ignores collations; dialects that support them override. */
  protected String sortExpr(FieldDef field) {
    return field.column();
  }

  protected abstract String quoteIdent(String ident);

  /** Quotes every part of a possibly schema-qualified name. */
  protected String table(CollectionDefinition c) {
    List<String> parts = new ArrayList<>();
    for (String p : c.source().split("\\.")) parts.add(quoteIdent(p));
    return String.join(".", parts);
  }

  protected String orderBy(CollectionDefinition c, List<SortField> sort) {
    List<String> parts = new ArrayList<>();
    for (SortField sf : sort) {
      parts.add(sortExpr(c.field(sf.field())) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
    }
    return "ORDER BY " + String.join(", ", parts);
  }

  private String where(CollectionDefinition c, QueryElement filter, RenderCtx ctx) {
    String pred = predicateSql(c, filter, ctx);
    return pred.isBlank() ? "" : " WHERE " + pred;
  }

  protected final String predicateSql(CollectionDefinition c, QueryElement filter, RenderCtx ctx) {
    if (filter == null) return "";
    return renderPredicateSql(c, filter, ctx, false);
  }

  private String renderPredicateSql(CollectionDefinition c, QueryElement el, RenderCtx ctx, boolean negate) {
    if (el instanceof NotElement n) {
      return renderPredicateSql(c, n.element(), ctx, !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause() == null ? Clause.AND : g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      if (g.elements().isEmpty()) return clause == Clause.OR ? "FALSE" : "TRUE";
      List<String> childSql = new ArrayList<>();
      for (QueryElement e : g.elements()) {
        childSql.add(renderPredicateSql(c, e, ctx, negate));
      }
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (!(el instanceof Condition cond)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    if (!c.hasField(cond.property())) {
      throw new QueryValidationException("Unknown field '" + cond.property() + "' in collection '" + c.name() + "'");
    }
    FieldDef f = c.field(cond.property());
    String expr = f.column();
    boolean not = cond.not() ^ negate;
    Object value = cond.value();

    return switch (cond.operator()) {
      case EQ -> (value == null)
          ? nullCheckSql(expr, true, not)
          : unarySql(expr, "=", value, f, not, ctx);
      case NE -> (value == null)
          ? nullCheckSql(expr, false, not)
          : unarySql(expr, "<>", value, f, not, ctx);
      case GT -> unaryNonNull(expr, ">", value, f, not, ctx);
      case GE -> unaryNonNull(expr, ">=", value, f, not, ctx);
      case LT -> unaryNonNull(expr, "<", value, f, not, ctx);
      case LE -> unaryNonNull(expr, "<=", value, f, not, ctx);
      case LIKE -> unaryNonNull(expr, "LIKE", value, f, not, ctx);
      case IN -> listSql(expr, "IN", toList(value), f, not, ctx);
      case NIN -> listSql(expr, "NOT IN", toList(value), f, not, ctx);
      case RANGE -> {
        if (cond.lower() == null || cond.upper() == null) {
          throw new IllegalArgumentException("RANGE requires non-null lower+upper for property '" + cond.property() + "'");
        }
        yield betweenSql(expr, cond.lower(), cond.upper(), f, not, ctx);
      }
    };
  }

  private static String nullCheckSql(String expr, boolean isNull, boolean not) {
    String sql = expr + (isNull ? " IS NULL" : " IS NOT NULL");
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unarySql(String expr, String op, Object value, FieldDef f, boolean not, RenderCtx ctx) {
    String sql = expr + " " + op + " " + ctx.add(new Bind(value, f.type()));
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unaryNonNull(String expr, String op, Object value, FieldDef f, boolean not, RenderCtx ctx) {
    if (value == null) throw new IllegalArgumentException(op + " requires non-null value");
    return unarySql(expr, op, value, f, not, ctx);
  }

  private static String betweenSql(String expr, Object lower, Object upper, FieldDef f, boolean not, RenderCtx ctx) {
    String p1 = ctx.add(new Bind(lower, f.type()));
    String p2 = ctx.add(new Bind(upper, f.type()));
    String sql = expr + " BETWEEN " + p1 + " AND " + p2;
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String listSql(String expr, String op, List<Object> vals, FieldDef f, boolean not, RenderCtx ctx) {
    if (vals.isEmpty()) {
      // IN () is false, NOT IN () is true
      boolean result = op.equals("NOT IN") ^ not;
      return result ? "TRUE" : "FALSE";
    }
    List<String> ph = new ArrayList<>();
    for (Object v : vals) ph.add(ctx.add(new Bind(v, f.type())));
    String sql = expr + " " + op + " (" + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  @SuppressWarnings("unchecked")
  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof List<?> l) return (List<Object>) l;
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}

package io.muse.persistence.jdbc.postgres;

import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.jdbc.dialect.AbstractJdbcSqlDialect;
import io.muse.persistence.jdbc.dialect.JdbcDialect;
import io.muse.persistence.query.OffsetPage;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides. Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 * Collations map to ICU collations ({@code "en-x-icu"}), which Postgres builds with ICU support ship.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  @Override public String id() { return "postgres"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " LIMIT " + page.limit() + " OFFSET " + page.offset();
  }

  @Override
  protected String sortExpr(FieldDef field) {
    if (field.collation() == null) return field.column();
    return field.column() + " COLLATE " + quoteIdent(field.collation() + "-x-icu");
  }
}

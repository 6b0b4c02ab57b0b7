package io.muse.persistence.jdbc.dialect;

import io.muse.persistence.jdbc.SqlStatement;
import io.muse.persistence.jdbc.bind.JdbcBinder;
import io.muse.persistence.spi.sql.Dialect;

import java.util.List;

/** Dialect for JDBC engines (statement rendering and dialect binders). */
public interface JdbcDialect extends Dialect<SqlStatement> {
  /** Binders evaluated before the base JDBC binders. */
  default List<JdbcBinder> binders() {
    return List.of();
  }
}

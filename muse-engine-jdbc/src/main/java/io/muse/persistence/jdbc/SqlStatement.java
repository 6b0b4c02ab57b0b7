package io.muse.persistence.jdbc;

import io.muse.persistence.spi.sql.NativeStatement;
import io.muse.persistence.spi.sql.StatementKind;

import java.util.List;

/** SQL with {@code :name} placeholders and the binds for them, in order of appearance. */
public record SqlStatement(StatementKind kind, String sql, List<Bind> binds) implements NativeStatement {
  public SqlStatement {
    if (kind == null) throw new IllegalArgumentException("kind is required");
    binds = binds == null ? List.of() : List.copyOf(binds);
  }
}

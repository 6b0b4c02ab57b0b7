package io.muse.persistence.memory;

import io.muse.persistence.pagination.PageWindow;
import io.muse.persistence.spi.sql.NativeStatement;
import io.muse.persistence.spi.sql.StatementKind;

import java.util.Comparator;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Compiled in-memory statement. Fields not used by a {@link StatementKind} are null
 * ({@code offset}/{@code limit} are only meaningful for selects).
 */
public record InMemoryStatement(
    StatementKind kind,
    String source,
    Predicate<Map<String, Object>> filter,
    Comparator<Map<String, Object>> order,
    String keyProperty,
    Object cursor,
    PageWindow window,
    long offset,
    int limit
) implements NativeStatement {

  static InMemoryStatement count(String source, Predicate<Map<String, Object>> filter) {
    return new InMemoryStatement(StatementKind.COUNT, source, filter, null, null, null, null, 0, -1);
  }
}

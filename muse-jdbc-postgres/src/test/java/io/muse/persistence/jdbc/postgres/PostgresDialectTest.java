package io.muse.persistence.jdbc.postgres;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.collection.FieldType;
import io.muse.persistence.jdbc.SqlStatement;
import io.muse.persistence.pagination.PageWindow;
import io.muse.persistence.pagination.SortResolver;
import io.muse.persistence.query.OffsetPage;
import io.muse.persistence.query.QueryFilters;
import io.muse.persistence.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private static final CollectionDefinition NAMESPACES = CollectionDefinition.builder("namespace")
      .source("namespace")
      .key("id", "id", FieldType.UUID)
      .field("name", FieldDef.sortable("name", FieldType.STRING).withCollation("en-US"))
      .field("createdAt", FieldDef.sortable("created_at", FieldType.INSTANT))
      .build();

  private final PostgresDialect d = new PostgresDialect();

  @Test
  void throwsOnUnknownProperty() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> d.renderCount(NAMESPACES, QueryFilters.eq("status", "CREATED")));
    assertTrue(ex.getMessage().contains("Unknown field 'status'"));
  }

  @Test
  void pagesWithLimitOffset() {
    SqlStatement s = d.renderSelect(NAMESPACES, null, SortResolver.resolve(NAMESPACES, "-createdAt").order(),
        new OffsetPage(50, 25));
    assertTrue(s.sql().endsWith("ORDER BY created_at DESC, id ASC LIMIT 25 OFFSET 50"), s.sql());
  }

  @Test
  void collatedColumnsSortWithIcuCollation() {
    SqlStatement s = d.renderBoundaryRows(NAMESPACES, null, SortResolver.resolve(NAMESPACES, "name"),
        PageWindow.of(100, 10, 2, 0));
    assertTrue(s.sql().contains("ORDER BY name COLLATE \"en-US-x-icu\" ASC, id ASC"), s.sql());
  }

  @Test
  void quotesIdentifiers() {
    CollectionDefinition c = CollectionDefinition.builder("odd")
        .source("my\"schema.items")
        .key("id", "id", FieldType.LONG)
        .build();
    assertTrue(d.renderCount(c, null).sql().contains("FROM \"my\"\"schema\".\"items\""));
  }
}

package io.muse.persistence.mongo;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.collection.FieldType;
import io.muse.persistence.pagination.PageWindow;
import io.muse.persistence.pagination.SortResolver;
import io.muse.persistence.query.OffsetPage;
import io.muse.persistence.spi.sql.StatementKind;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.muse.persistence.query.QueryFilters.eq;
import static org.junit.jupiter.api.Assertions.*;

final class MongoDialectTest {
  private static final CollectionDefinition TYPES = CollectionDefinition.builder("ontologyType")
      .source("ontology_type")
      .key("id", "_id", FieldType.STRING)
      .field("name", FieldDef.sortable("name", FieldType.STRING).withCollation("en-US"))
      .field("namespaceId", FieldDef.of("namespace_id", FieldType.STRING))
      .build();

  private final MongoDialect d = new MongoDialect();

  @Test
  void sortDocumentFollowsResolvedOrder() {
    MongoStatement st = d.renderBoundaryRows(TYPES, null, SortResolver.resolve(TYPES, "-name"),
        PageWindow.of(100, 10, 2, 0));
    assertEquals(new Document("name", -1).append("_id", 1), st.sort());
    assertEquals("en_US", st.collation().getLocale());
    assertEquals("_id", st.keyPath());
  }

  @Test
  void cursorLookupMatchesFilterOrCursor() {
    MongoStatement st = d.renderCursorRow(TYPES, eq("namespaceId", "ns1"), SortResolver.resolve(TYPES, null), "t7");
    Document filter = new Document("namespace_id", "ns1");
    Document atCursor = new Document("_id", "t7");

    assertEquals(StatementKind.CURSOR_ROW, st.kind());
    assertEquals(new Document("$or", List.of(filter, atCursor)), st.filter());
    assertEquals(new Document("$and", List.of(filter, atCursor)), st.cursorInFilter());
    assertNull(st.collation());
  }

  @Test
  void cursorLookupWithoutFilterSkipsMembershipCheck() {
    MongoStatement st = d.renderCursorRow(TYPES, null, SortResolver.resolve(TYPES, null), "t7");
    assertTrue(st.filter().isEmpty());
    assertNull(st.cursorInFilter());
  }

  @Test
  void selectCarriesSkipAndLimit() {
    MongoStatement st = d.renderSelect(TYPES, null, SortResolver.resolve(TYPES, "name").order(), new OffsetPage(40, 20));
    assertEquals(40, st.skip());
    assertEquals(20, st.limit());
  }
}

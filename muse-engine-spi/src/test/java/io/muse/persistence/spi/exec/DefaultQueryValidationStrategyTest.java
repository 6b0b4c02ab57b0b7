package io.muse.persistence.spi.exec;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.collection.FieldType;
import io.muse.persistence.pagination.UnknownSortColumnException;
import io.muse.persistence.query.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultQueryValidationStrategyTest {
  private static CollectionDefinition objects() {
    return CollectionDefinition.builder("ontologyObject")
        .source("object")
        .key("id", "id", FieldType.LONG)
        .field("name", FieldDef.sortable("name", FieldType.STRING))
        .field("namespaceId", FieldDef.of("namespace_id", FieldType.LONG))
        .build();
  }

  @Test
  void throwsOnUnknownFilterProperty() {
    Query q = Query.of(QueryFilters.eq("status", "CREATED"));
    DefaultQueryValidationStrategy v = new DefaultQueryValidationStrategy();
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> v.validate(objects(), q, q.filter()));
    assertTrue(ex.getMessage().contains("Unknown property 'status'"));
  }

  @Test
  void throwsOnUnsortableSortField() {
    Query q = new Query().withSort(List.of(SortField.asc("namespaceId")));
    DefaultQueryValidationStrategy v = new DefaultQueryValidationStrategy();
    assertThrows(UnknownSortColumnException.class, () -> v.validate(objects(), q, null));
  }

  @Test
  void validatesNestedGroups() {
    QueryElement f = QueryFilters.and(
        QueryFilters.eq("namespaceId", 1),
        QueryFilters.not(QueryFilters.or(QueryFilters.like("name", "a%"), QueryFilters.eq("owner", "x"))));
    DefaultQueryValidationStrategy v = new DefaultQueryValidationStrategy();
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> v.validate(objects(), null, f));
    assertTrue(ex.getMessage().contains("'owner'"));
  }

  @Test
  void inRequiresCollection() {
    DefaultQueryValidationStrategy v = new DefaultQueryValidationStrategy();
    QueryElement f = Condition.of("id", Operator.IN, 5);
    assertThrows(QueryValidationException.class, () -> v.validate(objects(), null, f));
  }

  @Test
  void normalizerCoercesValuesToFieldTypes() {
    QueryElement f = QueryFilters.and(QueryFilters.eq("namespaceId", "3"), QueryFilters.in("id", List.of(1, "2")));
    LogicalGroup g = (LogicalGroup) FilterNormalizer.normalize(objects(), f);
    assertEquals(3L, ((Condition) g.elements().get(0)).value());
    assertEquals(List.of(1L, 2L), ((Condition) g.elements().get(1)).value());
  }

  @Test
  void normalizerReportsBadValuesAsValidationErrors() {
    assertThrows(QueryValidationException.class,
        () -> FilterNormalizer.normalize(objects(), QueryFilters.eq("namespaceId", "three")));
  }
}

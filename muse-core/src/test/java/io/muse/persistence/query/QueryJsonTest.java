package io.muse.persistence.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesNotNode() throws Exception {
    String s = """
        {
          "filter": {
            "not": { "eq": { "field": "deleted", "value": true } }
          }
        }
        """;
    Query q = JSON.readValue(s, Query.class);
    assertTrue(q.filter() instanceof NotElement);
    NotElement n = (NotElement) q.filter();
    assertTrue(n.element() instanceof Condition);
    Condition c = (Condition) n.element();
    assertEquals("deleted", c.property());
    assertEquals(Operator.EQ, c.operator());
    assertEquals(Boolean.TRUE, c.value());
  }

  @Test
  void pageItemsQueryKeepsOffsetSortAndFilter() throws Exception {
    Query q = new Query()
        .withFilter(QueryFilters.and(
            QueryFilters.eq("namespaceId", 3),
            QueryFilters.range("createdOn", "2024-01-01T00:00:00Z", "2025-01-01T00:00:00Z")))
        .withSort(List.of(SortField.desc("name"), SortField.asc("id")))
        .withPage(new OffsetPage(50, 25));

    String json = JSON.writeValueAsString(q);
    Query back = JSON.readValue(json, Query.class);

    assertEquals(new OffsetPage(50, 25), back.page());
    assertEquals(List.of(SortField.desc("name"), SortField.asc("id")), back.sort());
    LogicalGroup g = (LogicalGroup) back.filter();
    Condition range = (Condition) g.elements().get(1);
    assertEquals(Operator.RANGE, range.operator());
    assertEquals("2024-01-01T00:00:00Z", range.lower());
  }

  @Test
  void rejectsConditionWithoutField() {
    String s = """
        { "filter": { "eq": { "value": 1 } } }
        """;
    assertThrows(Exception.class, () -> JSON.readValue(s, Query.class));
  }

  @Test
  void nonCanonicalFilterShapesAreRejected() {
    String groupWithoutClause = """
        { "filter": { "elements": [ { "operator": "EQ", "property": "name", "value": 3 } ] } }
        """;
    String bareList = """
        { "filter": [ { "eq": { "field": "name", "value": "a" } } ] }
        """;
    assertThrows(Exception.class, () -> JSON.readValue(groupWithoutClause, Query.class));
    assertThrows(Exception.class, () -> JSON.readValue(bareList, Query.class));
  }
}

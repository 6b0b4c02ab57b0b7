package io.muse.persistence.memory;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.collection.FieldType;
import io.muse.persistence.collection.InMemoryCollectionRegistry;
import io.muse.persistence.mapping.RowReader;
import io.muse.persistence.pagination.*;
import io.muse.persistence.query.OffsetPage;
import io.muse.persistence.query.Query;
import io.muse.persistence.query.SortField;
import io.muse.persistence.query.QueryValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static io.muse.persistence.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class InMemoryPaginationEngineTest {
  private static final CollectionDefinition ITEMS = CollectionDefinition.builder("item")
      .source("items")
      .key("id", "id", FieldType.LONG)
      .field("name", FieldDef.sortable("name", FieldType.STRING))
      .field("label", FieldDef.sortable("label", FieldType.STRING).withCollation("en"))
      .field("deleted", FieldDef.of("deleted", FieldType.BOOLEAN))
      .field("rank", FieldDef.of("rank", FieldType.INT))
      .build();

  private static final RowReader<Long> IDS = r -> r.longValue("id");

  private InMemoryStore store;
  private InMemoryPaginationEngine engine;

  @BeforeEach
  void setUp() {
    store = new InMemoryStore();
    for (long i = 1; i <= 101; i++) {
      Map<String, Object> row = new HashMap<>();
      row.put("id", i);
      row.put("name", String.format("item-%03d", i));
      row.put("deleted", i % 10 == 0);
      row.put("rank", (int) i);
      store.insert("items", row);
    }
    engine = new InMemoryPaginationEngine(new InMemoryHandle("mem", store), new InMemoryCollectionRegistry(List.of(ITEMS)));
  }

  private static PaginationOptions opts(Object cursor) {
    return PaginationOptions.defaults().withCursor(cursor);
  }

  @Test
  void firstPageListsWindowAndLastPage() {
    PageResult<Long> page = engine.page("item", null, opts(null), IDS);
    PaginationInfo info = page.info();

    assertEquals(101, info.collectionSize());
    assertEquals(1, info.cursorPage());
    assertEquals(List.of(25L, 50L, 75L), info.surroundingPages().stream().map(PageInfo::cursor).toList());
    assertEquals(new PageInfo(100L, 5, 101), info.lastPage());
    assertEquals(25, page.items().size());
    assertEquals(1L, page.items().get(0));
  }

  @Test
  void cursorSelectsRowsAfterIt() {
    PageResult<Long> page = engine.page("item", null, opts("25"), IDS);
    assertEquals(25, page.info().cursorRow());
    assertEquals(2, page.info().cursorPage());
    assertEquals(26L, page.items().get(0));
    assertEquals(50L, page.items().get(24));
  }

  @Test
  void lastPageHoldsTheRemainder() {
    PageResult<Long> page = engine.page("item", null, opts(100L), IDS);
    assertTrue(page.info().isLastPage());
    assertEquals(List.of(101L), page.items());
  }

  @Test
  void walkingNextPagesVisitsEveryRowOnce() {
    List<Long> seen = new ArrayList<>();
    Object cursor = null;
    for (int guard = 0; guard < 20; guard++) {
      PageResult<Long> page = engine.page("item", null, opts(cursor).withItemCount(7), IDS);
      seen.addAll(page.items());
      if (page.info().isLastPage()) break;
      long next = page.info().cursorPage() + 1;
      PageInfo target = page.info().surroundingPages().stream()
          .filter(p -> p.page() == next).findFirst().orElse(page.info().lastPage());
      cursor = target.cursor();
    }
    List<Long> expected = new ArrayList<>();
    for (long i = 1; i <= 101; i++) expected.add(i);
    assertEquals(expected, seen);
  }

  @Test
  void filterIsAppliedToCountAndItems() {
    PageResult<Long> page = engine.page("item", eq("deleted", false), opts(null), IDS);
    assertEquals(91, page.info().collectionSize());
    assertFalse(page.items().contains(10L));
    assertEquals(91, engine.count("item", eq("deleted", "false")));
  }

  @Test
  void cursorExcludedByFilterKeepsItsPosition() {
    PageResult<Long> page = engine.page("item", eq("deleted", false), opts(30L), IDS);
    // ids 10 and 20 are filtered out; id 30 would sit at filtered row 28
    assertEquals(27, page.info().cursorRow());
    assertEquals(31L, page.items().get(0));
  }

  @Test
  void deletedCursorFallsBackToFirstPage() {
    store.deleteByKey("items", "id", 25L);
    PageResult<Long> page = engine.page("item", null, opts(25L), IDS);
    assertEquals(0, page.info().cursorRow());
    assertEquals(1, page.info().cursorPage());
    assertEquals(1L, page.items().get(0));
  }

  @Test
  void unparsableCursorFallsBackToFirstPage() {
    PaginationInfo info = engine.paginate("item", null, opts("not-a-number"));
    assertEquals(0, info.cursorRow());
  }

  @Test
  void descendingSortReversesOrder() {
    PageResult<Long> page = engine.page("item", null, opts(null).withSort("-name"), IDS);
    assertEquals(101L, page.items().get(0));
    assertEquals(new PageInfo(2L, 5, 101), page.info().lastPage());
  }

  @Test
  void unknownSortColumnIsRejected() {
    UnknownSortColumnException e = assertThrows(UnknownSortColumnException.class,
        () -> engine.paginate("item", null, opts(null).withSort("deleted")));
    assertEquals("deleted", e.column());
  }

  @Test
  void smallResultIsASinglePage() {
    PageResult<Long> page = engine.page("item", le("id", 10), opts(null), IDS);
    assertEquals(10, page.info().collectionSize());
    assertTrue(page.info().surroundingPages().isEmpty());
    assertEquals(new PageInfo(null, 1, 0), page.info().lastPage());
    assertEquals(10, page.items().size());
  }

  @Test
  void nullsSortAfterValuesAscending() {
    Map<String, Object> row = new HashMap<>();
    row.put("id", 0L);
    row.put("name", null);
    store.insert("items", row);

    List<Long> ids = engine.select("item",
        new Query().withSort(List.of(SortField.asc("name")))
            .withPage(new OffsetPage(99, 5)),
        IDS);
    assertEquals(List.of(100L, 101L, 0L), ids);
  }

  @Test
  void collationOrdersCaseInsensitivelyFirst() {
    store.clear("items");
    long id = 1;
    for (String label : List.of("b", "A", "a", "B")) {
      store.insert("items", Map.of("id", id++, "label", label));
    }
    List<Object> labels = engine.select("item",
        new Query().withSort(List.of(SortField.asc("label"))),
        r -> r.raw("label"));
    assertEquals(List.of("a", "A", "b", "B"), labels);
  }

  @Test
  void threeValuedLogicExcludesUnknownRows() {
    store.clear("items");
    store.insert("items", Map.of("id", 1L, "name", "x"));
    Map<String, Object> noName = new HashMap<>();
    noName.put("id", 2L);
    noName.put("name", null);
    store.insert("items", noName);

    assertEquals(0, engine.count("item", ne("name", "x")));
    assertEquals(0, engine.count("item", not(eq("name", "x"))));
    assertEquals(1, engine.count("item", isNull("name")));
    assertEquals(2, engine.count("item", or(eq("name", "x"), isNull("name"))));
  }

  @Test
  void likeMatchesWildcards() {
    assertEquals(10, engine.count("item", like("name", "item-01_")));
    assertEquals(101, engine.count("item", like("name", "item-%")));
  }

  @Test
  void invalidFilterValueIsRejected() {
    assertThrows(QueryValidationException.class, () -> engine.count("item", eq("id", "abc")));
  }

  @Test
  void fractionalOrOverflowingNumbersAreRejected() {
    assertEquals(1, engine.count("item", eq("rank", 3L)));
    assertThrows(QueryValidationException.class, () -> engine.count("item", eq("rank", 2.5)));
    assertThrows(QueryValidationException.class, () -> engine.count("item", eq("rank", 4_294_967_298L)));
    assertThrows(QueryValidationException.class, () -> engine.count("item", eq("id", 2.5)));
    assertThrows(QueryValidationException.class, () -> engine.count("item", in("id", List.of(1L, 7.25))));
  }

  @Test
  void emptyCollectionIsASinglePageWithoutRows() {
    InMemoryPaginationEngine empty = new InMemoryPaginationEngine(
        new InMemoryHandle("empty", new InMemoryStore()), new InMemoryCollectionRegistry(List.of(ITEMS)));

    for (Object cursor : Arrays.asList(null, "5")) {
      PageResult<Long> page = empty.page("item", null, opts(cursor), IDS);
      assertEquals(0, page.info().collectionSize());
      assertEquals(0, page.info().cursorRow());
      assertEquals(1, page.info().cursorPage());
      assertEquals(List.of(), page.info().surroundingPages());
      assertEquals(new PageInfo(null, 1, 0), page.info().lastPage());
      assertEquals(List.of(), page.items());
    }
  }

  @Test
  void filterMatchingNothingBehavesLikeEmptyCollection() {
    PageResult<Long> page = engine.page("item", eq("name", "missing"), opts("5"), IDS);
    assertEquals(0, page.info().collectionSize());
    assertEquals(1, page.info().cursorPage());
    assertEquals(List.of(), page.items());
  }

  @Test
  void cursorRowGrowsStrictlyWithTheCursor() {
    long previous = -1;
    for (long id = 1; id <= 100; id++) {
      long row = engine.paginate("item", null, opts(id).withItemCount(10)).cursorRow();
      assertTrue(row > previous, "cursor " + id + " gave row " + row + " after " + previous);
      previous = row;
    }

    previous = -1;
    for (long id = 1; id < 100; id++) {
      if (id % 10 == 0) continue;
      long row = engine.paginate("item", eq("deleted", false), opts(id)).cursorRow();
      assertTrue(row > previous, "filtered cursor " + id + " gave row " + row + " after " + previous);
      previous = row;
    }
  }

  @Test
  void snapshotIgnoresLaterWrites() {
    InMemorySnapshot snapshot = new InMemorySnapshot(store);
    assertEquals(101, snapshot.rows("items").size());
    store.insert("items", Map.of("id", 500L, "name", "late"));
    assertEquals(101, snapshot.rows("items").size());
    assertEquals(102, store.rows("items").size());
  }
}

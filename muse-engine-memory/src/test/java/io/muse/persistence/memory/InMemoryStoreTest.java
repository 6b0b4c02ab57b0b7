package io.muse.persistence.memory;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryStoreTest {
  @Test
  void insertAllAppendsInOrderAfterExistingRows() {
    InMemoryStore store = new InMemoryStore();
    store.insert("items", Map.of("id", 0L));
    List<Map<String, Object>> batch = new ArrayList<>();
    for (long i = 1; i <= 5_000; i++) batch.add(Map.of("id", i));

    store.insertAll("items", batch);

    List<Map<String, Object>> rows = store.rows("items");
    assertEquals(5_001, rows.size());
    for (int i = 0; i < rows.size(); i++) assertEquals((long) i, rows.get(i).get("id"));
  }

  @Test
  void insertAllLeavesEarlierSnapshotsUntouched() {
    InMemoryStore store = new InMemoryStore();
    store.insertAll("items", List.of(Map.of("id", 1L)));
    List<Map<String, Object>> before = store.rows("items");

    store.insertAll("items", List.of(Map.of("id", 2L), Map.of("id", 3L)));
    store.insertAll("items", List.of());

    assertEquals(1, before.size());
    assertEquals(3, store.rows("items").size());
    assertThrows(UnsupportedOperationException.class, () -> store.rows("items").add(Map.of()));
  }

  @Test
  void insertedRowsAreCopies() {
    InMemoryStore store = new InMemoryStore();
    Map<String, Object> row = new HashMap<>(Map.of("id", 1L));
    store.insertAll("items", List.of(row));
    row.put("id", 99L);

    assertEquals(1L, store.rows("items").get(0).get("id"));
    assertEquals(1, store.deleteByKey("items", "id", 1L));
    assertTrue(store.rows("items").isEmpty());
  }
}

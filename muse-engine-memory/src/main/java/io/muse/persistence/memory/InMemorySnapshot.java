package io.muse.persistence.memory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Read session of the in-memory engine: the first read of a source pins its rows for the request. */
final class InMemorySnapshot {
  private final InMemoryStore store;
  private final Map<String, List<Map<String, Object>>> pinned = new HashMap<>();

  InMemorySnapshot(InMemoryStore store) {
    this.store = store;
  }

  List<Map<String, Object>> rows(String source) {
    return pinned.computeIfAbsent(source, store::rows);
  }
}

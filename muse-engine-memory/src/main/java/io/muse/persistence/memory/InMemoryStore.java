package io.muse.persistence.memory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Thread-safe row store keyed by collection source. Rows are maps keyed by property name.
 *
 * <p>Writers replace the per-source row list atomically, so a reader holding a {@link #rows} result
 * keeps a consistent view while other threads mutate the store.
 */
public final class InMemoryStore {
  private final ConcurrentHashMap<String, List<Map<String, Object>>> sources = new ConcurrentHashMap<>();

  /** Immutable view of the current rows of {@code source}. */
  public List<Map<String, Object>> rows(String source) {
    return sources.getOrDefault(source, List.of());
  }

  public void insert(String source, Map<String, Object> row) {
    Map<String, Object> copy = Collections.unmodifiableMap(new LinkedHashMap<>(row));
    sources.compute(source, (k, cur) -> {
      List<Map<String, Object>> next = new ArrayList<>(cur == null ? List.of() : cur);
      next.add(copy);
      return Collections.unmodifiableList(next);
    });
  }

  /** Appends all rows in one swap; readers see either none or all of them. */
  public void insertAll(String source, Collection<? extends Map<String, Object>> rows) {
    if (rows.isEmpty()) return;
    List<Map<String, Object>> copies = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
    sources.compute(source, (k, cur) -> {
      List<Map<String, Object>> next = new ArrayList<>((cur == null ? 0 : cur.size()) + copies.size());
      if (cur != null) next.addAll(cur);
      next.addAll(copies);
      return Collections.unmodifiableList(next);
    });
  }

  /** Removes rows matching {@code predicate}; returns how many were removed. */
  public int delete(String source, Predicate<Map<String, Object>> predicate) {
    int[] removed = {0};
    sources.computeIfPresent(source, (k, cur) -> {
      List<Map<String, Object>> next = new ArrayList<>(cur.size());
      for (Map<String, Object> r : cur) {
        if (predicate.test(r)) removed[0]++;
        else next.add(r);
      }
      return Collections.unmodifiableList(next);
    });
    return removed[0];
  }

  public int deleteByKey(String source, String keyProperty, Object key) {
    return delete(source, r -> Objects.equals(r.get(keyProperty), key));
  }

  public void clear(String source) {
    sources.remove(source);
  }
}

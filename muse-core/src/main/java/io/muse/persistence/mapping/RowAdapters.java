package io.muse.persistence.mapping;

import java.util.*;

public final class RowAdapters {
  private RowAdapters() {}

  /** Wraps a row keyed by property. */
  public static RowAdapter fromMap(Map<String, Object> map) {
    return new MapRowAdapter(map);
  }

  /**
   * Wraps a row keyed by physical column (or document path), translating property names through
   * {@code propertyToColumn}. Dotted paths descend into nested maps.
   */
  public static RowAdapter mapped(Map<String, Object> row, Map<String, String> propertyToColumn) {
    return new MappedRowAdapter(row, propertyToColumn);
  }

  static Object getByPath(Map<String, Object> root, String path) {
    if (path == null || path.isBlank()) return root;
    if (root.containsKey(path)) return root.get(path);
    Object cur = root;
    for (String p : path.split("\\.")) {
      if (!(cur instanceof Map<?, ?> m)) return null;
      cur = m.get(p);
    }
    return cur;
  }

  static final class MapRowAdapter implements RowAdapter {
    private final Map<String, Object> root;

    MapRowAdapter(Map<String, Object> root) {
      this.root = Objects.requireNonNull(root, "row");
    }

    @Override public boolean isNull(String property) { return raw(property) == null; }
    @Override public Object raw(String property) { return getByPath(root, property); }

    @Override
    public Map<String, Object> asMap() {
      return Collections.unmodifiableMap(root);
    }
  }

  static final class MappedRowAdapter implements RowAdapter {
    private final Map<String, Object> row;
    private final Map<String, String> map;

    MappedRowAdapter(Map<String, Object> row, Map<String, String> map) {
      this.row = Objects.requireNonNull(row, "row");
      this.map = Objects.requireNonNull(map, "propertyToColumn");
    }

    private String x(String property) {
      String m = map.get(property);
      return m != null ? m : property;
    }

    @Override public boolean isNull(String property) { return raw(property) == null; }
    @Override public Object raw(String property) { return getByPath(row, x(property)); }

    @Override
    public Map<String, Object> asMap() {
      Map<String, Object> out = new LinkedHashMap<>();
      for (String p : map.keySet()) out.put(p, raw(p));
      return out;
    }
  }
}

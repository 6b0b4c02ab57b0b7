package io.muse.persistence.mapping;

import java.util.Map;

/** Backend-neutral view of one fetched row, addressed by collection property. */
public interface RowAdapter {
  boolean isNull(String property);
  Object raw(String property);

  default String string(String property) {
    Object v = raw(property);
    return v == null ? null : String.valueOf(v);
  }

  default Long longValue(String property) {
    Object v = raw(property);
    if (v == null) return null;
    if (v instanceof Number n) return n.longValue();
    return Long.valueOf(String.valueOf(v));
  }

  default Boolean bool(String property) {
    Object v = raw(property);
    if (v == null) return null;
    if (v instanceof Boolean b) return b;
    return Boolean.valueOf(String.valueOf(v));
  }

  /** All properties of the row in collection declaration order. */
  Map<String, Object> asMap();
}

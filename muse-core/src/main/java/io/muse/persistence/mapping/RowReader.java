package io.muse.persistence.mapping;

import java.util.Map;

/** Maps a fetched row to a caller type. */
@FunctionalInterface
public interface RowReader<T> {
  T read(RowAdapter row);

  static RowReader<Map<String, Object>> asMap() {
    return RowAdapter::asMap;
  }
}

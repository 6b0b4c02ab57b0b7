package io.muse.persistence.jdbc;

import io.muse.persistence.mapping.RowAdapter;

import java.sql.*;
import java.util.*;

/** Current row of a page select, whose column labels are collection property names. */
public final class JdbcRowAdapter implements RowAdapter {
  private final ResultSet rs;
  private Map<String, Integer> colIndex;

  public JdbcRowAdapter(ResultSet rs) {
    this.rs = rs;
  }

  @Override public boolean isNull(String property) { return raw(property) == null; }

  @Override
  public Object raw(String property) {
    try {
      return normalize(rs.getObject(indexOf(property)));
    } catch (SQLException e) {
      throw new RuntimeException("muse.jdbc failed to read column '" + property + "'", e);
    }
  }

  @Override
  public Map<String, Object> asMap() {
    try {
      Map<String, Object> out = new LinkedHashMap<>();
      for (var e : columns().entrySet()) out.put(e.getKey(), normalize(rs.getObject(e.getValue())));
      return out;
    } catch (SQLException e) {
      throw new RuntimeException("muse.jdbc failed to read row", e);
    }
  }

  private static Object normalize(Object v) {
    if (v instanceof Timestamp ts) return ts.toInstant();
    return v;
  }

  private Map<String, Integer> columns() throws SQLException {
    if (colIndex == null) {
      colIndex = new LinkedHashMap<>();
      ResultSetMetaData md = rs.getMetaData();
      for (int i = 1; i <= md.getColumnCount(); i++) {
        colIndex.put(md.getColumnLabel(i), i);
      }
    }
    return colIndex;
  }

  private int indexOf(String label) throws SQLException {
    Integer i = columns().get(label);
    if (i == null) throw new IllegalArgumentException("Unknown column label: " + label);
    return i;
  }
}

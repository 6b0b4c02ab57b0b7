package io.muse.persistence.collection;

import java.util.*;

/**
 * Per-collection pagination configuration: where the rows live, which property identifies a row,
 * and which properties may be sorted on.
 *
 * <p>Built once at registration time. The key property doubles as the cursor column and as the
 * tie-break that makes every sort order total.
 */
public record CollectionDefinition(
    String name,
    String source,
    String key,
    Map<String, FieldDef> fields,
    String defaultSort
) {
  public CollectionDefinition {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    if (source == null || source.isBlank()) throw new IllegalArgumentException("source is required for collection: " + name);
    fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    if (key == null || key.isBlank() || !fields.containsKey(key)) {
      throw new IllegalArgumentException("Could not identify sort columns for collection '" + name
          + "': key property '" + key + "' is not a declared field");
    }
    defaultSort = (defaultSort == null || defaultSort.isBlank()) ? null : defaultSort.trim();
    if (defaultSort != null) {
      String col = defaultSort.replaceFirst("^[+-]", "").trim();
      FieldDef f = fields.get(col);
      if (col.isEmpty()) {
        defaultSort = null;
      } else if (!col.equals(key) && (f == null || !f.sortable())) {
        throw new IllegalArgumentException("defaultSort '" + defaultSort + "' is not a sortable property of collection: " + name);
      }
    }
  }

  public boolean hasField(String property) {
    return fields.containsKey(property);
  }

  public FieldDef field(String property) {
    FieldDef f = fields.get(property);
    if (f == null) throw new IllegalArgumentException("Unknown property '" + property + "' in collection: " + name);
    return f;
  }

  public FieldDef keyField() {
    return fields.get(key);
  }

  /** Properties callers may sort on; always contains the key. */
  public Set<String> sortableColumns() {
    Set<String> out = new LinkedHashSet<>();
    for (var e : fields.entrySet()) {
      if (e.getValue().sortable()) out.add(e.getKey());
    }
    out.add(key);
    return Collections.unmodifiableSet(out);
  }

  /** Coerces a raw cursor (usually a query-parameter string) to the key's type. */
  public Object coerceKey(Object raw) {
    return keyField().type().coerce(raw);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static final class Builder {
    private final String name;
    private String source;
    private String key;
    private String defaultSort;
    private final Map<String, FieldDef> fields = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder source(String source) { this.source = source; return this; }
    public Builder key(String key) { this.key = key; return this; }
    public Builder defaultSort(String defaultSort) { this.defaultSort = defaultSort; return this; }
    public Builder field(String property, FieldDef def) { fields.put(property, def); return this; }

    public Builder key(String property, String column, FieldType type) {
      this.key = property;
      return field(property, FieldDef.of(column, type));
    }

    public CollectionDefinition build() {
      return new CollectionDefinition(name, source, key, fields, defaultSort);
    }
  }
}

package io.muse.persistence.collection;

import java.util.Locale;

/**
 * One property of a collection.
 *
 * @param column physical column (JDBC) or document path (Mongo)
 * @param type scalar type, used to coerce cursors and filter values
 * @param sortable whether callers may sort on this property
 * @param collation optional BCP-47 locale tag for locale-aware string ordering
 */
public record FieldDef(String column, FieldType type, boolean sortable, String collation) {
  public FieldDef {
    if (column == null || column.isBlank()) throw new IllegalArgumentException("column is required");
    type = type == null ? FieldType.STRING : type;
    collation = (collation == null || collation.isBlank()) ? null : collation.trim();
  }

  public static FieldDef of(String column, FieldType type) {
    return new FieldDef(column, type, false, null);
  }

  public static FieldDef sortable(String column, FieldType type) {
    return new FieldDef(column, type, true, null);
  }

  public FieldDef withCollation(String tag) {
    return new FieldDef(column, type, sortable, tag);
  }

  public Locale collationLocale() {
    return collation == null ? null : Locale.forLanguageTag(collation);
  }
}

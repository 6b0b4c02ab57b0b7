package io.muse.persistence.memory;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.query.SortField;

import java.text.Collator;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/** Row comparators for sort fields. Nulls sort after all values (like Postgres). */
final class RowOrdering {
  private RowOrdering() {}

  static Comparator<Map<String, Object>> of(CollectionDefinition c, List<SortField> sort) {
    Comparator<Map<String, Object>> out = (a, b) -> 0;
    if (sort == null) return out;
    for (SortField sf : sort) {
      out = out.thenComparing(field(c.field(sf.field()), sf));
    }
    return out;
  }

  private static Comparator<Map<String, Object>> field(FieldDef def, SortField sf) {
    Collator collator = null;
    if (def.collationLocale() != null) {
      collator = Collator.getInstance(def.collationLocale());
      collator.setStrength(Collator.TERTIARY);
    }
    Comparator<Object> values = nullsGreatest(collator);
    if (sf.direction() == SortField.Direction.DESC) values = values.reversed();
    String p = sf.field();
    Comparator<Object> v = values;
    return (a, b) -> v.compare(a.get(p), b.get(p));
  }

  private static Comparator<Object> nullsGreatest(Collator collator) {
    return (a, b) -> {
      if (a == null) return b == null ? 0 : 1;
      if (b == null) return -1;
      return Values.compare(a, b, collator);
    };
  }
}

package io.muse.persistence.pagination;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.query.SortField;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a {@code [+|-]column} sort string against a collection's sortable properties.
 *
 * <p>An empty column falls back to the collection's default sort, then to the key ascending. The key
 * is appended as ascending tie-break so the resulting order is total.
 */
public final class SortResolver {
  private SortResolver() {}

  public static ResolvedSort resolve(CollectionDefinition def, String sort) {
    String s = sort == null ? "" : sort.trim();
    SortField.Direction dir = SortField.Direction.ASC;
    if (s.startsWith("-")) {
      dir = SortField.Direction.DESC;
      s = s.substring(1);
    } else if (s.startsWith("+")) {
      s = s.substring(1);
    }
    s = s.trim();

    if (s.isEmpty()) {
      if (def.defaultSort() != null) return resolve(def, def.defaultSort());
      s = def.key();
      dir = SortField.Direction.ASC;
    }

    if (!def.sortableColumns().contains(s)) {
      throw new UnknownSortColumnException(def.name(), s);
    }

    SortField primary = new SortField(s, dir);
    List<SortField> order = new ArrayList<>(2);
    order.add(primary);
    if (!s.equals(def.key())) order.add(SortField.asc(def.key()));
    return new ResolvedSort(primary, order);
  }
}

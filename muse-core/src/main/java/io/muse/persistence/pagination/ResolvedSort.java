package io.muse.persistence.pagination;

import io.muse.persistence.query.SortField;

import java.util.List;

/**
 * Effective sort order of a pagination request.
 *
 * @param primary the requested (or default) sort field
 * @param order full order: {@code primary} followed by the key as ascending tie-break
 */
public record ResolvedSort(SortField primary, List<SortField> order) {
  public ResolvedSort {
    if (primary == null) throw new IllegalArgumentException("primary is required");
    order = List.copyOf(order);
    if (order.isEmpty() || !order.get(0).equals(primary)) {
      throw new IllegalArgumentException("order must start with the primary sort field");
    }
  }

  /** The {@code [-]column} form echoed back in page links. */
  public String sortString() {
    return primary.toSortString();
  }
}

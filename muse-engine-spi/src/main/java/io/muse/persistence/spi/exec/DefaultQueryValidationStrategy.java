package io.muse.persistence.spi.exec;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.pagination.UnknownSortColumnException;
import io.muse.persistence.query.*;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Default, backend-agnostic query validation.
 *
 * Validates:
 * - filter Condition properties against the collection's fields
 * - IN/NIN values are collections, RANGE has both bounds
 * - sort fields against the collection's sortable columns
 *
 * Failures throw {@link QueryValidationException}.
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validate(CollectionDefinition collection, Query effectiveQuery, QueryElement filter) {
    Objects.requireNonNull(collection, "collection");

    validateElement(collection, filter);

    if (effectiveQuery != null) {
      validateSort(collection, effectiveQuery.sort());
    }
  }

  private static void validateSort(CollectionDefinition c, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return;
    for (SortField sf : sort) {
      if (sf == null) continue;
      if (!c.sortableColumns().contains(sf.field())) throw new UnknownSortColumnException(c.name(), sf.field());
    }
  }

  private static void validateElement(CollectionDefinition c, QueryElement el) {
    if (el == null) return;

    if (el instanceof Query q) {
      validateElement(c, q.filter());
      return;
    }
    if (el instanceof NotElement n) {
      validateElement(c, n.element());
      return;
    }
    if (el instanceof LogicalGroup g) {
      for (QueryElement child : g.elements()) validateElement(c, child);
      return;
    }
    if (el instanceof Condition cond) {
      validateCondition(c, cond);
      return;
    }

    throw new QueryValidationException("Unsupported QueryElement: " + el.getClass().getName());
  }

  private static void validateCondition(CollectionDefinition c, Condition cond) {
    String p = cond.property();
    if (p == null || p.isBlank()) {
      throw new QueryValidationException("Blank property in filter for collection '" + c.name() + "'");
    }
    if (!c.hasField(p)) {
      throw new QueryValidationException("Unknown property '" + p + "' in filter for collection '" + c.name() + "'");
    }
    switch (cond.operator()) {
      case IN, NIN -> {
        if (!(cond.value() instanceof Collection<?>)) {
          throw new QueryValidationException(cond.operator() + " on '" + p + "' requires a collection of values");
        }
      }
      case RANGE -> {
        if (cond.lower() == null || cond.upper() == null) {
          throw new QueryValidationException("RANGE on '" + p + "' requires non-null lower+upper");
        }
      }
      case LIKE -> {
        if (!(cond.value() instanceof String)) {
          throw new QueryValidationException("LIKE on '" + p + "' requires a string pattern");
        }
      }
      default -> { }
    }
  }
}

package io.muse.persistence.spi.exec;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.query.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Rewrites a validated filter so every condition value has its field's Java type (query parameters
 * and JSON arrive as strings and ints). LIKE patterns stay strings.
 */
public final class FilterNormalizer implements QueryVisitor<QueryElement> {
  private final CollectionDefinition collection;

  private FilterNormalizer(CollectionDefinition collection) {
    this.collection = collection;
  }

  public static QueryElement normalize(CollectionDefinition collection, QueryElement filter) {
    if (filter == null) return null;
    if (filter instanceof Query q) return normalize(collection, q.filter());
    return filter.accept(new FilterNormalizer(collection));
  }

  @Override
  public QueryElement visit(Condition c) {
    FieldDef f = collection.field(c.property());
    try {
      return switch (c.operator()) {
        case LIKE -> c;
        case RANGE -> c.withValues(null, f.type().coerce(c.lower()), f.type().coerce(c.upper()));
        case IN, NIN -> c.withValues(coerceAll(f, (Collection<?>) c.value()), null, null);
        default -> c.withValues(f.type().coerce(c.value()), null, null);
      };
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Invalid value for '" + c.property() + "' in collection '"
          + collection.name() + "': " + e.getMessage(), e);
    }
  }

  @Override
  public QueryElement visit(LogicalGroup g) {
    List<QueryElement> out = new ArrayList<>(g.elements().size());
    for (QueryElement e : g.elements()) out.add(e.accept(this));
    return new LogicalGroup(g.clause(), out);
  }

  @Override
  public QueryElement visit(NotElement n) {
    return new NotElement(n.element().accept(this));
  }

  private static List<Object> coerceAll(FieldDef f, Collection<?> values) {
    List<Object> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(f.type().coerce(v));
    return out;
  }
}

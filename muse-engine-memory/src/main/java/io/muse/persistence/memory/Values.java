package io.muse.persistence.memory;

import java.math.BigDecimal;
import java.text.Collator;

/** Value comparison shared by filters and sorting. */
final class Values {
  private Values() {}

  /**
   * Compares two non-null values. Numbers of different classes compare numerically; strings use
   * {@code collator} when given.
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  static int compare(Object a, Object b, Collator collator) {
    if (a instanceof Number x && b instanceof Number y && x.getClass() != y.getClass()) {
      return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString()));
    }
    if (collator != null && a instanceof String x && b instanceof String y) {
      return collator.compare(x, y);
    }
    if (a instanceof Comparable ca && a.getClass().isInstance(b)) {
      return ca.compareTo(b);
    }
    throw new IllegalArgumentException("Cannot compare " + a.getClass().getName() + " with " + b.getClass().getName());
  }

  static boolean equal(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) return compare(a, b, null) == 0;
    return a.equals(b);
  }
}

package io.muse.persistence.query;

import java.util.Objects;

/**
 * A single predicate on one collection property. RANGE uses {@code lower}/{@code upper} (inclusive),
 * IN/NIN take a collection as {@code value}, every other operator a scalar. An EQ/NE against
 * {@code null} tests for an unset property.
 */
public record Condition(String property, Operator operator, Object value, Object lower, Object upper, boolean not)
    implements QueryElement {
  public Condition {
    Objects.requireNonNull(property, "property");
    Objects.requireNonNull(operator, "operator");
  }

  public static Condition of(String property, Operator operator, Object value) {
    return new Condition(property, operator, value, null, null, false);
  }

  public static Condition range(String property, Object lower, Object upper) {
    return new Condition(property, Operator.RANGE, null, lower, upper, false);
  }

  /** Copy with replaced operands; property, operator and negation are kept. */
  public Condition withValues(Object value, Object lower, Object upper) {
    return new Condition(property, operator, value, lower, upper, not);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }
}

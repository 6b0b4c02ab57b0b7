package io.muse.persistence.memory;

import io.muse.persistence.query.*;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Compiles a filter into a row predicate with SQL three-valued logic: a comparison against a null
 * property is unknown, unknown propagates through NOT/AND/OR, and only rows evaluating to true match.
 */
final class FilterEvaluator implements QueryVisitor<Function<Map<String, Object>, Boolean>> {
  private static final FilterEvaluator INSTANCE = new FilterEvaluator();

  private FilterEvaluator() {}

  static Predicate<Map<String, Object>> compile(QueryElement filter) {
    if (filter == null) return r -> true;
    Function<Map<String, Object>, Boolean> f = filter.accept(INSTANCE);
    return r -> Boolean.TRUE.equals(f.apply(r));
  }

  @Override
  public Function<Map<String, Object>, Boolean> visit(LogicalGroup g) {
    var parts = g.elements().stream().map(e -> e.accept(this)).toList();
    boolean or = g.clause() == Clause.OR;
    return r -> {
      boolean unknown = false;
      for (var p : parts) {
        Boolean v = p.apply(r);
        if (v == null) unknown = true;
        else if (v == or) return or;
      }
      return unknown ? null : !or;
    };
  }

  @Override
  public Function<Map<String, Object>, Boolean> visit(NotElement n) {
    var inner = n.element().accept(this);
    return r -> not(inner.apply(r));
  }

  @Override
  public Function<Map<String, Object>, Boolean> visit(Condition c) {
    String p = c.property();
    Function<Map<String, Object>, Boolean> positive = switch (c.operator()) {
      case EQ -> c.value() == null
          ? r -> r.get(p) == null
          : r -> cmp(r.get(p), v -> Values.equal(v, c.value()));
      case NE -> c.value() == null
          ? r -> r.get(p) != null
          : r -> cmp(r.get(p), v -> !Values.equal(v, c.value()));
      case GT -> r -> cmp(r.get(p), v -> Values.compare(v, c.value(), null) > 0);
      case GE -> r -> cmp(r.get(p), v -> Values.compare(v, c.value(), null) >= 0);
      case LT -> r -> cmp(r.get(p), v -> Values.compare(v, c.value(), null) < 0);
      case LE -> r -> cmp(r.get(p), v -> Values.compare(v, c.value(), null) <= 0);
      case IN, NIN -> {
        Collection<?> values = (Collection<?>) c.value();
        boolean in = c.operator() == Operator.IN;
        // an empty list is decided without looking at the row, as in SQL rendering
        if (values.isEmpty()) yield r -> !in;
        yield r -> cmp(r.get(p), v -> contains(values, v) == in);
      }
      case RANGE -> r -> cmp(r.get(p),
          v -> Values.compare(v, c.lower(), null) >= 0 && Values.compare(v, c.upper(), null) <= 0);
      case LIKE -> {
        Pattern re = likeToRegex(String.valueOf(c.value()));
        yield r -> cmp(r.get(p), v -> re.matcher(String.valueOf(v)).matches());
      }
    };
    return c.not() ? r -> not(positive.apply(r)) : positive;
  }

  private static Boolean cmp(Object value, Predicate<Object> test) {
    return value == null ? null : test.test(value);
  }

  private static Boolean not(Boolean b) {
    return b == null ? null : !b;
  }

  private static boolean contains(Collection<?> values, Object v) {
    for (Object x : values) {
      if (x != null && Values.equal(v, x)) return true;
    }
    return false;
  }

  /** SQL LIKE: '%' any run, '_' any single character. */
  static Pattern likeToRegex(String like) {
    StringBuilder re = new StringBuilder();
    for (int i = 0; i < like.length(); i++) {
      char ch = like.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append('.');
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    return Pattern.compile(re.toString(), Pattern.DOTALL);
  }
}

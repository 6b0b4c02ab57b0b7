package io.muse.persistence.mongo;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.query.*;
import org.bson.Document;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders filters ({@link QueryElement}) to MongoDB BSON ({@link Document}), applying De Morgan for
 * NOT groups and rewriting EQ/NE null to IS NULL/IS NOT NULL semantics.
 *
 * A comparison against a null or missing field never matches, negated or not, so results agree with
 * SQL three-valued logic: negations render as {@code $nor} of the comparison and the null test.
 */
final class MongoQueryRenderer {
  static final Document TRUE = new Document("$expr", true);
  static final Document FALSE = new Document("$expr", false);

  private MongoQueryRenderer() {}

  static Document toBson(CollectionDefinition c, QueryElement filter) {
    if (filter == null) return new Document();
    return render(c, filter, false);
  }

  private static Document render(CollectionDefinition c, QueryElement el, boolean negate) {
    if (el instanceof NotElement n) {
      return render(c, n.element(), !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause() == null ? Clause.AND : g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      if (g.elements().isEmpty()) return clause == Clause.OR ? FALSE : TRUE;

      List<Document> parts = new ArrayList<>();
      for (QueryElement child : g.elements()) parts.add(render(c, child, negate));
      if (parts.size() == 1) return parts.get(0);
      return new Document((clause == Clause.OR) ? "$or" : "$and", parts);
    }

    if (!(el instanceof Condition cond)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }
    if (!c.hasField(cond.property())) {
      throw new QueryValidationException("Unknown field '" + cond.property() + "' in collection '" + c.name() + "'");
    }

    String path = c.field(cond.property()).column();
    boolean not = cond.not() ^ negate;
    Object value = cond.value();

    if ((cond.operator() == Operator.EQ || cond.operator() == Operator.NE) && value == null) {
      boolean isNull = (cond.operator() == Operator.EQ) ^ not;
      return isNull ? new Document(path, null) : new Document(path, new Document("$ne", null));
    }
    if (cond.operator() == Operator.IN || cond.operator() == Operator.NIN) {
      List<Object> vals = toList(value);
      if (vals.isEmpty()) {
        // IN [] is false, NIN [] is true
        boolean result = (cond.operator() == Operator.NIN) ^ not;
        return result ? TRUE : FALSE;
      }
    }

    Document positive = switch (cond.operator()) {
      case EQ -> new Document(path, value);
      case NE -> new Document(path, new Document("$nin", Arrays.asList(value, null)));
      case GT -> new Document(path, new Document("$gt", requireNonNull(cond.operator(), value)));
      case GE -> new Document(path, new Document("$gte", requireNonNull(cond.operator(), value)));
      case LT -> new Document(path, new Document("$lt", requireNonNull(cond.operator(), value)));
      case LE -> new Document(path, new Document("$lte", requireNonNull(cond.operator(), value)));
      case IN -> new Document(path, new Document("$in", toList(value)));
      case NIN -> {
        List<Object> vals = new ArrayList<>(toList(value));
        vals.add(null);
        yield new Document(path, new Document("$nin", vals));
      }
      case RANGE -> new Document(path,
          new Document("$gte", requireNonNull("RANGE.lower", cond.lower()))
              .append("$lte", requireNonNull("RANGE.upper", cond.upper())));
      case LIKE -> likePositive(path, String.valueOf(requireNonNull(cond.operator(), value)));
    };

    return not ? new Document("$nor", List.of(positive, new Document(path, null))) : positive;
  }

  private static Object requireNonNull(Object op, Object v) {
    if (v == null) throw new IllegalArgumentException(op + " requires non-null value");
    return v;
  }

  private static Document likePositive(String path, String likePattern) {
    // Translate SQL LIKE to regex. '%' -> '.*', '_' -> '.'
    StringBuilder re = new StringBuilder();
    re.append("^");
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append(".");
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    re.append("$");
    return new Document(path, new Document("$regex", re.toString()).append("$options", "s"));
  }

  @SuppressWarnings("unchecked")
  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof List<?> l) return (List<Object>) l;
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}

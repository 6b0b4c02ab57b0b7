package io.muse.persistence.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link Query}. */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  private static final int DEFAULT_LIMIT = 25;

  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query JSON must be an object");

    Query q = new Query();

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q.withFilter(parseElement(filter, codec));
    }

    JsonNode page = root.get("page");
    if (page != null && page.isObject()) {
      long offset = longOrDefault(page.get("offset"), 0L);
      int limit = (int) longOrDefault(page.get("limit"), DEFAULT_LIMIT);
      q.withPage(new OffsetPage(offset, limit));
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        String dir = textOrNull(s.get("dir"));
        if (f == null) continue;
        SortField.Direction d = (dir == null)
            ? SortField.Direction.ASC
            : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        fields.add(new SortField(f, d));
      }
      q.withSort(fields);
    }

    return q;
  }

  private static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;

    // { "and": [ ... ] } / { "or": [ ... ] }
    if (n.isObject() && n.has("and")) {
      return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    }
    if (n.isObject() && n.has("or")) {
      return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));
    }

    // { "not": <element> }
    if (n.isObject() && n.has("not")) {
      QueryElement child = parseElement(n.get("not"), codec);
      if (child == null) return null;
      return new NotElement(child);
    }

    // { "eq": { field:..., value:..., not?:... } }
    if (n.isObject()) {
      Iterator<String> it = n.fieldNames();
      while (it.hasNext()) {
        String k = it.next();
        Operator op = tryOp(k);
        if (op == null) continue;
        JsonNode body = n.get(k);
        if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
        return parseCondition(op, body, codec);
      }
    }

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static QueryElement parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new IllegalArgumentException(op + " requires field");
    boolean not = boolOrDefault(body.get("not"), false);

    if (op == Operator.RANGE) {
      Object lower = decodeValue(body.get("lower"), codec);
      Object upper = decodeValue(body.get("upper"), codec);
      return new Condition(field, op, null, lower, upper, not);
    }

    String valueKey = (op == Operator.IN || op == Operator.NIN) ? "values" : "value";
    return new Condition(field, op, decodeValue(body.get(valueKey), codec), null, null, not);
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static Operator tryOp(String key) {
    if (key == null) return null;
    try {
      return Operator.valueOf(key.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static long longOrDefault(JsonNode n, long def) {
    if (n == null || n.isNull()) return def;
    return n.isNumber() ? n.longValue() : Long.parseLong(n.asText());
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}

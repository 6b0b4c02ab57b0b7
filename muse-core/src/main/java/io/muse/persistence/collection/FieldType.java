package io.muse.persistence.collection;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/** Scalar types a collection field may declare. */
public enum FieldType {
  STRING,
  INT,
  LONG,
  BOOLEAN,
  UUID,
  INSTANT,
  DECIMAL;

  public static FieldType parse(String s) {
    if (s == null || s.isBlank()) return STRING;
    try {
      return FieldType.valueOf(s.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown field type: " + s, e);
    }
  }

  /**
   * Converts a raw value (typically the string form of a cursor or a filter value from a query
   * parameter) to this type's Java representation. Values already of the right type pass through.
   */
  public Object coerce(Object raw) {
    if (raw == null) return null;
    try {
      return switch (this) {
        case STRING -> raw instanceof String s ? s : String.valueOf(raw);
        case INT -> raw instanceof Number n ? Integer.valueOf(Math.toIntExact(exactLong(n))) : Integer.valueOf(raw.toString().trim());
        case LONG -> raw instanceof Number n ? Long.valueOf(exactLong(n)) : Long.valueOf(raw.toString().trim());
        case BOOLEAN -> raw instanceof Boolean b ? b : parseBoolean(raw.toString());
        case UUID -> raw instanceof java.util.UUID u ? u : java.util.UUID.fromString(raw.toString().trim());
        case INSTANT -> raw instanceof Instant i ? i : Instant.parse(raw.toString().trim());
        case DECIMAL -> raw instanceof BigDecimal d ? d : new BigDecimal(raw.toString().trim());
      };
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Not a " + name().toLowerCase(Locale.ROOT) + " value: " + raw, e);
    }
  }

  /** Fractional or out-of-range numbers are rejected, never truncated. */
  private static long exactLong(Number n) {
    if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) return n.longValue();
    return new BigDecimal(n.toString()).longValueExact();
  }

  private static Boolean parseBoolean(String s) {
    String v = s.trim().toLowerCase(Locale.ROOT);
    if (v.equals("true") || v.equals("1")) return Boolean.TRUE;
    if (v.equals("false") || v.equals("0")) return Boolean.FALSE;
    throw new IllegalArgumentException(s);
  }
}

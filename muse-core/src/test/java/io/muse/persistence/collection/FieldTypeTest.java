package io.muse.persistence.collection;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

final class FieldTypeTest {
  @Test
  void wholeNumbersConvertAcrossNumericClasses() {
    assertEquals(7, FieldType.INT.coerce(7L));
    assertEquals(7, FieldType.INT.coerce(7.0d));
    assertEquals(7L, FieldType.LONG.coerce(new BigDecimal("7.00")));
    assertEquals(Long.MAX_VALUE, FieldType.LONG.coerce(BigInteger.valueOf(Long.MAX_VALUE)));
    assertEquals(42L, FieldType.LONG.coerce(" 42 "));
  }

  @Test
  void fractionalNumbersAreNotTruncated() {
    assertThrows(IllegalArgumentException.class, () -> FieldType.INT.coerce(2.5d));
    assertThrows(IllegalArgumentException.class, () -> FieldType.LONG.coerce(2.5f));
    assertThrows(IllegalArgumentException.class, () -> FieldType.LONG.coerce(new BigDecimal("1.1")));
    assertThrows(IllegalArgumentException.class, () -> FieldType.LONG.coerce(Double.NaN));
  }

  @Test
  void outOfRangeNumbersAreNotWrapped() {
    assertThrows(IllegalArgumentException.class, () -> FieldType.INT.coerce(4_294_967_298L));
    assertThrows(IllegalArgumentException.class, () -> FieldType.INT.coerce((long) Integer.MAX_VALUE + 1));
    assertThrows(IllegalArgumentException.class,
        () -> FieldType.LONG.coerce(BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE)));
    assertThrows(IllegalArgumentException.class, () -> FieldType.LONG.coerce(1e20));
  }
}

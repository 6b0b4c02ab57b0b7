package io.muse.persistence.spi.sql;

/** Backend-native statement produced by a {@link Dialect}. */
public interface NativeStatement {
  StatementKind kind();
}

package io.muse.persistence.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  RANGE,
  /** SQL LIKE semantics: '%' matches any run, '_' a single character. */
  LIKE
}

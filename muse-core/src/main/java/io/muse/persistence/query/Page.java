package io.muse.persistence.query;

/** Row window applied after filter and sort. */
public interface Page {
  int limit();
}

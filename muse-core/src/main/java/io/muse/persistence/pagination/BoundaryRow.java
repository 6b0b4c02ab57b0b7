package io.muse.persistence.pagination;

/**
 * A row sitting on a page boundary under the current alignment.
 *
 * @param key value of the collection's key property
 * @param rowNumber 1-based rank in the filtered, sorted collection
 */
public record BoundaryRow(Object key, long rowNumber) {}

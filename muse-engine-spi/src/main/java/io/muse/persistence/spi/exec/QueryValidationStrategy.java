package io.muse.persistence.spi.exec;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.query.Query;
import io.muse.persistence.query.QueryElement;

/**
 * SPI hook to validate queries before statements are rendered.
 * <p>
 * Engines call this with the caller's filter (and, for plain selects, the whole query). Applications
 * may plug in stricter rules.
 */
public interface QueryValidationStrategy {
  void validate(CollectionDefinition collection, Query effectiveQuery, QueryElement filter);
}

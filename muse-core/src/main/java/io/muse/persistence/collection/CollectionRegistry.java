package io.muse.persistence.collection;

import java.util.Collection;

public interface CollectionRegistry {
  /** @throws IllegalArgumentException if no collection is registered under {@code name} */
  CollectionDefinition get(String name);

  Collection<CollectionDefinition> all();
}

package io.muse.persistence.collection;

import java.util.*;

/** Simple in-memory {@link CollectionRegistry}. */
public final class InMemoryCollectionRegistry implements CollectionRegistry {
  private final Map<String, CollectionDefinition> collections = new LinkedHashMap<>();

  public InMemoryCollectionRegistry(List<CollectionDefinition> defs) {
    for (CollectionDefinition d : defs) {
      if (collections.putIfAbsent(d.name(), d) != null) {
        throw new IllegalArgumentException("Duplicate collection: " + d.name());
      }
    }
  }

  @Override
  public CollectionDefinition get(String name) {
    CollectionDefinition d = collections.get(name);
    if (d == null) throw new IllegalArgumentException("Unknown collection: " + name);
    return d;
  }

  @Override
  public Collection<CollectionDefinition> all() {
    return Collections.unmodifiableCollection(collections.values());
  }
}

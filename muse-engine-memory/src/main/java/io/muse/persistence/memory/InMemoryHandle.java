package io.muse.persistence.memory;

import io.muse.persistence.exec.handle.EngineHandle;

import java.util.Objects;

/** In-memory engine handle. */
public final class InMemoryHandle implements EngineHandle<InMemoryStore> {
  private final String id;
  private final InMemoryStore store;

  public InMemoryHandle(String id, InMemoryStore store) {
    this.id = Objects.requireNonNull(id, "id");
    this.store = Objects.requireNonNull(store, "store");
  }

  @Override public String id() { return id; }
  @Override public InMemoryStore client() { return store; }
  @Override public String namespace() { return null; }
}

package io.muse.examples.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.CollectionRegistry;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.memory.InMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fills an {@link InMemoryStore} from a YAML resource of the form
 * {@code collectionName: [ {property: value, ...}, ... ]}. Values are coerced to the declared
 * field types; unknown properties are rejected.
 */
final class SeedDataLoader {
  private static final Logger log = LoggerFactory.getLogger(SeedDataLoader.class);
  private static final TypeReference<Map<String, List<Map<String, Object>>>> SEED_TYPE = new TypeReference<>() {};

  private final CollectionRegistry collections;

  SeedDataLoader(CollectionRegistry collections) {
    this.collections = collections;
  }

  void load(String resource, InMemoryStore store) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = SeedDataLoader.class.getClassLoader();
    Map<String, List<Map<String, Object>>> seed;
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Seed resource not found: " + resource);
      seed = new YAMLMapper().readValue(in, SEED_TYPE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read seed resource: " + resource, e);
    }
    if (seed == null) return;

    for (var e : seed.entrySet()) {
      CollectionDefinition c = collections.get(e.getKey());
      List<Map<String, Object>> rows = e.getValue() == null ? List.of() : e.getValue();
      for (Map<String, Object> raw : rows) store.insert(c.source(), coerce(c, raw));
      log.info("muse.seed collection={} source={} rows={}", c.name(), c.source(), rows.size());
    }
  }

  static Map<String, Object> coerce(CollectionDefinition c, Map<String, Object> raw) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (var f : raw.entrySet()) {
      if (!c.hasField(f.getKey())) {
        throw new IllegalArgumentException("Unknown field '" + f.getKey() + "' in collection '" + c.name() + "'");
      }
      FieldDef def = c.field(f.getKey());
      row.put(f.getKey(), def.type().coerce(f.getValue()));
    }
    return row;
  }
}

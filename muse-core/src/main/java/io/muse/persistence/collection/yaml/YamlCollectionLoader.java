package io.muse.persistence.collection.yaml;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldDef;
import io.muse.persistence.collection.FieldType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Stream;

/**
 * Loads {@link CollectionDefinition}s from YAML. One collection per document:
 *
 * <pre>
 * name: namespace
 * source: namespaces
 * key: id
 * defaultSort: name
 * fields:
 *   id:   { column: namespace_id, type: long }
 *   name: { column: name, type: string, sortable: true, collation: en-US }
 * </pre>
 *
 * A field given as a plain string is shorthand for {@code { column: <string> }}.
 */
public final class YamlCollectionLoader {
  private final ObjectReader reader = new YAMLMapper().readerFor(Map.class);

  public List<CollectionDefinition> loadDir(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) throw new IllegalArgumentException("Not a directory: " + dir);
    List<Path> files;
    try (Stream<Path> s = Files.list(dir)) {
      files = s.filter(p -> {
            String n = p.getFileName().toString();
            return n.endsWith(".yaml") || n.endsWith(".yml");
          })
          .sorted()
          .toList();
    }
    List<CollectionDefinition> out = new ArrayList<>();
    for (Path p : files) {
      try (InputStream in = Files.newInputStream(p)) {
        out.addAll(load(in, p.toString()));
      }
    }
    return out;
  }

  /** Loads a classpath resource, e.g. {@code collections/ontology.yaml}. */
  public List<CollectionDefinition> loadResource(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = YamlCollectionLoader.class.getClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Collection resource not found: " + resource);
      return load(in, resource);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read collection resource: " + resource, e);
    }
  }

  public List<CollectionDefinition> load(InputStream in, String origin) throws IOException {
    List<CollectionDefinition> out = new ArrayList<>();
    try (MappingIterator<Map<String, Object>> docs = reader.readValues(in)) {
      while (docs.hasNext()) {
        Map<String, Object> doc = docs.next();
        if (doc == null || doc.isEmpty()) continue;
        try {
          out.add(parse(doc));
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException(origin + ": " + e.getMessage(), e);
        }
      }
    }
    return out;
  }

  static CollectionDefinition parse(Map<String, Object> doc) {
    String name = str(doc.get("name"));
    CollectionDefinition.Builder b = CollectionDefinition.builder(name)
        .source(str(doc.get("source")))
        .key(str(doc.get("key")))
        .defaultSort(str(doc.get("defaultSort")));

    Object fields = doc.get("fields");
    if (fields != null && !(fields instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("fields must be a map in collection: " + name);
    }
    if (fields instanceof Map<?, ?> fm) {
      for (var e : fm.entrySet()) {
        String prop = String.valueOf(e.getKey());
        b.field(prop, parseField(prop, e.getValue()));
      }
    }
    return b.build();
  }

  private static FieldDef parseField(String prop, Object raw) {
    if (raw == null) return FieldDef.of(prop, FieldType.STRING);
    if (raw instanceof String column) return FieldDef.of(column, FieldType.STRING);
    if (!(raw instanceof Map<?, ?> m)) throw new IllegalArgumentException("Invalid field definition: " + prop);

    String column = str(m.get("column"));
    return new FieldDef(
        column == null ? prop : column,
        FieldType.parse(str(m.get("type"))),
        Boolean.parseBoolean(String.valueOf(m.get("sortable"))),
        str(m.get("collation")));
  }

  private static String str(Object o) {
    return o == null ? null : String.valueOf(o);
  }
}

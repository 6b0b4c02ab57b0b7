package io.muse.persistence.collection.yaml;

import io.muse.persistence.collection.CollectionDefinition;
import io.muse.persistence.collection.FieldType;
import io.muse.persistence.collection.InMemoryCollectionRegistry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class YamlCollectionLoaderTest {
  @Test
  void loadsOneCollectionPerDocument() {
    List<CollectionDefinition> defs = new YamlCollectionLoader().loadResource("collections/test-collections.yaml");
    assertEquals(2, defs.size());

    CollectionDefinition ns = defs.get(0);
    assertEquals("namespace", ns.name());
    assertEquals("id", ns.key());
    assertEquals("name", ns.defaultSort());
    assertEquals(FieldType.LONG, ns.keyField().type());
    assertEquals("en-US", ns.field("name").collation());
    assertEquals("description", ns.field("description").column());
    assertEquals("deleted_on", ns.field("deletedOn").column());
    assertEquals(Set.of("name", "deletedOn", "id"), ns.sortableColumns());
    assertEquals(17L, ns.coerceKey("17"));
  }

  @Test
  void registryLooksUpByName() {
    var registry = new InMemoryCollectionRegistry(new YamlCollectionLoader().loadResource("collections/test-collections.yaml"));
    assertEquals("type", registry.get("ontologyType").source());
    assertThrows(IllegalArgumentException.class, () -> registry.get("taxonomy"));
  }

  @Test
  void missingKeyIsReportedWithOrigin() {
    String yaml = """
        name: broken
        source: broken
        fields:
          name: { column: name, sortable: true }
        """;
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new YamlCollectionLoader().load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline"));
    assertTrue(ex.getMessage().startsWith("inline: "));
    assertTrue(ex.getMessage().contains("Could not identify sort columns"));
  }
}

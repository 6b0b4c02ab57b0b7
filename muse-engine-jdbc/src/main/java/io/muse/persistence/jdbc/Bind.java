package io.muse.persistence.jdbc;

import io.muse.persistence.collection.FieldType;

/** A positional statement parameter and the field type it was coerced to. */
public record Bind(Object value, FieldType type) {}

package io.muse.persistence.exec.handle;

/**
 * Resolved runtime handle for a backend engine family.
 *
 * Example:
 * - JDBC: client() is javax.sql.DataSource, namespace() is schema
 * - Mongo: client() is MongoClient, namespace() is database
 */
public interface EngineHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  /** Native client/handle used by an engine (DataSource, MongoClient, etc.). */
  TClient client();

  /** Namespace (schema/database) for this handle; may be null. */
  String namespace();
}

package io.muse.persistence.mongo;

import com.mongodb.client.model.Collation;
import io.muse.persistence.pagination.PageWindow;
import io.muse.persistence.spi.sql.NativeStatement;
import io.muse.persistence.spi.sql.StatementKind;
import org.bson.Document;

/**
 * Backend-native statement representation for MongoDB.
 *
 * @param filter      documents to read (for cursor lookups: the filter or the cursor document)
 * @param cursorInFilter cursor lookups only: the filter restricted to the cursor document
 * @param keyPath     document path of the collection key
 */
public record MongoStatement(
    StatementKind kind,
    String collection,
    Document filter,
    Document cursorInFilter,
    Document sort,
    Collation collation,
    String keyPath,
    Object cursor,
    PageWindow window,
    Integer skip,
    Integer limit
) implements NativeStatement {
}

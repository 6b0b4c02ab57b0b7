package io.muse.examples.service;

import io.muse.examples.config.MuseProperties;
import io.muse.persistence.exec.PaginationEngine;
import io.muse.persistence.mapping.RowReader;
import io.muse.persistence.pagination.PageResult;
import io.muse.persistence.pagination.PaginationOptions;
import io.muse.persistence.query.QueryElement;
import org.springframework.stereotype.Service;

import java.util.Map;

import static io.muse.persistence.query.QueryFilters.*;

/** Paged reads of namespaces, ontology types and ontology objects. */
@Service
public class OntologyService {
  public static final String NAMESPACE = "namespace";
  public static final String ONTOLOGY_TYPE = "ontologyType";
  public static final String ONTOLOGY_OBJECT = "ontologyObject";

  private final PaginationEngine<?> engine;
  private final MuseProperties.Pagination paging;

  public OntologyService(PaginationEngine<?> engine, MuseProperties props) {
    this.engine = engine;
    this.paging = props.getPagination();
  }

  /**
   * Options for one request: {@code cursor}, {@code item-count} and {@code sort} from the query
   * string, configured defaults otherwise. The item count is capped at the configured maximum.
   */
  public PaginationOptions options(Map<String, String> params) {
    PaginationOptions base = new PaginationOptions(paging.getDefaultItemCount(), null, null, paging.getSurroundingPages());
    PaginationOptions opts = PaginationOptions.fromQueryParams(params, null, base);
    return opts.itemCount() > paging.getMaxItemCount() ? opts.withItemCount(paging.getMaxItemCount()) : opts;
  }

  public PageResult<Map<String, Object>> namespaces(boolean includeDeleted, PaginationOptions options) {
    return engine.page(NAMESPACE, live(includeDeleted), options, RowReader.asMap());
  }

  public PageResult<Map<String, Object>> types(long namespaceId, boolean includeDeleted, PaginationOptions options) {
    requireNamespace(namespaceId);
    QueryElement filter = both(eq("namespaceId", namespaceId), live(includeDeleted));
    return engine.page(ONTOLOGY_TYPE, filter, options, RowReader.asMap());
  }

  public PageResult<Map<String, Object>> objects(long namespaceId, Long typeId, boolean includeDeleted,
                                                 PaginationOptions options) {
    requireNamespace(namespaceId);
    QueryElement filter = eq("namespaceId", namespaceId);
    if (typeId != null) {
      if (engine.count(ONTOLOGY_TYPE, and(eq("id", typeId), eq("namespaceId", namespaceId))) == 0) {
        throw new NotFoundException("Ontology type " + typeId + " not found in namespace " + namespaceId);
      }
      filter = and(filter, eq("typeId", typeId));
    }
    return engine.page(ONTOLOGY_OBJECT, both(filter, live(includeDeleted)), options, RowReader.asMap());
  }

  /** Soft-deleted rows carry a {@code deletedOn} timestamp. */
  private static QueryElement live(boolean includeDeleted) {
    return includeDeleted ? null : isNull("deletedOn");
  }

  private void requireNamespace(long namespaceId) {
    if (engine.count(NAMESPACE, eq("id", namespaceId)) == 0) {
      throw new NotFoundException("Namespace " + namespaceId + " not found");
    }
  }
}

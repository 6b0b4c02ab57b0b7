package io.muse.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

@JsonSerialize(using = QueryJsonSerializer.class)
@JsonDeserialize(using = QueryJsonDeserializer.class)
public final class Query implements QueryElement {
  private QueryElement filter;
  private Page page;
  private List<SortField> sort = new ArrayList<>();

  public Query() {}

  public QueryElement filter() { return filter; }
  public Page page() { return page; }
  public List<SortField> sort() { return sort; }

  public Query withFilter(QueryElement filter) { this.filter = filter; return this; }
  public Query withPage(Page page) { this.page = page; return this; }
  public Query withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }

  /** Shallow copy; filter tree nodes are immutable and shared. */
  public Query copy() {
    return new Query().withFilter(filter).withPage(page).withSort(sort);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) {
    return filter != null ? filter.accept(visitor) : null;
  }

  public static Query of(QueryElement filter) {
    return new Query().withFilter(filter);
  }

  public static Query and(QueryElement... elements) {
    return Query.of(QueryFilters.and(elements));
  }

  public static Query or(QueryElement... elements) {
    return Query.of(QueryFilters.or(elements));
  }
}

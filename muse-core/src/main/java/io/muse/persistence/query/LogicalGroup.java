package io.muse.persistence.query;

import java.util.List;
import java.util.Objects;

/** AND/OR over child elements. An empty AND matches everything, an empty OR nothing. */
public record LogicalGroup(Clause clause, List<QueryElement> elements) implements QueryElement {
  public LogicalGroup {
    Objects.requireNonNull(clause, "clause");
    elements = List.copyOf(elements == null ? List.of() : elements);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }
}

package io.muse.persistence.query;

import java.util.Objects;

public record NotElement(QueryElement element) implements QueryElement {
  public NotElement {
    Objects.requireNonNull(element, "element");
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }
}

package io.muse.examples.web;

import java.util.List;

/**
 * A navigation link.
 *
 * @param rel relation names, e.g. {@code [first, prev, page-1]}
 * @param page target page number
 */
public record ApiLink(String href, List<String> rel, long page) {
  public ApiLink {
    rel = List.copyOf(rel);
  }
}

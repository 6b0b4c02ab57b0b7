package io.muse.examples.web;

import io.muse.persistence.pagination.PageInfo;
import io.muse.persistence.pagination.PageResult;
import io.muse.persistence.pagination.PaginationInfo;
import io.muse.persistence.pagination.PaginationOptions;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds page links for a {@link PaginationInfo}. Each link carries the {@code cursor},
 * {@code item-count} and {@code sort} parameters (plus the caller's extra filter parameters), so
 * following it reproduces that page.
 *
 * <p>{@code first} never carries a cursor. {@code last} is omitted on the last page. {@code prev} and
 * {@code next} are attached to whichever link targets the neighbouring page number.
 */
public final class PageLinks {
  private final UriComponentsBuilder base;
  private final PaginationOptions options;
  private final Map<String, String> extraParams;

  public PageLinks(UriComponentsBuilder base, PaginationOptions options, Map<String, String> extraParams) {
    this.base = base;
    this.options = options;
    this.extraParams = extraParams == null ? Map.of() : extraParams;
  }

  public PageResponse toResponse(PageResult<Map<String, Object>> result) {
    PaginationInfo info = result.info();
    long lastPage = info.lastPage() == null ? info.cursorPage() : info.lastPage().page();
    return new PageResponse(
        self(info),
        links(info),
        info.collectionSize(),
        info.cursorPage(),
        lastPage,
        result.items());
  }

  ApiLink self(PaginationInfo info) {
    List<String> rel = new ArrayList<>();
    rel.add("self");
    if (info.cursorPage() == 1) rel.add("first");
    if (info.isLastPage()) rel.add("last");
    rel.add("page-" + info.cursorPage());
    return new ApiLink(href(options.cursor()), rel, info.cursorPage());
  }

  List<ApiLink> links(PaginationInfo info) {
    long current = info.cursorPage();
    List<ApiLink> out = new ArrayList<>();
    out.add(link(null, 1, current, "first"));

    PageInfo last = info.lastPage();
    if (last != null && !info.isLastPage()) {
      out.add(link(last.cursor(), last.page(), current, "last"));
    }
    for (PageInfo p : info.surroundingPages()) {
      if (p.equals(last)) continue;
      out.add(link(p.cursor(), p.page(), current, null));
    }
    return out;
  }

  private ApiLink link(Object cursor, long page, long current, String extraRel) {
    List<String> rel = new ArrayList<>();
    if (extraRel != null) rel.add(extraRel);
    if (page == current - 1) rel.add("prev");
    if (page == current + 1) rel.add("next");
    rel.add("page-" + page);
    return new ApiLink(href(cursor), rel, page);
  }

  private String href(Object cursor) {
    UriComponentsBuilder b = base.cloneBuilder().replaceQuery(null);
    options.toQueryParams(cursor).forEach((k, v) -> b.queryParam(k, v));
    extraParams.forEach((k, v) -> b.queryParam(k, v));
    return b.encode().build().toUriString();
  }
}

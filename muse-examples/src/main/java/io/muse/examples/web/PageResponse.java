package io.muse.examples.web;

import java.util.List;
import java.util.Map;

public record PageResponse(
    ApiLink self,
    List<ApiLink> links,
    long collectionSize,
    long page,
    long lastPage,
    List<Map<String, Object>> items
) {}

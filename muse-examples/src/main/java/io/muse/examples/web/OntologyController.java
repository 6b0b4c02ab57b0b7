package io.muse.examples.web;

import io.muse.examples.service.OntologyService;
import io.muse.persistence.pagination.PaginationOptions;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/namespaces")
public final class OntologyController {
  private final OntologyService ontology;

  public OntologyController(OntologyService ontology) {
    this.ontology = ontology;
  }

  @GetMapping("/")
  public PageResponse namespaces(@RequestParam Map<String, String> params,
                                 @RequestParam(name = "deleted", defaultValue = "false") boolean deleted) {
    PaginationOptions options = ontology.options(params);
    return links(options, deletedParam(deleted)).toResponse(ontology.namespaces(deleted, options));
  }

  @GetMapping("/{namespaceId}/types/")
  public PageResponse types(@PathVariable("namespaceId") long namespaceId,
                            @RequestParam Map<String, String> params,
                            @RequestParam(name = "deleted", defaultValue = "false") boolean deleted) {
    PaginationOptions options = ontology.options(params);
    return links(options, deletedParam(deleted)).toResponse(ontology.types(namespaceId, deleted, options));
  }

  @GetMapping("/{namespaceId}/objects/")
  public PageResponse objects(@PathVariable("namespaceId") long namespaceId,
                              @RequestParam Map<String, String> params,
                              @RequestParam(name = "type-id", required = false) Long typeId,
                              @RequestParam(name = "deleted", defaultValue = "false") boolean deleted) {
    PaginationOptions options = ontology.options(params);
    Map<String, String> extra = deletedParam(deleted);
    if (typeId != null) extra.put("type-id", String.valueOf(typeId));
    return links(options, extra).toResponse(ontology.objects(namespaceId, typeId, deleted, options));
  }

  private static Map<String, String> deletedParam(boolean deleted) {
    Map<String, String> extra = new LinkedHashMap<>();
    if (deleted) extra.put("deleted", "true");
    return extra;
  }

  private static PageLinks links(PaginationOptions options, Map<String, String> extra) {
    return new PageLinks(ServletUriComponentsBuilder.fromCurrentRequestUri(), options, extra);
  }
}

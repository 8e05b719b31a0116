package com.flamingo.ai.assessrec.api.rest;

import com.flamingo.ai.assessrec.service.index.CatalogIndex;
import com.flamingo.ai.assessrec.service.index.CatalogIndexHolder;
import com.flamingo.ai.assessrec.service.index.CatalogIndexService;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the served catalog snapshot. */
@RestController
@RequestMapping("/api/catalog")
@RequiredArgsConstructor
@Slf4j
public class CatalogController {

  private final CatalogIndexHolder catalogIndexHolder;
  private final CatalogIndexService catalogIndexService;

  /** Describes the snapshot being served. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> describe() {
    return ResponseEntity.ok(describe(catalogIndexHolder.current()));
  }

  /** Reloads the catalog source and swaps in a freshly built snapshot. */
  @PostMapping("/refresh")
  public ResponseEntity<Map<String, Object>> refresh() {
    log.info("Catalog refresh requested");
    return ResponseEntity.ok(describe(catalogIndexService.refresh()));
  }

  private static Map<String, Object> describe(CatalogIndex index) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("catalogSize", index.size());
    body.put("vectorIndex", index.hasVectors());
    body.put("builtAt", index.builtAt().toString());
    return body;
  }
}

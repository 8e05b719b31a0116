package com.flamingo.ai.assessrec.config;

import com.flamingo.ai.assessrec.service.index.CatalogIndexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Builds the first catalog index once the context is up. Load and consistency errors propagate and
 * stop the application.
 */
@Component
@Order(0)
@RequiredArgsConstructor
@Slf4j
public class CatalogIndexInitializer implements ApplicationRunner {

  private final CatalogIndexService catalogIndexService;

  @Override
  public void run(ApplicationArguments args) {
    log.info("Building catalog index...");
    var index = catalogIndexService.refresh();
    log.info(
        "Catalog index ready: {} records ({} mode)",
        index.size(),
        index.hasVectors() ? "vector" : "lexical-only");
  }
}

package com.flamingo.ai.assessrec.service.evaluation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.assessrec.exception.CatalogLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/** Reads a labelled query set: {@code [{"query": "...", "relevant": ["id-or-url", ...]}]}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LabeledQuerySetLoader {

  private final ResourceLoader resourceLoader;
  private final ObjectMapper objectMapper;

  public List<LabeledQuery> load(String location) {
    Resource resource = resourceLoader.getResource(location);
    try (InputStream in = resource.getInputStream()) {
      List<LabeledQuery> queries = objectMapper.readValue(in, new TypeReference<>() {});
      log.info("Loaded {} labelled queries from {}", queries.size(), location);
      return queries;
    } catch (IOException e) {
      throw new CatalogLoadException("Failed to read labelled queries from " + location, e);
    }
  }
}

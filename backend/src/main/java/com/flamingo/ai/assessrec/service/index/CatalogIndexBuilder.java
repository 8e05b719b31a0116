package com.flamingo.ai.assessrec.service.index;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;
import com.flamingo.ai.assessrec.service.catalog.CanonicalText;
import com.flamingo.ai.assessrec.service.catalog.CatalogLoader;
import com.flamingo.ai.assessrec.service.embedding.EmbeddingProvider;
import com.flamingo.ai.assessrec.service.ranking.LexicalTokenizer;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Builds immutable {@link CatalogIndex} snapshots from the catalog source. */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogIndexBuilder {

  private final CatalogLoader catalogLoader;
  private final EmbeddingProvider embeddingProvider;
  private final RecommenderConfig recommenderConfig;
  private final MeterRegistry meterRegistry;

  public CatalogIndex build() {
    return build(catalogLoader.load());
  }

  /**
   * Builds a snapshot for the given records.
   *
   * <p>If the embedding model is unavailable the snapshot is lexical-only. A vector with the wrong
   * dimension is never tolerated and fails the build.
   *
   * @param records catalog records in catalog order
   * @return the new snapshot
   */
  public CatalogIndex build(List<CatalogRecord> records) {
    long start = System.currentTimeMillis();

    List<String> texts = new ArrayList<>(records.size());
    List<Set<String>> termSets = new ArrayList<>(records.size());
    for (CatalogRecord record : records) {
      String text = CanonicalText.of(record);
      texts.add(text);
      termSets.add(LexicalTokenizer.terms(text));
    }

    VectorIndex vectorIndex = null;
    if (!records.isEmpty()) {
      List<float[]> vectors = embedAll(texts);
      if (vectors != null) {
        vectorIndex =
            VectorIndex.of(records, vectors, recommenderConfig.getEmbedding().getDimension());
      }
    }

    CatalogIndex index = new CatalogIndex(records, termSets, vectorIndex, Instant.now());
    meterRegistry
        .counter("catalog.index.builds", "mode", index.hasVectors() ? "vector" : "lexical")
        .increment();
    log.info(
        "Built catalog index: {} records, vectors={}, took {}ms",
        index.size(),
        index.hasVectors(),
        System.currentTimeMillis() - start);
    return index;
  }

  private List<float[]> embedAll(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    try {
      for (String text : texts) {
        vectors.add(embeddingProvider.embedPassage(text));
      }
    } catch (EmbeddingUnavailableException e) {
      log.warn(
          "Embedding unavailable after {} of {} records, building lexical-only index: {}",
          vectors.size(),
          texts.size(),
          e.getMessage());
      return null;
    }
    return vectors;
  }
}

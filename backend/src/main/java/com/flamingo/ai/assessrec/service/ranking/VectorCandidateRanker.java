package com.flamingo.ai.assessrec.service.ranking;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.domain.enums.ScoreSource;
import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;
import com.flamingo.ai.assessrec.service.embedding.EmbeddingProvider;
import com.flamingo.ai.assessrec.service.index.CatalogIndex;
import com.flamingo.ai.assessrec.service.index.VectorIndex;
import com.flamingo.ai.assessrec.service.recommendation.BoundedCallExecutor;
import com.flamingo.ai.assessrec.service.recommendation.BoundedCallExecutor.Lane;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Cosine-similarity ranking against the snapshot's vector index. */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorCandidateRanker implements CandidateRanker {

  private final EmbeddingProvider embeddingProvider;
  private final BoundedCallExecutor boundedCallExecutor;
  private final RecommenderConfig recommenderConfig;

  @Override
  public ScoreSource source() {
    return ScoreSource.VECTOR;
  }

  /**
   * {@inheritDoc}
   *
   * @throws EmbeddingUnavailableException when the snapshot has no vectors, or the query cannot be
   *     embedded within the configured timeout
   */
  @Override
  public List<RankedCandidate> rank(CatalogIndex index, String query, int limit) {
    VectorIndex vectors =
        index
            .vectors()
            .orElseThrow(
                () -> new EmbeddingUnavailableException("Index was built without vectors"));

    float[] queryVector =
        boundedCallExecutor.call(
            Lane.EMBEDDING,
            "Query embedding",
            recommenderConfig.getEmbedding().getTimeoutMs(),
            () -> embeddingProvider.embedQuery(query),
            VectorCandidateRanker::toEmbeddingUnavailable);

    List<RankedCandidate> ranked = vectors.topN(queryVector, limit);
    log.debug(
        "Vector ranking: {} candidates, best score {}",
        ranked.size(),
        ranked.isEmpty() ? 0 : ranked.get(0).score());
    return ranked;
  }

  private static RuntimeException toEmbeddingUnavailable(Throwable cause) {
    if (cause instanceof EmbeddingUnavailableException unavailable) {
      return unavailable;
    }
    return new EmbeddingUnavailableException("Query embedding failed: " + cause, cause);
  }
}

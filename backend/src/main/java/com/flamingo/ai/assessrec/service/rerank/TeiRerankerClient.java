package com.flamingo.ai.assessrec.service.rerank;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.exception.RerankUnavailableException;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** HTTP client for a Hugging Face TEI (Text Embeddings Inference) {@code /rerank} endpoint. */
@Component
@ConditionalOnProperty(name = "recommender.reranking.strategy", havingValue = "tei")
@Slf4j
public class TeiRerankerClient {

  private final WebClient webClient;
  private final int readTimeoutMs;
  private final boolean rawScores;
  private final boolean truncate;

  public TeiRerankerClient(RecommenderConfig recommenderConfig) {
    RecommenderConfig.Reranking.Tei tei = recommenderConfig.getReranking().getTei();
    this.readTimeoutMs = tei.getReadTimeoutMs();
    this.rawScores = tei.isRawScores();
    this.truncate = tei.isTruncate();
    this.webClient =
        WebClient.builder()
            .baseUrl(tei.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("TEI reranker client: baseUrl={}, model={}", tei.getBaseUrl(), tei.getModelId());
  }

  /**
   * Scores texts against a query.
   *
   * <p>A 4xx answer means the request itself is unusable (too many texts, input too long), so it is
   * raised as {@link RerankUnavailableException} and not retried. Server errors and timeouts
   * propagate unchanged for the retry policy.
   *
   * @param query the query
   * @param texts candidate texts
   * @return one result per text with its input index, ordered by TEI (score descending)
   */
  public List<RerankResult> rerank(String query, List<String> texts) {
    var request = new TeiRerankRequest(query, texts, rawScores, truncate);
    List<RerankResult> results;
    try {
      results =
          webClient
              .post()
              .uri("/rerank")
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(request)
              .retrieve()
              .bodyToFlux(RerankResult.class)
              .collectList()
              .timeout(Duration.ofMillis(readTimeoutMs))
              .block();
    } catch (WebClientResponseException e) {
      if (e.getStatusCode().is4xxClientError()) {
        throw new RerankUnavailableException(
            "TEI rejected rerank request for " + texts.size() + " texts: " + e.getStatusCode(), e);
      }
      throw e;
    }

    if (results == null || results.isEmpty()) {
      throw new RerankUnavailableException("TEI returned no scores for " + texts.size() + " texts");
    }
    log.debug("TEI scored {} texts", results.size());
    return results;
  }

  record TeiRerankRequest(String query, List<String> texts, boolean raw_scores, boolean truncate) {}

  /** TEI rerank response element. */
  public record RerankResult(int index, double score) {}
}

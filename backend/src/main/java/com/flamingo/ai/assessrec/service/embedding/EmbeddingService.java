package com.flamingo.ai.assessrec.service.embedding;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Embedding provider backed by the configured LangChain4j {@link EmbeddingModel}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService implements EmbeddingProvider {

  // Both the MiniLM tokenizer window and the OpenAI limit are far above this
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final RecommenderConfig recommenderConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  @Retry(name = "embedding")
  public float[] embedQuery(String query) {
    String text = recommenderConfig.getEmbedding().getQueryPrefix() + query;
    float[] vector = embed(text, "query");
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return vector;
  }

  @Override
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  @Retry(name = "embedding")
  public float[] embedPassage(String passage) {
    String text = recommenderConfig.getEmbedding().getPassagePrefix() + passage;
    float[] vector = embed(text, "passage");
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return vector;
  }

  private float[] embed(String text, String type) {
    if (text.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "{} too long for embedding, truncating from {} chars to {} chars",
          type,
          text.length(),
          MAX_CHARS_PER_EMBEDDING);
      text = text.substring(0, MAX_CHARS_PER_EMBEDDING);
    }

    log.debug("Embedding {} of {} chars", type, text.length());
    Response<Embedding> response = embeddingModel.embed(text);
    if (response == null || response.content() == null) {
      throw new EmbeddingUnavailableException("Embedding model returned no content for " + type);
    }
    float[] vector = response.content().vector();
    if (vector == null || vector.length == 0) {
      throw new EmbeddingUnavailableException("Embedding model returned an empty vector");
    }
    return vector;
  }

  @SuppressWarnings("unused")
  private float[] embedFallback(String text, Throwable t) {
    log.error("Embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    if (t instanceof EmbeddingUnavailableException unavailable) {
      throw unavailable;
    }
    throw new EmbeddingUnavailableException("Embedding model call failed", t);
  }
}

package com.flamingo.ai.assessrec.service.embedding;

import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;

/**
 * Text to fixed-length vector capability. Implementations must be deterministic for identical
 * input and must produce vectors of one dimension for their whole lifetime.
 */
public interface EmbeddingProvider {

  /**
   * Embeds a user query.
   *
   * @throws EmbeddingUnavailableException when no usable vector can be produced
   */
  float[] embedQuery(String query);

  /**
   * Embeds the canonical text of a catalog record.
   *
   * @throws EmbeddingUnavailableException when no usable vector can be produced
   */
  float[] embedPassage(String passage);
}

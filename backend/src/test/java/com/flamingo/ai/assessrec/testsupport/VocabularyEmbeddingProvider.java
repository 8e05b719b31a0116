package com.flamingo.ai.assessrec.testsupport;

import com.flamingo.ai.assessrec.service.embedding.EmbeddingProvider;
import com.flamingo.ai.assessrec.service.ranking.LexicalTokenizer;
import java.util.List;
import java.util.Set;

/**
 * Deterministic bag-of-words embedding over a fixed vocabulary. A small constant component keeps
 * every vector non-zero.
 */
public class VocabularyEmbeddingProvider implements EmbeddingProvider {

  private static final float BIAS = 0.1f;

  private final List<String> vocabulary;

  public VocabularyEmbeddingProvider(List<String> vocabulary) {
    this.vocabulary = List.copyOf(vocabulary);
  }

  public VocabularyEmbeddingProvider(String... vocabulary) {
    this(List.of(vocabulary));
  }

  public int dimension() {
    return vocabulary.size() + 1;
  }

  @Override
  public float[] embedQuery(String query) {
    return embed(query);
  }

  @Override
  public float[] embedPassage(String passage) {
    return embed(passage);
  }

  private float[] embed(String text) {
    Set<String> terms = LexicalTokenizer.terms(text);
    float[] vector = new float[dimension()];
    for (int i = 0; i < vocabulary.size(); i++) {
      vector[i] = terms.contains(vocabulary.get(i)) ? 1.0f : 0.0f;
    }
    vector[vocabulary.size()] = BIAS;
    return vector;
  }
}

package com.flamingo.ai.assessrec.service.index;

import com.flamingo.ai.assessrec.domain.enums.ScoreSource;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;
import com.flamingo.ai.assessrec.exception.InternalInconsistencyException;
import java.util.ArrayList;
import java.util.List;

/**
 * Exhaustive cosine-similarity index over catalog embeddings.
 *
 * <p>Vectors are normalised to unit length when the index is built, so scoring a query is a dot
 * product per record. Instances are immutable and safe to share between request threads.
 */
public final class VectorIndex {

  private final List<CatalogRecord> records;
  private final float[][] unitVectors;
  private final int dimension;

  private VectorIndex(List<CatalogRecord> records, float[][] unitVectors, int dimension) {
    this.records = records;
    this.unitVectors = unitVectors;
    this.dimension = dimension;
  }

  /**
   * Builds an index from records and their embeddings, aligned by position.
   *
   * @param records catalog records in catalog order
   * @param vectors one embedding per record
   * @param dimension the dimension every vector must have
   * @return the immutable index
   * @throws InternalInconsistencyException when counts or dimensions disagree, or a vector is zero
   */
  public static VectorIndex of(List<CatalogRecord> records, List<float[]> vectors, int dimension) {
    if (records.size() != vectors.size()) {
      throw new InternalInconsistencyException(
          "Record count "
              + records.size()
              + " does not match embedding count "
              + vectors.size());
    }

    float[][] unit = new float[vectors.size()][];
    for (int i = 0; i < vectors.size(); i++) {
      float[] vector = vectors.get(i);
      if (vector == null || vector.length != dimension) {
        throw new InternalInconsistencyException(
            "Embedding for record "
                + records.get(i).id()
                + " has dimension "
                + (vector == null ? 0 : vector.length)
                + ", expected "
                + dimension);
      }
      float[] normalized = normalize(vector);
      if (normalized == null) {
        throw new InternalInconsistencyException(
            "Embedding for record " + records.get(i).id() + " is a zero vector");
      }
      unit[i] = normalized;
    }
    return new VectorIndex(List.copyOf(records), unit, dimension);
  }

  /**
   * Ranks every record against the query vector.
   *
   * @param queryVector raw query embedding
   * @param n number of candidates wanted
   * @return {@code min(n, size())} candidates, highest cosine first, ties in catalog order
   * @throws EmbeddingUnavailableException when the query vector is missing, zero, or of the wrong
   *     dimension
   */
  public List<RankedCandidate> topN(float[] queryVector, int n) {
    if (queryVector == null || queryVector.length == 0) {
      throw new EmbeddingUnavailableException("Query vector is empty");
    }
    if (queryVector.length != dimension) {
      throw new EmbeddingUnavailableException(
          "Query vector has dimension " + queryVector.length + ", index expects " + dimension);
    }
    float[] query = normalize(queryVector);
    if (query == null) {
      throw new EmbeddingUnavailableException("Query vector is a zero vector");
    }

    List<RankedCandidate> scored = new ArrayList<>(records.size());
    for (int i = 0; i < records.size(); i++) {
      double score = dot(query, unitVectors[i]);
      scored.add(new RankedCandidate(records.get(i), score, ScoreSource.VECTOR));
    }
    // List.sort is stable, so equal scores keep catalog order
    scored.sort((a, b) -> Double.compare(b.score(), a.score()));

    int limit = Math.max(0, Math.min(n, scored.size()));
    return List.copyOf(scored.subList(0, limit));
  }

  public int size() {
    return records.size();
  }

  public int dimension() {
    return dimension;
  }

  private static double dot(float[] a, float[] b) {
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += (double) a[i] * b[i];
    }
    return sum;
  }

  private static float[] normalize(float[] vector) {
    double norm = 0.0;
    for (float v : vector) {
      norm += (double) v * v;
    }
    norm = Math.sqrt(norm);
    if (norm == 0.0 || Double.isNaN(norm) || Double.isInfinite(norm)) {
      return null;
    }
    float[] unit = new float[vector.length];
    for (int i = 0; i < vector.length; i++) {
      unit[i] = (float) (vector[i] / norm);
    }
    return unit;
  }
}

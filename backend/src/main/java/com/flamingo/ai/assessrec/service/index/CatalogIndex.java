package com.flamingo.ai.assessrec.service.index;

import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of the catalog as served: records, their lexical term sets and, when the
 * embedding model was reachable at build time, the vector index.
 *
 * @param records catalog records in catalog order
 * @param termSets lexical terms of each record's canonical text, aligned with {@code records}
 * @param vectorIndex vector index, {@code null} for a lexical-only snapshot
 * @param builtAt build completion time
 */
public record CatalogIndex(
    List<CatalogRecord> records,
    List<Set<String>> termSets,
    VectorIndex vectorIndex,
    Instant builtAt) {

  public CatalogIndex {
    records = List.copyOf(records);
    termSets = List.copyOf(termSets);
  }

  public Optional<VectorIndex> vectors() {
    return Optional.ofNullable(vectorIndex);
  }

  public boolean hasVectors() {
    return vectorIndex != null;
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }
}

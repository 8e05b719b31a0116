package com.flamingo.ai.assessrec.service.index;

import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Rebuilds the catalog snapshot and publishes it. */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogIndexService {

  private final CatalogIndexBuilder catalogIndexBuilder;
  private final CatalogIndexHolder catalogIndexHolder;

  /**
   * Loads the catalog, builds a new snapshot and swaps it in. Concurrent refreshes are serialised;
   * readers are never blocked.
   *
   * <p>Only the first snapshot may be lexical-only. A rebuild that could not embed the catalog
   * leaves the current vector snapshot in place.
   *
   * @return the snapshot now being served
   * @throws EmbeddingUnavailableException when the rebuild lost its vectors and was not published
   */
  public synchronized CatalogIndex refresh() {
    CatalogIndex next = catalogIndexBuilder.build();
    Optional<CatalogIndex> current = catalogIndexHolder.peek();
    boolean lostVectors = !next.isEmpty() && !next.hasVectors();
    if (lostVectors && current.map(CatalogIndex::hasVectors).orElse(false)) {
      log.warn(
          "Catalog rebuild could not embed {} records, keeping vector index built at {}",
          next.size(),
          current.get().builtAt());
      throw new EmbeddingUnavailableException(
          "Catalog refresh could not embed the catalog; the current index is still served");
    }

    catalogIndexHolder
        .swap(next)
        .ifPresent(
            previous ->
                log.info(
                    "Replaced catalog index built at {} ({} records) with {} records",
                    previous.builtAt(),
                    previous.size(),
                    next.size()));
    return next;
  }
}

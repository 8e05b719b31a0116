package com.flamingo.ai.assessrec.service.index;

import com.flamingo.ai.assessrec.exception.IndexNotReadyException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Process-wide reference to the catalog snapshot being served. A rebuild produces a new snapshot
 * and swaps it in; requests already holding the old one finish against it.
 */
@Component
public class CatalogIndexHolder {

  private final AtomicReference<CatalogIndex> current = new AtomicReference<>();

  /**
   * Returns the snapshot being served.
   *
   * @throws IndexNotReadyException if no snapshot has been built yet
   */
  public CatalogIndex current() {
    CatalogIndex index = current.get();
    if (index == null) {
      throw new IndexNotReadyException();
    }
    return index;
  }

  public Optional<CatalogIndex> peek() {
    return Optional.ofNullable(current.get());
  }

  /**
   * Atomically replaces the served snapshot.
   *
   * @param next the new snapshot
   * @return the snapshot it replaced, if any
   */
  public Optional<CatalogIndex> swap(CatalogIndex next) {
    if (next == null) {
      throw new IllegalArgumentException("Catalog index must not be null");
    }
    return Optional.ofNullable(current.getAndSet(next));
  }
}

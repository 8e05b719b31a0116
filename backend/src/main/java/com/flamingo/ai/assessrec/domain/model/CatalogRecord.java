package com.flamingo.ai.assessrec.domain.model;

import com.flamingo.ai.assessrec.domain.enums.AssessmentCategory;
import java.util.List;
import lombok.Builder;

/**
 * Immutable catalog entry. The first category is the primary category used for diversity
 * balancing.
 *
 * @param id stable identifier, unique within the catalog
 * @param name display name, never blank
 * @param url canonical reference link
 * @param description free text, may be empty
 * @param categories non-empty ordered list of categories
 * @param durationMinutes duration in minutes, {@code null} when unknown
 * @param adaptiveSupport whether the assessment is adaptive (IRT)
 * @param remoteSupport whether remote testing is supported
 */
@Builder
public record CatalogRecord(
    String id,
    String name,
    String url,
    String description,
    List<AssessmentCategory> categories,
    Integer durationMinutes,
    boolean adaptiveSupport,
    boolean remoteSupport) {

  public CatalogRecord {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Catalog record id must not be blank");
    }
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Catalog record name must not be blank: " + id);
    }
    description = description == null ? "" : description;
    url = url == null ? "" : url;
    categories =
        categories == null || categories.isEmpty()
            ? List.of(AssessmentCategory.OTHER)
            : List.copyOf(categories);
    if (durationMinutes != null && durationMinutes < 0) {
      durationMinutes = null;
    }
  }

  public AssessmentCategory primaryCategory() {
    return categories.get(0);
  }
}

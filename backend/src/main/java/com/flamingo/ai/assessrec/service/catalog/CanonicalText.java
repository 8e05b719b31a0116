package com.flamingo.ai.assessrec.service.catalog;

import com.flamingo.ai.assessrec.domain.enums.AssessmentCategory;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import java.util.stream.Collectors;

/** Builds the text a catalog record is embedded and lexically matched by. */
public final class CanonicalText {

  private CanonicalText() {}

  /**
   * Returns name, description and category display names joined by single spaces.
   *
   * @param record the catalog record
   * @return trimmed, single-spaced canonical text
   */
  public static String of(CatalogRecord record) {
    String categories =
        record.categories().stream()
            .map(AssessmentCategory::getDisplayName)
            .collect(Collectors.joining(" "));
    String joined = record.name() + " " + record.description() + " " + categories;
    return joined.trim().replaceAll("\\s+", " ");
  }
}

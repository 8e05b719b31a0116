package com.flamingo.ai.assessrec.testsupport;

import com.flamingo.ai.assessrec.domain.enums.AssessmentCategory;
import com.flamingo.ai.assessrec.domain.enums.ScoreSource;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import com.flamingo.ai.assessrec.domain.model.RankedCandidate;
import java.util.List;

/** Builders for catalog fixtures used across tests. */
public final class TestRecords {

  private TestRecords() {}

  public static CatalogRecord record(String id, AssessmentCategory category, String name) {
    return record(id, category, name, "");
  }

  public static CatalogRecord record(
      String id, AssessmentCategory category, String name, String description) {
    return CatalogRecord.builder()
        .id(id)
        .name(name)
        .url("https://catalog.example.com/" + id + "/")
        .description(description)
        .categories(List.of(category))
        .durationMinutes(30)
        .adaptiveSupport(false)
        .remoteSupport(true)
        .build();
  }

  public static RankedCandidate candidate(String id, AssessmentCategory category, double score) {
    return new RankedCandidate(record(id, category, "Assessment " + id), score, ScoreSource.VECTOR);
  }

  /** The three-record catalog: Java test, teamwork questionnaire, Python test. */
  public static List<CatalogRecord> javaTeamworkPython() {
    return List.of(
        record("A", AssessmentCategory.KNOWLEDGE_SKILLS, "Java programming test"),
        record("B", AssessmentCategory.PERSONALITY_BEHAVIOR, "teamwork communication"),
        record("C", AssessmentCategory.KNOWLEDGE_SKILLS, "Python programming test"));
  }
}

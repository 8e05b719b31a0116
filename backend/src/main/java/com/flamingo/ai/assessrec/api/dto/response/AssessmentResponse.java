package com.flamingo.ai.assessrec.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.assessrec.domain.enums.AssessmentCategory;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Wire form of one recommended assessment. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssessmentResponse {

  private String url;
  private String name;

  @JsonProperty("adaptive_support")
  private String adaptiveSupport;

  private String description;

  /** Minutes; null when unknown. */
  private Integer duration;

  @JsonProperty("remote_support")
  private String remoteSupport;

  @JsonProperty("test_type")
  private List<String> testType;

  public static AssessmentResponse fromRecord(CatalogRecord record) {
    return AssessmentResponse.builder()
        .url(record.url())
        .name(record.name())
        .adaptiveSupport(yesNo(record.adaptiveSupport()))
        .description(record.description())
        .duration(record.durationMinutes())
        .remoteSupport(yesNo(record.remoteSupport()))
        .testType(record.categories().stream().map(AssessmentCategory::getDisplayName).toList())
        .build();
  }

  private static String yesNo(boolean flag) {
    return flag ? "Yes" : "No";
  }
}

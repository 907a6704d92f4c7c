package com.dataprep.standardizer.dto.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Non-fatal condition surfaced alongside detection results. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisWarning {

  public static final String DATASET_TOO_LARGE_FOR_SIMILARITY_CHECK =
      "DATASET_TOO_LARGE_FOR_SIMILARITY_CHECK";

  @JsonProperty("code")
  private String code;

  @JsonProperty("message")
  private String message;

  @JsonProperty("distinct_values")
  private Integer distinctValues;

  @JsonProperty("limit")
  private Integer limit;

  public static AnalysisWarning similaritySkipped(int distinctValues, int limit) {
    return AnalysisWarning.builder()
        .code(DATASET_TOO_LARGE_FOR_SIMILARITY_CHECK)
        .message(
            String.format(
                "Similarity check skipped: %d distinct values exceed the limit of %d",
                distinctValues, limit))
        .distinctValues(distinctValues)
        .limit(limit)
        .build();
  }
}

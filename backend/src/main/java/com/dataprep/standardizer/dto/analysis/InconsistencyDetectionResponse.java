package com.dataprep.standardizer.dto.analysis;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InconsistencyDetectionResponse {

  @JsonProperty("column")
  private String column;

  @JsonProperty("candidates")
  private List<InconsistencyCandidate> candidates;

  @JsonProperty("warnings")
  private List<AnalysisWarning> warnings;

  @JsonProperty("message")
  private String message;

  @JsonProperty("column_profile")
  private ColumnProfile columnProfile;

  @JsonProperty("processing_metadata")
  private ProcessingMetadata processingMetadata;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ProcessingMetadata {

    @JsonProperty("total_rows")
    private Integer totalRows;

    @JsonProperty("analyzed_values")
    private Integer analyzedValues;

    @JsonProperty("distinct_values")
    private Integer distinctValues;

    @JsonProperty("processing_time_ms")
    private Long processingTimeMs;
  }
}

package com.dataprep.standardizer.dto.analysis;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnAnalysisRequest {

  @NotBlank
  @JsonProperty("column")
  private String column;

  @NotNull
  @NotEmpty
  @JsonProperty("columns")
  private List<String> columns;

  @NotNull
  @JsonProperty("data")
  private List<Map<String, Object>> data;

  /**
   * Identifies the analysis for supersession: a newer request with the same key cancels an older
   * one still running. Typically dataset id plus column.
   */
  @JsonProperty("analysis_key")
  private String analysisKey;
}

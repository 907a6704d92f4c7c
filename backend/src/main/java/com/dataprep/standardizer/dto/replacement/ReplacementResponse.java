package com.dataprep.standardizer.dto.replacement;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplacementResponse {

  @JsonProperty("column")
  private String column;

  @JsonProperty("columns")
  private List<String> columns;

  @JsonProperty("data")
  private List<Map<String, Object>> data;

  @JsonProperty("replaced_cells")
  private int replacedCells;
}

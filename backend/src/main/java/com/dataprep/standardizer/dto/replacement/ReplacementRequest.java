package com.dataprep.standardizer.dto.replacement;

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
public class ReplacementRequest {

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

  /** Operator-approved mapping of original value to standardized value. */
  @NotNull
  @JsonProperty("replacements")
  private Map<String, String> replacements;
}

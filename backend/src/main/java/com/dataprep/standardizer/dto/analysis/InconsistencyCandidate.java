package com.dataprep.standardizer.dto.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A proposed replacement for one distinct column value. {@code standardizedValue} never equals
 * {@code originalValue}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InconsistencyCandidate {

  public static final String SIMILAR_FORMAT = "Similar Format";

  @JsonProperty("column")
  private String column;

  @JsonProperty("original_value")
  private String originalValue;

  @JsonProperty("occurrence_count")
  private int occurrenceCount;

  @JsonProperty("standardized_value")
  private String standardizedValue;

  @JsonProperty("pattern_family")
  private String patternFamily;
}

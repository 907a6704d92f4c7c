package com.dataprep.standardizer.dto.analysis;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnProfile {

  public static final String MIXED_TEXT = "Mixed/Text";
  public static final String MIXED = "Mixed";

  @JsonProperty("column")
  private String column;

  @JsonProperty("total_values")
  private int totalValues;

  @JsonProperty("unique_values")
  private int uniqueValues;

  @JsonProperty("null_values")
  private int nullValues;

  @JsonProperty("duplicate_values")
  private int duplicateValues;

  @JsonProperty("detected_patterns")
  private List<String> detectedPatterns;

  @JsonProperty("recommended_type")
  private String recommendedType;

  /** Comma-separated detected families, or {@value #MIXED_TEXT} when none qualified. */
  @JsonProperty(value = "detected_pattern_summary", access = JsonProperty.Access.READ_ONLY)
  public String getDetectedPatternSummary() {
    if (detectedPatterns == null || detectedPatterns.isEmpty()) {
      return MIXED_TEXT;
    }
    return String.join(", ", detectedPatterns);
  }
}

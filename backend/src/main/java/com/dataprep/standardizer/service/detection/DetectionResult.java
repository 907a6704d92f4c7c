package com.dataprep.standardizer.service.detection;

import java.util.List;

import com.dataprep.standardizer.dto.analysis.AnalysisWarning;
import com.dataprep.standardizer.dto.analysis.InconsistencyCandidate;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Ranked candidates for one column plus any non-fatal warnings raised while computing them. */
@Value
@Builder
public class DetectionResult {

  String column;

  @Singular List<InconsistencyCandidate> candidates;

  @Singular List<AnalysisWarning> warnings;

  int analyzedValues;

  int distinctValues;

  public boolean isSimilarityCheckSkipped() {
    return warnings.stream()
        .anyMatch(
            warning ->
                AnalysisWarning.DATASET_TOO_LARGE_FOR_SIMILARITY_CHECK.equals(warning.getCode()));
  }
}

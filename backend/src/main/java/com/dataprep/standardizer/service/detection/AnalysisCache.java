package com.dataprep.standardizer.service.detection;

import java.util.Objects;

import lombok.Value;

/**
 * Caller-owned memo of the most recent analysis. The engine keeps no hidden state; callers pass
 * the previous value in and keep the one handed back.
 */
@Value
public class AnalysisCache {

  private static final AnalysisCache EMPTY = new AnalysisCache(null, null);

  String lastAnalysisKey;
  DetectionResult lastAnalysisResult;

  public static AnalysisCache empty() {
    return EMPTY;
  }

  public static String keyOf(String column, String datasetVersion) {
    return column + "@" + (datasetVersion == null ? "" : datasetVersion);
  }

  public boolean holds(String analysisKey) {
    return lastAnalysisResult != null && Objects.equals(lastAnalysisKey, analysisKey);
  }
}

package com.dataprep.standardizer.fixtures;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.dataprep.standardizer.config.StandardizerProperties;
import com.dataprep.standardizer.dto.analysis.ColumnAnalysisRequest;
import com.dataprep.standardizer.dto.analysis.InconsistencyCandidate;
import com.dataprep.standardizer.dto.replacement.ReplacementRequest;
import com.dataprep.standardizer.service.dataset.TabularDataset;
import com.dataprep.standardizer.service.detection.CanonicalGroupingService;
import com.dataprep.standardizer.service.detection.FrequencyAnalyzer;
import com.dataprep.standardizer.service.detection.InconsistencyDetectionService;
import com.dataprep.standardizer.service.detection.InconsistencyRanker;
import com.dataprep.standardizer.service.detection.SimilarityClusterService;
import com.dataprep.standardizer.service.pattern.PatternClassifier;
import com.dataprep.standardizer.service.pattern.ValueCanonicalizer;

/** Shared sample data and wired-up engine instances for unit tests. */
public final class TestFixtures {

  private TestFixtures() {}

  // ========================================
  // ENGINE
  // ========================================

  public static InconsistencyDetectionService detectionService() {
    return detectionService(new StandardizerProperties());
  }

  public static InconsistencyDetectionService detectionService(StandardizerProperties properties) {
    return new InconsistencyDetectionService(
        new FrequencyAnalyzer(),
        new CanonicalGroupingService(
            new PatternClassifier(), new ValueCanonicalizer(), properties),
        new SimilarityClusterService(properties),
        new InconsistencyRanker());
  }

  public static InconsistencyCandidate candidate(
      String original, int count, String standardized, String family) {
    return InconsistencyCandidate.builder()
        .column("value")
        .originalValue(original)
        .occurrenceCount(count)
        .standardizedValue(standardized)
        .patternFamily(family)
        .build();
  }

  // ========================================
  // DATASETS
  // ========================================

  public static List<Map<String, Object>> createContactRows() {
    List<Map<String, Object>> rows = new ArrayList<>();
    rows.add(createRow("1", "(555) 123 4567", "YES", "John Smith"));
    rows.add(createRow("2", "5551234567", "yes", "john smith"));
    rows.add(createRow("3", "(555) 123-4567", "No", "Jane Doe"));
    rows.add(createRow("4", "(555) 123-4567", "TRUE", null));
    rows.add(createRow("5", null, "0", "  "));
    return rows;
  }

  public static List<String> contactColumns() {
    return new ArrayList<>(Arrays.asList("id", "phone", "active", "name"));
  }

  public static TabularDataset createContactDataset() {
    return TabularDataset.of(contactColumns(), createContactRows());
  }

  public static Map<String, Object> createRow(
      String id, String phone, String active, String name) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("phone", phone);
    row.put("active", active);
    row.put("name", name);
    return row;
  }

  public static ColumnAnalysisRequest createAnalysisRequest(String column) {
    return ColumnAnalysisRequest.builder()
        .column(column)
        .columns(contactColumns())
        .data(createContactRows())
        .build();
  }

  public static ReplacementRequest createReplacementRequest(
      String column, Map<String, String> replacements) {
    return ReplacementRequest.builder()
        .column(column)
        .columns(contactColumns())
        .data(createContactRows())
        .replacements(replacements)
        .build();
  }
}

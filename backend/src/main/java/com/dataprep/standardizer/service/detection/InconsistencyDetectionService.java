package com.dataprep.standardizer.service.detection;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.dataprep.standardizer.dto.analysis.AnalysisWarning;
import com.dataprep.standardizer.dto.analysis.InconsistencyCandidate;
import com.dataprep.standardizer.exception.ColumnNotFoundException;
import com.dataprep.standardizer.service.dataset.TabularDataset;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the full detection pipeline for one column: frequency table, canonical grouping, similarity
 * clustering over whatever grouping left untouched, and ranking. Stateless and synchronous; see
 * {@code AnalysisTaskService} for running it off the request thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InconsistencyDetectionService {

  private final FrequencyAnalyzer frequencyAnalyzer;
  private final CanonicalGroupingService groupingService;
  private final SimilarityClusterService similarityClusterService;
  private final InconsistencyRanker ranker;

  public DetectionResult detect(TabularDataset dataset, String column) {
    if (!dataset.hasColumn(column)) {
      throw new ColumnNotFoundException(column);
    }
    return detect(column, dataset.columnValues(column));
  }

  /**
   * Returns the cached result when {@code cache} already holds this column and dataset version;
   * otherwise analyzes and returns a new cache value holding the fresh result.
   */
  public AnalysisCache detect(
      AnalysisCache cache, TabularDataset dataset, String column, String datasetVersion) {
    String key = AnalysisCache.keyOf(column, datasetVersion);
    if (cache != null && cache.holds(key)) {
      log.debug("Reusing cached analysis for {}", key);
      return cache;
    }
    return new AnalysisCache(key, detect(dataset, column));
  }

  public DetectionResult detect(String column, List<String> values) {
    long startTime = System.currentTimeMillis();
    FrequencyTable frequencies = frequencyAnalyzer.analyze(values);

    log.info(
        "Detecting inconsistencies in column '{}': {} values, {} distinct",
        column,
        frequencies.totalCount(),
        frequencies.distinctCount());

    List<InconsistencyCandidate> canonical = groupingService.group(column, frequencies);
    Set<String> proposed = new HashSet<>();
    canonical.forEach(candidate -> proposed.add(candidate.getOriginalValue()));

    DetectionResult.DetectionResultBuilder result =
        DetectionResult.builder()
            .column(column)
            .analyzedValues(frequencies.totalCount())
            .distinctValues(frequencies.distinctCount());

    List<String> eligible = similarityClusterService.eligibleValues(frequencies, proposed);
    List<InconsistencyCandidate> similar;
    if (similarityClusterService.exceedsLimit(eligible.size())) {
      AnalysisWarning warning =
          AnalysisWarning.similaritySkipped(eligible.size(), similarityClusterService.getLimit());
      log.warn("Column '{}': {}", column, warning.getMessage());
      result.warning(warning);
      similar = Collections.emptyList();
    } else {
      similar = similarityClusterService.cluster(column, frequencies, eligible);
    }

    List<InconsistencyCandidate> ranked = ranker.rank(canonical, similar);
    log.info(
        "Column '{}': {} candidates ({} canonical, {} similar) in {} ms",
        column,
        ranked.size(),
        canonical.size(),
        similar.size(),
        System.currentTimeMillis() - startTime);

    return result.candidates(ranked).build();
  }
}

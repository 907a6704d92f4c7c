package com.dataprep.standardizer.service.profile;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.dataprep.standardizer.config.StandardizerProperties;
import com.dataprep.standardizer.dto.analysis.ColumnProfile;
import com.dataprep.standardizer.exception.ColumnNotFoundException;
import com.dataprep.standardizer.service.dataset.TabularDataset;
import com.dataprep.standardizer.service.pattern.PatternClassifier;
import com.dataprep.standardizer.service.pattern.PatternFamily;
import com.dataprep.standardizer.service.pattern.PatternMatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Summary statistics and a dominant-family recommendation for a single column. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ColumnProfileService {

  private final PatternClassifier classifier;
  private final StandardizerProperties properties;

  public ColumnProfile profile(TabularDataset dataset, String column) {
    if (!dataset.hasColumn(column)) {
      throw new ColumnNotFoundException(column);
    }
    List<String> values = dataset.columnValues(column);
    Set<String> unique = new HashSet<>(values);

    double threshold = properties.getConfidenceThreshold();
    Set<PatternFamily> detected = EnumSet.noneOf(PatternFamily.class);
    for (String value : unique) {
      PatternMatch match = classifier.classify(value);
      if (match.isAbove(threshold)) {
        detected.add(match.getFamily());
      }
    }

    ColumnProfile profile =
        ColumnProfile.builder()
            .column(column)
            .totalValues(values.size())
            .uniqueValues(unique.size())
            .nullValues(dataset.rowCount() - values.size())
            .duplicateValues(values.size() - unique.size())
            .detectedPatterns(
                detected.stream().map(PatternFamily::getDisplayName).collect(Collectors.toList()))
            .recommendedType(recommendType(values))
            .build();

    log.debug("Profiled column '{}': {}", column, profile);
    return profile;
  }

  /**
   * Names the family covering more than the configured share of the leading sample, or {@value
   * ColumnProfile#MIXED} when no family dominates.
   */
  public String recommendType(List<String> values) {
    int sampleSize = Math.min(values.size(), properties.getRecommendation().getSampleSize());
    if (sampleSize == 0) {
      return ColumnProfile.MIXED;
    }

    double threshold = properties.getConfidenceThreshold();
    Map<PatternFamily, Integer> counts = new EnumMap<>(PatternFamily.class);
    for (String value : values.subList(0, sampleSize)) {
      PatternMatch match = classifier.classify(value);
      if (match.isAbove(threshold)) {
        counts.merge(match.getFamily(), 1, Integer::sum);
      }
    }

    PatternFamily dominant = null;
    int dominantCount = 0;
    for (Map.Entry<PatternFamily, Integer> entry : counts.entrySet()) {
      if (entry.getValue() > dominantCount) {
        dominant = entry.getKey();
        dominantCount = entry.getValue();
      }
    }

    if (dominant != null
        && dominantCount > sampleSize * properties.getRecommendation().getDominanceRatio()) {
      return dominant.getDisplayName();
    }
    return ColumnProfile.MIXED;
  }
}

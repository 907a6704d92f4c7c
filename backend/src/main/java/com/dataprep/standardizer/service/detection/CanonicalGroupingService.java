package com.dataprep.standardizer.service.detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.dataprep.standardizer.config.StandardizerProperties;
import com.dataprep.standardizer.dto.analysis.InconsistencyCandidate;
import com.dataprep.standardizer.service.pattern.PatternClassifier;
import com.dataprep.standardizer.service.pattern.PatternFamily;
import com.dataprep.standardizer.service.pattern.PatternMatch;
import com.dataprep.standardizer.service.pattern.ValueCanonicalizer;

import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Buckets distinct values by {@code (family, canonical form)} and proposes the canonical form for
 * every value that is not already written that way.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CanonicalGroupingService {

  private final PatternClassifier classifier;
  private final ValueCanonicalizer canonicalizer;
  private final StandardizerProperties properties;

  public List<InconsistencyCandidate> group(String column, FrequencyTable frequencies) {
    Map<GroupKey, List<String>> groups = new LinkedHashMap<>();
    double threshold = properties.getConfidenceThreshold();

    for (String value : frequencies.distinctValues()) {
      PatternMatch match = classifier.classify(value);
      if (!match.isAbove(threshold)) {
        continue;
      }
      String canonical = canonicalizer.canonicalize(value, match.getFamily());
      if (canonical.equals(value)) {
        continue;
      }
      groups
          .computeIfAbsent(new GroupKey(match.getFamily(), canonical), key -> new ArrayList<>())
          .add(value);
    }

    List<InconsistencyCandidate> candidates = new ArrayList<>();
    groups.forEach(
        (key, members) -> {
          members.sort(Comparator.comparingInt(frequencies::countOf).reversed());
          for (String member : members) {
            candidates.add(
                InconsistencyCandidate.builder()
                    .column(column)
                    .originalValue(member)
                    .occurrenceCount(frequencies.countOf(member))
                    .standardizedValue(key.getCanonicalForm())
                    .patternFamily(key.getFamily().getDisplayName())
                    .build());
          }
        });

    log.debug(
        "Column '{}': {} canonical groups yielded {} candidates",
        column,
        groups.size(),
        candidates.size());
    return candidates;
  }

  @Value
  private static class GroupKey {
    PatternFamily family;
    String canonicalForm;
  }
}

package com.dataprep.standardizer.service.detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.dataprep.standardizer.config.StandardizerProperties;
import com.dataprep.standardizer.dto.analysis.InconsistencyCandidate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback pass for near-duplicates no pattern family canonicalizes: every pair of eligible values
 * is compared once by normalized edit distance, and the less frequent member of a similar pair is
 * proposed to become the more frequent one.
 *
 * <p>Cost is {@code O(U^2 * L)} for {@code U} eligible values of average length {@code L}; callers
 * must check {@link #exceedsLimit(int)} before running it on large columns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SimilarityClusterService {

  private final StandardizerProperties properties;
  private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

  /**
   * Values eligible for clustering: every distinct value not already proposed by canonical
   * grouping, ordered by descending count and then lexicographically.
   */
  public List<String> eligibleValues(FrequencyTable frequencies, Set<String> alreadyProposed) {
    List<String> eligible = new ArrayList<>();
    for (String value : frequencies.distinctValues()) {
      if (!alreadyProposed.contains(value)) {
        eligible.add(value);
      }
    }
    eligible.sort(
        Comparator.comparingInt(frequencies::countOf)
            .reversed()
            .thenComparing(Comparator.naturalOrder()));
    return eligible;
  }

  public boolean exceedsLimit(int eligibleCount) {
    return eligibleCount > properties.getSimilarityMaxDistinctValues();
  }

  public int getLimit() {
    return properties.getSimilarityMaxDistinctValues();
  }

  /**
   * @param eligible values ordered as returned by {@link #eligibleValues}; for {@code i < j} the
   *     value at {@code i} wins any pairing
   */
  public List<InconsistencyCandidate> cluster(
      String column, FrequencyTable frequencies, List<String> eligible) {
    double threshold = properties.getSimilarityThreshold();
    Set<String> proposed = new HashSet<>();
    List<InconsistencyCandidate> candidates = new ArrayList<>();
    long comparisons = 0;

    for (int i = 0; i < eligible.size(); i++) {
      String winner = eligible.get(i);
      for (int j = i + 1; j < eligible.size(); j++) {
        String loser = eligible.get(j);
        if (proposed.contains(loser)) {
          continue;
        }
        comparisons++;
        if (similarity.calculate(winner, loser) > threshold) {
          proposed.add(loser);
          candidates.add(
              InconsistencyCandidate.builder()
                  .column(column)
                  .originalValue(loser)
                  .occurrenceCount(frequencies.countOf(loser))
                  .standardizedValue(winner)
                  .patternFamily(InconsistencyCandidate.SIMILAR_FORMAT)
                  .build());
        }
      }
    }

    log.debug(
        "Column '{}': {} similarity comparisons over {} values yielded {} candidates",
        column,
        comparisons,
        eligible.size(),
        candidates.size());
    return candidates;
  }
}

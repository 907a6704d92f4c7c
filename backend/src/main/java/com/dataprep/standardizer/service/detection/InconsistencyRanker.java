package com.dataprep.standardizer.service.detection;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.dataprep.standardizer.dto.analysis.InconsistencyCandidate;

/**
 * Merges canonical and similarity candidates into one list: at most one entry per original value
 * (canonical entries win), no-op entries dropped, ordered by descending occurrence count then
 * original value.
 */
@Service
public class InconsistencyRanker {

  static final Comparator<InconsistencyCandidate> RANKING =
      Comparator.comparingInt(InconsistencyCandidate::getOccurrenceCount)
          .reversed()
          .thenComparing(InconsistencyCandidate::getOriginalValue);

  public List<InconsistencyCandidate> rank(
      List<InconsistencyCandidate> canonical, List<InconsistencyCandidate> similar) {
    Map<String, InconsistencyCandidate> byOriginal = new LinkedHashMap<>();
    addAll(byOriginal, canonical);
    addAll(byOriginal, similar);

    List<InconsistencyCandidate> ranked = new ArrayList<>(byOriginal.values());
    ranked.sort(RANKING);
    return ranked;
  }

  private void addAll(
      Map<String, InconsistencyCandidate> byOriginal, List<InconsistencyCandidate> candidates) {
    if (candidates == null) {
      return;
    }
    for (InconsistencyCandidate candidate : candidates) {
      if (candidate.getOriginalValue() == null
          || candidate.getOriginalValue().equals(candidate.getStandardizedValue())) {
        continue;
      }
      byOriginal.putIfAbsent(candidate.getOriginalValue(), candidate);
    }
  }
}

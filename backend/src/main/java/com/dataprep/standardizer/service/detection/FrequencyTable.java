package com.dataprep.standardizer.service.detection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Occurrence count per distinct value, in first-seen order. */
@ToString
@EqualsAndHashCode
public final class FrequencyTable {

  private final Map<String, Integer> counts;
  private final int totalCount;

  FrequencyTable(LinkedHashMap<String, Integer> counts) {
    this.counts = Collections.unmodifiableMap(counts);
    this.totalCount = counts.values().stream().mapToInt(Integer::intValue).sum();
  }

  public int countOf(String value) {
    return counts.getOrDefault(value, 0);
  }

  public boolean contains(String value) {
    return counts.containsKey(value);
  }

  public List<String> distinctValues() {
    return new ArrayList<>(counts.keySet());
  }

  public int distinctCount() {
    return counts.size();
  }

  /** Sum of all counts; equals the number of non-empty cells analyzed. */
  public int totalCount() {
    return totalCount;
  }

  public Map<String, Integer> asMap() {
    return counts;
  }
}

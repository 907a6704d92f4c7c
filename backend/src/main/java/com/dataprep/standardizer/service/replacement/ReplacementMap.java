package com.dataprep.standardizer.service.replacement;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.dataprep.standardizer.dto.analysis.InconsistencyCandidate;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Operator-approved mapping of original value to standardized value. Immutable; the editing
 * methods return new maps.
 */
@ToString
@EqualsAndHashCode
public final class ReplacementMap {

  private static final ReplacementMap EMPTY = new ReplacementMap(new LinkedHashMap<>());

  private final Map<String, String> entries;

  private ReplacementMap(LinkedHashMap<String, String> entries) {
    this.entries = Collections.unmodifiableMap(entries);
  }

  public static ReplacementMap empty() {
    return EMPTY;
  }

  public static ReplacementMap of(Map<String, String> replacements) {
    LinkedHashMap<String, String> copy = new LinkedHashMap<>();
    if (replacements != null) {
      replacements.forEach((original, standardized) -> put(copy, original, standardized));
    }
    return new ReplacementMap(copy);
  }

  /** Accepts every given candidate's proposal. */
  public static ReplacementMap fromCandidates(Collection<InconsistencyCandidate> candidates) {
    LinkedHashMap<String, String> copy = new LinkedHashMap<>();
    for (InconsistencyCandidate candidate : candidates) {
      put(copy, candidate.getOriginalValue(), candidate.getStandardizedValue());
    }
    return new ReplacementMap(copy);
  }

  public ReplacementMap with(String original, String standardized) {
    LinkedHashMap<String, String> copy = new LinkedHashMap<>(entries);
    put(copy, original, standardized);
    return new ReplacementMap(copy);
  }

  public ReplacementMap without(String original) {
    if (!entries.containsKey(original)) {
      return this;
    }
    LinkedHashMap<String, String> copy = new LinkedHashMap<>(entries);
    copy.remove(original);
    return new ReplacementMap(copy);
  }

  /** The standardized value for {@code original}, or null when it is not being replaced. */
  public String lookup(String original) {
    return entries.get(original);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  public Map<String, String> asMap() {
    return entries;
  }

  private static void put(Map<String, String> target, String original, String standardized) {
    if (original == null || standardized == null) {
      throw new IllegalArgumentException("Replacement entries must not be null");
    }
    target.put(original, standardized);
  }
}

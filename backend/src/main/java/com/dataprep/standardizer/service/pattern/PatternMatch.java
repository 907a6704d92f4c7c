package com.dataprep.standardizer.service.pattern;

import lombok.Value;

/** Classification outcome for a single value. */
@Value
public class PatternMatch {

  PatternFamily family;
  double confidence;

  public static PatternMatch of(PatternFamily family) {
    return new PatternMatch(family, family.getBaseConfidence());
  }

  /** Whether this match is strong enough to drive canonicalization. */
  public boolean isAbove(double threshold) {
    return confidence > threshold;
  }
}

package com.dataprep.standardizer.service.pattern;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Assigns a raw column value to the first {@link PatternFamily} whose shape it satisfies. Never
 * fails: values that match no specific family resolve to {@link PatternFamily#TEXT}.
 */
@Slf4j
@Service
public class PatternClassifier {

  public PatternMatch classify(String value) {
    String trimmed = value == null ? "" : value.trim();
    for (PatternFamily family : PatternFamily.values()) {
      if (family.matches(trimmed)) {
        if (log.isTraceEnabled()) {
          log.trace("Classified '{}' as {}", trimmed, family.getDisplayName());
        }
        return PatternMatch.of(family);
      }
    }
    return PatternMatch.of(PatternFamily.TEXT);
  }
}

package com.dataprep.standardizer.service.pattern;

import org.springframework.stereotype.Service;

/**
 * Produces the standardized textual form of a value for a given family. Rules are deterministic and
 * idempotent; a value the family's rule cannot interpret is returned unchanged.
 */
@Service
public class ValueCanonicalizer {

  public String canonicalize(String value, PatternFamily family) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    if (family == null) {
      return trimmed;
    }
    return family.canonicalize(trimmed);
  }
}

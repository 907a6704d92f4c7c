package com.dataprep.standardizer.service.detection;

import java.util.LinkedHashMap;
import java.util.List;

import org.springframework.stereotype.Service;

import com.dataprep.standardizer.exception.InsufficientDataException;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
public class FrequencyAnalyzer {

  /**
   * Tabulates occurrences of each distinct trimmed, non-empty value.
   *
   * @throws InsufficientDataException when no value remains or only one distinct value does
   */
  public FrequencyTable analyze(List<String> values) {
    LinkedHashMap<String, Integer> counts = new LinkedHashMap<>();
    int nonEmpty = 0;
    if (values != null) {
      for (String value : values) {
        if (value == null) {
          continue;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
          continue;
        }
        counts.merge(trimmed, 1, Integer::sum);
        nonEmpty++;
      }
    }

    if (nonEmpty == 0) {
      throw new InsufficientDataException("No non-empty values to analyze", 0, 0);
    }
    if (counts.size() < 2) {
      throw new InsufficientDataException(
          "At least two distinct values are needed to detect inconsistencies",
          nonEmpty,
          counts.size());
    }

    log.debug("Frequency table built: {} values, {} distinct", nonEmpty, counts.size());
    return new FrequencyTable(counts);
  }
}

package com.dataprep.standardizer.service.replacement;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.dataprep.standardizer.exception.ColumnNotFoundException;
import com.dataprep.standardizer.service.dataset.TabularDataset;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies an approved {@link ReplacementMap} to one column and returns a new dataset. The input is
 * never modified: rewritten rows are copies, untouched rows are shared.
 */
@Slf4j
@Service
public class ReplacementService {

  public ReplacementResult apply(
      TabularDataset dataset, String column, ReplacementMap replacements) {
    if (!dataset.hasColumn(column)) {
      throw new ColumnNotFoundException(column);
    }
    if (replacements == null || replacements.isEmpty()) {
      return new ReplacementResult(TabularDataset.of(dataset.getColumns(), dataset.getRows()), 0);
    }

    List<Map<String, Object>> rows = new ArrayList<>(dataset.rowCount());
    int replaced = 0;
    for (Map<String, Object> row : dataset.getRows()) {
      String standardized = replacementFor(row, column, replacements);
      if (standardized == null) {
        rows.add(row);
        continue;
      }
      Map<String, Object> rewritten = new LinkedHashMap<>(row);
      rewritten.put(column, standardized);
      rows.add(rewritten);
      replaced++;
    }

    log.info(
        "Applied {} replacements to column '{}': {} of {} cells rewritten",
        replacements.size(),
        column,
        replaced,
        dataset.rowCount());
    return new ReplacementResult(TabularDataset.of(dataset.getColumns(), rows), replaced);
  }

  // Detection keys values by their trimmed text, so lookups do the same.
  private String replacementFor(Map<String, Object> row, String column, ReplacementMap map) {
    if (row == null) {
      return null;
    }
    Object cell = row.get(column);
    if (cell == null) {
      return null;
    }
    return map.lookup(cell.toString().trim());
  }
}

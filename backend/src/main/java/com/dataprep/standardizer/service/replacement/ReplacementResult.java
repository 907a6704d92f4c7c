package com.dataprep.standardizer.service.replacement;

import com.dataprep.standardizer.service.dataset.TabularDataset;

import lombok.Value;

@Value
public class ReplacementResult {

  TabularDataset dataset;

  /** Number of cells whose value was rewritten. */
  int replacedCells;
}

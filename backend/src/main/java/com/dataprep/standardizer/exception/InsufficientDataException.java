package com.dataprep.standardizer.exception;

import lombok.Getter;

/**
 * Signals that a column holds nothing to standardize: no non-empty values, or a single distinct
 * value. Callers should present this as "no inconsistencies", not as a failure.
 */
@Getter
public class InsufficientDataException extends RuntimeException {

  private final int nonEmptyValues;
  private final int distinctValues;

  public InsufficientDataException(String message, int nonEmptyValues, int distinctValues) {
    super(message);
    this.nonEmptyValues = nonEmptyValues;
    this.distinctValues = distinctValues;
  }
}

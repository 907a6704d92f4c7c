package com.dataprep.standardizer.exception;

import lombok.Getter;

@Getter
public class ColumnNotFoundException extends RuntimeException {

  private final String column;

  public ColumnNotFoundException(String column) {
    super(String.format("Column '%s' not found in dataset", column));
    this.column = column;
  }
}

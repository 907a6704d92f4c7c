package com.dataprep.standardizer.exception;

/** Raised when the result of a superseded or timed-out background analysis is requested. */
public class AnalysisCancelledException extends RuntimeException {

  public AnalysisCancelledException(String message) {
    super(message);
  }

  public AnalysisCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}

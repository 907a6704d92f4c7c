package com.dataprep.standardizer.service.task;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.dataprep.standardizer.exception.AnalysisCancelledException;
import com.dataprep.standardizer.service.detection.DetectionResult;

import lombok.Getter;

/**
 * Caller-side handle on a background detection run. Cancelling is advisory: the computation may
 * still finish, but its result is never handed out.
 */
public class AnalysisHandle {

  @Getter private final String analysisKey;
  private final CompletableFuture<DetectionResult> future;

  AnalysisHandle(String analysisKey, CompletableFuture<DetectionResult> future) {
    this.analysisKey = analysisKey;
    this.future = future;
  }

  public void cancel() {
    future.cancel(false);
  }

  public boolean isCancelled() {
    return future.isCancelled();
  }

  public boolean isDone() {
    return future.isDone();
  }

  /**
   * Waits for the result.
   *
   * @throws AnalysisCancelledException if the run was superseded, cancelled or did not finish in
   *     time
   */
  public DetectionResult await(Duration timeout) {
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (CancellationException e) {
      throw new AnalysisCancelledException(
          String.format("Analysis '%s' was superseded by a newer request", analysisKey), e);
    } catch (TimeoutException e) {
      cancel();
      throw new AnalysisCancelledException(
          String.format("Analysis '%s' did not finish within %s", analysisKey, timeout), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AnalysisCancelledException(
          String.format("Interrupted while waiting for analysis '%s'", analysisKey), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException("Analysis failed: " + analysisKey, cause);
    }
  }
}

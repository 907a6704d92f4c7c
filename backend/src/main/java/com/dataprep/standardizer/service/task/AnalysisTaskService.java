package com.dataprep.standardizer.service.task;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.dataprep.standardizer.service.dataset.TabularDataset;
import com.dataprep.standardizer.service.detection.DetectionResult;
import com.dataprep.standardizer.service.detection.InconsistencyDetectionService;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs detection on the analysis executor so the quadratic similarity pass stays off request
 * threads. Submitting a new analysis under a key cancels the one already running under that key.
 */
@Slf4j
@Service
public class AnalysisTaskService {

  private final InconsistencyDetectionService detectionService;
  private final Executor executor;
  private final Map<String, AnalysisHandle> inFlight = new ConcurrentHashMap<>();

  public AnalysisTaskService(
      InconsistencyDetectionService detectionService,
      @Qualifier("analysisExecutor") Executor executor) {
    this.detectionService = detectionService;
    this.executor = executor;
  }

  public AnalysisHandle submit(String analysisKey, TabularDataset dataset, String column) {
    Map<String, String> mdcContext = MDC.getCopyOfContextMap();

    CompletableFuture<DetectionResult> future =
        CompletableFuture.supplyAsync(
            () -> {
              if (mdcContext != null) {
                MDC.setContextMap(mdcContext);
              }
              try {
                return detectionService.detect(dataset, column);
              } finally {
                MDC.clear();
              }
            },
            executor);

    AnalysisHandle handle = new AnalysisHandle(analysisKey, future);
    AnalysisHandle previous = inFlight.put(analysisKey, handle);
    if (previous != null && !previous.isDone()) {
      log.info("Superseding running analysis '{}'", analysisKey);
      previous.cancel();
    }
    future.whenComplete((result, error) -> inFlight.remove(analysisKey, handle));
    return handle;
  }

  public int inFlightCount() {
    return inFlight.size();
  }
}

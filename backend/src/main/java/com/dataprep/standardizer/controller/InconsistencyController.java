package com.dataprep.standardizer.controller;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.dataprep.standardizer.config.StandardizerProperties;
import com.dataprep.standardizer.dto.analysis.ColumnAnalysisRequest;
import com.dataprep.standardizer.dto.analysis.ColumnProfile;
import com.dataprep.standardizer.dto.analysis.InconsistencyDetectionResponse;
import com.dataprep.standardizer.dto.analysis.InconsistencyDetectionResponse.ProcessingMetadata;
import com.dataprep.standardizer.dto.replacement.ReplacementRequest;
import com.dataprep.standardizer.dto.replacement.ReplacementResponse;
import com.dataprep.standardizer.exception.InsufficientDataException;
import com.dataprep.standardizer.service.dataset.TabularDataset;
import com.dataprep.standardizer.service.detection.DetectionResult;
import com.dataprep.standardizer.service.profile.ColumnProfileService;
import com.dataprep.standardizer.service.replacement.ReplacementMap;
import com.dataprep.standardizer.service.replacement.ReplacementResult;
import com.dataprep.standardizer.service.replacement.ReplacementService;
import com.dataprep.standardizer.service.task.AnalysisHandle;
import com.dataprep.standardizer.service.task.AnalysisTaskService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(
    name = "Format Standardization",
    description = "Detection and repair of inconsistently formatted column values")
public class InconsistencyController {

  static final String NO_INCONSISTENCIES_MESSAGE = "No format inconsistencies found in this column";

  private final AnalysisTaskService analysisTaskService;
  private final ColumnProfileService columnProfileService;
  private final ReplacementService replacementService;
  private final StandardizerProperties properties;

  @PostMapping(
      value = "/inconsistencies/detect",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Detect inconsistent formats",
      description =
          "Classifies every distinct value of one column, proposes canonical forms and clusters near-duplicates")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Candidates detected (possibly none)",
            content =
                @Content(schema = @Schema(implementation = InconsistencyDetectionResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(responseCode = "404", description = "Column not found", content = @Content),
        @ApiResponse(
            responseCode = "409",
            description = "Superseded by a newer analysis",
            content = @Content)
      })
  public ResponseEntity<InconsistencyDetectionResponse> detect(
      @Valid @RequestBody ColumnAnalysisRequest request) {
    long startTime = System.currentTimeMillis();
    String column = request.getColumn();
    log.info(
        "[INCONSISTENCY-CONTROLLER] Detect request for column '{}' over {} rows",
        column,
        request.getData().size());

    TabularDataset dataset = TabularDataset.of(request.getColumns(), request.getData());
    ColumnProfile profile = columnProfileService.profile(dataset, column);

    String analysisKey =
        request.getAnalysisKey() != null
            ? request.getAnalysisKey()
            : UUID.randomUUID().toString();
    AnalysisHandle handle = analysisTaskService.submit(analysisKey, dataset, column);

    InconsistencyDetectionResponse.InconsistencyDetectionResponseBuilder response =
        InconsistencyDetectionResponse.builder().column(column).columnProfile(profile);
    try {
      DetectionResult result =
          handle.await(Duration.ofSeconds(properties.getAnalysis().getTimeoutSeconds()));
      response
          .candidates(result.getCandidates())
          .warnings(result.getWarnings())
          .message(
              result.getCandidates().isEmpty()
                  ? NO_INCONSISTENCIES_MESSAGE
                  : String.format(
                      "Found %d format inconsistencies that can be standardized",
                      result.getCandidates().size()))
          .processingMetadata(
              metadata(
                  dataset,
                  result.getAnalyzedValues(),
                  result.getDistinctValues(),
                  startTime));
    } catch (InsufficientDataException e) {
      log.info("[INCONSISTENCY-CONTROLLER] Nothing to analyze in '{}': {}", column, e.getMessage());
      response
          .candidates(Collections.emptyList())
          .warnings(Collections.emptyList())
          .message(NO_INCONSISTENCIES_MESSAGE)
          .processingMetadata(
              metadata(dataset, e.getNonEmptyValues(), e.getDistinctValues(), startTime));
    }
    return ResponseEntity.ok(response.build());
  }

  @PostMapping(
      value = "/inconsistencies/apply",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Apply approved replacements",
      description = "Returns a copy of the dataset with the column's matching values substituted")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Replacements applied"),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(responseCode = "404", description = "Column not found", content = @Content)
      })
  public ResponseEntity<ReplacementResponse> apply(
      @Valid @RequestBody ReplacementRequest request) {
    log.info(
        "[INCONSISTENCY-CONTROLLER] Applying {} replacements to column '{}'",
        request.getReplacements().size(),
        request.getColumn());

    ReplacementResult result =
        replacementService.apply(
            TabularDataset.of(request.getColumns(), request.getData()),
            request.getColumn(),
            ReplacementMap.of(request.getReplacements()));

    return ResponseEntity.ok(
        ReplacementResponse.builder()
            .column(request.getColumn())
            .columns(result.getDataset().getColumns())
            .data(result.getDataset().getRows())
            .replacedCells(result.getReplacedCells())
            .build());
  }

  @PostMapping(
      value = "/inconsistencies/profile",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Profile a column",
      description = "Value counts, detected pattern families and a recommended column type")
  public ResponseEntity<ColumnProfile> profile(@Valid @RequestBody ColumnAnalysisRequest request) {
    return ResponseEntity.ok(
        columnProfileService.profile(
            TabularDataset.of(request.getColumns(), request.getData()), request.getColumn()));
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the service is healthy")
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }

  private ProcessingMetadata metadata(
      TabularDataset dataset, int analyzedValues, int distinctValues, long startTime) {
    return ProcessingMetadata.builder()
        .totalRows(dataset.rowCount())
        .analyzedValues(analyzedValues)
        .distinctValues(distinctValues)
        .processingTimeMs(System.currentTimeMillis() - startTime)
        .build();
  }
}

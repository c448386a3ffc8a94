package com.ospicorp.nitrateforecast.pipeline.controller;

import com.ospicorp.nitrateforecast.config.PipelineConfig;
import com.ospicorp.nitrateforecast.evaluation.model.EvaluationReport;
import com.ospicorp.nitrateforecast.features.model.LaggedFeatureTable;
import com.ospicorp.nitrateforecast.pipeline.model.CorrelationResponse;
import com.ospicorp.nitrateforecast.pipeline.model.FeatureTableResponse;
import com.ospicorp.nitrateforecast.pipeline.model.PipelineRequest;
import com.ospicorp.nitrateforecast.pipeline.service.ForecastPipelineService;
import com.ospicorp.nitrateforecast.series.model.RawSeries;
import com.ospicorp.nitrateforecast.series.model.SeriesInspection;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@Validated
@Tag(name = "Pipeline")
public class PipelineController {
  private static final MediaType CSV_MEDIA_TYPE = CsvHttpMessageConverter.TEXT_CSV;

  private final ForecastPipelineService pipeline;

  public PipelineController(ForecastPipelineService pipeline) {
    this.pipeline = pipeline;
  }

  @PostMapping("/series/inspections")
  @Tag(name = "Series")
  @Operation(summary = "Inspect raw series",
      description = "Row counts, coverage, duplicate timestamps, sampling interval and state labels per series.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "One summary per series",
          content = @Content(mediaType = "application/json",
              array = @ArraySchema(schema = @Schema(implementation = SeriesInspection.class)))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<List<SeriesInspection>> inspect(@Valid @RequestBody PipelineRequest request) {
    PipelineConfig config = pipeline.resolve(request.config());
    List<RawSeries> series = pipeline.toRawSeries(request.series(), config);
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(pipeline.inspect(series));
  }

  @PostMapping("/features")
  @Tag(name = "Features")
  @Operation(summary = "Build the feature table",
      description = "Aligns every series onto the grid, fills gaps per policy and adds the configured lag columns.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Feature table",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = FeatureTableResponse.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> features(@Valid @RequestBody PipelineRequest request,
      @RequestParam(name = "format", required = false)
      @Parameter(description = "json or csv; overrides the Accept header") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    PipelineConfig config = pipeline.resolve(request.config());
    LaggedFeatureTable table = pipeline.buildFeatures(
        pipeline.toRawSeries(request.series(), config), config);
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE)
        ? table.toRows()
        : pipeline.describe(table, config);
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  @PostMapping("/correlations")
  @Tag(name = "Features")
  @Operation(summary = "Lag discovery",
      description = "Autocorrelation of the target and cross-correlation of every other variable over the configured lag range.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Correlation profiles",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = CorrelationResponse.class))),
      @ApiResponse(responseCode = "400", description = "Bad request",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<CorrelationResponse> correlations(
      @Valid @RequestBody PipelineRequest request) {
    PipelineConfig config = pipeline.resolve(request.config());
    CorrelationResponse body = pipeline.correlations(
        pipeline.toRawSeries(request.series(), config), config);
    return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(body);
  }

  @PostMapping("/evaluations")
  @Tag(name = "Evaluation")
  @Operation(summary = "Rolling-window evaluation",
      description = "Runs the full pipeline and scores out-of-sample forecasts window by window. Skipped windows are listed with their cause.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Evaluation report or its rows as CSV",
          content = {
              @Content(mediaType = "application/json",
                  schema = @Schema(implementation = EvaluationReport.class)),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid configuration or data layout",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = ProblemDetail.class)))
  })
  public ResponseEntity<?> evaluate(@Valid @RequestBody PipelineRequest request,
      @RequestParam(name = "format", required = false)
      @Parameter(description = "json or csv; overrides the Accept header") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    MediaType contentType = selectMediaType(format, accept);
    PipelineConfig config = pipeline.resolve(request.config());
    EvaluationReport report = pipeline.evaluate(
        pipeline.toRawSeries(request.series(), config), config);
    Object body = contentType.isCompatibleWith(CSV_MEDIA_TYPE) ? report.rows() : report;
    return ResponseEntity.ok().contentType(contentType).body(body);
  }

  static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CSV_MEDIA_TYPE;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new IllegalArgumentException("Invalid format value. Supported values: json,csv.");
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes = MediaType.parseMediaTypes(accept);
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CSV_MEDIA_TYPE)) {
        return CSV_MEDIA_TYPE;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}

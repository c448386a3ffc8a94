package com.ospicorp.nitrateforecast.pipeline.service;

import com.ospicorp.nitrateforecast.config.PipelineConfig;
import com.ospicorp.nitrateforecast.evaluation.model.EvaluationReport;
import com.ospicorp.nitrateforecast.evaluation.model.WindowOutcome;
import com.ospicorp.nitrateforecast.evaluation.service.MetricsReporter;
import com.ospicorp.nitrateforecast.evaluation.service.RollingEvaluator;
import com.ospicorp.nitrateforecast.features.model.CorrelationPoint;
import com.ospicorp.nitrateforecast.features.model.LagCandidate;
import com.ospicorp.nitrateforecast.features.model.LaggedFeatureTable;
import com.ospicorp.nitrateforecast.features.service.LagFeatureBuilder;
import com.ospicorp.nitrateforecast.forecast.service.ForecastModel;
import com.ospicorp.nitrateforecast.forecast.service.ForecastModelFactory;
import com.ospicorp.nitrateforecast.pipeline.model.ConfigOverrides;
import com.ospicorp.nitrateforecast.pipeline.model.CorrelationResponse;
import com.ospicorp.nitrateforecast.pipeline.model.FeatureTableResponse;
import com.ospicorp.nitrateforecast.pipeline.model.ObservationPayload;
import com.ospicorp.nitrateforecast.pipeline.model.SeriesPayload;
import com.ospicorp.nitrateforecast.series.model.AggregationPolicy;
import com.ospicorp.nitrateforecast.series.model.AlignedColumn;
import com.ospicorp.nitrateforecast.series.model.AlignedDataset;
import com.ospicorp.nitrateforecast.series.model.GapRun;
import com.ospicorp.nitrateforecast.series.model.RawObservation;
import com.ospicorp.nitrateforecast.series.model.RawSeries;
import com.ospicorp.nitrateforecast.series.model.SeriesInspection;
import com.ospicorp.nitrateforecast.series.model.TimeGrid;
import com.ospicorp.nitrateforecast.series.service.GapHandler;
import com.ospicorp.nitrateforecast.series.service.ObservationNormalizer;
import com.ospicorp.nitrateforecast.series.service.SeriesInspector;
import com.ospicorp.nitrateforecast.series.service.TimeGridAligner;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the stages in order: align, fill gaps, add lags, evaluate, report. Each stage receives the
 * resolved {@link PipelineConfig} explicitly.
 */
@Service
public class ForecastPipelineService {

  private static final Logger log = LoggerFactory.getLogger(ForecastPipelineService.class);

  private final PipelineConfig defaults;
  private final Executor executor;
  private final RollingEvaluator evaluator;
  private final ForecastModelFactory modelFactory;

  public ForecastPipelineService(PipelineConfig defaults,
      @Qualifier("forecastExecutor") Executor executor, RollingEvaluator evaluator,
      ForecastModelFactory modelFactory) {
    this.defaults = defaults;
    this.executor = executor;
    this.evaluator = evaluator;
    this.modelFactory = modelFactory;
  }

  public PipelineConfig defaults() {
    return defaults;
  }

  public PipelineConfig resolve(ConfigOverrides overrides) {
    return overrides == null ? defaults : overrides.applyTo(defaults);
  }

  public List<RawSeries> toRawSeries(List<SeriesPayload> payloads, PipelineConfig config) {
    List<RawSeries> out = new ArrayList<>(payloads.size());
    for (SeriesPayload payload : payloads) {
      List<RawObservation> observations = new ArrayList<>(payload.observations().size());
      for (ObservationPayload o : payload.observations()) {
        observations.add(ObservationNormalizer.normalize(
            ObservationNormalizer.parseTimestamp(o.timestamp()), o.value()));
      }
      AggregationPolicy aggregation;
      try {
        aggregation = payload.aggregation() != null
            ? AggregationPolicy.fromCode(payload.aggregation())
            : config.aggregationFor(payload.name(), AggregationPolicy.MEAN);
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("Unsupported aggregation for " + payload.name() + ": "
            + payload.aggregation() + ". Supported values: mean,sum,last-state.", ex);
      }
      boolean zeroWhenEmpty = payload.zeroWhenEmpty() != null
          ? payload.zeroWhenEmpty() : config.zeroWhenEmpty().contains(payload.name());
      Duration nativeStep = payload.nativeStepSeconds() == null
          ? null : Duration.ofSeconds(payload.nativeStepSeconds());
      out.add(new RawSeries(payload.name(), nativeStep, observations, aggregation,
          payload.unit(), zeroWhenEmpty));
    }
    return out;
  }

  public List<SeriesInspection> inspect(List<RawSeries> series) {
    return SeriesInspector.inspectAll(series);
  }

  /** Study period from the configuration, falling back to the data span on either side. */
  public TimeGrid grid(List<RawSeries> series, PipelineConfig config) {
    if (config.studyStart() != null && config.studyEnd() != null) {
      return TimeGridAligner.buildGrid(config.studyStart(), config.studyEnd(), config.gridStep());
    }
    TimeGrid covering = TimeGridAligner.gridCovering(series, config.gridStep());
    Instant start = config.studyStart() != null ? config.studyStart() : covering.start();
    Instant end = config.studyEnd() != null ? config.studyEnd() : covering.end();
    return TimeGridAligner.buildGrid(start, end, config.gridStep());
  }

  public AlignedDataset alignAndFill(List<RawSeries> series, PipelineConfig config) {
    long started = System.currentTimeMillis();
    TimeGrid grid = grid(series, config);
    AlignedDataset aligned = TimeGridAligner.alignAll(grid, series, executor);
    AlignedDataset filled = GapHandler.apply(aligned, config.gapPolicy());
    log.info("Aligned {} series onto {} rows of {} from {} in {} ms", series.size(), grid.size(),
        grid.step(), grid.start(), System.currentTimeMillis() - started);
    return filled;
  }

  public LaggedFeatureTable buildFeatures(List<RawSeries> series, PipelineConfig config) {
    AlignedDataset dataset = alignAndFill(series, config);
    LaggedFeatureTable table = LagFeatureBuilder.materializeLags(dataset, config.lagSpecs());
    log.info("Feature table has {} columns ({} lag features)", table.columnNames().size(),
        table.lagColumns().size());
    return table;
  }

  public FeatureTableResponse describe(LaggedFeatureTable table, PipelineConfig config) {
    Map<String, Integer> missingCounts = new LinkedHashMap<>();
    Map<String, List<GapRun>> unfilled = new LinkedHashMap<>();
    for (AlignedColumn column : table.dataset().columns().values()) {
      int missing = 0;
      for (int flag : GapHandler.missingIndicator(column)) {
        missing += flag;
      }
      missingCounts.put(column.name(), missing);
      List<GapRun> gaps = GapHandler.findGaps(column, config.gapPolicy());
      if (!gaps.isEmpty()) {
        unfilled.put(column.name(), gaps);
      }
    }
    List<Map<String, Object>> rows = table.toRows();
    List<String> columns = rows.isEmpty() ? List.of() : List.copyOf(rows.get(0).keySet());
    TimeGrid grid = table.grid();
    return new FeatureTableResponse(grid.start(), grid.end(), grid.step().getSeconds(),
        grid.size(), columns, missingCounts, unfilled, rows);
  }

  public CorrelationResponse correlations(List<RawSeries> series, PipelineConfig config) {
    AlignedDataset dataset = alignAndFill(series, config);
    String target = config.targetVariable();
    double[] y = dataset.column(target).toArray();
    List<CorrelationPoint> acf = LagFeatureBuilder.autocorrelation(y, config.lagRange().max(),
        config.lagRange());
    List<String> predictors = dataset.names().stream().filter(n -> !n.equals(target)).toList();
    Map<String, List<CorrelationPoint>> cross = new LinkedHashMap<>();
    List<LagCandidate> strongest = LagFeatureBuilder.strongestLags(dataset, target, predictors,
        config.lagRange(), executor);
    for (LagCandidate candidate : strongest) {
      cross.put(candidate.predictor(), candidate.profile());
    }
    log.info("Computed correlations for target {} against {} predictors over lags {}..{}",
        target, predictors.size(), config.lagRange().min(), config.lagRange().max());
    return new CorrelationResponse(target, acf, cross, strongest);
  }

  public EvaluationReport evaluate(List<RawSeries> series, PipelineConfig config) {
    return evaluate(buildFeatures(series, config), config);
  }

  public EvaluationReport evaluate(LaggedFeatureTable table, PipelineConfig config) {
    ForecastModel model = modelFactory.create(config);
    List<WindowOutcome> outcomes = evaluator.evaluate(table, config, model);
    EvaluationReport report = MetricsReporter.report(outcomes, config.alertThreshold());
    log.info("Evaluation finished: {} of {} windows scored, {} skipped, rmse={} mae={}",
        report.summary().evaluatedWindows(), report.summary().plannedWindows(),
        report.summary().skippedWindows(), report.summary().rmse(), report.summary().mae());
    return report;
  }
}

package com.ospicorp.nitrateforecast.pipeline.model;

import com.ospicorp.nitrateforecast.config.PipelineConfig;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Per-request configuration. Null fields keep the service defaults; every value goes through the
 * same builder and validation as {@code application.yml}.
 */
public record ConfigOverrides(
    Long gridStepSeconds,
    String studyStart,
    String studyEnd,
    Integer shortGapMaxSteps,
    Integer longGapMinSteps,
    String shortGapFill,
    String longGapFillPolicy,
    Integer longGapSeasonSteps,
    String lagRangeSteps,
    List<String> lagSpecs,
    String modelFamily,
    String modelOrders,
    String rollingMode,
    Integer trainWindowSteps,
    Integer forecastHorizonSteps,
    Integer stepAdvanceSteps,
    Double alertThreshold,
    String targetVariable,
    List<String> exogenousColumns,
    List<String> forecastKnownColumns,
    Integer maxIterations,
    Long windowTimeoutSeconds,
    Double intervalLevel,
    Integer minTrainingMarginSteps,
    Map<String, String> seriesPolicies,
    List<String> zeroWhenEmpty
) {

  public PipelineConfig applyTo(PipelineConfig defaults) {
    PipelineConfig.Builder b = defaults.toBuilder();
    if (gridStepSeconds != null) {
      b.gridStepSeconds(gridStepSeconds);
    }
    if (studyStart != null) {
      b.studyStart(studyStart);
    }
    if (studyEnd != null) {
      b.studyEnd(studyEnd);
    }
    if (shortGapMaxSteps != null) {
      b.shortGapMaxSteps(shortGapMaxSteps);
    }
    if (longGapMinSteps != null) {
      b.longGapMinSteps(longGapMinSteps);
    }
    if (shortGapFill != null) {
      b.shortGapFill(shortGapFill);
    }
    if (longGapFillPolicy != null) {
      b.longGapFillPolicy(longGapFillPolicy);
    }
    if (longGapSeasonSteps != null) {
      b.longGapSeasonSteps(longGapSeasonSteps);
    }
    if (lagRangeSteps != null) {
      b.lagRange(lagRangeSteps);
    }
    if (lagSpecs != null) {
      b.lagSpecs(lagSpecs);
    }
    if (modelFamily != null) {
      b.modelFamily(modelFamily);
    }
    if (modelOrders != null) {
      b.modelOrders(modelOrders);
    }
    if (rollingMode != null) {
      b.rollingMode(rollingMode);
    }
    if (trainWindowSteps != null) {
      b.trainWindowSteps(trainWindowSteps);
    }
    if (forecastHorizonSteps != null) {
      b.forecastHorizonSteps(forecastHorizonSteps);
    }
    if (stepAdvanceSteps != null) {
      b.stepAdvanceSteps(stepAdvanceSteps);
    }
    if (alertThreshold != null) {
      b.alertThreshold(alertThreshold);
    }
    if (targetVariable != null) {
      b.targetVariable(targetVariable);
    }
    if (exogenousColumns != null) {
      b.exogenousColumns(exogenousColumns);
    }
    if (forecastKnownColumns != null) {
      b.forecastKnownColumns(forecastKnownColumns);
    }
    if (maxIterations != null) {
      b.maxIterations(maxIterations);
    }
    if (windowTimeoutSeconds != null) {
      b.windowTimeout(Duration.ofSeconds(windowTimeoutSeconds));
    }
    if (intervalLevel != null) {
      b.intervalLevel(intervalLevel);
    }
    if (minTrainingMarginSteps != null) {
      b.minTrainingMarginSteps(minTrainingMarginSteps);
    }
    if (seriesPolicies != null) {
      b.seriesPolicies(seriesPolicies);
    }
    if (zeroWhenEmpty != null) {
      b.zeroWhenEmpty(zeroWhenEmpty);
    }
    return b.build();
  }
}

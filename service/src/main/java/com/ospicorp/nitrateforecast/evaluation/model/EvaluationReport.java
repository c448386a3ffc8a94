package com.ospicorp.nitrateforecast.evaluation.model;

import java.util.List;

public record EvaluationReport(
    List<EvaluationRow> rows,
    List<WindowMetrics> windows,
    List<HorizonMetrics> horizons,
    MetricsSummary summary,
    List<SkippedWindow> skipped,
    ModelFitSummary latestFit
) {

  public EvaluationReport {
    rows = List.copyOf(rows);
    windows = List.copyOf(windows);
    horizons = List.copyOf(horizons);
    skipped = List.copyOf(skipped);
  }
}

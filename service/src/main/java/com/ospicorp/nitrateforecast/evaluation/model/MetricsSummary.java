package com.ospicorp.nitrateforecast.evaluation.model;

import java.util.Map;

public record MetricsSummary(
    int plannedWindows,
    int evaluatedWindows,
    int skippedWindows,
    Map<String, Integer> skippedByCause,
    int scoredPoints,
    Double rmse,
    Double mae,
    Double bias,
    ClassificationMetrics classification
) {}

package com.ospicorp.nitrateforecast.evaluation.model;

import java.time.Instant;

/** Error figures are null when the window has no scored point. */
public record WindowMetrics(
    int windowIndex,
    Instant cutoff,
    int scoredPoints,
    Double rmse,
    Double mae,
    Double bias
) {}

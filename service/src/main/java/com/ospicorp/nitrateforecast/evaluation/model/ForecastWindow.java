package com.ospicorp.nitrateforecast.evaluation.model;

import java.time.Instant;

/**
 * One planned train/forecast cycle. Training covers rows {@code [trainStartIndex, cutoffIndex)},
 * the forecast covers {@code [cutoffIndex, cutoffIndex + horizon)}.
 */
public record ForecastWindow(
    int index,
    int trainStartIndex,
    int cutoffIndex,
    int horizon,
    Instant trainStart,
    Instant cutoff
) {

  public int trainingRows() {
    return cutoffIndex - trainStartIndex;
  }

  public int forecastEndIndex() {
    return cutoffIndex + horizon;
  }
}

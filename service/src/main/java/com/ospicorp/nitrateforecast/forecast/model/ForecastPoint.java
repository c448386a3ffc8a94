package com.ospicorp.nitrateforecast.forecast.model;

import java.time.Instant;

public record ForecastPoint(
    Instant timestamp,
    int horizonStep,
    double predicted,
    double lowerBound,
    double upperBound,
    Double realized
) {

  public ForecastPoint withRealized(Double value) {
    return new ForecastPoint(timestamp, horizonStep, predicted, lowerBound, upperBound, value);
  }

  public Double absoluteError() {
    return realized == null ? null : Math.abs(predicted - realized);
  }
}

package com.ospicorp.nitrateforecast.forecast.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

public record ForecastResult(List<ForecastPoint> points) {

  public ForecastResult {
    points = List.copyOf(points);
  }

  public ForecastResult withRealized(Function<Instant, Double> realized) {
    List<ForecastPoint> scored = new ArrayList<>(points.size());
    for (ForecastPoint p : points) {
      scored.add(p.withRealized(realized.apply(p.timestamp())));
    }
    return new ForecastResult(scored);
  }

  public int horizon() {
    return points.size();
  }
}

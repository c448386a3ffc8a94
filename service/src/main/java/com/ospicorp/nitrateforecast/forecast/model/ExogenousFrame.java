package com.ospicorp.nitrateforecast.forecast.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Exogenous values for the forecast horizon, one row per forecast timestamp. */
public record ExogenousFrame(List<Instant> timestamps, Map<String, double[]> columns) {

  public ExogenousFrame {
    timestamps = List.copyOf(timestamps);
    columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
  }

  public static ExogenousFrame empty(List<Instant> timestamps) {
    return new ExogenousFrame(timestamps, Map.of());
  }

  public int size() {
    return timestamps.size();
  }
}

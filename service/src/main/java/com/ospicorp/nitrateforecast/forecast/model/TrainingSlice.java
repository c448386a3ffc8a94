package com.ospicorp.nitrateforecast.forecast.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Copied rows of the feature table; missing cells are NaN. */
public record TrainingSlice(
    List<Instant> timestamps,
    Duration step,
    String target,
    double[] targetValues,
    Map<String, double[]> exogenous
) {

  public TrainingSlice {
    timestamps = List.copyOf(timestamps);
    if (targetValues.length != timestamps.size()) {
      throw new IllegalArgumentException("Target length does not match the slice timestamps");
    }
    for (var e : exogenous.entrySet()) {
      if (e.getValue().length != timestamps.size()) {
        throw new IllegalArgumentException("Exogenous column " + e.getKey()
            + " does not match the slice timestamps");
      }
    }
    exogenous = Collections.unmodifiableMap(new LinkedHashMap<>(exogenous));
  }

  public int size() {
    return timestamps.size();
  }

  public Instant lastTimestamp() {
    return timestamps.isEmpty() ? null : timestamps.get(timestamps.size() - 1);
  }
}

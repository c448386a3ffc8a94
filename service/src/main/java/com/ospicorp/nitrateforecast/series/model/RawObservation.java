package com.ospicorp.nitrateforecast.series.model;

import java.time.Instant;
import java.util.Objects;

// value is null for non-numeric readings; state keeps the text label when there is one
public record RawObservation(Instant timestamp, Double value, String state) {

  public RawObservation {
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public static RawObservation of(Instant timestamp, double value) {
    return new RawObservation(timestamp, value, null);
  }

  public boolean hasValue() {
    return value != null && !value.isNaN();
  }
}

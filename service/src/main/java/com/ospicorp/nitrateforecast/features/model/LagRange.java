package com.ospicorp.nitrateforecast.features.model;

import com.ospicorp.nitrateforecast.error.ConfigException;

/** Inclusive range of lags in grid steps. */
public record LagRange(int min, int max) {
  public static final LagRange DEFAULT = new LagRange(0, 72);

  public LagRange {
    if (min > max) {
      throw new ConfigException("Lag range min (" + min + ") exceeds max (" + max + ")");
    }
  }

  public boolean contains(int lag) {
    return lag >= min && lag <= max;
  }
}

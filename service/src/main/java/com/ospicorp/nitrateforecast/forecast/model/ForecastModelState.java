package com.ospicorp.nitrateforecast.forecast.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of one fit. Implementations are immutable; refitting produces a new state.
 */
public interface ForecastModelState {

  ModelFamily family();

  ModelOrders orders();

  List<String> exogenousColumns();

  double residualVariance();

  /** Timestamp of the last training row; forecasts start one step later. */
  Instant trainedThrough();

  Duration step();

  int observations();

  /** Named coefficients for reporting. */
  Map<String, Double> coefficients();
}

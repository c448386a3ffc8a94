package com.ospicorp.nitrateforecast.forecast.service;

import com.ospicorp.nitrateforecast.forecast.model.ForecastModelState;
import com.ospicorp.nitrateforecast.forecast.model.ModelFamily;
import com.ospicorp.nitrateforecast.forecast.model.ModelOrders;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

record SeasonalNaiveState(
    ModelOrders orders,
    double[] lastSeason,
    double residualVariance,
    Instant trainedThrough,
    Duration step,
    int observations
) implements ForecastModelState {

  @Override
  public ModelFamily family() {
    return ModelFamily.SEASONAL_NAIVE;
  }

  @Override
  public List<String> exogenousColumns() {
    return List.of();
  }

  @Override
  public Map<String, Double> coefficients() {
    return Map.of("sigma2", residualVariance);
  }
}

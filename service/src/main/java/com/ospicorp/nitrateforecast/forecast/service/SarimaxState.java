package com.ospicorp.nitrateforecast.forecast.service;

import com.ospicorp.nitrateforecast.forecast.model.ForecastModelState;
import com.ospicorp.nitrateforecast.forecast.model.ModelFamily;
import com.ospicorp.nitrateforecast.forecast.model.ModelOrders;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fitted regression-with-SARIMA-errors model.
 *
 * @param armaAr AR polynomial of the differenced error, φ(B)Φ(B^s)
 * @param armaMa MA polynomial θ(B)Θ(B^s)
 * @param fullAr armaAr multiplied by the differencing operators, applied to the undifferenced error
 * @param levelTail last {@code fullAr.length - 1} regression errors of the training slice
 * @param innovationTail last {@code armaMa.length - 1} one-step innovations
 */
record SarimaxState(
    ModelOrders orders,
    List<String> exogenousColumns,
    double intercept,
    double[] beta,
    double[] armaAr,
    double[] armaMa,
    double[] fullAr,
    double[] levelTail,
    double[] innovationTail,
    double residualVariance,
    Instant trainedThrough,
    Duration step,
    int observations,
    Map<String, Double> coefficients
) implements ForecastModelState {

  SarimaxState {
    exogenousColumns = List.copyOf(exogenousColumns);
    coefficients = Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
  }

  @Override
  public ModelFamily family() {
    return ModelFamily.SARIMAX;
  }
}

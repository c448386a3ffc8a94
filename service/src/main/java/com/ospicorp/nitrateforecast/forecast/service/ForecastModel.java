package com.ospicorp.nitrateforecast.forecast.service;

import com.ospicorp.nitrateforecast.forecast.model.ExogenousFrame;
import com.ospicorp.nitrateforecast.forecast.model.ForecastModelState;
import com.ospicorp.nitrateforecast.forecast.model.ForecastResult;
import com.ospicorp.nitrateforecast.forecast.model.ModelFamily;
import com.ospicorp.nitrateforecast.forecast.model.ModelOrders;
import com.ospicorp.nitrateforecast.forecast.model.ResidualDiagnostics;
import com.ospicorp.nitrateforecast.forecast.model.TrainingSlice;
import java.util.List;

/**
 * Seasonal time-series model with exogenous regressors.
 *
 * <p>Implementations hold configuration only. Everything learned from data lives in the
 * returned {@link ForecastModelState}, so a single instance may serve concurrent windows.
 */
public interface ForecastModel {

  ModelFamily family();

  /**
   * @throws com.ospicorp.nitrateforecast.error.InsufficientDataException slice shorter than the
   *     orders allow
   * @throws com.ospicorp.nitrateforecast.error.NonConvergenceException iteration budget spent
   * @throws com.ospicorp.nitrateforecast.error.FitException any other estimation failure
   */
  ForecastModelState fit(TrainingSlice slice, ModelOrders orders, List<String> exogenousColumns);

  /**
   * @throws com.ospicorp.nitrateforecast.error.HorizonMismatchException when the frame does not
   *     cover exactly {@code horizon} steps after the training slice
   */
  ForecastResult forecast(ForecastModelState state, int horizon, ExogenousFrame futureExogenous);

  ResidualDiagnostics diagnose(ForecastModelState state, TrainingSlice slice);
}

package com.ospicorp.nitrateforecast.forecast.service;

import com.ospicorp.nitrateforecast.error.HorizonMismatchException;
import com.ospicorp.nitrateforecast.error.ModelException;
import com.ospicorp.nitrateforecast.forecast.model.ExogenousFrame;
import com.ospicorp.nitrateforecast.forecast.model.ForecastModelState;
import java.time.Instant;

final class ForecastFrames {
  private ForecastFrames() {
  }

  static void requireAligned(ForecastModelState state, int horizon, ExogenousFrame frame) {
    if (horizon <= 0) {
      throw new HorizonMismatchException("Forecast horizon must be positive, got " + horizon);
    }
    if (frame == null || frame.size() != horizon) {
      throw new HorizonMismatchException("Exogenous frame has "
          + (frame == null ? 0 : frame.size()) + " rows for a horizon of " + horizon);
    }
    for (int h = 0; h < horizon; h++) {
      Instant expected = state.trainedThrough().plus(state.step().multipliedBy(h + 1L));
      if (!expected.equals(frame.timestamps().get(h))) {
        throw new HorizonMismatchException("Forecast row " + h + " is at "
            + frame.timestamps().get(h) + " but the training grid expects " + expected);
      }
    }
    for (String column : state.exogenousColumns()) {
      double[] values = frame.columns().get(column);
      if (values == null || values.length != horizon) {
        throw new HorizonMismatchException("Exogenous column " + column
            + " does not cover the forecast horizon");
      }
      for (int h = 0; h < horizon; h++) {
        if (!Double.isFinite(values[h])) {
          throw new ModelException("Exogenous column " + column + " has no value at "
              + frame.timestamps().get(h));
        }
      }
    }
  }
}

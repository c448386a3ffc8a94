package com.ospicorp.nitrateforecast.evaluation.model;

import com.ospicorp.nitrateforecast.forecast.model.ForecastResult;

/** Either a scored forecast with its fit, or the record of why the window was skipped. */
public record WindowOutcome(
    ForecastWindow window,
    ForecastResult result,
    ModelFitSummary fit,
    SkippedWindow skipped
) {

  public static WindowOutcome completed(ForecastWindow window, ForecastResult result,
      ModelFitSummary fit) {
    return new WindowOutcome(window, result, fit, null);
  }

  public static WindowOutcome skipped(ForecastWindow window, String cause, String message) {
    return new WindowOutcome(window, null, null,
        new SkippedWindow(window.index(), window.cutoff(), cause, message));
  }

  public boolean isSkipped() {
    return skipped != null;
  }
}

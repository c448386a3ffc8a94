package com.ospicorp.nitrateforecast.evaluation.service;

import com.ospicorp.nitrateforecast.config.PipelineConfig;
import com.ospicorp.nitrateforecast.config.PipelineConfig.RollingMode;
import com.ospicorp.nitrateforecast.error.ConfigException;
import com.ospicorp.nitrateforecast.evaluation.model.ForecastWindow;
import com.ospicorp.nitrateforecast.series.model.TimeGrid;
import java.util.ArrayList;
import java.util.List;

/**
 * Lays out every window before any fitting starts. Window w has its cutoff at row
 * {@code T + w*S}; the plan stops at the last window whose horizon still fits in the grid.
 */
public final class WindowPlanner {
  private WindowPlanner() {
  }

  public static int windowCount(int rows, int trainSteps, int horizonSteps, int advanceSteps) {
    if (rows < trainSteps + horizonSteps) {
      return 0;
    }
    return (rows - trainSteps - horizonSteps) / advanceSteps + 1;
  }

  public static List<ForecastWindow> plan(TimeGrid grid, PipelineConfig config) {
    int train = config.trainWindowSteps();
    int horizon = config.forecastHorizonSteps();
    int advance = config.stepAdvanceSteps();
    int count = windowCount(grid.size(), train, horizon, advance);
    if (count == 0) {
      throw new ConfigException("No forecast window fits: " + grid.size() + " rows cannot hold "
          + train + " training rows plus a horizon of " + horizon);
    }
    List<ForecastWindow> windows = new ArrayList<>(count);
    for (int w = 0; w < count; w++) {
      int cutoff = train + w * advance;
      int start = config.rollingMode() == RollingMode.EXPANDING ? 0 : cutoff - train;
      windows.add(new ForecastWindow(w, start, cutoff, horizon, grid.timestampAt(start),
          grid.timestampAt(cutoff)));
    }
    return windows;
  }
}

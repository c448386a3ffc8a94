package com.ospicorp.nitrateforecast.forecast.service;

import com.ospicorp.nitrateforecast.error.FitException;
import com.ospicorp.nitrateforecast.error.InsufficientDataException;
import com.ospicorp.nitrateforecast.forecast.model.ExogenousFrame;
import com.ospicorp.nitrateforecast.forecast.model.ForecastModelState;
import com.ospicorp.nitrateforecast.forecast.model.ForecastPoint;
import com.ospicorp.nitrateforecast.forecast.model.ForecastResult;
import com.ospicorp.nitrateforecast.forecast.model.ModelFamily;
import com.ospicorp.nitrateforecast.forecast.model.ModelOrders;
import com.ospicorp.nitrateforecast.forecast.model.ModelSettings;
import com.ospicorp.nitrateforecast.forecast.model.ResidualDiagnostics;
import com.ospicorp.nitrateforecast.forecast.model.TrainingSlice;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Repeats the last observed season. Exogenous columns are accepted and ignored.
 */
public class SeasonalNaiveForecastModel implements ForecastModel {
  private final ModelSettings settings;

  public SeasonalNaiveForecastModel(ModelSettings settings) {
    this.settings = settings;
  }

  @Override
  public ModelFamily family() {
    return ModelFamily.SEASONAL_NAIVE;
  }

  @Override
  public ForecastModelState fit(TrainingSlice slice, ModelOrders orders,
      List<String> exogenousColumns) {
    int season = Math.max(1, orders.period());
    int n = slice.size();
    int required = season + 1 + settings.minTrainingMarginSteps();
    if (n < required) {
      throw new InsufficientDataException(n, required);
    }
    double[] y = slice.targetValues();
    double[] lastSeason = Arrays.copyOfRange(y, n - season, n);
    for (double v : lastSeason) {
      if (!Double.isFinite(v)) {
        throw new FitException("Last season of the training slice has unfilled gaps");
      }
    }

    double[] diffs = seasonalDifferences(y, season);
    int usable = 0;
    double sum = 0d;
    for (double v : diffs) {
      if (Double.isFinite(v)) {
        sum += v * v;
        usable++;
      }
    }
    if (usable < 2) {
      throw new InsufficientDataException(usable, 2);
    }
    return new SeasonalNaiveState(orders, lastSeason, sum / usable, slice.lastTimestamp(),
        slice.step(), n);
  }

  @Override
  public ForecastResult forecast(ForecastModelState state, int horizon,
      ExogenousFrame futureExogenous) {
    if (!(state instanceof SeasonalNaiveState s)) {
      throw new IllegalArgumentException("State was produced by " + state.family()
          + ", not SEASONAL_NAIVE");
    }
    ForecastFrames.requireAligned(s, horizon, futureExogenous);
    int season = s.lastSeason().length;
    double z = new NormalDistribution().inverseCumulativeProbability(
        0.5 + settings.intervalLevel() / 2);
    double sigma = Math.sqrt(s.residualVariance());

    List<ForecastPoint> points = new ArrayList<>(horizon);
    for (int h = 1; h <= horizon; h++) {
      double predicted = s.lastSeason()[(h - 1) % season];
      double halfWidth = z * sigma * Math.sqrt((h - 1) / season + 1d);
      points.add(new ForecastPoint(futureExogenous.timestamps().get(h - 1), h, predicted,
          predicted - halfWidth, predicted + halfWidth, null));
    }
    return new ForecastResult(points);
  }

  @Override
  public ResidualDiagnostics diagnose(ForecastModelState state, TrainingSlice slice) {
    int season = Math.max(1, state.orders().period());
    return ResidualStatistics.summarize(seasonalDifferences(slice.targetValues(), season), 0);
  }

  private static double[] seasonalDifferences(double[] y, int season) {
    double[] out = new double[Math.max(0, y.length - season)];
    for (int t = season; t < y.length; t++) {
      out[t - season] = y[t] - y[t - season];
    }
    return out;
  }
}

package com.ospicorp.nitrateforecast.forecast.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.nitrateforecast.error.FitException;
import com.ospicorp.nitrateforecast.error.HorizonMismatchException;
import com.ospicorp.nitrateforecast.error.InsufficientDataException;
import com.ospicorp.nitrateforecast.error.NonConvergenceException;
import com.ospicorp.nitrateforecast.forecast.model.ExogenousFrame;
import com.ospicorp.nitrateforecast.forecast.model.ForecastModelState;
import com.ospicorp.nitrateforecast.forecast.model.ForecastPoint;
import com.ospicorp.nitrateforecast.forecast.model.ForecastResult;
import com.ospicorp.nitrateforecast.forecast.model.ModelOrders;
import com.ospicorp.nitrateforecast.forecast.model.ModelSettings;
import com.ospicorp.nitrateforecast.forecast.model.ResidualDiagnostics;
import com.ospicorp.nitrateforecast.forecast.model.TrainingSlice;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SarimaxForecastModelTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final Duration HOUR = Duration.ofHours(1);
  private static final ModelOrders AR1 = new ModelOrders(1, 0, 0, 0, 0, 0, 0);

  private final SarimaxForecastModel model =
      new SarimaxForecastModel(new ModelSettings(2000, 0.95, 2));

  @Test
  void recoversAutoregressiveCoefficient() {
    double[] y = ar1(400, 0.6, 10d, new Random(42));

    ForecastModelState state = model.fit(slice(y, Map.of()), AR1, List.of());

    Map<String, Double> c = state.coefficients();
    assertEquals(List.of("intercept", "ar.L1", "sigma2"), new ArrayList<>(c.keySet()));
    assertEquals(0.6, c.get("ar.L1"), 0.1);
    assertEquals(10d, c.get("intercept"), 0.5);
    assertEquals(1d, c.get("sigma2"), 0.25);
    assertEquals(400, state.observations());
    assertEquals(START.plus(HOUR.multipliedBy(399)), state.trainedThrough());
  }

  @Test
  void forecastFollowsTheRecursionAndIntervalsWiden() {
    double[] y = ar1(400, 0.6, 10d, new Random(42));
    ForecastModelState state = model.fit(slice(y, Map.of()), AR1, List.of());

    ForecastResult result = model.forecast(state, 6, frame(400, 6, Map.of()));

    double c = state.coefficients().get("intercept");
    double phi = state.coefficients().get("ar.L1");
    List<ForecastPoint> points = result.points();
    assertEquals(6, points.size());
    assertEquals(c + phi * (y[399] - c), points.get(0).predicted(), 1e-9);
    assertEquals(c + phi * phi * (y[399] - c), points.get(1).predicted(), 1e-9);
    assertEquals(START.plus(HOUR.multipliedBy(400)), points.get(0).timestamp());
    assertEquals(1, points.get(0).horizonStep());
    double previous = 0d;
    for (ForecastPoint p : points) {
      assertTrue(p.lowerBound() < p.predicted() && p.predicted() < p.upperBound());
      double halfWidth = p.upperBound() - p.predicted();
      assertTrue(halfWidth > previous);
      previous = halfWidth;
      assertNull(p.realized());
    }
  }

  @Test
  void forecastRejectsFramesOffTheTrainingGrid() {
    double[] y = ar1(200, 0.5, 0d, new Random(7));
    ForecastModelState state = model.fit(slice(y, Map.of()), AR1, List.of());

    assertThrows(HorizonMismatchException.class,
        () -> model.forecast(state, 6, frame(200, 5, Map.of())));
    assertThrows(HorizonMismatchException.class,
        () -> model.forecast(state, 6, frame(201, 6, Map.of())));
  }

  @Test
  void tooShortSliceIsInsufficientData() {
    InsufficientDataException ex = assertThrows(InsufficientDataException.class,
        () -> model.fit(slice(new double[] {1d, 2d, 3d}, Map.of()), AR1, List.of()));

    assertEquals(3, ex.available());
    assertEquals(4, ex.required());
    assertEquals("INSUFFICIENT_DATA", ex.errorCode());
    assertFalse(ex.isFatal());
  }

  @Test
  void exhaustedIterationBudgetIsNonConvergence() {
    SarimaxForecastModel starved = new SarimaxForecastModel(new ModelSettings(1, 0.95, 2));
    double[] y = ar1(200, 0.5, 0d, new Random(3));

    NonConvergenceException ex = assertThrows(NonConvergenceException.class,
        () -> starved.fit(slice(y, Map.of()), AR1, List.of()));
    assertEquals("NON_CONVERGENCE", ex.errorCode());
  }

  @Test
  void estimatesExogenousEffect() {
    Random random = new Random(11);
    double[] noise = ar1(400, 0.4, 0d, random);
    double[] rain = new double[400];
    double[] y = new double[400];
    for (int t = 0; t < 400; t++) {
      rain[t] = 2 * random.nextGaussian();
      y[t] = 5d + 3d * rain[t] + noise[t];
    }

    ForecastModelState state = model.fit(slice(y, Map.of("rain", rain)), AR1, List.of("rain"));

    assertEquals(3d, state.coefficients().get("rain"), 0.2);
    assertEquals(List.of("rain"), state.exogenousColumns());

    ForecastResult result = model.forecast(state, 2,
        frame(400, 2, Map.of("rain", new double[] {1d, -1d})));
    assertTrue(result.points().get(0).predicted() > result.points().get(1).predicted());
  }

  @Test
  void missingExogenousColumnFailsTheFit() {
    double[] y = ar1(100, 0.5, 0d, new Random(5));

    assertThrows(FitException.class,
        () -> model.fit(slice(y, Map.of()), AR1, List.of("flow")));
  }

  @Test
  void sliceEndingInAGapFailsTheFit() {
    double[] y = ar1(100, 0.5, 0d, new Random(5));
    y[99] = Double.NaN;

    FitException ex = assertThrows(FitException.class,
        () -> model.fit(slice(y, Map.of()), AR1, List.of()));
    assertEquals("FIT_ERROR", ex.errorCode());
  }

  @Test
  void seasonalTermsAreNamedBySeasonalLag() {
    Random random = new Random(19);
    double[] pattern = {1d, 4d, 2d, 6d};
    double[] y = new double[200];
    for (int t = 0; t < y.length; t++) {
      y[t] = pattern[t % 4] + 0.3 * random.nextGaussian();
    }

    ForecastModelState state = model.fit(slice(y, Map.of()),
        new ModelOrders(0, 0, 0, 1, 0, 0, 4), List.of());

    assertTrue(state.coefficients().containsKey("ar.S.L4"));
    assertTrue(state.coefficients().get("ar.S.L4") > 0d);
  }

  @Test
  void diagnosticsCoverEveryUsableResidual() {
    double[] y = ar1(400, 0.6, 10d, new Random(42));
    TrainingSlice slice = slice(y, Map.of());
    ForecastModelState state = model.fit(slice, AR1, List.of());

    ResidualDiagnostics diagnostics = model.diagnose(state, slice);

    assertEquals(399, diagnostics.residualCount());
    assertEquals(24, diagnostics.ljungBoxLags());
    assertEquals(25, diagnostics.residualAcf().size());
    assertEquals(0d, diagnostics.residualMean(), 0.2);
    assertTrue(diagnostics.ljungBoxPValue() >= 0d && diagnostics.ljungBoxPValue() <= 1d);
  }

  @Test
  void differencedModelDropsTheIntercept() {
    double[] y = new double[120];
    Random random = new Random(23);
    for (int t = 1; t < y.length; t++) {
      y[t] = y[t - 1] + random.nextGaussian();
    }

    ForecastModelState state = model.fit(slice(y, Map.of()),
        new ModelOrders(1, 1, 0, 0, 0, 0, 0), List.of());

    assertFalse(state.coefficients().containsKey("intercept"));
    ForecastResult result = model.forecast(state, 3, frame(120, 3, Map.of()));
    assertEquals(3, result.horizon());
  }

  static double[] ar1(int n, double phi, double mean, Random random) {
    double[] y = new double[n];
    double u = 0d;
    for (int t = 0; t < n; t++) {
      u = phi * u + random.nextGaussian();
      y[t] = mean + u;
    }
    return y;
  }

  static TrainingSlice slice(double[] y, Map<String, double[]> exogenous) {
    return new TrainingSlice(timestamps(0, y.length), HOUR, "nitrate", y, exogenous);
  }

  static ExogenousFrame frame(int from, int count, Map<String, double[]> columns) {
    return new ExogenousFrame(timestamps(from, count), columns);
  }

  private static List<Instant> timestamps(int from, int count) {
    List<Instant> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      out.add(START.plus(HOUR.multipliedBy(from + i)));
    }
    return out;
  }
}

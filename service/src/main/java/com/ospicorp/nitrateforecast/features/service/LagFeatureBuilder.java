package com.ospicorp.nitrateforecast.features.service;

import com.ospicorp.nitrateforecast.error.ConfigException;
import com.ospicorp.nitrateforecast.features.model.CorrelationPoint;
import com.ospicorp.nitrateforecast.features.model.LagCandidate;
import com.ospicorp.nitrateforecast.features.model.LagRange;
import com.ospicorp.nitrateforecast.features.model.LagSpec;
import com.ospicorp.nitrateforecast.features.model.LaggedFeatureTable;
import com.ospicorp.nitrateforecast.series.model.AlignedColumn;
import com.ospicorp.nitrateforecast.series.model.AlignedDataset;
import com.ospicorp.nitrateforecast.series.model.FillState;
import com.ospicorp.nitrateforecast.util.Futures;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

public final class LagFeatureBuilder {
  static final int MIN_PAIRS = 3;

  private LagFeatureBuilder() {
  }

  /** Lags outside {@code bounds} are not reported, whatever {@code maxLag} asks for. */
  public static List<CorrelationPoint> autocorrelation(double[] series, int maxLag,
      LagRange bounds) {
    int from = Math.max(0, bounds.min());
    int to = Math.min(maxLag, bounds.max());
    List<CorrelationPoint> out = new ArrayList<>(Math.max(0, to - from + 1));
    for (int lag = from; lag <= to; lag++) {
      out.add(correlationAtLag(series, series, lag));
    }
    return out;
  }

  /** Positive lag k pairs target[t] with predictor[t - k]: the predictor leads. */
  public static List<CorrelationPoint> crossCorrelation(double[] target, double[] predictor,
      LagRange lagRange) {
    if (target.length != predictor.length) {
      throw new ConfigException("Cross-correlation needs series on the same grid");
    }
    List<CorrelationPoint> out = new ArrayList<>(lagRange.max() - lagRange.min() + 1);
    for (int lag = lagRange.min(); lag <= lagRange.max(); lag++) {
      out.add(correlationAtLag(target, predictor, lag));
    }
    return out;
  }

  public static List<LagCandidate> strongestLags(AlignedDataset dataset, String target,
      List<String> predictors, LagRange lagRange, Executor executor) {
    double[] y = dataset.column(target).toArray();
    List<CompletableFuture<LagCandidate>> tasks = new ArrayList<>(predictors.size());
    for (String predictor : predictors) {
      double[] x = dataset.column(predictor).toArray();
      tasks.add(CompletableFuture.supplyAsync(
          () -> strongest(predictor, crossCorrelation(y, x, lagRange)), executor));
    }
    List<LagCandidate> out = new ArrayList<>(tasks.size());
    for (var task : tasks) {
      out.add(Futures.await(task));
    }
    return out;
  }

  public static LaggedFeatureTable materializeLags(AlignedDataset dataset, List<LagSpec> specs) {
    Map<String, AlignedColumn> lagColumns = new LinkedHashMap<>();
    Map<String, LagSpec> lagSpecs = new LinkedHashMap<>();
    for (LagSpec spec : specs) {
      if (!dataset.hasColumn(spec.source())) {
        throw new ConfigException("Lag spec refers to unknown variable: " + spec.source());
      }
      String name = spec.columnName();
      if (lagSpecs.containsKey(name)) {
        throw new ConfigException("Lag spec listed twice: " + name);
      }
      lagColumns.put(name, shift(dataset.column(spec.source()), name, spec.offset()));
      lagSpecs.put(name, spec);
    }
    return new LaggedFeatureTable(dataset, lagColumns, lagSpecs);
  }

  static AlignedColumn shift(AlignedColumn source, String name, int offset) {
    int n = source.size();
    List<Double> values = new ArrayList<>(n);
    List<FillState> states = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      if (i < offset) {
        values.add(null);
        states.add(FillState.MISSING);
      } else {
        values.add(source.value(i - offset));
        states.add(source.state(i - offset));
      }
    }
    return new AlignedColumn(name, source.aggregation(), values, states);
  }

  /** Pearson over the pairwise-complete pairs {@code (a[t], b[t - lag])}. */
  static CorrelationPoint correlationAtLag(double[] a, double[] b, int lag) {
    int start = Math.max(0, lag);
    int end = Math.min(a.length, b.length + lag);
    double[] x = new double[Math.max(0, end - start)];
    double[] y = new double[x.length];
    int pairs = 0;
    for (int t = start; t < end; t++) {
      if (Double.isNaN(a[t]) || Double.isNaN(b[t - lag])) {
        continue;
      }
      x[pairs] = a[t];
      y[pairs] = b[t - lag];
      pairs++;
    }
    if (pairs < MIN_PAIRS) {
      return new CorrelationPoint(lag, Double.NaN, pairs);
    }
    x = Arrays.copyOf(x, pairs);
    y = Arrays.copyOf(y, pairs);
    if (StatUtils.variance(x) == 0d || StatUtils.variance(y) == 0d) {
      return new CorrelationPoint(lag, Double.NaN, pairs);
    }
    return new CorrelationPoint(lag, new PearsonsCorrelation().correlation(x, y), pairs);
  }

  private static LagCandidate strongest(String predictor, List<CorrelationPoint> profile) {
    CorrelationPoint best = null;
    for (CorrelationPoint p : profile) {
      if (Double.isNaN(p.coefficient())) {
        continue;
      }
      if (best == null || Math.abs(p.coefficient()) > Math.abs(best.coefficient())) {
        best = p;
      }
    }
    return best == null
        ? new LagCandidate(predictor, 0, Double.NaN, profile)
        : new LagCandidate(predictor, best.lag(), best.coefficient(), profile);
  }
}

package com.ospicorp.nitrateforecast.forecast.service;

import com.ospicorp.nitrateforecast.features.model.CorrelationPoint;
import com.ospicorp.nitrateforecast.features.model.LagRange;
import com.ospicorp.nitrateforecast.features.service.LagFeatureBuilder;
import com.ospicorp.nitrateforecast.forecast.model.ResidualDiagnostics;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.distribution.ChiSquaredDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

final class ResidualStatistics {
  static final int MAX_ACF_LAG = 24;

  private ResidualStatistics() {
  }

  static ResidualDiagnostics summarize(double[] residuals, int fittedParameters) {
    double[] r = Arrays.stream(residuals).filter(Double::isFinite).toArray();
    int n = r.length;
    if (n < 4) {
      return new ResidualDiagnostics(n, Double.NaN, Double.NaN, List.of(), Double.NaN, 0,
          Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }
    DescriptiveStatistics stats = new DescriptiveStatistics(r);
    int lags = Math.max(1, Math.min(MAX_ACF_LAG, n / 5));
    List<CorrelationPoint> acf = LagFeatureBuilder.autocorrelation(r, lags, new LagRange(0, lags));

    double q = 0d;
    for (CorrelationPoint p : acf) {
      if (p.lag() == 0 || Double.isNaN(p.coefficient())) {
        continue;
      }
      q += p.coefficient() * p.coefficient() / (n - p.lag());
    }
    q *= n * (n + 2d);
    int df = Math.max(1, lags - fittedParameters);
    double lbPValue = 1d - new ChiSquaredDistribution(df).cumulativeProbability(q);

    double skew = stats.getSkewness();
    double kurt = stats.getKurtosis();
    double jb = Double.NaN;
    double jbPValue = Double.NaN;
    if (Double.isFinite(skew) && Double.isFinite(kurt)) {
      jb = n / 6d * (skew * skew + kurt * kurt / 4d);
      jbPValue = 1d - new ChiSquaredDistribution(2).cumulativeProbability(jb);
    }

    return new ResidualDiagnostics(n, stats.getMean(), stats.getStandardDeviation(), acf, q,
        lags, lbPValue, jb, jbPValue, skew, kurt, heteroskedasticity(r));
  }

  /** Sum of squares over the last third divided by the first third. */
  static double heteroskedasticity(double[] r) {
    int third = r.length / 3;
    if (third < 1) {
      return Double.NaN;
    }
    double first = 0d;
    double last = 0d;
    for (int i = 0; i < third; i++) {
      first += r[i] * r[i];
      last += r[r.length - third + i] * r[r.length - third + i];
    }
    return first == 0d ? Double.NaN : last / first;
  }
}

package com.ospicorp.nitrateforecast.forecast.service;

/**
 * Lag polynomials as coefficient arrays, index i holding the coefficient of B^i.
 */
final class Polynomials {
  private Polynomials() {
  }

  static double[] multiply(double[] a, double[] b) {
    double[] out = new double[a.length + b.length - 1];
    for (int i = 0; i < a.length; i++) {
      if (a[i] == 0d) {
        continue;
      }
      for (int j = 0; j < b.length; j++) {
        out[i + j] += a[i] * b[j];
      }
    }
    return out;
  }

  /** 1 + sign * (c1 B^lag + c2 B^2lag + ...). */
  static double[] lagPolynomial(double[] coefficients, int lag, double sign) {
    double[] out = new double[coefficients.length * lag + 1];
    out[0] = 1d;
    for (int i = 0; i < coefficients.length; i++) {
      out[(i + 1) * lag] = sign * coefficients[i];
    }
    return out;
  }

  /** (1 - B)^d (1 - B^s)^D. */
  static double[] differencing(int d, int seasonalD, int period) {
    double[] out = {1d};
    for (int i = 0; i < d; i++) {
      out = multiply(out, new double[] {1d, -1d});
    }
    for (int i = 0; i < seasonalD; i++) {
      double[] seasonal = new double[period + 1];
      seasonal[0] = 1d;
      seasonal[period] = -1d;
      out = multiply(out, seasonal);
    }
    return out;
  }

  /** Applies the differencing polynomial; the first {@code degree} rows are dropped. */
  static double[] difference(double[] series, int d, int seasonalD, int period) {
    double[] poly = differencing(d, seasonalD, period);
    int degree = poly.length - 1;
    if (series.length <= degree) {
      return new double[0];
    }
    double[] out = new double[series.length - degree];
    for (int t = degree; t < series.length; t++) {
      double v = 0d;
      for (int i = 0; i < poly.length; i++) {
        v += poly[i] * series[t - i];
      }
      out[t - degree] = v;
    }
    return out;
  }

  /**
   * Innovations of the ARMA model {@code ar(B) w = ma(B) e}. Rows whose recursion touches a
   * missing value are NaN and contribute a zero shock to later rows.
   */
  static double[] innovations(double[] w, double[] ar, double[] ma) {
    int start = ar.length - 1;
    double[] shocks = new double[w.length];
    double[] out = new double[w.length];
    for (int t = 0; t < w.length; t++) {
      if (t < start) {
        out[t] = Double.NaN;
        continue;
      }
      double e = 0d;
      for (int i = 0; i < ar.length; i++) {
        e += ar[i] * w[t - i];
      }
      for (int j = 1; j < ma.length && t - j >= 0; j++) {
        e -= ma[j] * shocks[t - j];
      }
      if (Double.isNaN(e)) {
        out[t] = Double.NaN;
      } else {
        out[t] = e;
        shocks[t] = e;
      }
    }
    return out;
  }

  /** MA(infinity) weights of {@code ar(B) x = ma(B) e}, first {@code count} terms. */
  static double[] psiWeights(double[] ar, double[] ma, int count) {
    double[] psi = new double[count];
    for (int j = 0; j < count; j++) {
      double v = j == 0 ? 1d : (j < ma.length ? ma[j] : 0d);
      for (int i = 1; i < ar.length && i <= j; i++) {
        v -= ar[i] * psi[j - i];
      }
      psi[j] = v;
    }
    return psi;
  }
}

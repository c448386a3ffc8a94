package com.ospicorp.nitrateforecast.forecast.service;

import com.ospicorp.nitrateforecast.error.FitException;
import com.ospicorp.nitrateforecast.error.InsufficientDataException;
import com.ospicorp.nitrateforecast.error.NonConvergenceException;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

/**
 * Regression with seasonal ARIMA errors:
 * <pre>
 *   y_t = c + β'x_t + u_t,   φ(B)Φ(B^s)(1-B)^d(1-B^s)^D u_t = θ(B)Θ(B^s) e_t
 * </pre>
 * β is estimated by least squares (on the differenced data when d or D is set, where the
 * constant drops out); the ARMA coefficients minimise the conditional sum of squares of e.
 */
public class SarimaxForecastModel implements ForecastModel {
  static final double RELATIVE_TOLERANCE = 1e-8;
  static final double ABSOLUTE_TOLERANCE = 1e-10;
  static final double INITIAL_STEP = 0.1;
  static final double COEFFICIENT_BOUND = 0.999;

  private final ModelSettings settings;

  public SarimaxForecastModel(ModelSettings settings) {
    this.settings = settings;
  }

  @Override
  public ModelFamily family() {
    return ModelFamily.SARIMAX;
  }

  @Override
  public ForecastModelState fit(TrainingSlice slice, ModelOrders orders,
      List<String> exogenousColumns) {
    List<String> exog = List.copyOf(exogenousColumns);
    double[][] x = new double[exog.size()][];
    for (int k = 0; k < exog.size(); k++) {
      x[k] = slice.exogenous().get(exog.get(k));
      if (x[k] == null) {
        throw new FitException("Training slice has no exogenous column " + exog.get(k));
      }
    }

    int n = slice.size();
    int recursionDepth = orders.differencingLoss() + orders.p()
        + orders.seasonalP() * orders.period() + 1;
    int required = Math.max(orders.orderSum() + 1 + settings.minTrainingMarginSteps(),
        recursionDepth);
    if (n < required) {
      throw new InsufficientDataException(n, required);
    }

    double[] y = slice.targetValues();
    boolean withIntercept = orders.d() == 0 && orders.seasonalD() == 0;
    double[] coefficients = regress(y, x, orders, withIntercept);
    double intercept = withIntercept ? coefficients[0] : 0d;
    double[] beta = Arrays.copyOfRange(coefficients, withIntercept ? 1 : 0, coefficients.length);

    double[] u = regressionErrors(y, x, intercept, beta);
    double[] w = Polynomials.difference(u, orders.d(), orders.seasonalD(), orders.period());
    int k = orders.armaParameterCount();

    double[] zeroAr = armaAr(new double[k], orders);
    double[] zeroMa = armaMa(new double[k], orders);
    int usable = countFinite(Polynomials.innovations(w, zeroAr, zeroMa));
    int requiredResiduals = k + coefficients.length + 2;
    if (usable < requiredResiduals) {
      throw new InsufficientDataException(usable, requiredResiduals);
    }

    double[] params = k == 0 ? new double[0] : optimize(w, orders, k);
    double[] ar = armaAr(params, orders);
    double[] ma = armaMa(params, orders);
    double[] innovations = Polynomials.innovations(w, ar, ma);
    double css = 0d;
    for (double e : innovations) {
      if (Double.isFinite(e)) {
        css += e * e;
      }
    }
    double sigma2 = css / (usable - k);
    if (!Double.isFinite(sigma2)) {
      throw new FitException("Residual variance is not finite for orders " + orders);
    }

    double[] fullAr = Polynomials.multiply(ar,
        Polynomials.differencing(orders.d(), orders.seasonalD(), orders.period()));
    int r = fullAr.length - 1;
    double[] levelTail = Arrays.copyOfRange(u, n - r, n);
    for (double v : levelTail) {
      if (!Double.isFinite(v)) {
        throw new FitException("Training slice ends in an unfilled gap; the last " + r
            + " rows of target and regressors must be present");
      }
    }
    int m = ma.length - 1;
    double[] innovationTail = new double[m];
    for (int i = 0; i < m; i++) {
      int wIndex = n - m + i - orders.differencingLoss();
      if (wIndex >= 0 && wIndex < innovations.length && Double.isFinite(innovations[wIndex])) {
        innovationTail[i] = innovations[wIndex];
      }
    }

    return new SarimaxState(orders, exog, intercept, beta, ar, ma, fullAr, levelTail,
        innovationTail, sigma2, slice.lastTimestamp(), slice.step(), n,
        describe(orders, exog, withIntercept, intercept, beta, params, sigma2));
  }

  @Override
  public ForecastResult forecast(ForecastModelState state, int horizon,
      ExogenousFrame futureExogenous) {
    SarimaxState s = cast(state);
    ForecastFrames.requireAligned(s, horizon, futureExogenous);

    int r = s.fullAr().length - 1;
    int m = s.armaMa().length - 1;
    double[] level = Arrays.copyOf(s.levelTail(), r + horizon);
    double[] shocks = Arrays.copyOf(s.innovationTail(), m + horizon);
    double[] psi = Polynomials.psiWeights(s.fullAr(), s.armaMa(), horizon);
    double z = new NormalDistribution().inverseCumulativeProbability(
        0.5 + settings.intervalLevel() / 2);

    List<ForecastPoint> points = new ArrayList<>(horizon);
    double cumulativePsi = 0d;
    for (int h = 0; h < horizon; h++) {
      double error = 0d;
      for (int i = 1; i <= r; i++) {
        error -= s.fullAr()[i] * level[r + h - i];
      }
      for (int j = 1; j <= m; j++) {
        error += s.armaMa()[j] * shocks[m + h - j];
      }
      level[r + h] = error;

      double predicted = s.intercept() + error;
      for (int c = 0; c < s.exogenousColumns().size(); c++) {
        predicted += s.beta()[c] * futureExogenous.columns().get(s.exogenousColumns().get(c))[h];
      }
      cumulativePsi += psi[h] * psi[h];
      double halfWidth = z * Math.sqrt(s.residualVariance() * cumulativePsi);
      points.add(new ForecastPoint(futureExogenous.timestamps().get(h), h + 1, predicted,
          predicted - halfWidth, predicted + halfWidth, null));
    }
    return new ForecastResult(points);
  }

  @Override
  public ResidualDiagnostics diagnose(ForecastModelState state, TrainingSlice slice) {
    SarimaxState s = cast(state);
    double[][] x = new double[s.exogenousColumns().size()][];
    for (int k = 0; k < x.length; k++) {
      x[k] = slice.exogenous().get(s.exogenousColumns().get(k));
      if (x[k] == null) {
        throw new FitException("Slice has no exogenous column " + s.exogenousColumns().get(k));
      }
    }
    ModelOrders orders = s.orders();
    double[] u = regressionErrors(slice.targetValues(), x, s.intercept(), s.beta());
    double[] w = Polynomials.difference(u, orders.d(), orders.seasonalD(), orders.period());
    double[] innovations = Polynomials.innovations(w, s.armaAr(), s.armaMa());
    return ResidualStatistics.summarize(innovations, orders.armaParameterCount());
  }

  private double[] optimize(double[] w, ModelOrders orders, int k) {
    SimplexOptimizer optimizer = new SimplexOptimizer(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE);
    try {
      PointValuePair best = optimizer.optimize(
          new MaxEval(settings.maxIterations()),
          new MaxIter(settings.maxIterations()),
          new ObjectiveFunction(params -> conditionalSumOfSquares(w, params, orders)),
          GoalType.MINIMIZE,
          new InitialGuess(new double[k]),
          new NelderMeadSimplex(k, INITIAL_STEP));
      double[] point = best.getPoint();
      for (double v : point) {
        if (!Double.isFinite(v)) {
          throw new FitException("Optimiser returned non-finite coefficients for " + orders);
        }
      }
      return point;
    } catch (MaxCountExceededException ex) {
      throw new NonConvergenceException("Conditional sum of squares for " + orders
          + " did not converge within " + settings.maxIterations() + " evaluations", ex);
    }
  }

  private static double conditionalSumOfSquares(double[] w, double[] params, ModelOrders orders) {
    for (double v : params) {
      if (Math.abs(v) > COEFFICIENT_BOUND) {
        return Double.MAX_VALUE;
      }
    }
    double[] e = Polynomials.innovations(w, armaAr(params, orders), armaMa(params, orders));
    double css = 0d;
    for (double v : e) {
      if (Double.isFinite(v)) {
        css += v * v;
      }
    }
    return css;
  }

  static double[] armaAr(double[] params, ModelOrders o) {
    double[] phi = Arrays.copyOfRange(params, 0, o.p());
    int offset = o.p() + o.q();
    double[] seasonalPhi = Arrays.copyOfRange(params, offset, offset + o.seasonalP());
    return Polynomials.multiply(Polynomials.lagPolynomial(phi, 1, -1d),
        Polynomials.lagPolynomial(seasonalPhi, Math.max(1, o.period()), -1d));
  }

  static double[] armaMa(double[] params, ModelOrders o) {
    double[] theta = Arrays.copyOfRange(params, o.p(), o.p() + o.q());
    int offset = o.p() + o.q() + o.seasonalP();
    double[] seasonalTheta = Arrays.copyOfRange(params, offset, offset + o.seasonalQ());
    return Polynomials.multiply(Polynomials.lagPolynomial(theta, 1, 1d),
        Polynomials.lagPolynomial(seasonalTheta, Math.max(1, o.period()), 1d));
  }

  /** Returns [intercept?, β...]. */
  private static double[] regress(double[] y, double[][] x, ModelOrders orders,
      boolean withIntercept) {
    if (x.length == 0) {
      if (!withIntercept) {
        return new double[0];
      }
      double sum = 0d;
      int count = 0;
      for (double v : y) {
        if (Double.isFinite(v)) {
          sum += v;
          count++;
        }
      }
      if (count == 0) {
        throw new InsufficientDataException(0, 1);
      }
      return new double[] {sum / count};
    }

    double[] dy = withIntercept ? y
        : Polynomials.difference(y, orders.d(), orders.seasonalD(), orders.period());
    double[][] dx = new double[x.length][];
    for (int k = 0; k < x.length; k++) {
      dx[k] = withIntercept ? x[k]
          : Polynomials.difference(x[k], orders.d(), orders.seasonalD(), orders.period());
    }

    List<double[]> rows = new ArrayList<>();
    List<Double> targets = new ArrayList<>();
    for (int t = 0; t < dy.length; t++) {
      if (!Double.isFinite(dy[t])) {
        continue;
      }
      double[] row = new double[x.length];
      boolean complete = true;
      for (int k = 0; k < x.length; k++) {
        row[k] = dx[k][t];
        complete &= Double.isFinite(row[k]);
      }
      if (complete) {
        rows.add(row);
        targets.add(dy[t]);
      }
    }
    int columns = x.length + (withIntercept ? 1 : 0);
    if (rows.size() < columns + 2) {
      throw new InsufficientDataException(rows.size(), columns + 2);
    }

    OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
    ols.setNoIntercept(!withIntercept);
    try {
      ols.newSampleData(targets.stream().mapToDouble(Double::doubleValue).toArray(),
          rows.toArray(new double[0][]));
      return ols.estimateRegressionParameters();
    } catch (MathIllegalArgumentException ex) {
      throw new FitException("Regression on exogenous columns failed: " + ex.getMessage(), ex);
    }
  }

  private static double[] regressionErrors(double[] y, double[][] x, double intercept,
      double[] beta) {
    double[] u = new double[y.length];
    for (int t = 0; t < y.length; t++) {
      double v = y[t] - intercept;
      for (int k = 0; k < x.length; k++) {
        v -= beta[k] * x[k][t];
      }
      u[t] = v;
    }
    return u;
  }

  private static int countFinite(double[] values) {
    int count = 0;
    for (double v : values) {
      if (Double.isFinite(v)) {
        count++;
      }
    }
    return count;
  }

  private static Map<String, Double> describe(ModelOrders o, List<String> exog,
      boolean withIntercept, double intercept, double[] beta, double[] params, double sigma2) {
    Map<String, Double> out = new LinkedHashMap<>();
    if (withIntercept) {
      out.put("intercept", intercept);
    }
    for (int k = 0; k < exog.size(); k++) {
      out.put(exog.get(k), beta[k]);
    }
    int idx = 0;
    for (int i = 1; i <= o.p(); i++) {
      out.put("ar.L" + i, params[idx++]);
    }
    for (int i = 1; i <= o.q(); i++) {
      out.put("ma.L" + i, params[idx++]);
    }
    for (int i = 1; i <= o.seasonalP(); i++) {
      out.put("ar.S.L" + i * o.period(), params[idx++]);
    }
    for (int i = 1; i <= o.seasonalQ(); i++) {
      out.put("ma.S.L" + i * o.period(), params[idx++]);
    }
    out.put("sigma2", sigma2);
    return out;
  }

  private static SarimaxState cast(ForecastModelState state) {
    if (state instanceof SarimaxState s) {
      return s;
    }
    throw new IllegalArgumentException("State was produced by " + state.family()
        + ", not SARIMAX");
  }
}

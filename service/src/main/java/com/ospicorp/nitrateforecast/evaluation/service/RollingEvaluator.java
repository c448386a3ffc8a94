package com.ospicorp.nitrateforecast.evaluation.service;

import com.ospicorp.nitrateforecast.config.PipelineConfig;
import com.ospicorp.nitrateforecast.error.AlignmentException;
import com.ospicorp.nitrateforecast.error.ConfigException;
import com.ospicorp.nitrateforecast.error.ModelException;
import com.ospicorp.nitrateforecast.error.PipelineException;
import com.ospicorp.nitrateforecast.evaluation.model.ForecastWindow;
import com.ospicorp.nitrateforecast.evaluation.model.ModelFitSummary;
import com.ospicorp.nitrateforecast.evaluation.model.WindowOutcome;
import com.ospicorp.nitrateforecast.features.model.LagSpec;
import com.ospicorp.nitrateforecast.features.model.LaggedFeatureTable;
import com.ospicorp.nitrateforecast.forecast.model.ExogenousFrame;
import com.ospicorp.nitrateforecast.forecast.model.ForecastModelState;
import com.ospicorp.nitrateforecast.forecast.model.ForecastResult;
import com.ospicorp.nitrateforecast.forecast.model.TrainingSlice;
import com.ospicorp.nitrateforecast.forecast.service.ForecastModel;
import com.ospicorp.nitrateforecast.series.model.AlignedColumn;
import com.ospicorp.nitrateforecast.series.model.GapPolicy;
import com.ospicorp.nitrateforecast.series.model.TimeGrid;
import com.ospicorp.nitrateforecast.series.service.GapHandler;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs every planned window as an independent task. A window sees only rows before its cutoff
 * for training, and only exogenous values that are known at the cutoff for forecasting.
 */
@Service
public class RollingEvaluator {
  public static final String WINDOW_TIMEOUT = "WINDOW_TIMEOUT";
  public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

  private static final Logger log = LoggerFactory.getLogger(RollingEvaluator.class);

  private final Executor executor;

  public RollingEvaluator(@Qualifier("forecastExecutor") Executor executor) {
    this.executor = executor;
  }

  /**
   * @return one outcome per planned window, in window order
   * @throws AlignmentException when the table grid step differs from the configured one
   * @throws ConfigException for unknown columns or a plan with no window
   */
  public List<WindowOutcome> evaluate(LaggedFeatureTable table, PipelineConfig config,
      ForecastModel model) {
    TimeGrid grid = table.grid();
    if (!grid.step().equals(config.gridStep())) {
      throw new AlignmentException("Feature table step " + grid.step()
          + " does not match the configured grid step " + config.gridStep());
    }
    if (!table.hasColumn(config.targetVariable())) {
      throw new ConfigException("Unknown target variable: " + config.targetVariable());
    }
    for (String column : config.exogenousColumns()) {
      if (!table.hasColumn(column)) {
        throw new ConfigException("Unknown exogenous column: " + column);
      }
    }
    List<ForecastWindow> windows = WindowPlanner.plan(grid, config);
    Inputs inputs = Inputs.from(table, config);

    log.info("Evaluating {} {} windows: train={} horizon={} advance={} model={} {}",
        windows.size(), config.rollingMode(), config.trainWindowSteps(),
        config.forecastHorizonSteps(), config.stepAdvanceSteps(), model.family(),
        config.modelOrders());
    long started = System.currentTimeMillis();

    long timeoutMillis = config.windowTimeout().toMillis();
    List<CompletableFuture<WindowOutcome>> tasks = new ArrayList<>(windows.size());
    for (ForecastWindow window : windows) {
      CompletableFuture<WindowOutcome> task = new CompletableFuture<>();
      Runnable work = () -> runTimed(task, timeoutMillis,
          () -> runWindow(window, inputs, config, model));
      try {
        executor.execute(work);
      } catch (RejectedExecutionException ex) {
        log.debug("Executor saturated, running window {} on the calling thread", window.index());
        work.run();
      }
      tasks.add(task.handle((outcome, ex) -> ex == null ? outcome : skip(window, ex)));
    }

    List<WindowOutcome> outcomes = new ArrayList<>(tasks.size());
    for (CompletableFuture<WindowOutcome> task : tasks) {
      outcomes.add(task.join());
    }
    long skipped = outcomes.stream().filter(WindowOutcome::isSkipped).count();
    log.info("Evaluated {} windows in {} ms: {} completed, {} skipped", outcomes.size(),
        System.currentTimeMillis() - started, outcomes.size() - skipped, skipped);
    return outcomes;
  }

  /** The time limit starts when a worker picks the window up, not when it is queued. */
  private static void runTimed(CompletableFuture<WindowOutcome> task, long timeoutMillis,
      Supplier<WindowOutcome> window) {
    task.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
    try {
      task.complete(window.get());
    } catch (RuntimeException | Error ex) {
      task.completeExceptionally(ex);
    }
  }

  WindowOutcome runWindow(ForecastWindow window, Inputs inputs, PipelineConfig config,
      ForecastModel model) {
    Map<String, double[]> known = inputs.filledBefore(window.cutoffIndex());
    TrainingSlice slice = trainingSlice(window, inputs, known, config);
    ForecastModelState state = model.fit(slice, config.modelOrders(), config.exogenousColumns());
    ExogenousFrame frame = futureExogenous(window, inputs, known, config);
    ForecastResult forecast = model.forecast(state, window.horizon(), frame)
        .withRealized(t -> inputs.realizedAt(inputs.grid.indexOf(t)));
    ModelFitSummary fit = new ModelFitSummary(window.index(), state.family(),
        state.orders().toString(), state.trainedThrough(), state.observations(),
        state.coefficients(), model.diagnose(state, slice));
    log.debug("Window {} (cutoff {}) fitted on {} rows, sigma2={}", window.index(),
        window.cutoff(), slice.size(), state.residualVariance());
    return WindowOutcome.completed(window, forecast, fit);
  }

  /**
   * @param known every variable gap-filled from rows before the window's cutoff only, as
   *     returned by {@link Inputs#filledBefore}
   */
  static TrainingSlice trainingSlice(ForecastWindow window, Inputs inputs,
      Map<String, double[]> known, PipelineConfig config) {
    int from = window.trainStartIndex();
    int to = window.cutoffIndex();
    List<Instant> timestamps = new ArrayList<>(inputs.grid.timestamps().subList(from, to));
    for (Instant t : timestamps) {
      if (!t.isBefore(window.cutoff())) {
        throw new IllegalStateException("Training row " + t + " is not before cutoff "
            + window.cutoff());
      }
    }
    Map<String, double[]> exogenous = new LinkedHashMap<>();
    for (String column : config.exogenousColumns()) {
      exogenous.put(column, Arrays.copyOfRange(inputs.columnBefore(column, known, to), from, to));
    }
    return new TrainingSlice(timestamps, inputs.grid.step(), config.targetVariable(),
        Arrays.copyOfRange(known.get(config.targetVariable()), from, to), exogenous);
  }

  /**
   * A future cell is read only when it is known at the cutoff: its column is forecast-known, or
   * it is a lag whose source row lies before the cutoff. Lag sources are read gap-filled from
   * rows before the cutoff. Other cells repeat the last value known before the cutoff.
   */
  static ExogenousFrame futureExogenous(ForecastWindow window, Inputs inputs,
      Map<String, double[]> known, PipelineConfig config) {
    int cutoff = window.cutoffIndex();
    List<Instant> timestamps = new ArrayList<>(
        inputs.grid.timestamps().subList(cutoff, window.forecastEndIndex()));
    Map<String, double[]> columns = new LinkedHashMap<>();
    for (String column : config.exogenousColumns()) {
      boolean forecastKnown = config.forecastKnownColumns().contains(column);
      LagSpec lag = inputs.lags.get(column);
      double carried = lastFiniteBefore(inputs.columnBefore(column, known, cutoff), cutoff);
      double[] future = new double[window.horizon()];
      for (int h = 0; h < future.length; h++) {
        int row = cutoff + h;
        double value = Double.NaN;
        if (forecastKnown) {
          value = inputs.forecastKnownAt(column, row);
        } else if (lag != null && row - lag.offset() < cutoff && row >= lag.offset()) {
          value = known.get(lag.source())[row - lag.offset()];
        }
        if (Double.isFinite(value)) {
          carried = value;
        }
        future[h] = carried;
      }
      columns.put(column, future);
    }
    return new ExogenousFrame(timestamps, columns);
  }

  private static double lastFiniteBefore(double[] values, int index) {
    for (int i = index - 1; i >= 0; i--) {
      if (Double.isFinite(values[i])) {
        return values[i];
      }
    }
    return Double.NaN;
  }

  private static WindowOutcome skip(ForecastWindow window, Throwable failure) {
    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
        ? failure.getCause() : failure;
    if (cause instanceof TimeoutException) {
      log.warn("Window {} (cutoff {}) exceeded its time limit and was skipped",
          window.index(), window.cutoff());
      return WindowOutcome.skipped(window, WINDOW_TIMEOUT, "Window did not finish in time");
    }
    if (cause instanceof ModelException ex) {
      log.warn("Window {} (cutoff {}) skipped with {}: {}", window.index(), window.cutoff(),
          ex.errorCode(), ex.getMessage());
      return WindowOutcome.skipped(window, ex.errorCode(), ex.getMessage());
    }
    String code = cause instanceof PipelineException ex ? ex.errorCode() : UNEXPECTED_ERROR;
    log.error("Window {} (cutoff {}) failed unexpectedly", window.index(), window.cutoff(),
        cause);
    return WindowOutcome.skipped(window, code, String.valueOf(cause.getMessage()));
  }

  /**
   * Unfilled columns shared read-only by every window task. Each window refills them from its
   * own past, so no training value depends on a row at or after the cutoff.
   */
  static final class Inputs {
    final TimeGrid grid;
    final GapPolicy gapPolicy;
    final AlignedColumn target;
    final Map<String, AlignedColumn> variables;
    final Map<String, LagSpec> lags;
    final Map<String, double[]> forecastKnown;

    private Inputs(TimeGrid grid, GapPolicy gapPolicy, AlignedColumn target,
        Map<String, AlignedColumn> variables, Map<String, LagSpec> lags,
        Map<String, double[]> forecastKnown) {
      this.grid = grid;
      this.gapPolicy = gapPolicy;
      this.target = target;
      this.variables = variables;
      this.lags = lags;
      this.forecastKnown = forecastKnown;
    }

    static Inputs from(LaggedFeatureTable table, PipelineConfig config) {
      Map<String, AlignedColumn> variables = new LinkedHashMap<>();
      Map<String, LagSpec> lags = new LinkedHashMap<>();
      Map<String, double[]> forecastKnown = new LinkedHashMap<>();
      String target = config.targetVariable();
      variables.put(target, GapHandler.unfilled(table.column(target)));
      for (String column : config.exogenousColumns()) {
        LagSpec lag = table.lagSpec(column).orElse(null);
        String variable = lag == null ? column : lag.source();
        AlignedColumn raw = variables.computeIfAbsent(variable,
            name -> GapHandler.unfilled(table.column(name)));
        if (lag != null) {
          lags.put(column, lag);
        }
        if (config.forecastKnownColumns().contains(column)) {
          // future values of these columns are published ahead, so the whole timeline may be used
          forecastKnown.put(variable, GapHandler.fill(raw, config.gapPolicy()).toArray());
        }
      }
      return new Inputs(table.grid(), config.gapPolicy(), variables.get(target), variables, lags,
          forecastKnown);
    }

    /** Every variable gap-filled as if the grid ended at {@code cutoff}. */
    Map<String, double[]> filledBefore(int cutoff) {
      Map<String, double[]> known = new LinkedHashMap<>();
      for (var e : variables.entrySet()) {
        known.put(e.getKey(), GapHandler.fillBefore(e.getValue(), cutoff, gapPolicy).toArray());
      }
      return known;
    }

    /** Rows {@code [0, cutoff)} of an exogenous column, lags shifted from their source. */
    double[] columnBefore(String column, Map<String, double[]> known, int cutoff) {
      LagSpec lag = lags.get(column);
      if (lag == null) {
        return known.get(column);
      }
      double[] source = known.get(lag.source());
      double[] out = new double[cutoff];
      for (int i = 0; i < cutoff; i++) {
        out[i] = i < lag.offset() ? Double.NaN : source[i - lag.offset()];
      }
      return out;
    }

    double forecastKnownAt(String column, int row) {
      LagSpec lag = lags.get(column);
      int sourceRow = lag == null ? row : row - lag.offset();
      double[] values = forecastKnown.get(lag == null ? column : lag.source());
      return sourceRow < 0 ? Double.NaN : values[sourceRow];
    }

    /** Target value at a row only when it was observed; gap-filled cells are not scored. */
    Double realizedAt(int row) {
      if (row < 0 || row >= target.size() || target.state(row).wasMissing()
          || !target.isPresent(row) || !Double.isFinite(target.value(row))) {
        return null;
      }
      return target.value(row);
    }
  }
}

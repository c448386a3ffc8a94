package com.ospicorp.nitrateforecast.evaluation.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.nitrateforecast.config.PipelineConfig;
import com.ospicorp.nitrateforecast.config.PipelineConfig.RollingMode;
import com.ospicorp.nitrateforecast.error.AlignmentException;
import com.ospicorp.nitrateforecast.error.ConfigException;
import com.ospicorp.nitrateforecast.error.HorizonMismatchException;
import com.ospicorp.nitrateforecast.evaluation.model.EvaluationReport;
import com.ospicorp.nitrateforecast.evaluation.model.ForecastWindow;
import com.ospicorp.nitrateforecast.evaluation.model.WindowOutcome;
import com.ospicorp.nitrateforecast.features.model.LagSpec;
import com.ospicorp.nitrateforecast.features.model.LaggedFeatureTable;
import com.ospicorp.nitrateforecast.features.service.LagFeatureBuilder;
import com.ospicorp.nitrateforecast.forecast.model.ExogenousFrame;
import com.ospicorp.nitrateforecast.forecast.model.ForecastModelState;
import com.ospicorp.nitrateforecast.forecast.model.ForecastPoint;
import com.ospicorp.nitrateforecast.forecast.model.ForecastResult;
import com.ospicorp.nitrateforecast.forecast.model.ModelFamily;
import com.ospicorp.nitrateforecast.forecast.model.ModelOrders;
import com.ospicorp.nitrateforecast.forecast.model.ResidualDiagnostics;
import com.ospicorp.nitrateforecast.forecast.model.TrainingSlice;
import com.ospicorp.nitrateforecast.forecast.service.ForecastModel;
import com.ospicorp.nitrateforecast.forecast.service.SarimaxForecastModel;
import com.ospicorp.nitrateforecast.series.model.AggregationPolicy;
import com.ospicorp.nitrateforecast.series.model.AlignedColumn;
import com.ospicorp.nitrateforecast.series.model.AlignedDataset;
import com.ospicorp.nitrateforecast.series.model.FillState;
import com.ospicorp.nitrateforecast.series.model.TimeGrid;
import com.ospicorp.nitrateforecast.series.service.GapHandler;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class RollingEvaluatorTest {
  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final Duration HOUR = Duration.ofHours(1);

  private ExecutorService pool;
  private RollingEvaluator evaluator;

  @BeforeEach
  void setUp() {
    pool = Executors.newFixedThreadPool(4);
    evaluator = new RollingEvaluator(pool);
  }

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void windowsSeeOnlyWhatIsKnownAtTheirCutoff() {
    Queue<String> violations = new ConcurrentLinkedQueue<>();
    PipelineConfig config = base()
        .exogenousColumns(List.of("rain", "rain_lag2", "tide"))
        .forecastKnownColumns(List.of("tide"))
        .build();

    List<WindowOutcome> outcomes = evaluator.evaluate(table(40, null), config,
        new RecordingModel(frameCheck(violations)));

    assertEquals(6, outcomes.size());
    assertTrue(outcomes.stream().noneMatch(WindowOutcome::isSkipped));
    assertTrue(violations.isEmpty(), () -> String.join("\n", violations));
  }

  @Test
  void trainingSliceEndsBeforeTheCutoff() {
    PipelineConfig config = base().exogenousColumns(List.of("rain")).build();
    LaggedFeatureTable table = table(40, null);
    ForecastWindow window = WindowPlanner.plan(table.grid(), config).get(2);

    TrainingSlice slice = sliceFor(window, table, config);

    assertEquals(10, slice.size());
    assertEquals(window.cutoff().minus(HOUR), slice.lastTimestamp());
    assertEquals(19d, slice.targetValues()[9], 0d);
    assertEquals(119d, slice.exogenous().get("rain")[9], 0d);
    assertEquals(10d, slice.targetValues()[0], 0d);
  }

  @Test
  void unknownFutureValuesRepeatTheLastKnownOne() {
    PipelineConfig config = base()
        .exogenousColumns(List.of("rain", "rain_lag2", "tide"))
        .forecastKnownColumns(List.of("tide"))
        .build();
    LaggedFeatureTable table = table(40, null);
    ForecastWindow window = WindowPlanner.plan(table.grid(), config).get(0);

    ExogenousFrame frame = frameFor(window, table, config);

    assertArrayEquals(new double[] {109d, 109d, 109d}, frame.columns().get("rain"), 0d);
    assertArrayEquals(new double[] {108d, 109d, 109d}, frame.columns().get("rain_lag2"), 0d);
    assertArrayEquals(new double[] {210d, 211d, 212d}, frame.columns().get("tide"), 0d);
    assertEquals(window.cutoff(), frame.timestamps().get(0));
  }

  @Test
  void rowsAfterTheCutoffDoNotChangeTheTrainingSlice() {
    PipelineConfig config = base().exogenousColumns(List.of("rain")).build();
    // the same gap starts at row 19; it is short overall in one table and long in the other
    LaggedFeatureTable shortGap = gappyTable(config, 19, 22, 0d);
    LaggedFeatureTable longGap = gappyTable(config, 19, 24, 0d);
    ForecastWindow window = WindowPlanner.plan(shortGap.grid(), config).get(2);
    assertEquals(20, window.cutoffIndex());

    TrainingSlice fromShort = sliceFor(window, shortGap, config);
    TrainingSlice fromLong = sliceFor(window, longGap, config);

    assertEquals(18d, fromShort.targetValues()[9], 0d);
    assertArrayEquals(fromShort.targetValues(), fromLong.targetValues(), 0d);
    assertArrayEquals(fromShort.exogenous().get("rain"), fromLong.exogenous().get("rain"), 0d);
  }

  @Test
  void linearFillNeverReadsPastTheCutoff() {
    PipelineConfig config = base()
        .shortGapFill("linear")
        .exogenousColumns(List.of("rain", "rain_lag2"))
        .build();
    LaggedFeatureTable calm = gappyTable(config, 19, 20, 0d);
    LaggedFeatureTable spike = gappyTable(config, 19, 20, 500d);
    ForecastWindow window = WindowPlanner.plan(calm.grid(), config).get(2);

    TrainingSlice fromCalm = sliceFor(window, calm, config);
    TrainingSlice fromSpike = sliceFor(window, spike, config);
    ExogenousFrame calmFrame = frameFor(window, calm, config);
    ExogenousFrame spikeFrame = frameFor(window, spike, config);

    assertEquals(18d, fromCalm.targetValues()[9], 0d);
    assertEquals(118d, fromCalm.exogenous().get("rain")[9], 0d);
    assertArrayEquals(fromCalm.targetValues(), fromSpike.targetValues(), 0d);
    assertArrayEquals(fromCalm.exogenous().get("rain"), fromSpike.exogenous().get("rain"), 0d);
    // rain_lag2 at the second forecast row reads rain row 19, the filled cell
    assertEquals(118d, calmFrame.columns().get("rain_lag2")[1], 0d);
    assertArrayEquals(calmFrame.columns().get("rain_lag2"), spikeFrame.columns().get("rain_lag2"),
        0d);
  }

  @Test
  void timeLimitStartsWhenTheWindowRuns() {
    ExecutorService single = Executors.newSingleThreadExecutor();
    try {
      PipelineConfig config = base().windowTimeout(Duration.ofMillis(500)).build();

      List<WindowOutcome> outcomes = new RollingEvaluator(single).evaluate(table(40, null),
          config, new RecordingModel(frame -> sleep(200)));

      assertEquals(6, outcomes.size());
      assertTrue(outcomes.stream().noneMatch(WindowOutcome::isSkipped),
          () -> outcomes.stream().filter(WindowOutcome::isSkipped)
              .map(o -> o.window().index() + ":" + o.skipped().cause()).toList().toString());
    } finally {
      single.shutdownNow();
    }
  }

  @Test
  void windowsBeyondTheQueueCapacityAreStillFitted() {
    ThreadPoolTaskExecutor small = new ThreadPoolTaskExecutor();
    small.setCorePoolSize(1);
    small.setMaxPoolSize(1);
    small.setQueueCapacity(2);
    small.initialize();
    try {
      List<WindowOutcome> outcomes = new RollingEvaluator(small).evaluate(table(40, null),
          base().build(), new RecordingModel(frame -> sleep(50)));

      assertEquals(6, outcomes.size());
      for (WindowOutcome outcome : outcomes) {
        assertFalse(outcome.isSkipped(), "window " + outcome.window().index());
      }
    } finally {
      small.shutdown();
    }
  }

  @Test
  void outcomesComeBackInWindowOrder() {
    Random jitter = new Random(1);
    List<Long> delays = new ArrayList<>();
    for (int i = 0; i < 6; i++) {
      delays.add((long) jitter.nextInt(30));
    }
    PipelineConfig config = base().build();

    List<WindowOutcome> outcomes = evaluator.evaluate(table(40, null), config,
        new RecordingModel(frame -> sleep(delays.get(indexOf(frame) / 5 - 2))));

    for (int i = 0; i < outcomes.size(); i++) {
      assertEquals(i, outcomes.get(i).window().index());
    }
  }

  @Test
  void shortExpandingWindowIsSkippedAndReported() {
    PipelineConfig config = PipelineConfig.builder()
        .rollingMode(RollingMode.EXPANDING)
        .trainWindowSteps(4)
        .forecastHorizonSteps(2)
        .stepAdvanceSteps(2)
        .modelOrders(new ModelOrders(1, 0, 0, 0, 0, 0, 0))
        .build();

    List<WindowOutcome> outcomes = evaluator.evaluate(noisyTable(40), config,
        new SarimaxForecastModel(config.modelSettings()));

    assertEquals(18, outcomes.size());
    assertTrue(outcomes.get(0).isSkipped());
    assertEquals("INSUFFICIENT_DATA", outcomes.get(0).skipped().cause());
    for (int i = 1; i < outcomes.size(); i++) {
      assertFalse(outcomes.get(i).isSkipped(), "window " + i);
    }

    EvaluationReport report = MetricsReporter.report(outcomes, null);
    assertEquals(18, report.summary().plannedWindows());
    assertEquals(17, report.summary().evaluatedWindows());
    assertEquals(Map.of("INSUFFICIENT_DATA", 1), report.summary().skippedByCause());
    assertEquals(34, report.rows().size());
  }

  @Test
  void slowWindowIsSkippedWithTimeout() {
    PipelineConfig config = base().windowTimeout(Duration.ofMillis(100)).build();

    List<WindowOutcome> outcomes = evaluator.evaluate(table(13, null), config,
        new RecordingModel(frame -> sleep(2000)));

    assertEquals(1, outcomes.size());
    assertEquals(RollingEvaluator.WINDOW_TIMEOUT, outcomes.get(0).skipped().cause());
  }

  @Test
  void unexpectedFailureIsRecordedPerWindow() {
    List<WindowOutcome> outcomes = evaluator.evaluate(table(40, null), base().build(),
        new RecordingModel(frame -> {
          if (indexOf(frame) == 15) {
            throw new IllegalStateException("boom");
          }
          if (indexOf(frame) == 20) {
            throw new HorizonMismatchException("frame off grid");
          }
        }));

    assertEquals(RollingEvaluator.UNEXPECTED_ERROR, outcomes.get(1).skipped().cause());
    assertEquals("HORIZON_MISMATCH", outcomes.get(2).skipped().cause());
    assertFalse(outcomes.get(0).isSkipped());
    assertFalse(outcomes.get(3).isSkipped());
  }

  @Test
  void gapFilledTargetIsNotScored() {
    List<WindowOutcome> outcomes = evaluator.evaluate(table(40, 11), base().build(),
        new RecordingModel(frame -> { }));

    List<ForecastPoint> points = outcomes.get(0).result().points();
    assertEquals(10d, points.get(0).realized());
    assertNull(points.get(1).realized());
    assertEquals(12d, points.get(2).realized());
  }

  @Test
  void mismatchedGridIsFatal() {
    PipelineConfig config = base().gridStep(Duration.ofMinutes(30)).build();

    assertThrows(AlignmentException.class,
        () -> evaluator.evaluate(table(40, null), config, new RecordingModel(frame -> { })));
  }

  @Test
  void unknownColumnsAreFatal() {
    PipelineConfig unknownExog = base().exogenousColumns(List.of("turbidity")).build();
    PipelineConfig unknownTarget = base().targetVariable("phosphate").build();

    assertThrows(ConfigException.class,
        () -> evaluator.evaluate(table(40, null), unknownExog, new RecordingModel(f -> { })));
    assertThrows(ConfigException.class,
        () -> evaluator.evaluate(table(40, null), unknownTarget, new RecordingModel(f -> { })));
  }

  private static PipelineConfig.Builder base() {
    return PipelineConfig.builder()
        .trainWindowSteps(10)
        .forecastHorizonSteps(3)
        .stepAdvanceSteps(5);
  }

  /** Checks every forecast frame against the values a cutoff at its first row may know. */
  private static Consumer<ExogenousFrame> frameCheck(Queue<String> violations) {
    return frame -> {
      int c = indexOf(frame);
      double[] rain = frame.columns().get("rain");
      double[] lag = frame.columns().get("rain_lag2");
      double[] tide = frame.columns().get("tide");
      for (int h = 0; h < frame.size(); h++) {
        if (rain[h] != 99 + c) {
          violations.add("rain at cutoff " + c + " step " + h + " = " + rain[h]);
        }
        double expectedLag = h < 2 ? 98 + c + h : 99 + c;
        if (lag[h] != expectedLag) {
          violations.add("rain_lag2 at cutoff " + c + " step " + h + " = " + lag[h]);
        }
        if (tide[h] != 200 + c + h) {
          violations.add("tide at cutoff " + c + " step " + h + " = " + tide[h]);
        }
      }
    };
  }

  private static int indexOf(ExogenousFrame frame) {
    return (int) Duration.between(START, frame.timestamps().get(0)).toHours();
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(ex);
    }
  }

  private static TrainingSlice sliceFor(ForecastWindow window, LaggedFeatureTable table,
      PipelineConfig config) {
    RollingEvaluator.Inputs inputs = RollingEvaluator.Inputs.from(table, config);
    return RollingEvaluator.trainingSlice(window, inputs,
        inputs.filledBefore(window.cutoffIndex()), config);
  }

  private static ExogenousFrame frameFor(ForecastWindow window, LaggedFeatureTable table,
      PipelineConfig config) {
    RollingEvaluator.Inputs inputs = RollingEvaluator.Inputs.from(table, config);
    return RollingEvaluator.futureExogenous(window, inputs,
        inputs.filledBefore(window.cutoffIndex()), config);
  }

  /**
   * Built the way the pipeline builds it: nitrate[i] = i and rain[i] = 100 + i, both missing over
   * {@code [gapFrom, gapTo)}, {@code afterCutoff} added to every row from 20 on, gaps filled over
   * the whole timeline, then rain_lag2.
   */
  private static LaggedFeatureTable gappyTable(PipelineConfig config, int gapFrom, int gapTo,
      double afterCutoff) {
    List<Double> nitrate = new ArrayList<>();
    List<Double> rain = new ArrayList<>();
    List<FillState> states = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      boolean missing = i >= gapFrom && i < gapTo;
      double shift = i >= 20 ? afterCutoff : 0d;
      nitrate.add(missing ? null : i + shift);
      rain.add(missing ? null : 100d + i + shift);
      states.add(missing ? FillState.MISSING : FillState.OBSERVED);
    }
    Map<String, AlignedColumn> columns = new LinkedHashMap<>();
    columns.put("nitrate", new AlignedColumn("nitrate", AggregationPolicy.MEAN, nitrate, states));
    columns.put("rain", new AlignedColumn("rain", AggregationPolicy.SUM, rain, states));
    AlignedDataset filled = GapHandler.apply(
        new AlignedDataset(new TimeGrid(START, HOUR, 40), columns), config.gapPolicy());
    return LagFeatureBuilder.materializeLags(filled, List.of(new LagSpec("rain", 2)));
  }

  /**
   * nitrate[i] = i, rain[i] = 100 + i, tide[i] = 200 + i, plus rain_lag2. The optional row is
   * marked as a filled gap in the target.
   */
  private static LaggedFeatureTable table(int rows, Integer filledRow) {
    List<Double> nitrate = new ArrayList<>();
    List<FillState> nitrateStates = new ArrayList<>();
    List<Double> rain = new ArrayList<>();
    List<Double> tide = new ArrayList<>();
    for (int i = 0; i < rows; i++) {
      nitrate.add((double) i);
      nitrateStates.add(filledRow != null && filledRow == i
          ? FillState.SHORT_GAP_FILLED : FillState.OBSERVED);
      rain.add(100d + i);
      tide.add(200d + i);
    }
    Map<String, AlignedColumn> columns = new LinkedHashMap<>();
    columns.put("nitrate", new AlignedColumn("nitrate", AggregationPolicy.MEAN, nitrate,
        nitrateStates));
    columns.put("rain", observed("rain", rain));
    columns.put("tide", observed("tide", tide));
    AlignedDataset dataset = new AlignedDataset(new TimeGrid(START, HOUR, rows), columns);
    return LagFeatureBuilder.materializeLags(dataset, List.of(new LagSpec("rain", 2)));
  }

  private static LaggedFeatureTable noisyTable(int rows) {
    Random random = new Random(99);
    List<Double> nitrate = new ArrayList<>();
    for (int i = 0; i < rows; i++) {
      nitrate.add(10d + Math.sin(i * 0.5) + 0.3 * random.nextGaussian());
    }
    Map<String, AlignedColumn> columns = new LinkedHashMap<>();
    columns.put("nitrate", observed("nitrate", nitrate));
    return LaggedFeatureTable.of(new AlignedDataset(new TimeGrid(START, HOUR, rows), columns));
  }

  private static AlignedColumn observed(String name, List<Double> values) {
    List<FillState> states = new ArrayList<>();
    for (int i = 0; i < values.size(); i++) {
      states.add(FillState.OBSERVED);
    }
    return new AlignedColumn(name, AggregationPolicy.MEAN, values, states);
  }

  /** Fits nothing; forecasts a constant after handing each frame to {@code onForecast}. */
  private static final class RecordingModel implements ForecastModel {
    private final Consumer<ExogenousFrame> onForecast;

    RecordingModel(Consumer<ExogenousFrame> onForecast) {
      this.onForecast = onForecast;
    }

    @Override
    public ModelFamily family() {
      return ModelFamily.SARIMAX;
    }

    @Override
    public ForecastModelState fit(TrainingSlice slice, ModelOrders orders,
        List<String> exogenousColumns) {
      return new StubState(orders, exogenousColumns, slice.lastTimestamp(), slice.step(),
          slice.size());
    }

    @Override
    public ForecastResult forecast(ForecastModelState state, int horizon,
        ExogenousFrame futureExogenous) {
      if (!futureExogenous.timestamps().get(0).isAfter(state.trainedThrough())) {
        throw new IllegalStateException("Forecast starts inside the training slice");
      }
      onForecast.accept(futureExogenous);
      List<ForecastPoint> points = new ArrayList<>();
      for (int h = 0; h < horizon; h++) {
        points.add(new ForecastPoint(futureExogenous.timestamps().get(h), h + 1, 1d, 0d, 2d,
            null));
      }
      return new ForecastResult(points);
    }

    @Override
    public ResidualDiagnostics diagnose(ForecastModelState state, TrainingSlice slice) {
      return new ResidualDiagnostics(slice.size(), 0d, 0d, List.of(), 0d, 0, 1d, 0d, 1d, 0d, 0d,
          1d);
    }
  }

  private record StubState(
      ModelOrders orders,
      List<String> exogenousColumns,
      Instant trainedThrough,
      Duration step,
      int observations
  ) implements ForecastModelState {

    @Override
    public ModelFamily family() {
      return ModelFamily.SARIMAX;
    }

    @Override
    public double residualVariance() {
      return 1d;
    }

    @Override
    public Map<String, Double> coefficients() {
      return Map.of();
    }
  }
}

package com.ospicorp.nitrateforecast.config;

import com.ospicorp.nitrateforecast.error.ConfigException;
import com.ospicorp.nitrateforecast.features.model.LagRange;
import com.ospicorp.nitrateforecast.features.model.LagSpec;
import com.ospicorp.nitrateforecast.forecast.model.ModelFamily;
import com.ospicorp.nitrateforecast.forecast.model.ModelOrders;
import com.ospicorp.nitrateforecast.forecast.model.ModelSettings;
import com.ospicorp.nitrateforecast.series.model.AggregationPolicy;
import com.ospicorp.nitrateforecast.series.model.GapPolicy;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Resolved, validated pipeline configuration. Passed explicitly to every stage; never mutated.
 */
public record PipelineConfig(
    Duration gridStep,
    Instant studyStart,
    Instant studyEnd,
    GapPolicy gapPolicy,
    LagRange lagRange,
    List<LagSpec> lagSpecs,
    ModelFamily modelFamily,
    ModelOrders modelOrders,
    RollingMode rollingMode,
    int trainWindowSteps,
    int forecastHorizonSteps,
    int stepAdvanceSteps,
    Double alertThreshold,
    String targetVariable,
    List<String> exogenousColumns,
    Set<String> forecastKnownColumns,
    int maxIterations,
    Duration windowTimeout,
    double intervalLevel,
    int minTrainingMarginSteps,
    Map<String, AggregationPolicy> seriesPolicies,
    Set<String> zeroWhenEmpty
) {

  public PipelineConfig {
    if (gridStep == null || gridStep.isZero() || gridStep.isNegative()) {
      throw new ConfigException("grid-step-seconds must be positive, got " + gridStep);
    }
    if (studyStart != null && studyEnd != null && !studyEnd.isAfter(studyStart)) {
      throw new ConfigException("study-end " + studyEnd + " must be after study-start "
          + studyStart);
    }
    if (gapPolicy == null || lagRange == null || modelFamily == null || modelOrders == null
        || rollingMode == null) {
      throw new ConfigException("Gap policy, lag range, model family, orders and rolling mode "
          + "are required");
    }
    requirePositive("train-window-steps", trainWindowSteps);
    requirePositive("forecast-horizon-steps", forecastHorizonSteps);
    requirePositive("step-advance-steps", stepAdvanceSteps);
    requirePositive("max-iterations", maxIterations);
    if (minTrainingMarginSteps < 0) {
      throw new ConfigException("min-training-margin-steps must be >= 0, got "
          + minTrainingMarginSteps);
    }
    if (alertThreshold != null && !Double.isFinite(alertThreshold)) {
      throw new ConfigException("alert-threshold must be finite");
    }
    if (targetVariable == null || targetVariable.isBlank()) {
      throw new ConfigException("target-variable is required");
    }
    if (windowTimeout == null || windowTimeout.isZero() || windowTimeout.isNegative()) {
      throw new ConfigException("window-timeout must be positive, got " + windowTimeout);
    }
    if (!(intervalLevel > 0d && intervalLevel < 1d)) {
      throw new ConfigException("interval-level must lie in (0, 1), got " + intervalLevel);
    }

    lagSpecs = List.copyOf(lagSpecs == null ? List.of() : lagSpecs);
    Set<String> lagNames = new HashSet<>();
    for (LagSpec spec : lagSpecs) {
      if (!lagNames.add(spec.columnName())) {
        throw new ConfigException("Duplicate lag spec " + spec.columnName());
      }
    }
    exogenousColumns = List.copyOf(exogenousColumns == null ? List.of() : exogenousColumns);
    if (exogenousColumns.contains(targetVariable)) {
      throw new ConfigException("The target " + targetVariable
          + " cannot also be an exogenous column");
    }
    if (new HashSet<>(exogenousColumns).size() != exogenousColumns.size()) {
      throw new ConfigException("exogenous-columns contains duplicates");
    }
    forecastKnownColumns = Set.copyOf(forecastKnownColumns == null ? Set.of()
        : forecastKnownColumns);
    for (String known : forecastKnownColumns) {
      if (!exogenousColumns.contains(known)) {
        throw new ConfigException("forecast-known column " + known
            + " is not one of the exogenous columns");
      }
    }
    seriesPolicies = Map.copyOf(seriesPolicies == null ? Map.of() : seriesPolicies);
    zeroWhenEmpty = Set.copyOf(zeroWhenEmpty == null ? Set.of() : zeroWhenEmpty);
  }

  public ModelSettings modelSettings() {
    return new ModelSettings(maxIterations, intervalLevel, minTrainingMarginSteps);
  }

  public AggregationPolicy aggregationFor(String variable, AggregationPolicy fallback) {
    return seriesPolicies.getOrDefault(variable, fallback);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    Builder b = new Builder();
    b.gridStep = gridStep;
    b.studyStart = studyStart;
    b.studyEnd = studyEnd;
    b.shortGapMaxSteps = gapPolicy.shortGapMaxSteps();
    b.longGapMinSteps = gapPolicy.longGapMinSteps();
    b.shortGapFill = gapPolicy.shortGapFill();
    b.longGapFill = gapPolicy.longGapFill();
    b.seasonSteps = gapPolicy.seasonSteps();
    b.lagRange = lagRange;
    b.lagSpecs = new ArrayList<>(lagSpecs);
    b.modelFamily = modelFamily;
    b.modelOrders = modelOrders;
    b.rollingMode = rollingMode;
    b.trainWindowSteps = trainWindowSteps;
    b.forecastHorizonSteps = forecastHorizonSteps;
    b.stepAdvanceSteps = stepAdvanceSteps;
    b.alertThreshold = alertThreshold;
    b.targetVariable = targetVariable;
    b.exogenousColumns = new ArrayList<>(exogenousColumns);
    b.forecastKnownColumns = new LinkedHashSet<>(forecastKnownColumns);
    b.maxIterations = maxIterations;
    b.windowTimeout = windowTimeout;
    b.intervalLevel = intervalLevel;
    b.minTrainingMarginSteps = minTrainingMarginSteps;
    b.seriesPolicies = new LinkedHashMap<>(seriesPolicies);
    b.zeroWhenEmpty = new LinkedHashSet<>(zeroWhenEmpty);
    return b;
  }

  private static void requirePositive(String name, int value) {
    if (value <= 0) {
      throw new ConfigException(name + " must be positive, got " + value);
    }
  }

  public enum RollingMode {
    ROLLING,
    EXPANDING;

    public static RollingMode fromCode(String code) {
      return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
  }

  /**
   * Mutable builder. Text setters accept the configuration-file spelling ({@code forward-fill},
   * {@code 1,0,0,0,0,0,24}) and raise {@link ConfigException} for anything unparseable.
   */
  public static final class Builder {
    private Duration gridStep = Duration.ofHours(1);
    private Instant studyStart;
    private Instant studyEnd;
    private int shortGapMaxSteps = 3;
    private int longGapMinSteps = 4;
    private GapPolicy.ShortGapFill shortGapFill = GapPolicy.ShortGapFill.FORWARD_FILL;
    private GapPolicy.LongGapFill longGapFill = GapPolicy.LongGapFill.NONE;
    private int seasonSteps = 24;
    private LagRange lagRange = LagRange.DEFAULT;
    private List<LagSpec> lagSpecs = new ArrayList<>();
    private ModelFamily modelFamily = ModelFamily.SARIMAX;
    private ModelOrders modelOrders = new ModelOrders(1, 0, 0, 0, 0, 0, 0);
    private RollingMode rollingMode = RollingMode.ROLLING;
    private int trainWindowSteps = 72;
    private int forecastHorizonSteps = 6;
    private int stepAdvanceSteps = 6;
    private Double alertThreshold;
    private String targetVariable = "nitrate";
    private List<String> exogenousColumns = new ArrayList<>();
    private Set<String> forecastKnownColumns = new LinkedHashSet<>();
    private int maxIterations = 2000;
    private Duration windowTimeout = Duration.ofSeconds(60);
    private double intervalLevel = 0.95;
    private int minTrainingMarginSteps = 2;
    private Map<String, AggregationPolicy> seriesPolicies = new LinkedHashMap<>();
    private Set<String> zeroWhenEmpty = new LinkedHashSet<>();

    private Builder() {
    }

    public Builder gridStep(Duration value) {
      this.gridStep = value;
      return this;
    }

    public Builder gridStepSeconds(long seconds) {
      return gridStep(Duration.ofSeconds(seconds));
    }

    public Builder studyStart(Instant value) {
      this.studyStart = value;
      return this;
    }

    public Builder studyStart(String value) {
      return studyStart(parseInstant("study-start", value));
    }

    public Builder studyEnd(Instant value) {
      this.studyEnd = value;
      return this;
    }

    public Builder studyEnd(String value) {
      return studyEnd(parseInstant("study-end", value));
    }

    public Builder shortGapMaxSteps(int value) {
      this.shortGapMaxSteps = value;
      return this;
    }

    public Builder longGapMinSteps(int value) {
      this.longGapMinSteps = value;
      return this;
    }

    public Builder shortGapFill(String code) {
      this.shortGapFill = parseCode("short-gap-fill", code, GapPolicy.ShortGapFill::fromCode);
      return this;
    }

    public Builder longGapFillPolicy(String code) {
      this.longGapFill = parseCode("long-gap-fill-policy", code, GapPolicy.LongGapFill::fromCode);
      return this;
    }

    public Builder longGapSeasonSteps(int value) {
      this.seasonSteps = value;
      return this;
    }

    public Builder lagRange(LagRange value) {
      this.lagRange = value;
      return this;
    }

    /** Parses {@code min,max}. */
    public Builder lagRange(String text) {
      String[] parts = text == null ? new String[0] : text.split(",");
      if (parts.length != 2) {
        throw new ConfigException("lag-range-steps must be min,max, got " + text);
      }
      return lagRange(new LagRange(parseInt("lag-range-steps", parts[0]),
          parseInt("lag-range-steps", parts[1])));
    }

    public Builder lagSpecs(Collection<String> specs) {
      List<LagSpec> parsed = new ArrayList<>();
      for (String spec : specs) {
        parsed.add(LagSpec.parse(spec));
      }
      this.lagSpecs = parsed;
      return this;
    }

    public Builder modelFamily(String code) {
      this.modelFamily = parseCode("model-family", code, ModelFamily::fromCode);
      return this;
    }

    public Builder modelOrders(ModelOrders value) {
      this.modelOrders = value;
      return this;
    }

    public Builder modelOrders(String text) {
      return modelOrders(ModelOrders.parse(text));
    }

    public Builder rollingMode(String code) {
      this.rollingMode = parseCode("rolling-mode", code, RollingMode::fromCode);
      return this;
    }

    public Builder rollingMode(RollingMode value) {
      this.rollingMode = value;
      return this;
    }

    public Builder trainWindowSteps(int value) {
      this.trainWindowSteps = value;
      return this;
    }

    public Builder forecastHorizonSteps(int value) {
      this.forecastHorizonSteps = value;
      return this;
    }

    public Builder stepAdvanceSteps(int value) {
      this.stepAdvanceSteps = value;
      return this;
    }

    public Builder alertThreshold(Double value) {
      this.alertThreshold = value;
      return this;
    }

    public Builder targetVariable(String value) {
      this.targetVariable = value;
      return this;
    }

    public Builder exogenousColumns(Collection<String> values) {
      this.exogenousColumns = new ArrayList<>(values);
      return this;
    }

    public Builder forecastKnownColumns(Collection<String> values) {
      this.forecastKnownColumns = new LinkedHashSet<>(values);
      return this;
    }

    public Builder maxIterations(int value) {
      this.maxIterations = value;
      return this;
    }

    public Builder windowTimeout(Duration value) {
      this.windowTimeout = value;
      return this;
    }

    public Builder intervalLevel(double value) {
      this.intervalLevel = value;
      return this;
    }

    public Builder minTrainingMarginSteps(int value) {
      this.minTrainingMarginSteps = value;
      return this;
    }

    public Builder seriesPolicies(Map<String, String> policies) {
      Map<String, AggregationPolicy> parsed = new LinkedHashMap<>();
      policies.forEach((variable, code) -> parsed.put(variable,
          parseCode("series-policies." + variable, code, AggregationPolicy::fromCode)));
      this.seriesPolicies = parsed;
      return this;
    }

    public Builder zeroWhenEmpty(Collection<String> variables) {
      this.zeroWhenEmpty = new LinkedHashSet<>(variables);
      return this;
    }

    public PipelineConfig build() {
      GapPolicy gapPolicy = new GapPolicy(shortGapMaxSteps, longGapMinSteps, shortGapFill,
          longGapFill, seasonSteps);
      return new PipelineConfig(gridStep, studyStart, studyEnd, gapPolicy, lagRange, lagSpecs,
          modelFamily, modelOrders, rollingMode, trainWindowSteps, forecastHorizonSteps,
          stepAdvanceSteps, alertThreshold, targetVariable, exogenousColumns,
          forecastKnownColumns, maxIterations, windowTimeout, intervalLevel,
          minTrainingMarginSteps, seriesPolicies, zeroWhenEmpty);
    }

    private static <T> T parseCode(String key, String code, Function<String, T> parser) {
      if (code == null || code.isBlank()) {
        throw new ConfigException(key + " must not be blank");
      }
      try {
        return parser.apply(code);
      } catch (IllegalArgumentException ex) {
        throw new ConfigException("Unsupported value for " + key + ": " + code);
      }
    }

    private static int parseInt(String key, String text) {
      try {
        return Integer.parseInt(text.trim());
      } catch (NumberFormatException ex) {
        throw new ConfigException(key + " is not an integer: " + text);
      }
    }

    private static Instant parseInstant(String key, String text) {
      if (text == null || text.isBlank()) {
        return null;
      }
      try {
        return OffsetDateTime.parse(text.trim()).toInstant();
      } catch (DateTimeParseException ex) {
        throw new ConfigException(key + " must be ISO-8601 with an offset, got " + text);
      }
    }
  }
}

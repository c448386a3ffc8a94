package com.ospicorp.nitrateforecast.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bound from {@code nitrate.forecast.*}. Values stay in their textual form here so that every
 * domain check happens once, in {@link PipelineConfig.Builder}.
 */
@ConfigurationProperties(prefix = "nitrate.forecast")
public class ForecastProperties {
  private long gridStepSeconds = 3600;
  private String studyStart;
  private String studyEnd;
  private int shortGapMaxSteps = 3;
  private int longGapMinSteps = 4;
  private String shortGapFill = "forward-fill";
  private String longGapFillPolicy = "none";
  private int longGapSeasonSteps = 24;
  private String lagRangeSteps = "0,72";
  private List<String> lagSpecs = new ArrayList<>();
  private String modelFamily = "sarimax";
  private String modelOrders = "1,0,0,0,0,0,0";
  private String rollingMode = "rolling";
  private int trainWindowSteps = 72;
  private int forecastHorizonSteps = 6;
  private int stepAdvanceSteps = 6;
  private Double alertThreshold;
  private String targetVariable = "nitrate";
  private List<String> exogenousColumns = new ArrayList<>();
  private List<String> forecastKnownColumns = new ArrayList<>();
  private int maxIterations = 2000;
  private Duration windowTimeout = Duration.ofSeconds(60);
  private double intervalLevel = 0.95;
  private int minTrainingMarginSteps = 2;
  private Map<String, String> seriesPolicies = new LinkedHashMap<>();
  private List<String> zeroWhenEmpty = new ArrayList<>();

  public PipelineConfig.Builder toBuilder() {
    return PipelineConfig.builder()
        .gridStepSeconds(gridStepSeconds)
        .studyStart(studyStart)
        .studyEnd(studyEnd)
        .shortGapMaxSteps(shortGapMaxSteps)
        .longGapMinSteps(longGapMinSteps)
        .shortGapFill(shortGapFill)
        .longGapFillPolicy(longGapFillPolicy)
        .longGapSeasonSteps(longGapSeasonSteps)
        .lagRange(lagRangeSteps)
        .lagSpecs(lagSpecs)
        .modelFamily(modelFamily)
        .modelOrders(modelOrders)
        .rollingMode(rollingMode)
        .trainWindowSteps(trainWindowSteps)
        .forecastHorizonSteps(forecastHorizonSteps)
        .stepAdvanceSteps(stepAdvanceSteps)
        .alertThreshold(alertThreshold)
        .targetVariable(targetVariable)
        .exogenousColumns(exogenousColumns)
        .forecastKnownColumns(forecastKnownColumns)
        .maxIterations(maxIterations)
        .windowTimeout(windowTimeout)
        .intervalLevel(intervalLevel)
        .minTrainingMarginSteps(minTrainingMarginSteps)
        .seriesPolicies(seriesPolicies)
        .zeroWhenEmpty(zeroWhenEmpty);
  }

  public long getGridStepSeconds() {
    return gridStepSeconds;
  }

  public void setGridStepSeconds(long gridStepSeconds) {
    this.gridStepSeconds = gridStepSeconds;
  }

  public String getStudyStart() {
    return studyStart;
  }

  public void setStudyStart(String studyStart) {
    this.studyStart = studyStart;
  }

  public String getStudyEnd() {
    return studyEnd;
  }

  public void setStudyEnd(String studyEnd) {
    this.studyEnd = studyEnd;
  }

  public int getShortGapMaxSteps() {
    return shortGapMaxSteps;
  }

  public void setShortGapMaxSteps(int shortGapMaxSteps) {
    this.shortGapMaxSteps = shortGapMaxSteps;
  }

  public int getLongGapMinSteps() {
    return longGapMinSteps;
  }

  public void setLongGapMinSteps(int longGapMinSteps) {
    this.longGapMinSteps = longGapMinSteps;
  }

  public String getShortGapFill() {
    return shortGapFill;
  }

  public void setShortGapFill(String shortGapFill) {
    this.shortGapFill = shortGapFill;
  }

  public String getLongGapFillPolicy() {
    return longGapFillPolicy;
  }

  public void setLongGapFillPolicy(String longGapFillPolicy) {
    this.longGapFillPolicy = longGapFillPolicy;
  }

  public int getLongGapSeasonSteps() {
    return longGapSeasonSteps;
  }

  public void setLongGapSeasonSteps(int longGapSeasonSteps) {
    this.longGapSeasonSteps = longGapSeasonSteps;
  }

  public String getLagRangeSteps() {
    return lagRangeSteps;
  }

  public void setLagRangeSteps(String lagRangeSteps) {
    this.lagRangeSteps = lagRangeSteps;
  }

  public List<String> getLagSpecs() {
    return lagSpecs;
  }

  public void setLagSpecs(List<String> lagSpecs) {
    this.lagSpecs = lagSpecs;
  }

  public String getModelFamily() {
    return modelFamily;
  }

  public void setModelFamily(String modelFamily) {
    this.modelFamily = modelFamily;
  }

  public String getModelOrders() {
    return modelOrders;
  }

  public void setModelOrders(String modelOrders) {
    this.modelOrders = modelOrders;
  }

  public String getRollingMode() {
    return rollingMode;
  }

  public void setRollingMode(String rollingMode) {
    this.rollingMode = rollingMode;
  }

  public int getTrainWindowSteps() {
    return trainWindowSteps;
  }

  public void setTrainWindowSteps(int trainWindowSteps) {
    this.trainWindowSteps = trainWindowSteps;
  }

  public int getForecastHorizonSteps() {
    return forecastHorizonSteps;
  }

  public void setForecastHorizonSteps(int forecastHorizonSteps) {
    this.forecastHorizonSteps = forecastHorizonSteps;
  }

  public int getStepAdvanceSteps() {
    return stepAdvanceSteps;
  }

  public void setStepAdvanceSteps(int stepAdvanceSteps) {
    this.stepAdvanceSteps = stepAdvanceSteps;
  }

  public Double getAlertThreshold() {
    return alertThreshold;
  }

  public void setAlertThreshold(Double alertThreshold) {
    this.alertThreshold = alertThreshold;
  }

  public String getTargetVariable() {
    return targetVariable;
  }

  public void setTargetVariable(String targetVariable) {
    this.targetVariable = targetVariable;
  }

  public List<String> getExogenousColumns() {
    return exogenousColumns;
  }

  public void setExogenousColumns(List<String> exogenousColumns) {
    this.exogenousColumns = exogenousColumns;
  }

  public List<String> getForecastKnownColumns() {
    return forecastKnownColumns;
  }

  public void setForecastKnownColumns(List<String> forecastKnownColumns) {
    this.forecastKnownColumns = forecastKnownColumns;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(int maxIterations) {
    this.maxIterations = maxIterations;
  }

  public Duration getWindowTimeout() {
    return windowTimeout;
  }

  public void setWindowTimeout(Duration windowTimeout) {
    this.windowTimeout = windowTimeout;
  }

  public double getIntervalLevel() {
    return intervalLevel;
  }

  public void setIntervalLevel(double intervalLevel) {
    this.intervalLevel = intervalLevel;
  }

  public int getMinTrainingMarginSteps() {
    return minTrainingMarginSteps;
  }

  public void setMinTrainingMarginSteps(int minTrainingMarginSteps) {
    this.minTrainingMarginSteps = minTrainingMarginSteps;
  }

  public Map<String, String> getSeriesPolicies() {
    return seriesPolicies;
  }

  public void setSeriesPolicies(Map<String, String> seriesPolicies) {
    this.seriesPolicies = seriesPolicies;
  }

  public List<String> getZeroWhenEmpty() {
    return zeroWhenEmpty;
  }

  public void setZeroWhenEmpty(List<String> zeroWhenEmpty) {
    this.zeroWhenEmpty = zeroWhenEmpty;
  }
}

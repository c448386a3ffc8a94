package com.ospicorp.nitrateforecast.evaluation.service;

import com.ospicorp.nitrateforecast.evaluation.model.ClassificationMetrics;
import com.ospicorp.nitrateforecast.evaluation.model.EvaluationReport;
import com.ospicorp.nitrateforecast.evaluation.model.EvaluationRow;
import com.ospicorp.nitrateforecast.evaluation.model.HorizonMetrics;
import com.ospicorp.nitrateforecast.evaluation.model.MetricsSummary;
import com.ospicorp.nitrateforecast.evaluation.model.ModelFitSummary;
import com.ospicorp.nitrateforecast.evaluation.model.SkippedWindow;
import com.ospicorp.nitrateforecast.evaluation.model.WindowMetrics;
import com.ospicorp.nitrateforecast.evaluation.model.WindowOutcome;
import com.ospicorp.nitrateforecast.forecast.model.ForecastPoint;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns window outcomes into a report. Per-window figures sit next to the aggregate ones, and
 * skipped windows are always counted.
 */
public final class MetricsReporter {
  private MetricsReporter() {
  }

  public static EvaluationReport report(List<WindowOutcome> outcomes, Double threshold) {
    List<WindowOutcome> ordered = new ArrayList<>(outcomes);
    ordered.sort(Comparator.comparingInt(o -> o.window().index()));

    List<EvaluationRow> rows = new ArrayList<>();
    List<WindowMetrics> windows = new ArrayList<>();
    List<SkippedWindow> skipped = new ArrayList<>();
    Map<Integer, ErrorAccumulator> byHorizon = new TreeMap<>();
    ErrorAccumulator overall = new ErrorAccumulator();
    Confusion confusion = threshold == null ? null : new Confusion(threshold);
    ModelFitSummary latestFit = null;

    for (WindowOutcome outcome : ordered) {
      if (outcome.isSkipped()) {
        skipped.add(outcome.skipped());
        continue;
      }
      latestFit = outcome.fit();
      ErrorAccumulator window = new ErrorAccumulator();
      List<ForecastPoint> points = new ArrayList<>(outcome.result().points());
      points.sort(Comparator.comparing(ForecastPoint::timestamp));
      for (ForecastPoint p : points) {
        rows.add(new EvaluationRow(outcome.window().index(), p.timestamp(), p.predicted(),
            p.lowerBound(), p.upperBound(), p.realized(), p.absoluteError()));
        if (p.realized() == null) {
          continue;
        }
        window.add(p.predicted(), p.realized());
        overall.add(p.predicted(), p.realized());
        byHorizon.computeIfAbsent(p.horizonStep(), h -> new ErrorAccumulator())
            .add(p.predicted(), p.realized());
        if (confusion != null) {
          confusion.add(p.predicted(), p.realized());
        }
      }
      windows.add(new WindowMetrics(outcome.window().index(), outcome.window().cutoff(),
          window.count, window.rmse(), window.mae(), window.bias()));
    }

    List<HorizonMetrics> horizons = new ArrayList<>(byHorizon.size());
    byHorizon.forEach((step, acc) ->
        horizons.add(new HorizonMetrics(step, acc.count, acc.rmse(), acc.mae())));

    Map<String, Integer> byCause = new LinkedHashMap<>();
    for (SkippedWindow s : skipped) {
      byCause.merge(s.cause(), 1, Integer::sum);
    }

    MetricsSummary summary = new MetricsSummary(ordered.size(), ordered.size() - skipped.size(),
        skipped.size(), byCause, overall.count, overall.rmse(), overall.mae(), overall.bias(),
        confusion == null ? null : confusion.toMetrics());
    return new EvaluationReport(rows, windows, horizons, summary, skipped, latestFit);
  }

  private static final class ErrorAccumulator {
    private int count;
    private double sumSquared;
    private double sumAbsolute;
    private double sumError;

    void add(double predicted, double realized) {
      double error = predicted - realized;
      count++;
      sumSquared += error * error;
      sumAbsolute += Math.abs(error);
      sumError += error;
    }

    Double rmse() {
      return count == 0 ? null : Math.sqrt(sumSquared / count);
    }

    Double mae() {
      return count == 0 ? null : sumAbsolute / count;
    }

    /** Mean of predicted minus realized. */
    Double bias() {
      return count == 0 ? null : sumError / count;
    }
  }

  private static final class Confusion {
    private final double threshold;
    private int tp;
    private int fp;
    private int fn;
    private int tn;

    Confusion(double threshold) {
      this.threshold = threshold;
    }

    void add(double predicted, double realized) {
      boolean predictedAlert = predicted >= threshold;
      boolean actualAlert = realized >= threshold;
      if (predictedAlert && actualAlert) {
        tp++;
      } else if (predictedAlert) {
        fp++;
      } else if (actualAlert) {
        fn++;
      } else {
        tn++;
      }
    }

    ClassificationMetrics toMetrics() {
      Double precision = ratio(tp, tp + fp);
      Double recall = ratio(tp, tp + fn);
      Double f1 = precision == null || recall == null || precision + recall == 0d
          ? null : 2 * precision * recall / (precision + recall);
      return new ClassificationMetrics(threshold, tp, fp, fn, tn, precision, recall, f1);
    }

    private static Double ratio(int numerator, int denominator) {
      return denominator == 0 ? null : (double) numerator / denominator;
    }
  }
}

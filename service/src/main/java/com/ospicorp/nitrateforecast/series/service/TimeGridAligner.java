package com.ospicorp.nitrateforecast.series.service;

import com.ospicorp.nitrateforecast.error.AlignmentException;
import com.ospicorp.nitrateforecast.series.model.AggregationPolicy;
import com.ospicorp.nitrateforecast.series.model.AlignedColumn;
import com.ospicorp.nitrateforecast.series.model.AlignedDataset;
import com.ospicorp.nitrateforecast.series.model.FillState;
import com.ospicorp.nitrateforecast.series.model.RawObservation;
import com.ospicorp.nitrateforecast.series.model.RawSeries;
import com.ospicorp.nitrateforecast.series.model.TimeGrid;
import com.ospicorp.nitrateforecast.util.Futures;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Buckets raw observations into left-closed grid intervals {@code [t, t + step)}.
 *
 * <p>Stateless; every method is a pure function of its arguments, so independent variables can
 * be aligned concurrently.
 */
public final class TimeGridAligner {
  private TimeGridAligner() {
  }

  public static TimeGrid buildGrid(Instant start, Instant end, Duration step) {
    if (step == null || step.isZero() || step.isNegative()) {
      throw new AlignmentException("Grid step must be positive, got " + step);
    }
    if (start == null || end == null || !end.isAfter(start)) {
      throw new AlignmentException("Study period is empty: " + start + " to " + end);
    }
    Duration span = Duration.between(start, end);
    long full = span.dividedBy(step);
    long size = start.plus(step.multipliedBy(full)).isBefore(end) ? full + 1 : full;
    if (size > Integer.MAX_VALUE) {
      throw new AlignmentException("Study period holds too many grid steps: " + size);
    }
    return new TimeGrid(start, step, (int) size);
  }

  /** Study period spanning every observation, floored to the step on the epoch. */
  public static TimeGrid gridCovering(List<RawSeries> series, Duration step) {
    Instant first = null;
    Instant last = null;
    for (RawSeries s : series) {
      for (RawObservation o : s.observations()) {
        if (first == null || o.timestamp().isBefore(first)) {
          first = o.timestamp();
        }
        if (last == null || o.timestamp().isAfter(last)) {
          last = o.timestamp();
        }
      }
    }
    if (first == null) {
      throw new AlignmentException("Study period is empty: no observations supplied");
    }
    return buildGrid(floor(first, step), floor(last, step).plus(step), step);
  }

  public static Instant floor(Instant t, Duration step) {
    long stepMillis = step.toMillis();
    long millis = t.toEpochMilli();
    return Instant.ofEpochMilli(millis - Math.floorMod(millis, stepMillis));
  }

  public static AlignedColumn align(TimeGrid grid, RawSeries series) {
    int n = grid.size();
    double[] sums = new double[n];
    int[] counts = new int[n];
    double[] lasts = new double[n];
    Instant first = null;
    Instant last = null;

    for (RawObservation o : series.observations()) {
      if (!o.hasValue()) {
        continue;
      }
      if (first == null) {
        first = o.timestamp();
      }
      last = o.timestamp();
      int bucket = grid.bucketOf(o.timestamp());
      if (bucket < 0) {
        continue;
      }
      sums[bucket] += o.value();
      counts[bucket]++;
      lasts[bucket] = o.value();
    }

    List<Double> values = new ArrayList<>(n);
    List<FillState> states = new ArrayList<>(n);
    Instant coverageEnd = last == null ? null : last.plus(resolveNativeStep(series, grid.step()));
    for (int i = 0; i < n; i++) {
      Instant bucketStart = grid.timestampAt(i);
      Instant bucketEnd = bucketStart.plus(grid.step());
      if (counts[i] == 0) {
        boolean insideCoverage = first != null
            && bucketStart.isBefore(coverageEnd) && bucketEnd.isAfter(first);
        if (series.aggregation() == AggregationPolicy.SUM && series.zeroWhenEmpty()
            && insideCoverage) {
          values.add(0d);
          states.add(FillState.EMPTY_AS_ZERO);
        } else {
          values.add(null);
          states.add(FillState.MISSING);
        }
        continue;
      }
      values.add(switch (series.aggregation()) {
        case MEAN -> sums[i] / counts[i];
        case SUM -> sums[i];
        case LAST_STATE -> lasts[i];
      });
      boolean fullyCovered = !bucketStart.isBefore(first) && !bucketEnd.isAfter(coverageEnd);
      states.add(fullyCovered ? FillState.OBSERVED : FillState.BOUNDARY_PARTIAL);
    }
    return new AlignedColumn(series.name(), series.aggregation(), values, states);
  }

  public static AlignedDataset alignAll(TimeGrid grid, List<RawSeries> series, Executor executor) {
    Set<String> seen = new HashSet<>();
    for (RawSeries s : series) {
      if (!seen.add(s.name())) {
        throw new AlignmentException("Variable supplied more than once: " + s.name());
      }
    }
    List<CompletableFuture<AlignedColumn>> tasks = new ArrayList<>(series.size());
    for (RawSeries s : series) {
      tasks.add(CompletableFuture.supplyAsync(() -> align(grid, s), executor));
    }
    Map<String, AlignedColumn> columns = new LinkedHashMap<>();
    for (var task : tasks) {
      AlignedColumn column = Futures.await(task);
      columns.put(column.name(), column);
    }
    return new AlignedDataset(grid, columns);
  }

  static Duration resolveNativeStep(RawSeries series, Duration fallback) {
    if (series.nativeStep() != null && !series.nativeStep().isZero()
        && !series.nativeStep().isNegative()) {
      return series.nativeStep();
    }
    Double median = SeriesInspector.medianIntervalSeconds(series);
    if (median == null || median <= 0d) {
      return fallback;
    }
    return Duration.ofMillis(Math.round(median * 1000d));
  }
}

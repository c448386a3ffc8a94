package com.ospicorp.nitrateforecast.series.service;

import com.ospicorp.nitrateforecast.series.model.RawObservation;
import com.ospicorp.nitrateforecast.series.model.RawSeries;
import com.ospicorp.nitrateforecast.series.model.SeriesInspection;
import com.ospicorp.nitrateforecast.series.model.StateCount;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public final class SeriesInspector {
  static final int TOP_STATES = 10;

  private SeriesInspector() {
  }

  public static SeriesInspection inspect(RawSeries series) {
    List<RawObservation> obs = series.observations();
    int rows = obs.size();
    Set<Instant> unique = new HashSet<>();
    int numeric = 0;
    int text = 0;
    Map<String, Long> stateCounts = new LinkedHashMap<>();
    for (RawObservation o : obs) {
      unique.add(o.timestamp());
      if (o.hasValue()) {
        numeric++;
      }
      if (o.state() != null) {
        text++;
        if (!o.hasValue()) {
          stateCounts.merge(o.state(), 1L, Long::sum);
        }
      }
    }

    List<StateCount> topStates = new ArrayList<>();
    stateCounts.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
            .thenComparing(Map.Entry.comparingByKey()))
        .limit(TOP_STATES)
        .forEach(e -> topStates.add(new StateCount(e.getKey(), e.getValue())));

    Double median = medianIntervalSeconds(series);
    double pct = rows == 0 ? 0d : Math.round(numeric * 10000d / rows) / 100d;
    return new SeriesInspection(
        series.name(),
        rows,
        rows == 0 ? null : obs.get(0).timestamp(),
        rows == 0 ? null : obs.get(rows - 1).timestamp(),
        unique.size(),
        rows - unique.size(),
        humanInterval(median),
        median,
        numeric,
        pct,
        text,
        topStates);
  }

  public static List<SeriesInspection> inspectAll(List<RawSeries> series) {
    return series.stream()
        .map(SeriesInspector::inspect)
        .sorted(Comparator.comparingInt(SeriesInspection::rows).reversed())
        .toList();
  }

  /** Median spacing of consecutive timestamps in seconds, null with fewer than two readings. */
  public static Double medianIntervalSeconds(RawSeries series) {
    List<RawObservation> obs = series.observations();
    if (obs.size() < 2) {
      return null;
    }
    double[] deltas = new double[obs.size() - 1];
    for (int i = 1; i < obs.size(); i++) {
      Duration d = Duration.between(obs.get(i - 1).timestamp(), obs.get(i).timestamp());
      deltas[i - 1] = d.toMillis() / 1000d;
    }
    Arrays.sort(deltas);
    int mid = deltas.length / 2;
    return deltas.length % 2 == 1 ? deltas[mid] : (deltas[mid - 1] + deltas[mid]) / 2d;
  }

  public static String humanInterval(Double seconds) {
    if (seconds == null || seconds.isNaN()) {
      return "NA";
    }
    if (seconds < 60) {
      return String.format(Locale.ROOT, "%.0fs", seconds);
    }
    if (seconds < 3600) {
      return String.format(Locale.ROOT, "%.1f min", seconds / 60);
    }
    if (seconds < 86400) {
      return String.format(Locale.ROOT, "%.2f hr", seconds / 3600);
    }
    return String.format(Locale.ROOT, "%.2f d", seconds / 86400);
  }
}

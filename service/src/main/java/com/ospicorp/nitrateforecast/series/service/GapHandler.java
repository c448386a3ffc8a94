package com.ospicorp.nitrateforecast.series.service;

import com.ospicorp.nitrateforecast.series.model.AlignedColumn;
import com.ospicorp.nitrateforecast.series.model.AlignedDataset;
import com.ospicorp.nitrateforecast.series.model.FillState;
import com.ospicorp.nitrateforecast.series.model.GapPolicy;
import com.ospicorp.nitrateforecast.series.model.GapRun;
import com.ospicorp.nitrateforecast.series.model.GapRun.GapClass;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class GapHandler {
  private GapHandler() {
  }

  /**
   * Runs of missing cells, classed by length. Medium runs, longer than a short gap but shorter
   * than a long one, are reported here but {@link #fill} leaves them missing.
   */
  public static List<GapRun> findGaps(AlignedColumn column, GapPolicy policy) {
    List<GapRun> runs = new ArrayList<>();
    int i = 0;
    while (i < column.size()) {
      if (column.state(i) != FillState.MISSING) {
        i++;
        continue;
      }
      int start = i;
      while (i < column.size() && column.state(i) == FillState.MISSING) {
        i++;
      }
      int length = i - start;
      GapClass gapClass;
      if (length <= policy.shortGapMaxSteps()) {
        gapClass = GapClass.SHORT;
      } else if (length >= policy.longGapMinSteps()) {
        gapClass = GapClass.LONG;
      } else {
        gapClass = GapClass.MEDIUM;
      }
      runs.add(new GapRun(start, length, gapClass));
    }
    return runs;
  }

  public static AlignedColumn fill(AlignedColumn column, GapPolicy policy) {
    List<GapRun> runs = findGaps(column, policy);
    if (runs.isEmpty()) {
      return column;
    }
    Double[] values = column.values().toArray(new Double[0]);
    FillState[] states = column.states().toArray(new FillState[0]);

    // left to right, so a seasonal fill can read an earlier fill one season back
    for (GapRun run : runs) {
      switch (run.gapClass()) {
        case SHORT -> fillShort(values, states, run, policy);
        case LONG -> fillLong(values, states, run, policy);
        case MEDIUM -> {
        }
      }
    }
    return column.withValues(Arrays.asList(values), Arrays.asList(states));
  }

  public static AlignedDataset apply(AlignedDataset dataset, GapPolicy policy) {
    Map<String, AlignedColumn> filled = new LinkedHashMap<>();
    for (var e : dataset.columns().entrySet()) {
      filled.put(e.getKey(), fill(e.getValue(), policy));
    }
    return dataset.withColumns(filled);
  }

  /** Puts every cell that had no observation behind it back to missing, undoing earlier fills. */
  public static AlignedColumn unfilled(AlignedColumn column) {
    List<Double> values = new ArrayList<>(column.size());
    List<FillState> states = new ArrayList<>(column.size());
    for (int i = 0; i < column.size(); i++) {
      if (column.state(i).wasMissing()) {
        values.add(null);
        states.add(FillState.MISSING);
      } else {
        values.add(column.value(i));
        states.add(column.state(i));
      }
    }
    return column.withValues(values, states);
  }

  /**
   * Fills the first {@code rows} cells as if the grid ended there. A run reaching that row is
   * classified by its length before it, and no fill reads a later cell. The column must not have
   * been filled already; see {@link #unfilled}.
   */
  public static AlignedColumn fillBefore(AlignedColumn column, int rows, GapPolicy policy) {
    AlignedColumn head = column.withValues(column.values().subList(0, rows),
        column.states().subList(0, rows));
    return fill(head, policy);
  }

  /** 1 where the cell had no observation at alignment time, regardless of later fills. */
  public static int[] missingIndicator(AlignedColumn column) {
    return column.missingIndicator();
  }

  private static void fillShort(Double[] values, FillState[] states, GapRun run,
      GapPolicy policy) {
    int before = run.start() - 1;
    int after = run.endExclusive();
    if (before < 0 || values[before] == null) {
      return;
    }
    double left = values[before];
    boolean linear = policy.shortGapFill() == GapPolicy.ShortGapFill.LINEAR
        && after < values.length && values[after] != null;
    for (int i = run.start(); i < after; i++) {
      if (linear) {
        double fraction = (double) (i - before) / (after - before);
        values[i] = left + (values[after] - left) * fraction;
      } else {
        values[i] = left;
      }
      states[i] = FillState.SHORT_GAP_FILLED;
    }
  }

  private static void fillLong(Double[] values, FillState[] states, GapRun run,
      GapPolicy policy) {
    if (policy.longGapFill() != GapPolicy.LongGapFill.SEASONAL_NAIVE) {
      return;
    }
    int season = policy.seasonSteps();
    for (int i = run.start(); i < run.endExclusive(); i++) {
      int source = i - season;
      if (source >= 0 && values[source] != null) {
        values[i] = values[source];
        states[i] = FillState.LONG_GAP_FILLED;
      }
    }
  }
}

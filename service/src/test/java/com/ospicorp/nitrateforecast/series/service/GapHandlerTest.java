package com.ospicorp.nitrateforecast.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.nitrateforecast.error.GapPolicyException;
import com.ospicorp.nitrateforecast.series.model.AggregationPolicy;
import com.ospicorp.nitrateforecast.series.model.AlignedColumn;
import com.ospicorp.nitrateforecast.series.model.FillState;
import com.ospicorp.nitrateforecast.series.model.GapPolicy;
import com.ospicorp.nitrateforecast.series.model.GapPolicy.LongGapFill;
import com.ospicorp.nitrateforecast.series.model.GapPolicy.ShortGapFill;
import com.ospicorp.nitrateforecast.series.model.GapRun;
import com.ospicorp.nitrateforecast.series.model.GapRun.GapClass;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class GapHandlerTest {
  private static final GapPolicy FORWARD = new GapPolicy(3, 4, ShortGapFill.FORWARD_FILL,
      LongGapFill.NONE, 24);

  @Test
  void gapsAreClassifiedByLength() {
    GapPolicy policy = new GapPolicy(1, 3, ShortGapFill.FORWARD_FILL, LongGapFill.NONE, 24);
    AlignedColumn column = column(1d, null, 2d, null, null, 3d, null, null, null, 4d);

    List<GapRun> gaps = GapHandler.findGaps(column, policy);

    assertEquals(List.of(
        new GapRun(1, 1, GapClass.SHORT),
        new GapRun(3, 2, GapClass.MEDIUM),
        new GapRun(6, 3, GapClass.LONG)), gaps);
  }

  @Test
  void shortGapIsForwardFilledByDefault() {
    AlignedColumn filled = GapHandler.fill(column(1d, null, null, 4d), FORWARD);

    assertEquals(Arrays.asList(1d, 1d, 1d, 4d), filled.values());
    assertEquals(FillState.SHORT_GAP_FILLED, filled.state(1));
    assertEquals(FillState.SHORT_GAP_FILLED, filled.state(2));
  }

  @Test
  void linearFillInterpolatesBetweenNeighbours() {
    GapPolicy linear = new GapPolicy(3, 4, ShortGapFill.LINEAR, LongGapFill.NONE, 24);

    AlignedColumn filled = GapHandler.fill(column(1d, null, null, 4d), linear);

    assertEquals(2d, filled.value(1), 1e-12);
    assertEquals(3d, filled.value(2), 1e-12);
  }

  @Test
  void linearFillWithoutRightNeighbourFallsBackToForwardFill() {
    GapPolicy linear = new GapPolicy(3, 4, ShortGapFill.LINEAR, LongGapFill.NONE, 24);

    AlignedColumn filled = GapHandler.fill(column(1d, 5d, null), linear);

    assertEquals(5d, filled.value(2));
  }

  @Test
  void leadingGapStaysMissing() {
    AlignedColumn filled = GapHandler.fill(column(null, null, 3d), FORWARD);

    assertNull(filled.value(0));
    assertEquals(FillState.MISSING, filled.state(1));
  }

  @Test
  void longGapIsLeftMissingWithoutSeasonalPolicy() {
    AlignedColumn filled = GapHandler.fill(column(1d, null, null, null, null, 2d), FORWARD);

    for (int i = 1; i <= 4; i++) {
      assertNull(filled.value(i));
      assertEquals(FillState.MISSING, filled.state(i));
    }
  }

  @Test
  void seasonalNaiveCopiesOneSeasonBackAndChains() {
    GapPolicy seasonal = new GapPolicy(1, 4, ShortGapFill.FORWARD_FILL,
        LongGapFill.SEASONAL_NAIVE, 2);

    AlignedColumn filled = GapHandler.fill(column(1d, 2d, null, null, null, null), seasonal);

    assertEquals(Arrays.asList(1d, 2d, 1d, 2d, 1d, 2d), filled.values());
    assertEquals(FillState.LONG_GAP_FILLED, filled.state(5));
  }

  @Test
  void missingIndicatorSurvivesFilling() {
    AlignedColumn original = column(1d, null, null, 4d);

    AlignedColumn filled = GapHandler.fill(original, FORWARD);

    assertArrayEquals(GapHandler.missingIndicator(original), GapHandler.missingIndicator(filled));
    assertArrayEquals(new int[] {0, 1, 1, 0}, GapHandler.missingIndicator(filled));
  }

  @Test
  void unfilledRestoresTheMissingCells() {
    AlignedColumn filled = GapHandler.fill(column(1d, null, null, 4d), FORWARD);

    AlignedColumn raw = GapHandler.unfilled(filled);

    assertEquals(Arrays.asList(1d, null, null, 4d), raw.values());
    assertEquals(FillState.MISSING, raw.state(1));
    assertEquals(FillState.OBSERVED, raw.state(3));
  }

  @Test
  void fillBeforeClassifiesRunsByTheirLengthUpToTheEnd() {
    // five missing cells overall is a long gap, but only two fall before row 3
    AlignedColumn column = column(7d, null, null, null, null, null, 9d);

    AlignedColumn head = GapHandler.fillBefore(column, 3, FORWARD);

    assertEquals(Arrays.asList(7d, 7d, 7d), head.values());
    assertEquals(Arrays.asList(7d, null, null, null, null, null, 9d),
        GapHandler.fill(column, FORWARD).values());
  }

  @Test
  void fillBeforeNeverInterpolatesTowardsALaterCell() {
    GapPolicy linear = new GapPolicy(3, 4, ShortGapFill.LINEAR, LongGapFill.NONE, 24);

    AlignedColumn head = GapHandler.fillBefore(column(1d, null, 9d), 2, linear);

    assertEquals(Arrays.asList(1d, 1d), head.values());
  }

  @Test
  void fillingIsDeterministic() {
    AlignedColumn original = column(1d, null, 3d, null, null, null, null, 8d, null);

    assertEquals(GapHandler.fill(original, FORWARD), GapHandler.fill(original, FORWARD));
  }

  @Test
  void policyRejectsOverlappingThresholds() {
    assertThrows(GapPolicyException.class,
        () -> new GapPolicy(4, 4, ShortGapFill.FORWARD_FILL, LongGapFill.NONE, 24));
    assertThrows(GapPolicyException.class,
        () -> new GapPolicy(1, 0, ShortGapFill.FORWARD_FILL, LongGapFill.NONE, 24));
    assertThrows(GapPolicyException.class,
        () -> new GapPolicy(1, 4, ShortGapFill.FORWARD_FILL, LongGapFill.SEASONAL_NAIVE, 0));
  }

  static AlignedColumn column(Double... values) {
    List<FillState> states = new ArrayList<>();
    for (Double v : values) {
      states.add(v == null ? FillState.MISSING : FillState.OBSERVED);
    }
    return new AlignedColumn("nitrate", AggregationPolicy.MEAN, Arrays.asList(values), states);
  }
}

package com.ospicorp.nitrateforecast.series.service;

import static org.junit.jupiter.api.Assertions.*;

import com.ospicorp.nitrateforecast.error.AlignmentException;
import com.ospicorp.nitrateforecast.series.model.AggregationPolicy;
import com.ospicorp.nitrateforecast.series.model.AlignedColumn;
import com.ospicorp.nitrateforecast.series.model.AlignedDataset;
import com.ospicorp.nitrateforecast.series.model.FillState;
import com.ospicorp.nitrateforecast.series.model.RawObservation;
import com.ospicorp.nitrateforecast.series.model.RawSeries;
import com.ospicorp.nitrateforecast.series.model.TimeGrid;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimeGridAlignerTest {
  private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
  private static final Duration HOUR = Duration.ofHours(1);

  @Test
  void buildGridRejectsNonPositiveStepAndEmptyPeriod() {
    assertThrows(AlignmentException.class,
        () -> TimeGridAligner.buildGrid(T0, T0.plus(HOUR), Duration.ZERO));
    assertThrows(AlignmentException.class,
        () -> TimeGridAligner.buildGrid(T0, T0.plus(HOUR), Duration.ofMinutes(-5)));
    assertThrows(AlignmentException.class, () -> TimeGridAligner.buildGrid(T0, T0, HOUR));
  }

  @Test
  void buildGridRoundsPartialLastStepUp() {
    TimeGrid grid = TimeGridAligner.buildGrid(T0, T0.plus(Duration.ofMinutes(150)), HOUR);

    assertEquals(3, grid.size());
    assertEquals(T0.plus(Duration.ofHours(2)), grid.timestampAt(2));
  }

  @Test
  void seriesAlreadyOnTheGridAlignsToItself() {
    List<RawObservation> obs = new ArrayList<>();
    for (int i = 0; i < 24; i++) {
      obs.add(RawObservation.of(T0.plus(HOUR.multipliedBy(i)), 10d + i * 0.5));
    }
    RawSeries series = new RawSeries("nitrate", HOUR, obs, AggregationPolicy.MEAN, "mg/L", false);
    TimeGrid grid = TimeGridAligner.buildGrid(T0, T0.plus(Duration.ofHours(24)), HOUR);

    AlignedColumn column = TimeGridAligner.align(grid, series);

    for (int i = 0; i < 24; i++) {
      assertEquals(10d + i * 0.5, column.value(i));
      assertEquals(FillState.OBSERVED, column.state(i));
    }
  }

  @Test
  void precipitationIsSummedWithinTheHour() {
    Duration quarter = Duration.ofMinutes(15);
    List<RawObservation> obs = List.of(
        RawObservation.of(T0, 0d),
        RawObservation.of(T0.plus(quarter), 2d),
        RawObservation.of(T0.plus(quarter.multipliedBy(2)), 0d),
        RawObservation.of(T0.plus(quarter.multipliedBy(3)), 0d));
    RawSeries rain = new RawSeries("precipitation", quarter, obs, AggregationPolicy.SUM, "mm",
        true);
    TimeGrid grid = TimeGridAligner.buildGrid(T0, T0.plus(HOUR), HOUR);

    AlignedColumn column = TimeGridAligner.align(grid, rain);

    assertEquals(2d, column.value(0));
    assertEquals(FillState.OBSERVED, column.state(0));
  }

  @Test
  void emptyBucketIsMissingNotZero() {
    RawSeries series = RawSeries.of("turbidity", AggregationPolicy.MEAN, List.of(
        RawObservation.of(T0, 1d),
        RawObservation.of(T0.plus(Duration.ofHours(2)), 3d)));
    TimeGrid grid = TimeGridAligner.buildGrid(T0, T0.plus(Duration.ofHours(3)), HOUR);

    AlignedColumn column = TimeGridAligner.align(grid, series);

    assertNull(column.value(1));
    assertEquals(FillState.MISSING, column.state(1));
    assertArrayEquals(new int[] {0, 1, 0}, column.missingIndicator());
  }

  @Test
  void sumWithZeroWhenEmptyFillsOnlyInsideCoverage() {
    RawSeries rain = new RawSeries("precipitation", HOUR, List.of(
        RawObservation.of(T0, 1d),
        RawObservation.of(T0.plus(Duration.ofHours(2)), 4d)), AggregationPolicy.SUM, "mm", true);
    TimeGrid grid = TimeGridAligner.buildGrid(T0, T0.plus(Duration.ofHours(5)), HOUR);

    AlignedColumn column = TimeGridAligner.align(grid, rain);

    assertEquals(0d, column.value(1));
    assertEquals(FillState.EMPTY_AS_ZERO, column.state(1));
    assertNull(column.value(4));
    assertEquals(FillState.MISSING, column.state(4));
  }

  @Test
  void bucketOnlyPartlyCoveredIsFlaggedBoundaryPartial() {
    Duration quarter = Duration.ofMinutes(15);
    RawSeries series = new RawSeries("flow", quarter, List.of(
        RawObservation.of(T0.plus(Duration.ofMinutes(30)), 2d),
        RawObservation.of(T0.plus(Duration.ofMinutes(45)), 4d),
        RawObservation.of(T0.plus(Duration.ofMinutes(60)), 6d),
        RawObservation.of(T0.plus(Duration.ofMinutes(75)), 8d),
        RawObservation.of(T0.plus(Duration.ofMinutes(90)), 10d),
        RawObservation.of(T0.plus(Duration.ofMinutes(105)), 12d)), AggregationPolicy.MEAN, null,
        false);
    TimeGrid grid = TimeGridAligner.buildGrid(T0, T0.plus(Duration.ofHours(2)), HOUR);

    AlignedColumn column = TimeGridAligner.align(grid, series);

    assertEquals(3d, column.value(0));
    assertEquals(FillState.BOUNDARY_PARTIAL, column.state(0));
    assertEquals(9d, column.value(1));
    assertEquals(FillState.OBSERVED, column.state(1));
  }

  @Test
  void lastStateKeepsTheLatestReadingInTheBucket() {
    RawSeries pump = RawSeries.of("pump_status", AggregationPolicy.LAST_STATE, List.of(
        RawObservation.of(T0.plus(Duration.ofMinutes(5)), 1d),
        RawObservation.of(T0.plus(Duration.ofMinutes(50)), 0d),
        RawObservation.of(T0.plus(Duration.ofMinutes(20)), 1d)));
    TimeGrid grid = TimeGridAligner.buildGrid(T0, T0.plus(HOUR), HOUR);

    assertEquals(0d, TimeGridAligner.align(grid, pump).value(0));
  }

  @Test
  void readingsWithoutValueAreIgnored() {
    RawSeries series = RawSeries.of("nitrate", AggregationPolicy.MEAN, List.of(
        RawObservation.of(T0, 5d),
        new RawObservation(T0.plus(Duration.ofMinutes(30)), null, "I/O Timeout")));
    TimeGrid grid = TimeGridAligner.buildGrid(T0, T0.plus(HOUR), HOUR);

    assertEquals(5d, TimeGridAligner.align(grid, series).value(0));
  }

  @Test
  void alignAllKeepsInputOrderAndRejectsDuplicates() {
    RawSeries a = RawSeries.of("nitrate", AggregationPolicy.MEAN, List.of(RawObservation.of(T0, 1d)));
    RawSeries b = RawSeries.of("rain", AggregationPolicy.SUM, List.of(RawObservation.of(T0, 2d)));
    TimeGrid grid = TimeGridAligner.buildGrid(T0, T0.plus(HOUR), HOUR);

    AlignedDataset dataset = TimeGridAligner.alignAll(grid, List.of(b, a), Runnable::run);

    assertEquals(List.of("rain", "nitrate"), List.copyOf(dataset.names()));
    assertThrows(AlignmentException.class,
        () -> TimeGridAligner.alignAll(grid, List.of(a, a), Runnable::run));
  }

  @Test
  void gridCoveringFloorsToTheStep() {
    RawSeries series = RawSeries.of("nitrate", AggregationPolicy.MEAN, List.of(
        RawObservation.of(Instant.parse("2024-03-01T00:20:00Z"), 1d),
        RawObservation.of(Instant.parse("2024-03-01T02:10:00Z"), 2d)));

    TimeGrid grid = TimeGridAligner.gridCovering(List.of(series), HOUR);

    assertEquals(T0, grid.start());
    assertEquals(3, grid.size());
  }
}

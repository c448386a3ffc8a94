package com.ospicorp.nitrateforecast.series.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * A variable as delivered by its source, at its own sampling frequency.
 *
 * <p>Observations are kept sorted by timestamp. The sort is stable, so readings sharing a
 * timestamp keep the order they arrived in. {@code nativeStep} may be null, in which case the
 * aligner infers it from the median spacing.
 */
public record RawSeries(
    String name,
    Duration nativeStep,
    List<RawObservation> observations,
    AggregationPolicy aggregation,
    String unit,
    boolean zeroWhenEmpty
) {

  public RawSeries {
    Objects.requireNonNull(name, "name");
    List<RawObservation> sorted = new ArrayList<>(observations == null ? List.of() : observations);
    sorted.sort(Comparator.comparing(RawObservation::timestamp));
    observations = List.copyOf(sorted);
    aggregation = aggregation == null ? AggregationPolicy.MEAN : aggregation;
  }

  public static RawSeries of(String name, AggregationPolicy aggregation,
      List<RawObservation> observations) {
    return new RawSeries(name, null, observations, aggregation, null, false);
  }

  public boolean isEmpty() {
    return observations.isEmpty();
  }
}

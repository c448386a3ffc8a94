package com.ospicorp.nitrateforecast.series.model;

import com.ospicorp.nitrateforecast.error.AlignmentException;
import java.time.Duration;
import java.time.Instant;
import java.util.AbstractList;
import java.util.List;
import java.util.Objects;

/** Fixed-step master index. {@link #end()} is exclusive. */
public record TimeGrid(Instant start, Duration step, int size) {

  public TimeGrid {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(step, "step");
    if (step.isNegative() || step.isZero()) {
      throw new AlignmentException("Grid step must be positive, got " + step);
    }
    if (size <= 0) {
      throw new AlignmentException("Grid must contain at least one timestamp");
    }
  }

  public Instant end() {
    return timestampAt(size);
  }

  public Instant timestampAt(int index) {
    return start.plus(step.multipliedBy(index));
  }

  /** Bucket holding {@code t}, or -1 when it falls outside the grid. */
  public int bucketOf(Instant t) {
    if (t.isBefore(start) || !t.isBefore(end())) {
      return -1;
    }
    Duration offset = Duration.between(start, t);
    return (int) offset.dividedBy(step);
  }

  /** Exact position of a grid timestamp, or -1. */
  public int indexOf(Instant t) {
    int bucket = bucketOf(t);
    return bucket >= 0 && timestampAt(bucket).equals(t) ? bucket : -1;
  }

  public List<Instant> timestamps() {
    return new AbstractList<>() {
      @Override
      public Instant get(int index) {
        Objects.checkIndex(index, size);
        return timestampAt(index);
      }

      @Override
      public int size() {
        return size;
      }
    };
  }
}

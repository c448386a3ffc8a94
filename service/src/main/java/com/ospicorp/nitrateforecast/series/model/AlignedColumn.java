package com.ospicorp.nitrateforecast.series.model;

import com.ospicorp.nitrateforecast.error.AlignmentException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** A series on the grid. A null value means missing; {@code states} is the missingness mask. */
public record AlignedColumn(
    String name,
    AggregationPolicy aggregation,
    List<Double> values,
    List<FillState> states
) {

  public AlignedColumn {
    Objects.requireNonNull(name, "name");
    if (values.size() != states.size()) {
      throw new AlignmentException("Column " + name + " has " + values.size()
          + " values but " + states.size() + " mask entries");
    }
    values = Collections.unmodifiableList(new ArrayList<>(values));
    states = List.copyOf(states);
  }

  public int size() {
    return values.size();
  }

  public Double value(int i) {
    return values.get(i);
  }

  public FillState state(int i) {
    return states.get(i);
  }

  public boolean isPresent(int i) {
    return values.get(i) != null;
  }

  public double[] toArray() {
    double[] out = new double[values.size()];
    for (int i = 0; i < out.length; i++) {
      Double v = values.get(i);
      out[i] = v == null ? Double.NaN : v;
    }
    return out;
  }

  public int[] missingIndicator() {
    int[] out = new int[states.size()];
    for (int i = 0; i < out.length; i++) {
      out[i] = states.get(i).wasMissing() ? 1 : 0;
    }
    return out;
  }

  public AlignedColumn withValues(List<Double> newValues, List<FillState> newStates) {
    return new AlignedColumn(name, aggregation, newValues, newStates);
  }
}

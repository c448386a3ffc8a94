package com.ospicorp.nitrateforecast.series.model;

public enum FillState {
  OBSERVED(false),
  BOUNDARY_PARTIAL(false),
  EMPTY_AS_ZERO(false),
  MISSING(true),
  SHORT_GAP_FILLED(true),
  LONG_GAP_FILLED(true);

  private final boolean wasMissing;

  FillState(boolean wasMissing) {
    this.wasMissing = wasMissing;
  }

  /** True when no observation backed the cell at alignment time, whatever fill came later. */
  public boolean wasMissing() {
    return wasMissing;
  }
}

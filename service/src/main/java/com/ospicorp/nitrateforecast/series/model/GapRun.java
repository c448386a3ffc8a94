package com.ospicorp.nitrateforecast.series.model;

public record GapRun(int start, int length, GapClass gapClass) {

  public int endExclusive() {
    return start + length;
  }

  public enum GapClass {
    SHORT,
    MEDIUM,
    LONG
  }
}

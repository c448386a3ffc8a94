package com.ospicorp.nitrateforecast.series.model;

import java.util.Locale;

public enum AggregationPolicy {
  MEAN,
  SUM,
  LAST_STATE;

  public static AggregationPolicy fromCode(String code) {
    if (code == null || code.isBlank()) {
      return MEAN;
    }
    return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
  }
}

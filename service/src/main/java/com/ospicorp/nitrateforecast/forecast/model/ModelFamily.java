package com.ospicorp.nitrateforecast.forecast.model;

import java.util.Locale;

public enum ModelFamily {
  SARIMAX,
  SEASONAL_NAIVE;

  public static ModelFamily fromCode(String code) {
    return valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
  }
}

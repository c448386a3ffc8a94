package com.ospicorp.nitrateforecast.features.model;

import com.ospicorp.nitrateforecast.error.ConfigException;
import java.util.Objects;

public record LagSpec(String source, int offset) {

  public LagSpec {
    Objects.requireNonNull(source, "source");
    if (offset < 0) {
      throw new ConfigException("Lag offset for " + source + " must be >= 0, got " + offset);
    }
  }

  /** Parses {@code variable:offset}. */
  public static LagSpec parse(String text) {
    int sep = text == null ? -1 : text.lastIndexOf(':');
    if (sep <= 0 || sep == text.length() - 1) {
      throw new ConfigException("Lag spec must look like variable:offset, got " + text);
    }
    try {
      return new LagSpec(text.substring(0, sep).trim(),
          Integer.parseInt(text.substring(sep + 1).trim()));
    } catch (NumberFormatException ex) {
      throw new ConfigException("Lag offset is not an integer in " + text);
    }
  }

  public String columnName() {
    return source + "_lag" + offset;
  }
}

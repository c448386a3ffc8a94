package com.ospicorp.nitrateforecast.forecast.model;

import com.ospicorp.nitrateforecast.error.ConfigException;

/** SARIMA orders (p,d,q)(P,D,Q)s. */
public record ModelOrders(
    int p,
    int d,
    int q,
    int seasonalP,
    int seasonalD,
    int seasonalQ,
    int period
) {

  public ModelOrders {
    if (p < 0 || d < 0 || q < 0 || seasonalP < 0 || seasonalD < 0 || seasonalQ < 0) {
      throw new ConfigException("Model orders must be non-negative");
    }
    if (period < 0) {
      throw new ConfigException("Seasonal period must be non-negative, got " + period);
    }
    if (period < 2 && (seasonalP > 0 || seasonalD > 0 || seasonalQ > 0)) {
      throw new ConfigException("Seasonal terms need a seasonal period of at least 2");
    }
  }

  /** Parses {@code p,d,q,P,D,Q,s}. */
  public static ModelOrders parse(String text) {
    String[] parts = text == null ? new String[0] : text.split(",");
    if (parts.length != 7) {
      throw new ConfigException("Model orders must be p,d,q,P,D,Q,s, got " + text);
    }
    int[] v = new int[7];
    for (int i = 0; i < 7; i++) {
      try {
        v[i] = Integer.parseInt(parts[i].trim());
      } catch (NumberFormatException ex) {
        throw new ConfigException("Model order is not an integer: " + parts[i]);
      }
    }
    return new ModelOrders(v[0], v[1], v[2], v[3], v[4], v[5], v[6]);
  }

  public int orderSum() {
    return p + d + q + seasonalP + seasonalD + seasonalQ;
  }

  public int armaParameterCount() {
    return p + q + seasonalP + seasonalQ;
  }

  public int differencingLoss() {
    return d + seasonalD * period;
  }

  @Override
  public String toString() {
    return "(" + p + "," + d + "," + q + ")(" + seasonalP + "," + seasonalD + "," + seasonalQ
        + ")" + period;
  }
}

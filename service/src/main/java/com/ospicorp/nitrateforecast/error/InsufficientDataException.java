package com.ospicorp.nitrateforecast.error;

public class InsufficientDataException extends FitException {
  private final int available;
  private final int required;

  public InsufficientDataException(int available, int required) {
    super("Training slice has " + available + " usable rows; at least " + required
        + " are required", "INSUFFICIENT_DATA", null);
    this.available = available;
    this.required = required;
  }

  public int available() {
    return available;
  }

  public int required() {
    return required;
  }
}

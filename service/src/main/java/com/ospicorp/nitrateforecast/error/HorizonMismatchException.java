package com.ospicorp.nitrateforecast.error;

public class HorizonMismatchException extends ModelException {

  public HorizonMismatchException(String message) {
    super(message, "HORIZON_MISMATCH");
  }
}

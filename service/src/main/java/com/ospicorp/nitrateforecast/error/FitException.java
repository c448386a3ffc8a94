package com.ospicorp.nitrateforecast.error;

public class FitException extends ModelException {

  public FitException(String message) {
    super(message, "FIT_ERROR");
  }

  public FitException(String message, Throwable cause) {
    super(message, "FIT_ERROR", cause);
  }

  protected FitException(String message, String errorCode, Throwable cause) {
    super(message, errorCode, cause);
  }
}

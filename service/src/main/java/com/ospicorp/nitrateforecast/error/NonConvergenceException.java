package com.ospicorp.nitrateforecast.error;

public class NonConvergenceException extends FitException {

  public NonConvergenceException(String message, Throwable cause) {
    super(message, "NON_CONVERGENCE", cause);
  }
}

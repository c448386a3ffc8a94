package com.ospicorp.nitrateforecast.error;

public abstract class PipelineException extends RuntimeException {
  private final String errorCode;
  private final boolean fatal;

  protected PipelineException(String message, String errorCode, boolean fatal) {
    super(message);
    this.errorCode = errorCode;
    this.fatal = fatal;
  }

  protected PipelineException(String message, String errorCode, boolean fatal, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.fatal = fatal;
  }

  public String errorCode() {
    return errorCode;
  }

  /** Fatal errors abort the whole run; the others are confined to one forecast window. */
  public boolean isFatal() {
    return fatal;
  }
}

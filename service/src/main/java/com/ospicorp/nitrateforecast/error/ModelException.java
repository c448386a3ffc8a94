package com.ospicorp.nitrateforecast.error;

public class ModelException extends PipelineException {

  public ModelException(String message) {
    super(message, "MODEL_ERROR", false);
  }

  protected ModelException(String message, String errorCode) {
    super(message, errorCode, false);
  }

  protected ModelException(String message, String errorCode, Throwable cause) {
    super(message, errorCode, false, cause);
  }
}

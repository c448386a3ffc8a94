package com.ospicorp.nitrateforecast.error;

public class AlignmentException extends PipelineException {

  public AlignmentException(String message) {
    super(message, "ALIGNMENT_ERROR", true);
  }
}

package com.ospicorp.nitrateforecast.error;

public class GapPolicyException extends PipelineException {

  public GapPolicyException(String message) {
    super(message, "GAP_POLICY_ERROR", true);
  }
}

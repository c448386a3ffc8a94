package com.ospicorp.nitrateforecast.error;

public class ConfigException extends PipelineException {

  public ConfigException(String message) {
    super(message, "CONFIG_ERROR", true);
  }
}

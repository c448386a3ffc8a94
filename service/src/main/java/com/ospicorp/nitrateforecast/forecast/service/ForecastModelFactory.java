package com.ospicorp.nitrateforecast.forecast.service;

import com.ospicorp.nitrateforecast.config.PipelineConfig;
import org.springframework.stereotype.Component;

@Component
public class ForecastModelFactory {

  public ForecastModel create(PipelineConfig config) {
    return switch (config.modelFamily()) {
      case SARIMAX -> new SarimaxForecastModel(config.modelSettings());
      case SEASONAL_NAIVE -> new SeasonalNaiveForecastModel(config.modelSettings());
    };
  }
}

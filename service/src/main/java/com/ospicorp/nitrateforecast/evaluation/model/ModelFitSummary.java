package com.ospicorp.nitrateforecast.evaluation.model;

import com.ospicorp.nitrateforecast.forecast.model.ModelFamily;
import com.ospicorp.nitrateforecast.forecast.model.ResidualDiagnostics;
import java.time.Instant;
import java.util.Map;

public record ModelFitSummary(
    int windowIndex,
    ModelFamily family,
    String orders,
    Instant trainedThrough,
    int observations,
    Map<String, Double> coefficients,
    ResidualDiagnostics diagnostics
) {}

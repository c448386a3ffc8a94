package com.ospicorp.nitrateforecast.pipeline.model;

import com.ospicorp.nitrateforecast.features.model.CorrelationPoint;
import com.ospicorp.nitrateforecast.features.model.LagCandidate;
import java.util.List;
import java.util.Map;

public record CorrelationResponse(
    String target,
    List<CorrelationPoint> autocorrelation,
    Map<String, List<CorrelationPoint>> crossCorrelations,
    List<LagCandidate> strongestLags
) {}

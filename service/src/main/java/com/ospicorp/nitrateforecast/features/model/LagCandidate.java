package com.ospicorp.nitrateforecast.features.model;

import java.util.List;

public record LagCandidate(String predictor, int lag, double coefficient,
    List<CorrelationPoint> profile) {}

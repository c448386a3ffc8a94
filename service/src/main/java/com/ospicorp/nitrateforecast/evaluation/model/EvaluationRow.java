package com.ospicorp.nitrateforecast.evaluation.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

@JsonPropertyOrder({"windowIndex", "forecastTimestamp", "predicted", "lowerBound", "upperBound",
    "realized", "absoluteError"})
public record EvaluationRow(
    int windowIndex,
    Instant forecastTimestamp,
    double predicted,
    double lowerBound,
    double upperBound,
    Double realized,
    Double absoluteError
) {}

package com.ospicorp.nitrateforecast.evaluation.model;

/**
 * Exceedance labels over scored points; a value is positive when it is at or above the
 * threshold. Ratios with a zero denominator are null.
 */
public record ClassificationMetrics(
    double threshold,
    int truePositives,
    int falsePositives,
    int falseNegatives,
    int trueNegatives,
    Double precision,
    Double recall,
    Double f1
) {}

package com.ospicorp.nitrateforecast.features.model;

// coefficient is NaN when fewer than three complete pairs exist or a side has no variance
public record CorrelationPoint(int lag, double coefficient, int pairs) {}

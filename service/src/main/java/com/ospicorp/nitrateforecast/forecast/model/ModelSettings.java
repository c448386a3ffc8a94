package com.ospicorp.nitrateforecast.forecast.model;

public record ModelSettings(int maxIterations, double intervalLevel, int minTrainingMarginSteps) {}

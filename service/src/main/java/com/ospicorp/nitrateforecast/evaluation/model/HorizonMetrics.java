package com.ospicorp.nitrateforecast.evaluation.model;

public record HorizonMetrics(int horizonStep, int scoredPoints, Double rmse, Double mae) {}

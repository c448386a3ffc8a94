package com.ospicorp.nitrateforecast.series.model;

public record StateCount(String state, long count) {}

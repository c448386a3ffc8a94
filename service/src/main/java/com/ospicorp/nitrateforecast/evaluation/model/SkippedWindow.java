package com.ospicorp.nitrateforecast.evaluation.model;

import java.time.Instant;

/** {@code cause} is an error code such as INSUFFICIENT_DATA or WINDOW_TIMEOUT. */
public record SkippedWindow(int windowIndex, Instant cutoff, String cause, String message) {}

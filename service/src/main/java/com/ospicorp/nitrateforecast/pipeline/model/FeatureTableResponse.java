package com.ospicorp.nitrateforecast.pipeline.model;

import com.ospicorp.nitrateforecast.series.model.GapRun;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record FeatureTableResponse(
    Instant start,
    Instant end,
    long stepSeconds,
    int rowCount,
    List<String> columns,
    Map<String, Integer> missingCounts,
    Map<String, List<GapRun>> unfilledGaps,
    List<Map<String, Object>> rows
) {}

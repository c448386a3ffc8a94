package com.ospicorp.nitrateforecast.series.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeriesInspection(
    String series,
    int rows,
    @JsonProperty("start_utc") Instant startUtc,
    @JsonProperty("end_utc") Instant endUtc,
    @JsonProperty("unique_timestamps") int uniqueTimestamps,
    @JsonProperty("duplicate_timestamps") int duplicateTimestamps,
    @JsonProperty("median_interval") String medianInterval,
    @JsonProperty("median_interval_seconds") Double medianIntervalSeconds,
    @JsonProperty("value_num_nonnull") int valueNumNonNull,
    @JsonProperty("value_num_pct") double valueNumPct,
    @JsonProperty("value_str_nonnull") int valueStrNonNull,
    @JsonProperty("top_states") List<StateCount> topStates
) {}

package com.ospicorp.nitrateforecast.pipeline.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

public record SeriesPayload(
    @NotBlank @Schema(example = "nitrate") String name,
    @Schema(example = "mg/L") String unit,
    @Schema(description = "mean, sum or last-state; falls back to series-policies, then mean",
        example = "mean")
    String aggregation,
    @Positive @Schema(description = "Sampling step of the source; inferred when absent",
        example = "900")
    Long nativeStepSeconds,
    Boolean zeroWhenEmpty,
    @NotNull @Valid List<ObservationPayload> observations
) {}

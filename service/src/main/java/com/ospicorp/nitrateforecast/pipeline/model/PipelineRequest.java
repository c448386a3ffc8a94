package com.ospicorp.nitrateforecast.pipeline.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record PipelineRequest(
    @NotEmpty @Valid List<SeriesPayload> series,
    ConfigOverrides config
) {}

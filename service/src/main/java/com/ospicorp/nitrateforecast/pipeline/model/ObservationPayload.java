package com.ospicorp.nitrateforecast.pipeline.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record ObservationPayload(
    @NotBlank
    @Schema(description = "ISO-8601 timestamp with an explicit offset",
        example = "2024-03-01T13:00:00Z")
    String timestamp,
    @Schema(description = "Number, numeric text, state text or a {Name, Value} object",
        example = "4.2")
    JsonNode value
) {}

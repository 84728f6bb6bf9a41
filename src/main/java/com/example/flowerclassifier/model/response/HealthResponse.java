package com.example.flowerclassifier.model.response;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "Service health including database connectivity and model state")
public record HealthResponse(
        @Schema(example = "healthy") String status,
        @Schema(example = "connected") String database,
        ModelHealth model,
        Instant timestamp) {

    public record ModelHealth(
            @Schema(example = "READY") String status,
            @Schema(description = "Acquisition strategy that produced the loaded model", example = "remote", nullable = true)
            String source) {
    }
}

package com.driftmonitor.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class DriftEvaluationRequest {

    @Pattern(regexp = "^[a-zA-Z0-9._:-]{1,100}$", message = "modelId must match ^[a-zA-Z0-9._:-]{1,100}$")
    String modelId;

    @NotNull(message = "reference is required")
    Map<String, List<Double>> reference;

    @NotNull(message = "current is required")
    Map<String, List<Double>> current;

    @Valid
    ConfigOverrides config;

    /** Per-run overrides; anything left null falls back to the service defaults. */
    @Value
    @Builder
    @Jacksonized
    public static class ConfigOverrides {
        @DecimalMin(value = "0.0", message = "significanceLevel must be >= 0")
        @DecimalMax(value = "1.0", message = "significanceLevel must be <= 1")
        Double significanceLevel;

        @DecimalMin(value = "0.0", message = "driftMagnitudeThreshold must be >= 0")
        @DecimalMax(value = "1.0", message = "driftMagnitudeThreshold must be <= 1")
        Double driftMagnitudeThreshold;

        @Positive(message = "minSampleSize must be positive")
        Integer minSampleSize;

        Boolean failOnInsufficientSample;
    }
}

package com.driftmonitor.config;

import com.driftmonitor.monitor.DriftMonitorConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "drift-monitor")
@Data
@Validated
public class DriftMonitorProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double significanceLevel = DriftMonitorConfig.DEFAULT_SIGNIFICANCE_LEVEL;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double driftMagnitudeThreshold = DriftMonitorConfig.DEFAULT_DRIFT_MAGNITUDE_THRESHOLD;

    @Positive
    private int minSampleSize = DriftMonitorConfig.DEFAULT_MIN_SAMPLE_SIZE;

    private boolean failOnInsufficientSample = false;

    @Min(1)
    private int maxFeatures = 500;

    @Min(1)
    private int maxObservations = 1_000_000;

    public DriftMonitorConfig toConfig() {
        return DriftMonitorConfig.builder()
            .significanceLevel(significanceLevel)
            .driftMagnitudeThreshold(driftMagnitudeThreshold)
            .minSampleSize(minSampleSize)
            .failOnInsufficientSample(failOnInsufficientSample)
            .build();
    }
}

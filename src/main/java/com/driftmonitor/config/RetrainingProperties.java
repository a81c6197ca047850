package com.driftmonitor.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Where the external training pipeline lives and whether it is called at all.
 */
@Configuration
@ConfigurationProperties(prefix = "retraining")
@Data
@Validated
public class RetrainingProperties {

    private boolean enabled = true;

    @NotBlank
    private String baseUrl = "http://localhost:8090";

    @Min(1)
    private int timeoutSeconds = 10;

    @Min(0)
    private int maxRetries = 2;
}

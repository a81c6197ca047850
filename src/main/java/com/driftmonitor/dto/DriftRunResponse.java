package com.driftmonitor.dto;

import com.driftmonitor.monitor.DriftResult;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A stored run. {@code results} is only filled in when a single run is fetched.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriftRunResponse {
    UUID runId;
    String modelId;
    String requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    int featureCount;
    int significantCount;
    int inconclusiveCount;
    double maxStatistic;
    boolean retrainRecommended;
    double significanceLevel;
    double driftMagnitudeThreshold;
    int minSampleSize;
    TriggerStatus triggerStatus;
    String retrainingJobId;
    String triggerMessage;
    List<DriftResult> results;
}

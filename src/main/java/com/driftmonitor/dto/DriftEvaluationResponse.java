package com.driftmonitor.dto;

import com.driftmonitor.monitor.DriftReport;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriftEvaluationResponse {
    UUID runId;
    String modelId;
    String requestId;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant evaluatedAt;
    DriftReport report;
    TriggerStatus triggerStatus;
    String retrainingJobId;
    String triggerMessage;
}

package com.driftmonitor.controller;

import com.driftmonitor.config.RequestContextFilter;
import com.driftmonitor.dto.DriftEvaluationRequest;
import com.driftmonitor.dto.DriftEvaluationResponse;
import com.driftmonitor.dto.DriftRunResponse;
import com.driftmonitor.dto.MonitoringJobResponse;
import com.driftmonitor.monitor.DriftMonitorConfig;
import com.driftmonitor.service.DriftEvaluationService;
import com.driftmonitor.service.MonitoringJobService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/drift")
@RequiredArgsConstructor
public class DriftController {

    private final DriftEvaluationService evaluationService;
    private final MonitoringJobService jobService;

    @PostMapping("/evaluate")
    public ResponseEntity<DriftEvaluationResponse> evaluate(
            @Valid @RequestBody DriftEvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestContextFilter.requestId(httpRequest);
        log.info("POST /drift/evaluate | modelId={} | features={} | requestId={}",
                 request.getModelId(), request.getReference().size(), requestId);
        DriftEvaluationResponse response = evaluationService.evaluate(request, requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("Location", "/api/v1/drift/runs/" + response.getRunId())
            .body(response);
    }

    @PostMapping("/evaluate/async")
    public ResponseEntity<MonitoringJobResponse> evaluateAsync(
            @Valid @RequestBody DriftEvaluationRequest request, HttpServletRequest httpRequest) {
        String requestId = RequestContextFilter.requestId(httpRequest);
        UUID jobId = jobService.submit(
            "DRIFT_EVALUATION",
            requestId,
            () -> {
                MDC.put(RequestContextFilter.MDC_KEY, requestId);
                try {
                    return evaluationService.evaluate(request, requestId);
                } finally {
                    MDC.remove(RequestContextFilter.MDC_KEY);
                }
            }
        );
        return ResponseEntity.accepted()
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(jobService.getJob(jobId));
    }

    @GetMapping("/runs")
    public ResponseEntity<Page<DriftRunResponse>> runs(
            @RequestParam(required = false) String modelId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(evaluationService.getRuns(modelId, PageRequest.of(page, size)));
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<DriftRunResponse> run(@PathVariable UUID runId) {
        return ResponseEntity.ok(evaluationService.getRun(runId));
    }

    @GetMapping("/config")
    public ResponseEntity<DriftMonitorConfig> config() {
        return ResponseEntity.ok(evaluationService.defaultConfig());
    }
}

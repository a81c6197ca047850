package com.driftmonitor.controller;

import com.driftmonitor.client.RetrainingTriggerClient;
import com.driftmonitor.dto.MonitoringJobResponse;
import com.driftmonitor.service.MonitoringJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class OperationsController {

    private final MonitoringJobService jobService;
    private final RetrainingTriggerClient retrainingClient;

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<MonitoringJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(jobService.getJob(jobId));
    }

    @GetMapping("/retraining/health")
    public Mono<ResponseEntity<Map<String, Object>>> retrainingHealth() {
        return retrainingClient.isHealthy().map(healthy -> {
            Map<String, Object> body = Map.of("retrainingPipeline", healthy ? "UP" : "DOWN",
                                               "status", healthy ? "ok" : "degraded");
            return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(body);
        });
    }
}

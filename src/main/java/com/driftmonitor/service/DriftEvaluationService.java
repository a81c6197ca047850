package com.driftmonitor.service;

import com.driftmonitor.client.RetrainingTriggerClient;
import com.driftmonitor.config.DriftMonitorProperties;
import com.driftmonitor.config.RetrainingProperties;
import com.driftmonitor.dto.DriftEvaluationRequest;
import com.driftmonitor.dto.DriftEvaluationResponse;
import com.driftmonitor.dto.DriftRunResponse;
import com.driftmonitor.dto.TriggerStatus;
import com.driftmonitor.entity.DriftRunRecord;
import com.driftmonitor.exception.DriftRunNotFoundException;
import com.driftmonitor.exception.EvaluationCancelledException;
import com.driftmonitor.exception.PayloadTooLargeException;
import com.driftmonitor.monitor.DriftMonitor;
import com.driftmonitor.monitor.DriftMonitorConfig;
import com.driftmonitor.monitor.DriftReport;
import com.driftmonitor.monitor.DriftResult;
import com.driftmonitor.monitor.FeatureSample;
import com.driftmonitor.monitor.SampleSource;
import com.driftmonitor.repository.DriftRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the drift monitor for callers and acts on its decision: every run is stored, and the
 * training pipeline is notified when a report recommends retraining.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriftEvaluationService {

    private static final TypeReference<List<DriftResult>> RESULT_LIST = new TypeReference<>() {};

    private final DriftMonitor driftMonitor;
    private final DriftRunRepository repository;
    private final RetrainingTriggerClient retrainingClient;
    private final DriftMonitorProperties monitorProperties;
    private final RetrainingProperties retrainingProperties;
    private final ObjectMapper objectMapper;

    public DriftEvaluationResponse evaluate(DriftEvaluationRequest request, String requestId) {
        checkPayloadSize(request.getReference());
        checkPayloadSize(request.getCurrent());

        DriftMonitorConfig config = resolveConfig(request.getConfig());
        DriftReport report = driftMonitor.evaluate(
            toSamples(request.getReference(), SampleSource.REFERENCE),
            toSamples(request.getCurrent(), SampleSource.CURRENT),
            config);
        log.info("Drift evaluated | modelId={} | features={} | significant={} | inconclusive={} | maxStatistic={} | retrain={} | requestId={}",
                 request.getModelId(), report.getFeatureCount(), report.getSignificantCount(),
                 report.getInconclusiveCount(), report.getMaxStatistic(), report.isRetrainRecommended(), requestId);

        discardIfCancelled(null, request.getModelId(), requestId);
        DriftRunRecord record = repository.save(toRecord(request.getModelId(), report, config, requestId));
        discardIfCancelled(record, request.getModelId(), requestId);

        TriggerOutcome outcome = arbitrateRetraining(record.getId(), request.getModelId(), report, requestId);
        if (outcome.status() != TriggerStatus.TRIGGERED) {
            discardIfCancelled(record, request.getModelId(), requestId);
        }
        record.setTriggerStatus(outcome.status());
        record.setRetrainingJobId(outcome.jobId());
        record.setTriggerMessage(outcome.message());
        DriftRunRecord saved;
        try {
            saved = repository.save(record);
        } catch (RuntimeException ex) {
            log.error("Drift run update failed, stored trigger status is stale | id={} | trigger={} | retrainingJobId={} | requestId={}",
                      record.getId(), outcome.status(), outcome.jobId(), requestId, ex);
            throw ex;
        }
        log.info("Drift run saved | id={} | trigger={} | requestId={}", saved.getId(), outcome.status(), requestId);

        return DriftEvaluationResponse.builder()
            .runId(saved.getId())
            .modelId(saved.getModelId())
            .requestId(requestId)
            .evaluatedAt(saved.getCreatedAt() != null ? saved.getCreatedAt() : Instant.now())
            .report(report)
            .triggerStatus(outcome.status())
            .retrainingJobId(outcome.jobId())
            .triggerMessage(outcome.message())
            .build();
    }

    @Transactional(readOnly = true)
    public DriftRunResponse getRun(UUID runId) {
        DriftRunRecord record = repository.findById(runId)
            .orElseThrow(() -> new DriftRunNotFoundException(runId));
        return toRunResponse(record, readResults(record));
    }

    @Transactional(readOnly = true)
    public Page<DriftRunResponse> getRuns(String modelId, Pageable pageable) {
        Page<DriftRunRecord> page = modelId == null || modelId.isBlank()
            ? repository.findAllByOrderByCreatedAtDesc(pageable)
            : repository.findByModelIdOrderByCreatedAtDesc(modelId, pageable);
        return page.map(r -> toRunResponse(r, null));
    }

    public DriftMonitorConfig defaultConfig() {
        return monitorProperties.toConfig();
    }

    DriftMonitorConfig resolveConfig(DriftEvaluationRequest.ConfigOverrides overrides) {
        DriftMonitorConfig base = monitorProperties.toConfig();
        if (overrides == null) {
            return base;
        }
        return base.toBuilder()
            .significanceLevel(overrides.getSignificanceLevel() != null
                ? overrides.getSignificanceLevel() : base.getSignificanceLevel())
            .driftMagnitudeThreshold(overrides.getDriftMagnitudeThreshold() != null
                ? overrides.getDriftMagnitudeThreshold() : base.getDriftMagnitudeThreshold())
            .minSampleSize(overrides.getMinSampleSize() != null
                ? overrides.getMinSampleSize() : base.getMinSampleSize())
            .failOnInsufficientSample(overrides.getFailOnInsufficientSample() != null
                ? overrides.getFailOnInsufficientSample() : base.isFailOnInsufficientSample())
            .build();
    }

    private TriggerOutcome arbitrateRetraining(UUID runId, String modelId, DriftReport report, String requestId) {
        if (!report.isRetrainRecommended()) {
            return new TriggerOutcome(TriggerStatus.NOT_REQUIRED, null, null);
        }
        if (!retrainingProperties.isEnabled()) {
            log.info("Retraining recommended but trigger disabled | runId={} | drifted={} | requestId={}",
                     runId, report.getDriftedFeatures(), requestId);
            return new TriggerOutcome(TriggerStatus.SKIPPED, null, "Retraining trigger is disabled");
        }
        try {
            RetrainingTriggerClient.RetrainingAck ack = retrainingClient.trigger(
                    new RetrainingTriggerClient.RetrainingRequest(
                        modelId, runId, report.getMaxStatistic(), report.getDriftedFeatures()),
                    requestId)
                .block(Duration.ofSeconds(retrainingProperties.getTimeoutSeconds() * 2L));
            if (ack == null) {
                return new TriggerOutcome(TriggerStatus.FAILED, null, "Training pipeline returned an empty response");
            }
            log.info("Retraining triggered | runId={} | jobId={} | status={} | requestId={}",
                     runId, ack.jobId(), ack.status(), requestId);
            return new TriggerOutcome(TriggerStatus.TRIGGERED, ack.jobId(), ack.status());
        } catch (RuntimeException ex) {
            // the report stands on its own; a failed notification is recorded on the run
            log.warn("Retraining trigger failed | runId={} | requestId={} | reason={}",
                     runId, requestId, ex.getMessage(), ex);
            return new TriggerOutcome(TriggerStatus.FAILED, null, truncate(
                ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName()));
        }
    }

    /**
     * Background runs are cancelled by interrupting their worker. A cancelled run leaves no
     * record behind, unless the training pipeline has already accepted a retrain request for it.
     */
    private void discardIfCancelled(DriftRunRecord record, String modelId, String requestId) {
        if (!Thread.currentThread().isInterrupted()) {
            return;
        }
        if (record != null) {
            repository.delete(record);
        }
        log.warn("Drift evaluation cancelled | modelId={} | runId={} | requestId={}",
                 modelId, record != null ? record.getId() : null, requestId);
        throw new EvaluationCancelledException(modelId);
    }

    private void checkPayloadSize(Map<String, List<Double>> samples) {
        if (samples == null) {
            return;
        }
        if (samples.size() > monitorProperties.getMaxFeatures()) {
            throw new PayloadTooLargeException("Feature", samples.size(), monitorProperties.getMaxFeatures());
        }
        for (List<Double> values : samples.values()) {
            if (values != null && values.size() > monitorProperties.getMaxObservations()) {
                throw new PayloadTooLargeException("Observation", values.size(), monitorProperties.getMaxObservations());
            }
        }
    }

    private Map<String, FeatureSample> toSamples(Map<String, List<Double>> raw, SampleSource source) {
        if (raw == null) {
            return null;
        }
        Map<String, FeatureSample> samples = new LinkedHashMap<>();
        raw.forEach((feature, values) -> samples.put(feature, FeatureSample.of(feature, source, values)));
        return samples;
    }

    private DriftRunRecord toRecord(String modelId, DriftReport report, DriftMonitorConfig config, String requestId) {
        return DriftRunRecord.builder()
            .modelId(modelId)
            .featureCount(report.getFeatureCount())
            .significantCount(report.getSignificantCount())
            .inconclusiveCount(report.getInconclusiveCount())
            .maxStatistic(report.getMaxStatistic())
            .retrainRecommended(report.isRetrainRecommended())
            .significanceLevel(config.getSignificanceLevel())
            .driftMagnitudeThreshold(config.getDriftMagnitudeThreshold())
            .minSampleSize(config.getMinSampleSize())
            .resultsJson(writeResults(report.getResults()))
            .triggerStatus(report.isRetrainRecommended() ? TriggerStatus.PENDING : TriggerStatus.NOT_REQUIRED)
            .requestId(requestId)
            .build();
    }

    private String writeResults(List<DriftResult> results) {
        try {
            return objectMapper.writeValueAsString(results);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Drift results could not be serialised", ex);
        }
    }

    private List<DriftResult> readResults(DriftRunRecord record) {
        try {
            return objectMapper.readValue(record.getResultsJson(), RESULT_LIST);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored results of drift run " + record.getId() + " are unreadable", ex);
        }
    }

    private DriftRunResponse toRunResponse(DriftRunRecord r, List<DriftResult> results) {
        return DriftRunResponse.builder()
            .runId(r.getId())
            .modelId(r.getModelId())
            .requestId(r.getRequestId())
            .createdAt(r.getCreatedAt())
            .featureCount(r.getFeatureCount())
            .significantCount(r.getSignificantCount())
            .inconclusiveCount(r.getInconclusiveCount())
            .maxStatistic(r.getMaxStatistic())
            .retrainRecommended(r.isRetrainRecommended())
            .significanceLevel(r.getSignificanceLevel())
            .driftMagnitudeThreshold(r.getDriftMagnitudeThreshold())
            .minSampleSize(r.getMinSampleSize())
            .triggerStatus(r.getTriggerStatus())
            .retrainingJobId(r.getRetrainingJobId())
            .triggerMessage(r.getTriggerMessage())
            .results(results)
            .build();
    }

    private static String truncate(String message) {
        return message.length() <= 500 ? message : message.substring(0, 500);
    }

    private record TriggerOutcome(TriggerStatus status, String jobId, String message) {}
}

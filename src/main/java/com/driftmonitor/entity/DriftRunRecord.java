package com.driftmonitor.entity;

import com.driftmonitor.dto.TriggerStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "drift_runs",
    indexes = {
        @Index(name = "idx_run_model",   columnList = "model_id"),
        @Index(name = "idx_run_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriftRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_id", length = 100)
    private String modelId;

    @Column(name = "feature_count", nullable = false)
    private int featureCount;

    @Column(name = "significant_count", nullable = false)
    private int significantCount;

    @Column(name = "inconclusive_count", nullable = false)
    private int inconclusiveCount;

    @Column(name = "max_statistic", nullable = false)
    private double maxStatistic;

    @Column(name = "retrain_recommended", nullable = false)
    private boolean retrainRecommended;

    @Column(name = "significance_level", nullable = false)
    private double significanceLevel;

    @Column(name = "drift_magnitude_threshold", nullable = false)
    private double driftMagnitudeThreshold;

    @Column(name = "min_sample_size", nullable = false)
    private int minSampleSize;

    @Column(name = "results_json", nullable = false, columnDefinition = "text")
    private String resultsJson;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_status", nullable = false, length = 20)
    private TriggerStatus triggerStatus;

    @Column(name = "retraining_job_id", length = 100)
    private String retrainingJobId;

    @Column(name = "trigger_message", length = 500)
    private String triggerMessage;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = 64)
    private String requestId;
}

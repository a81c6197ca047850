package com.driftmonitor.service;

import com.driftmonitor.dto.JobStatus;
import com.driftmonitor.dto.MonitoringJobResponse;
import com.driftmonitor.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs evaluations in the background. A job that outlives {@code jobs.timeout-seconds} is
 * failed and its worker thread is interrupted; tasks are expected to check the interrupt
 * flag before they write anything.
 */
@Slf4j
@Service
public class MonitoringJobService {

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    @Value("${jobs.timeout-seconds:300}")
    private long timeoutSeconds;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public UUID submit(String jobType, String requestId, Supplier<Object> task) {
        JobState state = new JobState(UUID.randomUUID(), jobType, requestId, Instant.now());
        jobs.put(state.jobId, state);
        evictFinishedJobs();

        CompletableFuture<Object> outcome = new CompletableFuture<>();
        Future<?> worker = executor.submit(() -> {
            state.advance(JobStatus.RUNNING, "Running", null);
            try {
                outcome.complete(task.get());
            } catch (RuntimeException ex) {
                outcome.completeExceptionally(ex);
            }
        });
        outcome.orTimeout(timeoutSeconds, TimeUnit.SECONDS)
            .whenComplete((result, ex) -> {
                if (ex == null) {
                    state.advance(JobStatus.COMPLETED, "Completed", result);
                    return;
                }
                if (unwrap(ex) instanceof TimeoutException) {
                    worker.cancel(true);
                }
                state.advance(JobStatus.FAILED, describe(ex), null);
                log.warn("Job failed | jobId={} | type={} | reason={} | requestId={}",
                         state.jobId, jobType, state.message, requestId);
            });
        log.info("Job submitted | jobId={} | type={} | requestId={}", state.jobId, jobType, requestId);
        return state.jobId;
    }

    public MonitoringJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }

    private String describe(Throwable ex) {
        Throwable cause = unwrap(ex);
        if (cause instanceof TimeoutException) {
            return "Job timed out after " + timeoutSeconds + "s; it was cancelled and its result discarded";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /** Drops the longest-finished jobs once more than {@code jobs.max-retained} are held. */
    private void evictFinishedJobs() {
        int excess = jobs.size() - maxRetained;
        if (excess <= 0) {
            return;
        }
        List<JobState> oldest = jobs.values().stream()
            .filter(JobState::isFinished)
            .sorted(Comparator.comparing(s -> s.completedAt))
            .limit(excess)
            .toList();
        oldest.forEach(s -> jobs.remove(s.jobId));
    }

    private static final class JobState {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile JobStatus status = JobStatus.QUEUED;
        private volatile String message = "Queued";
        private volatile Object result;

        private JobState(UUID jobId, String jobType, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        private boolean isFinished() {
            return status == JobStatus.COMPLETED || status == JobStatus.FAILED;
        }

        // finished jobs are frozen; a late worker cannot overwrite a timeout
        private synchronized void advance(JobStatus next, String message, Object result) {
            if (isFinished()) {
                return;
            }
            if (next == JobStatus.RUNNING) {
                startedAt = Instant.now();
            } else {
                completedAt = Instant.now();
            }
            this.result = result;
            this.message = message;
            this.status = next;
        }

        private synchronized MonitoringJobResponse toResponse() {
            return MonitoringJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .message(message)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}

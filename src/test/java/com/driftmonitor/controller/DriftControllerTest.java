package com.driftmonitor.controller;

import com.driftmonitor.config.RequestContextFilter;
import com.driftmonitor.dto.DriftEvaluationRequest;
import com.driftmonitor.dto.DriftEvaluationResponse;
import com.driftmonitor.service.DriftEvaluationService;
import com.driftmonitor.service.MonitoringJobService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DriftControllerTest {

    @Mock DriftEvaluationService evaluationService;
    @Mock MonitoringJobService   jobService;
    @InjectMocks DriftController controller;

    @Captor ArgumentCaptor<Supplier<Object>> task;

    @Test
    void evaluateAsync_jobLogsUnderTheCallersRequestId() throws Exception {
        MockHttpServletRequest http = new MockHttpServletRequest();
        http.setAttribute(RequestContextFilter.REQUEST_ID_ATTRIBUTE, "req-async-1");
        DriftEvaluationRequest request = DriftEvaluationRequest.builder()
            .modelId("churn-v3")
            .reference(Map.of("x", List.of(1.0, 2.0)))
            .current(Map.of("x", List.of(1.0, 2.0)))
            .build();
        when(jobService.submit(eq("DRIFT_EVALUATION"), eq("req-async-1"), any())).thenReturn(UUID.randomUUID());
        AtomicReference<String> seenInJob = new AtomicReference<>();
        when(evaluationService.evaluate(request, "req-async-1")).thenAnswer(inv -> {
            seenInJob.set(MDC.get(RequestContextFilter.MDC_KEY));
            return DriftEvaluationResponse.builder().modelId("churn-v3").build();
        });

        controller.evaluateAsync(request, http);
        verify(jobService).submit(eq("DRIFT_EVALUATION"), eq("req-async-1"), task.capture());

        AtomicReference<String> leftAfterJob = new AtomicReference<>("unset");
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture.supplyAsync(() -> {
                Object result = task.getValue().get();
                leftAfterJob.set(MDC.get(RequestContextFilter.MDC_KEY));
                return result;
            }, worker).get();
        } finally {
            worker.shutdownNow();
        }

        assertThat(seenInJob.get()).isEqualTo("req-async-1");
        assertThat(leftAfterJob.get()).isNull();
    }
}

package com.driftmonitor.exception;

public class EvaluationCancelledException extends DriftMonitorException {
    public EvaluationCancelledException(String modelId) {
        super("EVALUATION_CANCELLED",
              "Drift evaluation for model '" + modelId + "' was cancelled before its run was stored.");
    }
}

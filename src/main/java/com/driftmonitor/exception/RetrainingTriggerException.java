package com.driftmonitor.exception;

public class RetrainingTriggerException extends DriftMonitorException {
    public RetrainingTriggerException(String message) {
        super("RETRAINING_TRIGGER_ERROR", message);
    }
    public RetrainingTriggerException(String message, Throwable cause) {
        super("RETRAINING_TRIGGER_ERROR", message, cause);
    }
}

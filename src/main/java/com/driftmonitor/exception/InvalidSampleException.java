package com.driftmonitor.exception;

public class InvalidSampleException extends DriftMonitorException {
    public InvalidSampleException(String message) {
        super("INVALID_SAMPLE", message);
    }
}

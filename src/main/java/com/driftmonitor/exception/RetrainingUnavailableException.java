package com.driftmonitor.exception;

public class RetrainingUnavailableException extends DriftMonitorException {
    public RetrainingUnavailableException(Throwable cause) {
        super("RETRAINING_UNAVAILABLE",
              "The retraining pipeline is currently unavailable. Please try again later.",
              cause);
    }
}

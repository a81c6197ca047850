package com.driftmonitor.exception;

import java.util.UUID;

public class DriftRunNotFoundException extends DriftMonitorException {
    public DriftRunNotFoundException(UUID runId) {
        super("DRIFT_RUN_NOT_FOUND", "Drift run with id '" + runId + "' not found.");
    }
}

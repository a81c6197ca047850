package com.driftmonitor.exception;

public class InvalidConfigException extends DriftMonitorException {
    public InvalidConfigException(String message) {
        super("INVALID_CONFIG", message);
    }
}

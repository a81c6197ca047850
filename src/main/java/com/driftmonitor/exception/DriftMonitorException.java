package com.driftmonitor.exception;

import lombok.Getter;

@Getter
public abstract class DriftMonitorException extends RuntimeException {

    private final String code;

    protected DriftMonitorException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected DriftMonitorException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}

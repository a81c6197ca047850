package com.driftmonitor.exception;

public class EmptyReportException extends DriftMonitorException {
    public EmptyReportException() {
        super("EMPTY_REPORT", "A drift report needs at least one feature; nothing was supplied to evaluate.");
    }
}

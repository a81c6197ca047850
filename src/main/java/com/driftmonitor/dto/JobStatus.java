package com.driftmonitor.dto;

public enum JobStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}

package com.driftmonitor.dto;

public enum TriggerStatus {
    /** The report did not recommend retraining. */
    NOT_REQUIRED,
    /** Stored before the trigger outcome is known. */
    PENDING,
    TRIGGERED,
    /** Retraining was recommended but the trigger is disabled. */
    SKIPPED,
    FAILED
}

package com.driftmonitor.monitor;

public enum DriftVerdict {
    SIGNIFICANT,
    NOT_SIGNIFICANT,
    /** Too few observations on either side to trust the test. */
    INCONCLUSIVE
}

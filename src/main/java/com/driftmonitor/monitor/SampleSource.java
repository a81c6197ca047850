package com.driftmonitor.monitor;

public enum SampleSource {
    REFERENCE,
    CURRENT
}

package com.driftmonitor.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class EmptySampleException extends DriftMonitorException {

    private final List<String> features;

    public EmptySampleException(List<String> features, int minSampleSize) {
        super("EMPTY_SAMPLE",
              "Features " + features + " have fewer than the " + minSampleSize
              + " observations required for a drift test.");
        this.features = List.copyOf(features);
    }
}

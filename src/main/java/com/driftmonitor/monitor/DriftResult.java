package com.driftmonitor.monitor;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of the drift test for one feature. Statistic and p-value are null when the
 * feature was inconclusive.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DriftResult {
    String feature;
    Double statistic;
    @JsonProperty("pValue")
    Double pValue;
    DriftVerdict verdict;
    int referenceSize;
    int currentSize;
    String note;

    static DriftResult tested(String feature, DistributionComparator.Comparison comparison,
                              int referenceSize, int currentSize, double significanceLevel) {
        return DriftResult.builder()
            .feature(feature)
            .statistic(comparison.statistic())
            .pValue(comparison.pValue())
            .verdict(comparison.pValue() < significanceLevel
                ? DriftVerdict.SIGNIFICANT : DriftVerdict.NOT_SIGNIFICANT)
            .referenceSize(referenceSize)
            .currentSize(currentSize)
            .build();
    }

    static DriftResult inconclusive(String feature, int referenceSize, int currentSize, int required) {
        return DriftResult.builder()
            .feature(feature)
            .verdict(DriftVerdict.INCONCLUSIVE)
            .referenceSize(referenceSize)
            .currentSize(currentSize)
            .note("reference has " + referenceSize + " and current has " + currentSize
                + " observations, " + required + " required on each side")
            .build();
    }

    @JsonProperty("pValue")
    public Double getPValue() {
        return pValue;
    }

    @JsonProperty("significant")
    public boolean isSignificant() {
        return verdict == DriftVerdict.SIGNIFICANT;
    }

    @JsonIgnore
    public boolean isInconclusive() {
        return verdict == DriftVerdict.INCONCLUSIVE;
    }
}

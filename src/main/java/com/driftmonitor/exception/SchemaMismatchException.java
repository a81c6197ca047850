package com.driftmonitor.exception;

import lombok.Getter;

import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Raised when the reference and current sides of a run do not track the same features.
 * Both sets are reported so that schema drift between ingestion sides is visible as a whole.
 */
@Getter
public class SchemaMismatchException extends DriftMonitorException {

    private final SortedSet<String> missingFromReference;
    private final SortedSet<String> missingFromCurrent;

    public SchemaMismatchException(Set<String> missingFromReference, Set<String> missingFromCurrent) {
        super("SCHEMA_MISMATCH", describe(missingFromReference, missingFromCurrent));
        this.missingFromReference = new TreeSet<>(missingFromReference);
        this.missingFromCurrent = new TreeSet<>(missingFromCurrent);
    }

    private static String describe(Set<String> missingFromReference, Set<String> missingFromCurrent) {
        StringBuilder sb = new StringBuilder("Reference and current feature sets differ.");
        if (!missingFromReference.isEmpty()) {
            sb.append(" Missing from reference: ").append(new TreeSet<>(missingFromReference)).append('.');
        }
        if (!missingFromCurrent.isEmpty()) {
            sb.append(" Missing from current: ").append(new TreeSet<>(missingFromCurrent)).append('.');
        }
        return sb.toString();
    }
}

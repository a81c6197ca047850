package com.driftmonitor.exception;

public class PayloadTooLargeException extends DriftMonitorException {
    public PayloadTooLargeException(String what, long size, long max) {
        super("PAYLOAD_TOO_LARGE",
              what + " count " + size + " exceeds the maximum allowed of " + max + ".");
    }
}

package com.elssolution.energymonitor.analysis;

/** One device's analysis could not be completed; the rest of the report still is. */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}

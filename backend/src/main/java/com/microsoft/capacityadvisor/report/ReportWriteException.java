package com.microsoft.capacityadvisor.report;

/**
 * Report output could not be written.
 */
public class ReportWriteException extends RuntimeException {

    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.queryscope.analyzer.report;

/**
 * A report could not be handed to its destination.
 */
public class ReportDeliveryException extends RuntimeException {

    public ReportDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

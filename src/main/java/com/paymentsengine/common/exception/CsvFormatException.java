package com.paymentsengine.common.exception;

/**
 * Thrown when a CSV input is structurally unusable, such as a missing required header.
 */
public class CsvFormatException extends PaymentsEngineException {

    public CsvFormatException(String message) {
        super(message);
    }

    public CsvFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.paymentsengine.common.exception;

/**
 * Thrown when a transaction record is malformed: unknown type, ids out of range,
 * or a missing or negative amount where one is required.
 */
public class InvalidTransactionRecordException extends PaymentsEngineException {

    public InvalidTransactionRecordException(String message) {
        super(message);
    }

    public InvalidTransactionRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}

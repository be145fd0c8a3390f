package com.paymentsengine.common.exception;

/**
 * Thrown when the command line does not name a usable input file.
 */
public class InvalidArgumentsException extends PaymentsEngineException {

    public enum Reason {
        ARGUMENTS_TOO_SHORT,
        EXPECTED_CSV_FILE
    }

    private final Reason reason;

    public InvalidArgumentsException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}

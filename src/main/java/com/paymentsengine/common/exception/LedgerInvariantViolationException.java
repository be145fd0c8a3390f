package com.paymentsengine.common.exception;

/**
 * Signals a programming defect: balances reached a state the dispute state machine
 * should never produce. Not a business outcome; the run must stop.
 */
public class LedgerInvariantViolationException extends PaymentsEngineException {

    public LedgerInvariantViolationException(String message) {
        super(message);
    }
}

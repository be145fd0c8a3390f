package com.paymentsengine.common.exception;

/**
 * Thrown when a dispute lifecycle transition is not allowed from the current state.
 */
public class InvalidDisputeStateException extends PaymentsEngineException {

    public InvalidDisputeStateException(long txId, String currentState, String operation) {
        super(String.format("Cannot perform operation '%s' on transaction %d in state %s",
            operation, txId, currentState));
    }
}

package com.paymentsengine.common.exception;

import com.paymentsengine.common.Amount;

/**
 * Thrown when an account has insufficient available funds for a transaction.
 */
public class InsufficientFundsException extends PaymentsEngineException {

    public InsufficientFundsException(int clientId, Amount required, Amount available) {
        super(String.format("Insufficient funds for client %d. Required: %s, Available: %s",
            clientId, required, available));
    }
}

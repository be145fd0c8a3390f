package com.paymentsengine.common.exception;

/**
 * Thrown when a balance-changing operation targets a locked account.
 */
public class AccountLockedException extends PaymentsEngineException {

    public AccountLockedException(int clientId, String operation) {
        super(String.format("Cannot perform operation '%s' on locked account %d", operation, clientId));
    }
}

package com.paymentsengine.ledger;

/**
 * Why the ledger dropped a record. Rejections leave accounts and history untouched.
 */
public enum RejectionReason {
    ACCOUNT_LOCKED,
    INSUFFICIENT_FUNDS,
    DUPLICATE_TRANSACTION,
    TRANSACTION_NOT_FOUND,
    CLIENT_MISMATCH,
    INVALID_DISPUTE_STATE,
    AMOUNT_OVERFLOW
}

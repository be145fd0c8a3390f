package com.paymentsengine.ledger;

/**
 * Dispute lifecycle of a deposit or withdrawal.
 *
 * NONE -> DISPUTED -> RESOLVED | CHARGED_BACK. Both outcomes are terminal:
 * a transaction goes through at most one dispute.
 */
public enum DisputeStatus {
    /**
     * Never disputed.
     */
    NONE,

    /**
     * Under dispute; its amount is held.
     */
    DISPUTED,

    /**
     * Dispute closed, held funds released back to available.
     */
    RESOLVED,

    /**
     * Dispute closed by reversing the transaction. The account is locked.
     */
    CHARGED_BACK
}

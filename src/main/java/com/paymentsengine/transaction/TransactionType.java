package com.paymentsengine.transaction;

import com.paymentsengine.common.exception.InvalidTransactionRecordException;

import java.util.Locale;

/**
 * Kinds of input transaction records.
 *
 * Deposits and withdrawals move funds and are remembered for later disputes.
 * Disputes, resolves and chargebacks reference an earlier deposit or withdrawal
 * and carry no amount of their own.
 */
public enum TransactionType {
    /**
     * Credit to the client's available funds.
     */
    DEPOSIT(true),

    /**
     * Debit from the client's available funds.
     */
    WITHDRAWAL(true),

    /**
     * Claim that a prior transaction was erroneous. Moves its amount from available to held.
     */
    DISPUTE(false),

    /**
     * Ends a dispute in the client's disfavour. Held funds return to available.
     */
    RESOLVE(false),

    /**
     * Ends a dispute by reversing the transaction. Held funds are withdrawn and the account locks.
     */
    CHARGEBACK(false);

    private final boolean carriesAmount;

    TransactionType(boolean carriesAmount) {
        this.carriesAmount = carriesAmount;
    }

    /**
     * Whether records of this kind carry an amount and create a disputable history entry.
     */
    public boolean carriesAmount() {
        return carriesAmount;
    }

    /**
     * Resolve an input name such as {@code "deposit"} or {@code " Chargeback "}.
     * The historical misspelling {@code "withdrawl"} is accepted.
     */
    public static TransactionType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidTransactionRecordException("Transaction type is missing");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("WITHDRAWL")) {
            return WITHDRAWAL;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidTransactionRecordException("Unknown transaction type: " + name.trim(), e);
        }
    }
}

package com.paymentsengine.transaction;

import com.paymentsengine.common.Amount;
import com.paymentsengine.common.PrecisionPolicy;
import com.paymentsengine.common.exception.AmountParseException;
import com.paymentsengine.common.exception.InvalidTransactionRecordException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;

/**
 * One input event for the engine.
 *
 * A flat tagged value: {@link #getType()} selects which of the five kinds this is,
 * and {@link #getAmount()} is present exactly for the kinds that carry one.
 * Instances are validated on construction, so the ledger only ever sees
 * well-formed records.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionRecord {

    public static final int MAX_CLIENT_ID = 0xFFFF;

    public static final long MAX_TX_ID = 0xFFFF_FFFFL;

    TransactionType type;
    int clientId;
    long txId;
    Amount amount;

    public static TransactionRecord deposit(int clientId, long txId, Amount amount) {
        return of(TransactionType.DEPOSIT, clientId, txId, amount);
    }

    public static TransactionRecord withdrawal(int clientId, long txId, Amount amount) {
        return of(TransactionType.WITHDRAWAL, clientId, txId, amount);
    }

    public static TransactionRecord dispute(int clientId, long txId) {
        return of(TransactionType.DISPUTE, clientId, txId, null);
    }

    public static TransactionRecord resolve(int clientId, long txId) {
        return of(TransactionType.RESOLVE, clientId, txId, null);
    }

    public static TransactionRecord chargeback(int clientId, long txId) {
        return of(TransactionType.CHARGEBACK, clientId, txId, null);
    }

    /**
     * Build and validate a record. An amount given for a dispute, resolve or chargeback is dropped.
     *
     * @throws InvalidTransactionRecordException if ids are out of range, or a deposit or withdrawal
     *                                           has a missing or negative amount
     */
    public static TransactionRecord of(TransactionType type, long clientId, long txId, Amount amount) {
        if (type == null) {
            throw new InvalidTransactionRecordException("Transaction type cannot be null");
        }
        if (clientId < 0 || clientId > MAX_CLIENT_ID) {
            throw new InvalidTransactionRecordException(
                String.format("Client id %d out of range 0..%d", clientId, MAX_CLIENT_ID));
        }
        if (txId < 0 || txId > MAX_TX_ID) {
            throw new InvalidTransactionRecordException(
                String.format("Transaction id %d out of range 0..%d", txId, MAX_TX_ID));
        }
        if (!type.carriesAmount()) {
            return new TransactionRecord(type, (int) clientId, txId, null);
        }
        if (amount == null) {
            throw new InvalidTransactionRecordException(
                String.format("%s %d requires an amount", type, txId));
        }
        if (amount.isNegative()) {
            throw new InvalidTransactionRecordException(
                String.format("%s %d has negative amount %s", type, txId, amount));
        }
        return new TransactionRecord(type, (int) clientId, txId, amount);
    }

    /**
     * Build a record from raw text fields as they appear in an input file.
     *
     * @param amount may be null or blank for kinds that carry no amount
     */
    public static TransactionRecord parse(String type, String clientId, String txId, String amount,
                                          PrecisionPolicy policy) {
        TransactionType transactionType = TransactionType.fromName(type);
        long client = parseUnsigned("client", clientId);
        long tx = parseUnsigned("tx", txId);

        Amount parsedAmount = null;
        if (transactionType.carriesAmount() && amount != null && !amount.isBlank()) {
            try {
                parsedAmount = Amount.parse(amount, policy);
            } catch (AmountParseException e) {
                throw new InvalidTransactionRecordException(e.getMessage(), e);
            }
        }
        return of(transactionType, client, tx, parsedAmount);
    }

    public Optional<Amount> amount() {
        return Optional.ofNullable(amount);
    }

    public boolean createsHistory() {
        return type.carriesAmount();
    }

    private static long parseUnsigned(String field, String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidTransactionRecordException("Missing " + field + " id");
        }
        String trimmed = text.trim();
        if (!trimmed.chars().allMatch(c -> c >= '0' && c <= '9') || trimmed.length() > 10) {
            throw new InvalidTransactionRecordException(
                String.format("Invalid %s id '%s'", field, trimmed));
        }
        return Long.parseLong(trimmed);
    }
}

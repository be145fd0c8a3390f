package com.paymentsengine.ledger;

import com.paymentsengine.common.Amount;
import com.paymentsengine.common.exception.InvalidDisputeStateException;
import com.paymentsengine.transaction.TransactionRecord;
import com.paymentsengine.transaction.TransactionType;
import lombok.Getter;

/**
 * Retained record of an accepted deposit or withdrawal, the only thing disputes can refer to.
 * Entries are never removed from the ledger; only their dispute status changes.
 */
@Getter
public class TransactionHistoryEntry {

    private final long txId;

    private final int clientId;

    private final TransactionType type;

    private final Amount amount;

    private DisputeStatus status;

    public TransactionHistoryEntry(long txId, int clientId, TransactionType type, Amount amount) {
        this.txId = txId;
        this.clientId = clientId;
        this.type = type;
        this.amount = amount;
        this.status = DisputeStatus.NONE;
    }

    static TransactionHistoryEntry from(TransactionRecord record) {
        return new TransactionHistoryEntry(record.getTxId(), record.getClientId(),
            record.getType(), record.getAmount());
    }

    public boolean belongsTo(int clientId) {
        return this.clientId == clientId;
    }

    public void dispute() {
        requireStatus(DisputeStatus.NONE, "dispute");
        this.status = DisputeStatus.DISPUTED;
    }

    public void resolve() {
        requireStatus(DisputeStatus.DISPUTED, "resolve");
        this.status = DisputeStatus.RESOLVED;
    }

    public void chargeBack() {
        requireStatus(DisputeStatus.DISPUTED, "chargeback");
        this.status = DisputeStatus.CHARGED_BACK;
    }

    /**
     * @throws InvalidDisputeStateException if the entry is not in the expected state
     */
    void requireStatus(DisputeStatus expected, String operation) {
        if (status != expected) {
            throw new InvalidDisputeStateException(txId, status.name(), operation);
        }
    }
}

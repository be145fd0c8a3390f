package com.paymentsengine.ledger;

import com.paymentsengine.accounts.Account;
import com.paymentsengine.accounts.AccountView;
import com.paymentsengine.common.exception.AccountLockedException;
import com.paymentsengine.common.exception.AmountOverflowException;
import com.paymentsengine.common.exception.InsufficientFundsException;
import com.paymentsengine.common.exception.InvalidDisputeStateException;
import com.paymentsengine.transaction.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * In-memory store of client accounts and of the deposits and withdrawals they can dispute.
 *
 * Each record is applied completely or not at all. Business-rule failures (locked account,
 * insufficient funds, unknown or foreign transaction, illegal dispute transition) are reported
 * as a rejected {@link ApplyOutcome} and leave every balance and history entry unchanged.
 * A {@link com.paymentsengine.common.exception.LedgerInvariantViolationException} means the
 * state machine itself is broken and is never caught here.
 *
 * Not thread-safe. One instance serves one run.
 */
@Slf4j
public class Ledger {

    private final Map<Integer, Account> accounts = new TreeMap<>();

    private final Map<Long, TransactionHistoryEntry> history = new HashMap<>();

    private final LedgerStatistics statistics = new LedgerStatistics();

    private final boolean allowDisputesOnLockedAccounts;

    public Ledger() {
        this(true);
    }

    /**
     * @param allowDisputesOnLockedAccounts whether disputes, resolves and chargebacks still apply
     *                                      to an account already locked by an earlier chargeback
     */
    public Ledger(boolean allowDisputesOnLockedAccounts) {
        this.allowDisputesOnLockedAccounts = allowDisputesOnLockedAccounts;
    }

    /**
     * Apply one record. The referenced client's account is created on first sight,
     * even when the record itself is rejected.
     */
    public ApplyOutcome apply(TransactionRecord record) {
        Account account = accounts.computeIfAbsent(record.getClientId(), Account::new);

        ApplyOutcome outcome;
        try {
            outcome = dispatch(record, account);
        } catch (AccountLockedException e) {
            outcome = ApplyOutcome.reject(RejectionReason.ACCOUNT_LOCKED, e.getMessage());
        } catch (InsufficientFundsException e) {
            outcome = ApplyOutcome.reject(RejectionReason.INSUFFICIENT_FUNDS, e.getMessage());
        } catch (InvalidDisputeStateException e) {
            outcome = ApplyOutcome.reject(RejectionReason.INVALID_DISPUTE_STATE, e.getMessage());
        } catch (AmountOverflowException e) {
            log.error("Rejected {} {} for client {}: {}",
                record.getType(), record.getTxId(), record.getClientId(), e.getMessage());
            outcome = ApplyOutcome.reject(RejectionReason.AMOUNT_OVERFLOW, e.getMessage());
        }

        account.verifyInvariants();
        statistics.record(outcome);

        if (outcome.isAccepted()) {
            log.debug("Applied {}: txn={}, client={}", record.getType(), record.getTxId(), record.getClientId());
        } else {
            log.debug("Rejected {}: txn={}, client={}, reason={}, detail={}", record.getType(),
                record.getTxId(), record.getClientId(), outcome.getReason(), outcome.getDetail());
        }
        return outcome;
    }

    /**
     * Accounts ordered by client id ascending.
     */
    public List<AccountView> snapshot() {
        return accounts.values().stream()
            .map(Account::toView)
            .collect(Collectors.toList());
    }

    public Optional<AccountView> findAccount(int clientId) {
        return Optional.ofNullable(accounts.get(clientId)).map(Account::toView);
    }

    public Optional<TransactionHistoryEntry> findHistoryEntry(long txId) {
        return Optional.ofNullable(history.get(txId));
    }

    public LedgerStatistics getStatistics() {
        return statistics;
    }

    private ApplyOutcome dispatch(TransactionRecord record, Account account) {
        switch (record.getType()) {
            case DEPOSIT:
                return applyDeposit(record, account);
            case WITHDRAWAL:
                return applyWithdrawal(record, account);
            case DISPUTE:
                return applyDispute(record, account);
            case RESOLVE:
                return applyResolve(record, account);
            case CHARGEBACK:
                return applyChargeback(record, account);
            default:
                throw new IllegalStateException("Unhandled transaction type: " + record.getType());
        }
    }

    private ApplyOutcome applyDeposit(TransactionRecord record, Account account) {
        if (history.containsKey(record.getTxId())) {
            return duplicate(record);
        }
        account.deposit(record.getAmount());
        history.put(record.getTxId(), TransactionHistoryEntry.from(record));
        return ApplyOutcome.accept();
    }

    private ApplyOutcome applyWithdrawal(TransactionRecord record, Account account) {
        if (history.containsKey(record.getTxId())) {
            return duplicate(record);
        }
        account.withdraw(record.getAmount());
        history.put(record.getTxId(), TransactionHistoryEntry.from(record));
        return ApplyOutcome.accept();
    }

    private ApplyOutcome applyDispute(TransactionRecord record, Account account) {
        Optional<ApplyOutcome> refused = checkReference(record, account);
        if (refused.isPresent()) {
            return refused.get();
        }
        TransactionHistoryEntry entry = history.get(record.getTxId());
        entry.requireStatus(DisputeStatus.NONE, "dispute");
        account.hold(entry.getAmount());
        entry.dispute();
        return ApplyOutcome.accept();
    }

    private ApplyOutcome applyResolve(TransactionRecord record, Account account) {
        Optional<ApplyOutcome> refused = checkReference(record, account);
        if (refused.isPresent()) {
            return refused.get();
        }
        TransactionHistoryEntry entry = history.get(record.getTxId());
        entry.requireStatus(DisputeStatus.DISPUTED, "resolve");
        account.release(entry.getAmount());
        entry.resolve();
        return ApplyOutcome.accept();
    }

    private ApplyOutcome applyChargeback(TransactionRecord record, Account account) {
        Optional<ApplyOutcome> refused = checkReference(record, account);
        if (refused.isPresent()) {
            return refused.get();
        }
        TransactionHistoryEntry entry = history.get(record.getTxId());
        entry.requireStatus(DisputeStatus.DISPUTED, "chargeback");
        account.chargeBack(entry.getAmount());
        entry.chargeBack();
        log.info("Charged back txn={} for client {}, account locked", entry.getTxId(), account.getClientId());
        return ApplyOutcome.accept();
    }

    /**
     * Checks shared by dispute, resolve and chargeback: the referenced transaction must exist
     * and belong to the same client.
     */
    private Optional<ApplyOutcome> checkReference(TransactionRecord record, Account account) {
        if (account.isLocked() && !allowDisputesOnLockedAccounts) {
            return Optional.of(ApplyOutcome.reject(RejectionReason.ACCOUNT_LOCKED,
                String.format("Account %d is locked", account.getClientId())));
        }
        TransactionHistoryEntry entry = history.get(record.getTxId());
        if (entry == null) {
            return Optional.of(ApplyOutcome.reject(RejectionReason.TRANSACTION_NOT_FOUND,
                String.format("Transaction %d not found", record.getTxId())));
        }
        if (!entry.belongsTo(record.getClientId())) {
            log.warn("Client {} referenced transaction {} owned by client {}",
                record.getClientId(), entry.getTxId(), entry.getClientId());
            return Optional.of(ApplyOutcome.reject(RejectionReason.CLIENT_MISMATCH,
                String.format("Transaction %d belongs to client %d, not %d",
                    entry.getTxId(), entry.getClientId(), record.getClientId())));
        }
        return Optional.empty();
    }

    private ApplyOutcome duplicate(TransactionRecord record) {
        return ApplyOutcome.reject(RejectionReason.DUPLICATE_TRANSACTION,
            String.format("Transaction %d already recorded", record.getTxId()));
    }
}

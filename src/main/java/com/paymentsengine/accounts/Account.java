package com.paymentsengine.accounts;

import com.paymentsengine.common.Amount;
import com.paymentsengine.common.exception.AccountLockedException;
import com.paymentsengine.common.exception.AmountOverflowException;
import com.paymentsengine.common.exception.InsufficientFundsException;
import com.paymentsengine.common.exception.LedgerInvariantViolationException;
import lombok.Getter;

/**
 * Balance state of a single client.
 *
 * Funds are either available (free to withdraw) or held (frozen by an open dispute).
 * The total is always derived from the two. A chargeback locks the account for good;
 * a locked account refuses deposits and withdrawals but still lets open disputes settle.
 *
 * Accounts never look up transaction history: the ledger decides which amounts
 * to hold, release or charge back and calls the matching operation here.
 */
@Getter
public class Account {

    private final int clientId;

    private Amount available;

    private Amount held;

    private boolean locked;

    public Account(int clientId) {
        this.clientId = clientId;
        this.available = Amount.zero();
        this.held = Amount.zero();
        this.locked = false;
    }

    public Amount getTotal() {
        return available.add(held);
    }

    public void deposit(Amount amount) {
        requireUnlocked("deposit");
        // total must stay representable, not just available
        getTotal().add(amount);
        this.available = this.available.add(amount);
    }

    public void withdraw(Amount amount) {
        requireUnlocked("withdraw");
        requireAvailable(amount);
        this.available = this.available.subtract(amount);
    }

    /**
     * Move funds from available to held for a dispute.
     */
    public void hold(Amount amount) {
        requireAvailable(amount);
        Amount newHeld = this.held.add(amount);
        this.available = this.available.subtract(amount);
        this.held = newHeld;
    }

    /**
     * Return previously held funds to available.
     */
    public void release(Amount amount) {
        requireHeld(amount, "release");
        Amount newAvailable = this.available.add(amount);
        this.held = this.held.subtract(amount);
        this.available = newAvailable;
    }

    /**
     * Remove previously held funds permanently and lock the account.
     */
    public void chargeBack(Amount amount) {
        requireHeld(amount, "chargeback");
        this.held = this.held.subtract(amount);
        this.locked = true;
    }

    /**
     * @throws LedgerInvariantViolationException if either balance is negative or the total
     *                                           is out of range
     */
    public void verifyInvariants() {
        if (available.isNegative() || held.isNegative()) {
            throw new LedgerInvariantViolationException(String.format(
                "Account %d has negative balance: available=%s, held=%s", clientId, available, held));
        }
        try {
            getTotal();
        } catch (AmountOverflowException e) {
            throw new LedgerInvariantViolationException(String.format(
                "Account %d total out of range: available=%s, held=%s", clientId, available, held));
        }
    }

    public AccountView toView() {
        return new AccountView(clientId, available, held, getTotal(), locked);
    }

    private void requireUnlocked(String operation) {
        if (locked) {
            throw new AccountLockedException(clientId, operation);
        }
    }

    private void requireAvailable(Amount amount) {
        if (available.isLessThan(amount)) {
            throw new InsufficientFundsException(clientId, amount, available);
        }
    }

    private void requireHeld(Amount amount, String operation) {
        if (held.isLessThan(amount)) {
            throw new LedgerInvariantViolationException(String.format(
                "Cannot %s %s on account %d holding only %s", operation, amount, clientId, held));
        }
    }
}

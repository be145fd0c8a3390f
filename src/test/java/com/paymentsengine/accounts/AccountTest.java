package com.paymentsengine.accounts;

import com.paymentsengine.common.Amount;
import com.paymentsengine.common.exception.AccountLockedException;
import com.paymentsengine.common.exception.AmountOverflowException;
import com.paymentsengine.common.exception.InsufficientFundsException;
import com.paymentsengine.common.exception.LedgerInvariantViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for account balance operations.
 * Verifies the available/held split and the lock taken by a chargeback.
 */
class AccountTest {

    private Account account;

    @BeforeEach
    void setUp() {
        account = new Account(7);
        account.deposit(Amount.parse("100"));
    }

    @Test
    void testNewAccountIsEmptyAndUnlocked() {
        Account fresh = new Account(1);

        assertEquals(1, fresh.getClientId());
        assertEquals(Amount.zero(), fresh.getAvailable());
        assertEquals(Amount.zero(), fresh.getHeld());
        assertEquals(Amount.zero(), fresh.getTotal());
        assertFalse(fresh.isLocked());
    }

    @Test
    void testWithdraw() {
        account.withdraw(Amount.parse("40"));

        assertEquals(Amount.parse("60"), account.getAvailable());
        assertEquals(Amount.parse("60"), account.getTotal());
    }

    @Test
    void testWithdraw_InsufficientFundsLeavesBalanceUnchanged() {
        assertThrows(InsufficientFundsException.class, () -> account.withdraw(Amount.parse("100.0001")));

        assertEquals(Amount.parse("100"), account.getAvailable());
    }

    @Test
    void testWithdraw_EntireBalance() {
        account.withdraw(Amount.parse("100"));

        assertEquals(Amount.zero(), account.getAvailable());
    }

    @Test
    void testHoldAndRelease() {
        account.hold(Amount.parse("30"));
        assertEquals(Amount.parse("70"), account.getAvailable());
        assertEquals(Amount.parse("30"), account.getHeld());
        assertEquals(Amount.parse("100"), account.getTotal());

        account.release(Amount.parse("30"));
        assertEquals(Amount.parse("100"), account.getAvailable());
        assertEquals(Amount.zero(), account.getHeld());
    }

    @Test
    void testHold_MoreThanAvailable() {
        assertThrows(InsufficientFundsException.class, () -> account.hold(Amount.parse("150")));

        assertEquals(Amount.parse("100"), account.getAvailable());
        assertEquals(Amount.zero(), account.getHeld());
    }

    @Test
    void testChargeBackLocksAccount() {
        account.hold(Amount.parse("30"));
        account.chargeBack(Amount.parse("30"));

        assertTrue(account.isLocked());
        assertEquals(Amount.parse("70"), account.getAvailable());
        assertEquals(Amount.zero(), account.getHeld());
        assertEquals(Amount.parse("70"), account.getTotal());

        assertThrows(AccountLockedException.class, () -> account.deposit(Amount.parse("1")));
        assertThrows(AccountLockedException.class, () -> account.withdraw(Amount.parse("1")));
        assertEquals(Amount.parse("70"), account.getAvailable());
    }

    @Test
    void testReleasingMoreThanHeldIsAnInvariantViolation() {
        account.hold(Amount.parse("10"));

        assertThrows(LedgerInvariantViolationException.class, () -> account.release(Amount.parse("20")));
        assertThrows(LedgerInvariantViolationException.class, () -> account.chargeBack(Amount.parse("20")));
        assertEquals(Amount.parse("10"), account.getHeld());
        assertFalse(account.isLocked());
    }

    @Test
    void testDepositOverflowingTotalLeavesBalancesUntouched() {
        Account full = new Account(1);
        full.deposit(Amount.MAX);
        full.hold(Amount.MAX);

        assertThrows(AmountOverflowException.class, () -> full.deposit(Amount.parse("1")));
        assertEquals(Amount.zero(), full.getAvailable());
        assertEquals(Amount.MAX, full.getTotal());
        full.verifyInvariants();
    }

    @Test
    void testToView() {
        account.hold(Amount.parse("25"));

        AccountView view = account.toView();

        assertEquals(new AccountView(7, Amount.parse("75"), Amount.parse("25"), Amount.parse("100"), false), view);
    }
}

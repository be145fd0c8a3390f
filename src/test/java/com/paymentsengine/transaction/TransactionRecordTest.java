package com.paymentsengine.transaction;

import com.paymentsengine.common.Amount;
import com.paymentsengine.common.PrecisionPolicy;
import com.paymentsengine.common.exception.InvalidTransactionRecordException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionRecordTest {

    @Test
    void testDepositCarriesAmount() {
        TransactionRecord record = TransactionRecord.deposit(1, 10, Amount.parse("2.5"));

        assertEquals(TransactionType.DEPOSIT, record.getType());
        assertEquals(1, record.getClientId());
        assertEquals(10L, record.getTxId());
        assertEquals(Amount.parse("2.5"), record.getAmount());
        assertTrue(record.createsHistory());
    }

    @Test
    void testDisputeKindsDropAmount() {
        TransactionRecord record = TransactionRecord.of(TransactionType.RESOLVE, 1, 10, Amount.parse("2.5"));

        assertNull(record.getAmount());
        assertTrue(record.amount().isEmpty());
        assertFalse(record.createsHistory());
        assertFalse(TransactionRecord.chargeback(1, 10).createsHistory());
    }

    @Test
    void testDepositAndWithdrawalRequireAmount() {
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.deposit(1, 1, null));
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.withdrawal(1, 1, null));
    }

    @Test
    void testNegativeAmountRejected() {
        InvalidTransactionRecordException e = assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.deposit(1, 1, Amount.parse("-1")));
        assertTrue(e.getMessage().contains("negative"));
    }

    @Test
    void testZeroAmountAllowed() {
        assertEquals(Amount.zero(), TransactionRecord.withdrawal(1, 1, Amount.zero()).getAmount());
    }

    @Test
    void testIdRanges() {
        assertEquals(65535, TransactionRecord.dispute(65535, 4294967295L).getClientId());
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.of(TransactionType.DISPUTE, 65536, 1, null));
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.of(TransactionType.DISPUTE, -1, 1, null));
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.of(TransactionType.DISPUTE, 1, 4294967296L, null));
    }

    @Test
    void testParseFromTextFields() {
        TransactionRecord record = TransactionRecord.parse(" withdrawal ", " 2 ", " 5 ", " 3.0 ",
            PrecisionPolicy.TRUNCATE);

        assertEquals(TransactionRecord.withdrawal(2, 5, Amount.parse("3")), record);
    }

    @Test
    void testParse_DisputeWithoutAmount() {
        assertEquals(TransactionRecord.dispute(1, 1),
            TransactionRecord.parse("dispute", "1", "1", null, PrecisionPolicy.TRUNCATE));
        assertEquals(TransactionRecord.dispute(1, 1),
            TransactionRecord.parse("dispute", "1", "1", "", PrecisionPolicy.TRUNCATE));
    }

    @Test
    void testParse_MalformedFields() {
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.parse("transfer", "1", "1", "1.0", PrecisionPolicy.TRUNCATE));
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.parse("deposit", "one", "1", "1.0", PrecisionPolicy.TRUNCATE));
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.parse("deposit", "1", "-1", "1.0", PrecisionPolicy.TRUNCATE));
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.parse("deposit", "1", "", "1.0", PrecisionPolicy.TRUNCATE));
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.parse("deposit", "1", "1", "abc", PrecisionPolicy.TRUNCATE));
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.parse("deposit", "1", "1", "", PrecisionPolicy.TRUNCATE));
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.parse("deposit", "1", "99999999999", "1", PrecisionPolicy.TRUNCATE));
    }

    @Test
    void testParse_PrecisionPolicyApplied() {
        assertEquals(Amount.parse("1.2345"),
            TransactionRecord.parse("deposit", "1", "1", "1.23456", PrecisionPolicy.TRUNCATE).getAmount());
        assertThrows(InvalidTransactionRecordException.class,
            () -> TransactionRecord.parse("deposit", "1", "1", "1.23456", PrecisionPolicy.REJECT));
    }

    @Test
    void testTypeNames() {
        assertEquals(TransactionType.CHARGEBACK, TransactionType.fromName("Chargeback"));
        assertEquals(TransactionType.WITHDRAWAL, TransactionType.fromName("withdrawl"));
        assertThrows(InvalidTransactionRecordException.class, () -> TransactionType.fromName(" "));
        assertThrows(InvalidTransactionRecordException.class, () -> TransactionType.fromName("refund"));
    }
}

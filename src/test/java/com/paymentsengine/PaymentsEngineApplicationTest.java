package com.paymentsengine;

import com.paymentsengine.cli.PaymentsEngineRunner;
import com.paymentsengine.common.Amount;
import com.paymentsengine.common.PrecisionPolicy;
import com.paymentsengine.csv.TransactionCsvReader;
import com.paymentsengine.engine.ProcessingResult;
import com.paymentsengine.engine.TransactionEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the wired engine against a CSV fixture.
 */
@SpringBootTest
@ActiveProfiles("test")
class PaymentsEngineApplicationTest {

    @Autowired
    private TransactionEngine engine;

    @Autowired
    private ApplicationContext context;

    @Test
    void testCommandLineRunnerDisabledInTests() {
        assertTrue(context.getBeansOfType(PaymentsEngineRunner.class).isEmpty());
    }

    @Test
    void testProcessFixture() throws Exception {
        try (Reader reader = new InputStreamReader(
                getClass().getResourceAsStream("/fixtures/transactions.csv"), StandardCharsets.UTF_8);
             TransactionCsvReader records = new TransactionCsvReader(reader, PrecisionPolicy.TRUNCATE)) {

            ProcessingResult result = engine.process(records);

            assertTrue(result.isComplete());
            assertEquals(2, records.getSkipped());
            assertEquals(3, result.getAccounts().size());

            assertEquals(Amount.parse("1.5"), result.getAccounts().get(0).getAvailable());
            assertEquals(Amount.zero(), result.getAccounts().get(0).getHeld());
            assertEquals(Amount.parse("2"), result.getAccounts().get(1).getTotal());
            assertTrue(result.getAccounts().get(2).isLocked());
            assertEquals(Amount.zero(), result.getAccounts().get(2).getTotal());
        }
    }
}

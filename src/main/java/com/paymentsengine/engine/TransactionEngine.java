package com.paymentsengine.engine;

import com.paymentsengine.ledger.Ledger;
import com.paymentsengine.transaction.TransactionRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.Iterator;

/**
 * Folds a stream of transaction records through a fresh {@link Ledger}.
 *
 * Records are applied strictly in the order the iterable yields them; a dispute seen
 * before its deposit is rejected, not deferred. Rejected records never stop the run.
 * An I/O failure of the input stops reading, and the snapshot of what was applied
 * so far is still returned, marked incomplete.
 */
@Service
@Slf4j
public class TransactionEngine {

    private final boolean allowDisputesOnLockedAccounts;

    public TransactionEngine(
            @Value("${payments-engine.ledger.allow-disputes-on-locked-accounts:true}")
            boolean allowDisputesOnLockedAccounts) {
        this.allowDisputesOnLockedAccounts = allowDisputesOnLockedAccounts;
    }

    public ProcessingResult process(Iterable<TransactionRecord> records) {
        Ledger ledger = new Ledger(allowDisputesOnLockedAccounts);
        Iterator<TransactionRecord> iterator = records.iterator();
        long applied = 0;
        boolean complete = true;

        while (true) {
            TransactionRecord record;
            try {
                if (!iterator.hasNext()) {
                    break;
                }
                record = iterator.next();
            } catch (UncheckedIOException e) {
                log.error("Input failed after {} records, stopping: {}", applied, e.getMessage(), e);
                complete = false;
                break;
            }
            ledger.apply(record);
            applied++;
        }

        ProcessingResult result = new ProcessingResult(ledger.snapshot(), ledger.getStatistics(), complete);
        log.info("Processed {} transactions into {} accounts: {}",
            applied, result.getAccounts().size(), result.getStatistics());
        return result;
    }
}

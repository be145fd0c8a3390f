package com.paymentsengine.engine;

import com.paymentsengine.accounts.AccountView;
import com.paymentsengine.ledger.LedgerStatistics;
import lombok.Value;

import java.util.List;

/**
 * Final account snapshot of a run, with the counts behind it.
 * {@code complete} is false when the input failed part-way; the snapshot then
 * reflects the records applied before the failure.
 */
@Value
public class ProcessingResult {
    List<AccountView> accounts;
    LedgerStatistics statistics;
    boolean complete;
}

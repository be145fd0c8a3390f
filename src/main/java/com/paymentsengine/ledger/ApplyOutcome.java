package com.paymentsengine.ledger;

import lombok.Value;

/**
 * Result of applying one record to the ledger.
 */
@Value
public class ApplyOutcome {
    boolean accepted;
    RejectionReason reason;
    String detail;

    public static ApplyOutcome accept() {
        return new ApplyOutcome(true, null, null);
    }

    public static ApplyOutcome reject(RejectionReason reason, String detail) {
        return new ApplyOutcome(false, reason, detail);
    }
}

package com.paymentsengine.ledger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Running counts of accepted and rejected records for one ledger.
 */
public class LedgerStatistics {

    private long accepted;

    private final Map<RejectionReason, Long> rejections = new EnumMap<>(RejectionReason.class);

    void record(ApplyOutcome outcome) {
        if (outcome.isAccepted()) {
            accepted++;
        } else {
            rejections.merge(outcome.getReason(), 1L, Long::sum);
        }
    }

    public long getAccepted() {
        return accepted;
    }

    public long getRejected() {
        return rejections.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getRejected(RejectionReason reason) {
        return rejections.getOrDefault(reason, 0L);
    }

    public Map<RejectionReason, Long> getRejections() {
        return Collections.unmodifiableMap(rejections);
    }

    @Override
    public String toString() {
        return String.format("accepted=%d, rejected=%d %s", accepted, getRejected(), rejections);
    }
}

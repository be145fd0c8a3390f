package com.paymentsengine.accounts;

import com.paymentsengine.common.Amount;
import lombok.Value;

/**
 * Immutable snapshot of an account, as handed to output writers.
 */
@Value
public class AccountView {
    int clientId;
    Amount available;
    Amount held;
    Amount total;
    boolean locked;
}

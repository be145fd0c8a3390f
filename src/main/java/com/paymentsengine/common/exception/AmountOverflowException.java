package com.paymentsengine.common.exception;

/**
 * Thrown when amount arithmetic leaves the representable range.
 */
public class AmountOverflowException extends PaymentsEngineException {

    public AmountOverflowException(String result) {
        super("Amount out of range: " + result);
    }
}

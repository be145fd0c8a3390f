package com.paymentsengine.common.exception;

/**
 * Thrown when text cannot be turned into an amount.
 */
public class AmountParseException extends PaymentsEngineException {

    private final String input;

    public AmountParseException(String input, String reason) {
        super(String.format("Invalid amount '%s': %s", input, reason));
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}

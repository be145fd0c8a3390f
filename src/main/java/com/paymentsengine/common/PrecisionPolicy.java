package com.paymentsengine.common;

/**
 * How amounts with more than {@link Amount#SCALE} fractional digits are treated.
 */
public enum PrecisionPolicy {
    /**
     * Round toward zero at four fractional digits. Lossy: {@code 1.23459} becomes {@code 1.2345}.
     */
    TRUNCATE,

    /**
     * Refuse the amount outright.
     */
    REJECT
}

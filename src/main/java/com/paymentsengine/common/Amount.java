package com.paymentsengine.common;

import com.paymentsengine.common.exception.AmountOverflowException;
import com.paymentsengine.common.exception.AmountParseException;
import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Pattern;

/**
 * Immutable value object representing a signed monetary amount with a fixed
 * precision of four fractional digits.
 *
 * Uses BigDecimal for exact decimal arithmetic. The representable range is that
 * of a signed 64-bit count of 1/10000 units; arithmetic leaving that range fails
 * with {@link AmountOverflowException} instead of losing precision.
 */
@EqualsAndHashCode
public final class Amount implements Comparable<Amount> {

    public static final int SCALE = 4;

    private static final BigDecimal MAX_VALUE = BigDecimal.valueOf(Long.MAX_VALUE, SCALE);

    private static final BigDecimal MIN_VALUE = BigDecimal.valueOf(Long.MIN_VALUE, SCALE);

    public static final Amount ZERO = new Amount(BigDecimal.ZERO.setScale(SCALE));

    public static final Amount MAX = ofUnits(Long.MAX_VALUE);

    public static final Amount MIN = ofUnits(Long.MIN_VALUE);

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final BigDecimal value;

    private Amount(BigDecimal value) {
        this.value = value;
    }

    public static Amount zero() {
        return ZERO;
    }

    /**
     * Amount from a count of 1/10000 units, e.g. {@code ofUnits(314)} is {@code 0.0314}.
     */
    public static Amount ofUnits(long units) {
        return new Amount(BigDecimal.valueOf(units, SCALE));
    }

    public static Amount of(BigDecimal value) {
        return of(value, PrecisionPolicy.TRUNCATE);
    }

    public static Amount of(BigDecimal value, PrecisionPolicy policy) {
        if (value == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("Precision policy cannot be null");
        }
        BigDecimal scaled;
        if (value.stripTrailingZeros().scale() > SCALE) {
            if (policy == PrecisionPolicy.REJECT) {
                throw new AmountParseException(value.toPlainString(),
                    "more than " + SCALE + " fractional digits");
            }
            scaled = value.setScale(SCALE, RoundingMode.DOWN);
        } else {
            scaled = value.setScale(SCALE, RoundingMode.UNNECESSARY);
        }
        return checkRange(scaled);
    }

    public static Amount parse(String text) {
        return parse(text, PrecisionPolicy.TRUNCATE);
    }

    /**
     * Parse a plain decimal string such as {@code "10"}, {@code "-3.5"} or {@code "0.0001"}.
     * Exponent notation is not accepted.
     *
     * @throws AmountParseException if the text is not a decimal number, is out of range,
     *                              or carries too many fractional digits under {@link PrecisionPolicy#REJECT}
     */
    public static Amount parse(String text, PrecisionPolicy policy) {
        if (text == null || text.isBlank()) {
            throw new AmountParseException(text, "amount is empty");
        }
        String trimmed = text.trim();
        if (!DECIMAL.matcher(trimmed).matches()) {
            throw new AmountParseException(text, "not a decimal number");
        }
        try {
            return of(new BigDecimal(trimmed), policy);
        } catch (AmountOverflowException e) {
            throw new AmountParseException(text, "out of range");
        }
    }

    public Amount add(Amount other) {
        return checkRange(this.value.add(other.value));
    }

    public Amount subtract(Amount other) {
        return checkRange(this.value.subtract(other.value));
    }

    public Amount negate() {
        return checkRange(this.value.negate());
    }

    public boolean isNegative() {
        return value.signum() < 0;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public boolean isPositive() {
        return value.signum() > 0;
    }

    public boolean isLessThan(Amount other) {
        return compareTo(other) < 0;
    }

    public boolean isGreaterThan(Amount other) {
        return compareTo(other) > 0;
    }

    public boolean isGreaterThanOrEqual(Amount other) {
        return compareTo(other) >= 0;
    }

    /**
     * Plain notation with exactly four fractional digits, e.g. {@code 12.0000}.
     */
    public String toDisplayString() {
        return value.toPlainString();
    }

    @Override
    public int compareTo(Amount other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return toDisplayString();
    }

    private static Amount checkRange(BigDecimal candidate) {
        if (candidate.compareTo(MAX_VALUE) > 0 || candidate.compareTo(MIN_VALUE) < 0) {
            throw new AmountOverflowException(candidate.toPlainString());
        }
        return new Amount(candidate);
    }
}

package com.expense.audit.normalize;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Tolerant parsing of money strings such as {@code "$1,200.50"}.
 *
 * <p>Unparseable input is a normal outcome: {@link #parse} returns empty and
 * {@link #normalize} returns the empty string, which callers must read as
 * "unknown" rather than zero.
 *
 * <p>Exponent forms are accepted, but only within the range of a double, so every
 * parsed amount can be rescaled and summed cheaply.
 */
public final class AmountParser {

    // Amounts beyond the range of a double are unparseable; amounts below it read as zero
    private static final BigDecimal MAX_AMOUNT = new BigDecimal(Double.MAX_VALUE);
    private static final int MAX_MAGNITUDE = 309;
    private static final int MIN_MAGNITUDE = -324;

    private AmountParser() {}

    public static Optional<BigDecimal> parse(String value) {
        if (value == null || value.isEmpty()) {
            return Optional.empty();
        }
        String raw = value.replace("$", "").replace(",", "").strip();
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(raw);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (amount.signum() == 0) {
            return Optional.of(amount);
        }
        // Position of the most significant digit; long because precision - scale can overflow int
        long magnitude = (long) amount.precision() - amount.scale();
        if (magnitude > MAX_MAGNITUDE || amount.abs().compareTo(MAX_AMOUNT) > 0) {
            return Optional.empty();
        }
        if (magnitude < MIN_MAGNITUDE) {
            return Optional.of(BigDecimal.ZERO);
        }
        return Optional.of(amount);
    }

    /**
     * Canonical two-decimal plain string used as a grouping key, e.g. {@code "100.00"}.
     */
    public static String normalize(String value) {
        return parse(value)
                .map(amount -> amount.setScale(2, RoundingMode.HALF_EVEN).toPlainString())
                .orElse("");
    }
}

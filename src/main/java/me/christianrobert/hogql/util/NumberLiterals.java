package me.christianrobert.hogql.util;

import me.christianrobert.hogql.context.ParsingException;

import java.math.BigInteger;
import java.util.Locale;

/**
 * Classifies numeric literal text as integer or float and parses it.
 *
 * <p>Integers are {@link BigInteger} so that no literal is truncated. Floats are {@link Double};
 * {@code inf}, {@code -inf} and {@code nan} (any case, optional leading {@code +}) map to the
 * IEEE special values.
 *
 * <p>Hex literals are classified before the "contains e means float" rule, so {@code 0xE} is the
 * integer 14 rather than a float.
 */
public final class NumberLiterals {

    private static final String HEX_PREFIX = "0x";

    private NumberLiterals() {
    }

    public static Number parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new ParsingException("Empty number literal");
        }
        String lower = text.toLowerCase(Locale.ROOT);
        String unsigned = lower;
        boolean negative = false;
        if (lower.startsWith("+") || lower.startsWith("-")) {
            negative = lower.charAt(0) == '-';
            unsigned = lower.substring(1);
        }

        if (unsigned.equals("inf")) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (unsigned.equals("nan")) {
            return Double.NaN;
        }

        try {
            if (unsigned.startsWith(HEX_PREFIX)) {
                if (unsigned.contains("p") || unsigned.contains(".")) {
                    return Double.parseDouble(lower);
                }
                BigInteger value = new BigInteger(unsigned.substring(HEX_PREFIX.length()), 16);
                return negative ? value.negate() : value;
            }
            if (isFloat(unsigned)) {
                return Double.parseDouble(lower);
            }
            return new BigInteger(lower.startsWith("+") ? unsigned : lower);
        } catch (NumberFormatException e) {
            throw new ParsingException("Invalid number literal: " + text, e);
        }
    }

    public static boolean isFloat(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.contains(HEX_PREFIX)) {
            return lower.contains("p") || lower.contains(".");
        }
        return lower.contains(".") || lower.contains("e") || lower.contains("inf") || lower.contains("nan");
    }
}

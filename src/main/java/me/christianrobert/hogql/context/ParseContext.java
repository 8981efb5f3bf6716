package me.christianrobert.hogql.context;

import me.christianrobert.hogql.util.ReservedKeywords;

/**
 * Validation context for a single transduction call.
 *
 * <p>Created fresh per call and never shared, so two parses of the same text are independent.
 */
public class ParseContext {

    private final ReservedKeywords reservedKeywords;

    public ParseContext(ReservedKeywords reservedKeywords) {
        if (reservedKeywords == null) {
            throw new IllegalArgumentException("Reserved keywords cannot be null");
        }
        this.reservedKeywords = reservedKeywords;
    }

    public static ParseContext defaults() {
        return new ParseContext(ReservedKeywords.defaults());
    }

    public ReservedKeywords getReservedKeywords() {
        return reservedKeywords;
    }

    public boolean isReservedAlias(String alias) {
        return reservedKeywords.isReserved(alias);
    }
}

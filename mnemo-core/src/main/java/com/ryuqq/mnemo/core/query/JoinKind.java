package com.ryuqq.mnemo.core.query;

/**
 * Join flavours.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public enum JoinKind {

    /** Matched pairs only. */
    INNER("&"),

    /** Every left row, padded with empty units when unmatched. */
    LEFT("<<"),

    /** Every right row, padded with empty units when unmatched. */
    RIGHT(">>");

    private final String symbol;

    JoinKind(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return symbol used in toString output
     */
    public String symbol() {
        return symbol;
    }
}

package com.ryuqq.mnemo.core.spi;

import java.util.Locale;

/**
 * 선언된 타입과 storage가 맞지 않을 때 DDL 호출의 대응 방식.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public enum ConflictMode {

    /** Raise {@link com.ryuqq.mnemo.core.exception.MappingException}. */
    ERROR,

    /** Log a warning, collect it, and continue. */
    WARN,

    /** Reconcile storage with the model; raise if the issue cannot be repaired. */
    REPAIR,

    /** Continue silently. */
    IGNORE;

    /**
     * @return lower-case configuration value
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a mode case-insensitively.
     *
     * @param value "error", "warn", "repair" or "ignore"; null means ERROR
     * @return parsed mode
     * @throws IllegalArgumentException if the value names no mode
     */
    public static ConflictMode of(String value) {
        if (value == null || value.isBlank()) {
            return ERROR;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown conflict mode: '" + value + "'", e);
        }
    }
}

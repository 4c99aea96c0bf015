package com.ryuqq.mnemo.core.query;

import java.util.Locale;

/**
 * One sort key.
 *
 * @param arg row position of the unit holding the attribute
 * @param attribute property name
 * @param descending true for descending order
 * @author Mnemo Team
 * @since 1.0.0
 */
public record OrderTerm(int arg, String attribute, boolean descending) {

    public OrderTerm {
        if (arg < 0) {
            throw new IllegalArgumentException("arg cannot be negative");
        }
        if (attribute == null || attribute.isBlank()) {
            throw new IllegalArgumentException("attribute cannot be null or blank");
        }
    }

    /**
     * Parses {@code "Name"}, {@code "Name ASC"} or {@code "Name DESC"}.
     *
     * @param arg row position
     * @param spec term text
     * @return parsed term
     * @throws IllegalArgumentException if the direction is not ASC or DESC
     */
    public static OrderTerm parse(int arg, String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("spec cannot be null or blank");
        }
        String[] parts = spec.trim().split("\\s+");
        if (parts.length == 1) {
            return new OrderTerm(arg, parts[0], false);
        }
        if (parts.length == 2) {
            String direction = parts[1].toUpperCase(Locale.ROOT);
            if (direction.equals("DESC")) {
                return new OrderTerm(arg, parts[0], true);
            }
            if (direction.equals("ASC")) {
                return new OrderTerm(arg, parts[0], false);
            }
        }
        throw new IllegalArgumentException("Cannot parse order term: '" + spec + "'");
    }

    @Override
    public String toString() {
        return "x" + arg + "." + attribute + (descending ? " DESC" : "");
    }
}

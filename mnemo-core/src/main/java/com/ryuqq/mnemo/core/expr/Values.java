package com.ryuqq.mnemo.core.expr;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * 조건식, 정렬, identity가 공유하는 값 비교 규칙.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>숫자는 boxing 타입과 무관하게 수치로 비교</li>
 *   <li>무한대와 NaN은 {@link Double#compare}로 비교 (NaN은 +Infinity 뒤)</li>
 *   <li>그 외 값은 서로 {@link Comparable}이어야 함</li>
 *   <li>{@code null}은 {@code null}과만 같고 정렬 시 가장 앞</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Values {

    private Values() {
    }

    /**
     * @param a first value
     * @param b second value
     * @return true if both are null, numerically equal numbers, or equal objects
     */
    public static boolean equal(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number) a, (Number) b) == 0;
        }
        return a.equals(b);
    }

    /**
     * Hash consistent with {@link #equal(Object, Object)}.
     *
     * @param value value to hash
     * @return hash code
     */
    public static int hash(Object value) {
        if (value instanceof Number && !isFinite(value)) {
            return Double.hashCode(((Number) value).doubleValue());
        }
        if (value instanceof Number) {
            BigDecimal decimal = toBigDecimal((Number) value);
            if (decimal.signum() == 0) {
                return 0;
            }
            return decimal.stripTrailingZeros().hashCode();
        }
        return Objects.hashCode(value);
    }

    /**
     * Total order used by sorting: nulls first, numbers numerically.
     *
     * @param a first value
     * @param b second value
     * @return negative, zero or positive
     * @throws IllegalArgumentException if the values are not mutually comparable
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        if (a == null) {
            return -1;
        }
        if (b == null) {
            return 1;
        }
        if (a instanceof Number && b instanceof Number) {
            return compareNumbers((Number) a, (Number) b);
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return ((Comparable) a).compareTo(b);
        }
        if (b instanceof Comparable && b.getClass().isInstance(a)) {
            return -((Comparable) b).compareTo(a);
        }
        throw new IllegalArgumentException(
            "Cannot compare " + a.getClass().getSimpleName() + " with " + b.getClass().getSimpleName());
    }

    /**
     * Numeric order. Infinities sort outside every finite number and NaN
     * after positive infinity, equal only to itself.
     */
    private static int compareNumbers(Number a, Number b) {
        if (!isFinite(a) || !isFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return toBigDecimal(a).compareTo(toBigDecimal(b));
    }

    /**
     * @param value any value
     * @return false only for infinite or NaN Double and Float values
     */
    public static boolean isFinite(Object value) {
        if (value instanceof Double || value instanceof Float) {
            return Double.isFinite(((Number) value).doubleValue());
        }
        return true;
    }

    /**
     * @param value any finite number
     * @return exact decimal representation
     * @throws NumberFormatException for infinite or NaN values
     */
    public static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (isIntegral(value)) {
            return BigDecimal.valueOf(value.longValue());
        }
        return BigDecimal.valueOf(value.doubleValue());
    }

    /**
     * @param value any value
     * @return true for Byte, Short, Integer, Long and BigInteger
     */
    public static boolean isIntegral(Object value) {
        return value instanceof Byte || value instanceof Short || value instanceof Integer
            || value instanceof Long || value instanceof BigInteger;
    }
}

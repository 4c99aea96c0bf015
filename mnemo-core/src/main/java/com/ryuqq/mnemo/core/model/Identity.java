package com.ryuqq.mnemo.core.model;

import com.ryuqq.mnemo.core.expr.Values;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * Identity Value Object.
 *
 * <p>unit 식별자 값의 순서 있는 tuple입니다. sequencer가 할당하기 전에는
 * 값이 {@code null}일 수 있습니다.</p>
 *
 * <p><strong>동등성:</strong></p>
 * <ul>
 *   <li>위치별로 {@link Values#equal(Object, Object)} 비교</li>
 *   <li>숫자는 값으로 비교하므로 {@code Identity.of(1)}과 {@code Identity.of(1L)}은 같음</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시 값 목록을 복사하며 변경 가능한 목록을 노출하지 않습니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Identity {

    private static final Identity EMPTY = new Identity(Collections.emptyList());

    private final List<Object> values;

    private Identity(List<Object> values) {
        this.values = values;
    }

    /**
     * 주어진 값으로 identity 생성.
     *
     * @param values identifier values in declared identifier order
     * @return new Identity
     * @throws IllegalArgumentException if values is null
     */
    public static Identity of(Object... values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        return of(Arrays.asList(values));
    }

    /**
     * 주어진 값으로 identity 생성.
     *
     * @param values identifier values in declared identifier order
     * @return new Identity
     * @throws IllegalArgumentException if values is null
     */
    public static Identity of(List<?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (values.isEmpty()) {
            return EMPTY;
        }
        return new Identity(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    /**
     * The identity of units whose type declares no identifiers.
     *
     * @return empty Identity
     */
    public static Identity empty() {
        return EMPTY;
    }

    /**
     * @return unmodifiable identifier values
     */
    public List<Object> values() {
        return values;
    }

    /**
     * @param index identifier position
     * @return value at the position
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * @return number of identifier values
     */
    public int size() {
        return values.size();
    }

    /**
     * @return true if this identity has no values
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * @return true if any identifier value is still null
     */
    public boolean hasNulls() {
        return values.contains(null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identity)) {
            return false;
        }
        Identity other = (Identity) o;
        if (values.size() != other.values.size()) {
            return false;
        }
        for (int i = 0; i < values.size(); i++) {
            if (!Values.equal(values.get(i), other.values.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (Object value : values) {
            result = 31 * result + Values.hash(value);
        }
        return result;
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "Identity(", ")");
        for (Object value : values) {
            joiner.add(String.valueOf(value));
        }
        return joiner.toString();
    }
}

package com.ryuqq.mnemo.core.model;

import java.util.Collection;

/**
 * 단일 식별자 타입의 자동 증가 sequencer.
 *
 * <p>다음 값은 저장된 최대 식별자 + 1이며, 그보다 큰 값이 없으면 초기값입니다.
 * 할당되는 boxing 타입은 식별자 property의 선언 타입({@code Integer} 또는 {@code Long})을 따릅니다.</p>
 *
 * <p>자체적으로는 thread-safe하지 않습니다. 호출자가 타입의 storage lock을 잡은 상태에서 할당합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class IntegerSequencer implements Sequencer {

    private final long initial;

    /**
     * @param initial value handed out for an empty type
     */
    public IntegerSequencer(long initial) {
        this.initial = initial;
    }

    /**
     * @return value handed out for an empty type
     */
    public long initial() {
        return initial;
    }

    @Override
    public boolean validId(Identity identity) {
        return !identity.isEmpty() && !identity.hasNulls();
    }

    @Override
    public void assign(Unit unit, Collection<Identity> existing) {
        EntityType type = unit.type();
        if (type.identifiers().size() != 1) {
            throw new IllegalStateException(
                type.name() + " needs exactly one identifier for autoincrement but has "
                    + type.identifiers());
        }
        long next = initial;
        for (Identity identity : existing) {
            Object value = identity.isEmpty() ? null : identity.get(0);
            if (value instanceof Number && ((Number) value).longValue() >= next) {
                next = ((Number) value).longValue() + 1;
            }
        }
        String name = type.identifiers().get(0);
        Class<?> valueType = type.property(name).type();
        if (valueType == Integer.class) {
            unit.set(name, Math.toIntExact(next));
        } else {
            unit.set(name, next);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{initial=" + initial + "}";
    }
}

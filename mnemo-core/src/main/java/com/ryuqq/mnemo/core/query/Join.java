package com.ryuqq.mnemo.core.query;

import com.ryuqq.mnemo.core.model.EntityType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * association을 따라 두 relation을 join.
 *
 * <p>{@code path}가 null이면 타입에서 association을 찾습니다.
 * 먼저 왼쪽 타입에서 오른쪽 타입 이름의 association을 찾고, 없으면 반대 방향을 찾습니다.</p>
 *
 * @param left 왼쪽 relation
 * @param right 오른쪽 relation
 * @param kind inner, left, right join
 * @param path 명시한 association path (null이면 자동 탐색)
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Join(Relation left, Relation right, JoinKind kind, String path) implements Relation {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException if left, right or kind is null
     */
    public Join {
        if (left == null || right == null) {
            throw new IllegalArgumentException("left and right cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }

    @Override
    public List<EntityType> types() {
        List<EntityType> types = new ArrayList<>(left.types());
        types.addAll(right.types());
        return Collections.unmodifiableList(types);
    }

    @Override
    public String toString() {
        return "(" + left + " " + kind.symbol() + " " + right + ")";
    }
}

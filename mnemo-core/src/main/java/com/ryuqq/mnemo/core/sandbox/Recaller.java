package com.ryuqq.mnemo.core.sandbox;

import com.ryuqq.mnemo.core.model.Unit;

/**
 * 한 타입의 unit을 위치 기반으로 조회.
 *
 * <p>값은 타입의 식별자와 순서대로 비교되며, 식별자가 없는 타입은
 * 선언된 property 순서대로 비교됩니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Recaller {

    /**
     * @param values leading identifier (or property) values
     * @return the matching unit, or null
     */
    Unit find(Object... values);
}

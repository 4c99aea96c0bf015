package com.ryuqq.mnemo.core.model;

import com.ryuqq.mnemo.core.exception.UnrecallableException;

/**
 * sandbox가 한 entity type의 unit에 대해 호출하는 생명주기 callback.
 *
 * <p>모든 메서드의 기본 구현은 아무 일도 하지 않습니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public interface UnitHooks {

    /** Hooks that do nothing. */
    UnitHooks NONE = new UnitHooks() {
    };

    /**
     * Called after a new unit was reserved in the store and placed in the sandbox.
     *
     * @param unit the memorized unit
     */
    default void onMemorize(Unit unit) {
    }

    /**
     * Called after a unit was removed from the sandbox and destroyed in the store.
     *
     * @param unit the forgotten unit
     */
    default void onForget(Unit unit) {
    }

    /**
     * Called once when a unit loaded from the store enters a sandbox.
     *
     * @param unit the recalled unit
     * @throws UnrecallableException to hide the unit from the caller
     */
    default void onRecall(Unit unit) {
    }

    /**
     * Called before a unit is saved and evicted from its sandbox.
     *
     * @param unit the unit being repressed
     */
    default void onRepress(Unit unit) {
    }
}

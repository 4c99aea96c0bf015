package com.ryuqq.mnemo.core.model;

import java.util.Collection;

/**
 * entity type의 식별자 할당 전략.
 *
 * <p>저장소는 unit을 reserve할 때 sequencer를 확인합니다. {@link #validId(Identity)}가
 * false이면 타입 lock을 잡은 상태에서 저장된 모든 identity를 넘겨
 * {@link #assign(Unit, Collection)}을 호출합니다.</p>
 *
 * <p><strong>기본 전략:</strong></p>
 * <ul>
 *   <li>{@link #manual()} - 애플리케이션이 식별자 지정</li>
 *   <li>{@link #integer()} - 자동 증가, 저장된 최대값 + 1</li>
 *   <li>{@link #dynamic()} - 백엔드 생성, 불가능하면 클라이언트에서 할당</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public interface Sequencer {

    /**
     * @param identity a unit's current identity
     * @return true if the identity can be stored as is
     */
    boolean validId(Identity identity);

    /**
     * Assigns identifier values to a unit whose identity is not valid.
     *
     * @param unit unit to complete
     * @param existing identities already stored for the unit's type
     * @throws IllegalStateException if this strategy cannot assign identifiers
     */
    void assign(Unit unit, Collection<Identity> existing);

    /**
     * @return sequencer that requires application-supplied identifiers
     */
    static Sequencer manual() {
        return ManualSequencer.INSTANCE;
    }

    /**
     * @return autoincrement sequencer starting at 1
     */
    static Sequencer integer() {
        return new IntegerSequencer(1L);
    }

    /**
     * @param initial first value handed out for an empty type
     * @return autoincrement sequencer starting at {@code initial}
     */
    static Sequencer integer(long initial) {
        return new IntegerSequencer(initial);
    }

    /**
     * @return backend-generated sequencer
     */
    static Sequencer dynamic() {
        return new DynamicSequencer();
    }
}

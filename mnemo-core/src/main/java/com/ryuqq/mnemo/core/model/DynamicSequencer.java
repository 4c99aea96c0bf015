package com.ryuqq.mnemo.core.model;

/**
 * 백엔드가 식별자를 생성하는 sequencer.
 *
 * <p>기본 제공 백엔드는 식별자를 직접 생성하지 않으므로
 * {@link IntegerSequencer}와 동일하게 클라이언트에서 값을 할당합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class DynamicSequencer extends IntegerSequencer {

    /**
     * 생성자. 클라이언트 할당은 1부터 시작합니다.
     */
    public DynamicSequencer() {
        super(1L);
    }
}

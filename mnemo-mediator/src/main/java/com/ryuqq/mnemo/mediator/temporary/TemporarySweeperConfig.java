package com.ryuqq.mnemo.mediator.temporary;

/**
 * TemporarySweeper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>sweepIntervalMs: 스윕 주기 (기본 60000ms = 1분)</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 * @param sweepIntervalMs 스윕 주기 (밀리초, 양수여야 함)
 */
public record TemporarySweeperConfig(long sweepIntervalMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: sweepIntervalMs=60000ms (1분)</p>
     */
    public TemporarySweeperConfig() {
        this(60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TemporarySweeperConfig {
        if (sweepIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "sweepIntervalMs must be positive (current: " + sweepIntervalMs + ")"
            );
        }
    }

    /**
     * sweepIntervalMs만 변경한 새 인스턴스 생성.
     */
    public TemporarySweeperConfig withSweepIntervalMs(long sweepIntervalMs) {
        return new TemporarySweeperConfig(sweepIntervalMs);
    }
}

package com.ryuqq.mnemo.mediator.cache;

/**
 * CacheSweeper 설정 (불변 record).
 *
 * <p>이 record는 CacheSweeper의 동작을 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>sweepIntervalMs: 스윕 주기 (기본 60000ms = 1분)</li>
 *   <li>lifetimeMs: 마지막 접근 이후 유지 시간 (기본 300000ms = 5분)</li>
 * </ul>
 *
 * <p><strong>lifetimeMs 설정 가이드:</strong></p>
 * <ul>
 *   <li>자주 바뀌는 데이터: lifetimeMs = 60000ms (1분)</li>
 *   <li>참조 데이터: lifetimeMs = 3600000ms (1시간)</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 * @param sweepIntervalMs 스윕 주기 (밀리초, 양수여야 함)
 * @param lifetimeMs 유지 시간 (밀리초, 양수여야 함)
 */
public record SweeperConfig(
    long sweepIntervalMs,
    long lifetimeMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: sweepIntervalMs=60000ms (1분), lifetimeMs=300000ms (5분)</p>
     */
    public SweeperConfig() {
        this(60000, 300000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SweeperConfig {
        if (sweepIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "sweepIntervalMs must be positive (current: " + sweepIntervalMs + ")"
            );
        }
        if (lifetimeMs <= 0) {
            throw new IllegalArgumentException(
                "lifetimeMs must be positive (current: " + lifetimeMs + ")"
            );
        }
    }

    /**
     * sweepIntervalMs만 변경한 새 인스턴스 생성.
     */
    public SweeperConfig withSweepIntervalMs(long sweepIntervalMs) {
        return new SweeperConfig(sweepIntervalMs, lifetimeMs);
    }

    /**
     * lifetimeMs만 변경한 새 인스턴스 생성.
     */
    public SweeperConfig withLifetimeMs(long lifetimeMs) {
        return new SweeperConfig(sweepIntervalMs, lifetimeMs);
    }
}

package com.ryuqq.mnemo.mediator.cache;

import com.ryuqq.mnemo.core.model.EntityType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * CacheSweeper 컴포넌트.
 *
 * <p>AgedCache에서 lifetime 동안 접근되지 않은 unit을 제거합니다.</p>
 *
 * <p><strong>스윕 흐름:</strong></p>
 * <pre>
 * 1. cutoff = now - lifetimeMs
 * 2. For each cached type:
 *    a. cache.sweep(type, cutoff)
 *    b. 예외 발생 시 로깅 후 다음 타입 진행
 * 3. 제거 건수 로깅
 * </pre>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>주기적 스윕 (schedule)</li>
 *   <li>타입 단위 장애 격리</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class CacheSweeper {

    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);
    private final AgedCache cache;
    private final SweeperConfig config;
    private final Clock clock;

    public CacheSweeper(AgedCache cache, SweeperConfig config) {
        this(cache, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param cache 스윕 대상 캐시
     * @param config 설정
     * @param clock cutoff 계산용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CacheSweeper(AgedCache cache, SweeperConfig config, Clock clock) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.cache = cache;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 만료된 unit 스윕.
     *
     * @return 제거된 unit 수
     */
    public int sweep() {
        log.info("CacheSweeper sweep started");

        Instant cutoff = clock.instant().minusMillis(config.lifetimeMs());

        int dropped = 0;
        int failed = 0;
        for (EntityType type : cache.cachedTypes()) {
            try {
                dropped += cache.sweep(type, cutoff);
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to sweep {} in CacheSweeper", type.name(), e);
            }
        }

        log.info("CacheSweeper sweep completed: {} dropped, {} types failed", dropped, failed);
        return dropped;
    }

    /**
     * sweepIntervalMs 주기로 스윕 예약.
     *
     * @param scheduler 실행기
     * @return 예약 핸들 (cancel로 중지)
     */
    public ScheduledFuture<?> schedule(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        return scheduler.scheduleWithFixedDelay(
            this::sweep, config.sweepIntervalMs(), config.sweepIntervalMs(), TimeUnit.MILLISECONDS);
    }
}

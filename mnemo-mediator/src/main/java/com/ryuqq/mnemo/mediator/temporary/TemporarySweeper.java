package com.ryuqq.mnemo.mediator.temporary;

import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.expr.Exprs;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.sandbox.Sandbox;
import com.ryuqq.mnemo.core.spi.StorageManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * TemporarySweeper 컴포넌트.
 *
 * <p>만료 시각이 지난 임시 unit을 저장소에서 제거합니다.</p>
 *
 * <p><strong>스윕 흐름:</strong></p>
 * <pre>
 * 1. 새 Sandbox 생성
 * 2. For each temporary type ({@link TemporaryHooks#isTemporary}):
 *    a. Expiration &lt;= now 인 unit recall
 *       (TemporaryHooks.onRecall이 만료 unit을 forget)
 *    b. 예외 발생 시 로깅 후 다음 타입 진행
 * 3. sandbox.flushAll()
 * 4. 제거 건수 로깅
 * </pre>
 *
 * <p>now는 각 타입에 설치된 {@link TemporaryHooks}의 시계를 따릅니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class TemporarySweeper {

    private static final Logger log = LoggerFactory.getLogger(TemporarySweeper.class);
    private final StorageManager store;
    private final TemporarySweeperConfig config;

    /**
     * 생성자.
     *
     * @param store 스윕 대상 저장소
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public TemporarySweeper(StorageManager store, TemporarySweeperConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.config = config;
    }

    /**
     * 만료된 임시 unit 스윕.
     *
     * @return 제거된 unit 수
     */
    public long sweep() {
        log.info("TemporarySweeper sweep started");

        Sandbox sandbox = new Sandbox(store);
        long forgotten = 0;
        int failed = 0;
        for (EntityType type : store.classes()) {
            if (!TemporaryHooks.isTemporary(type)) {
                continue;
            }
            try {
                forgotten += sweep(sandbox, type);
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to sweep {} in TemporarySweeper", type.name(), e);
            }
        }
        sandbox.flushAll();

        log.info("TemporarySweeper sweep completed: {} forgotten, {} types failed", forgotten, failed);
        return forgotten;
    }

    private long sweep(Sandbox sandbox, EntityType type) {
        TemporaryHooks hooks = (TemporaryHooks) type.hooks();
        Expr expired = Exprs.attr(TemporaryHooks.EXPIRATION).le(hooks.now());
        long before = store.count(type, expired);
        sandbox.recall(type, expired);
        return before - store.count(type, expired);
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

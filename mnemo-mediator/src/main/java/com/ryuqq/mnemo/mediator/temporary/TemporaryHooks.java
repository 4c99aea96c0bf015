package com.ryuqq.mnemo.mediator.temporary;

import com.ryuqq.mnemo.core.exception.UnrecallableException;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Property;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.model.UnitHooks;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 임시 unit 수명 관리 hook.
 *
 * <p>{@value #EXPIRATION} 속성({@link LocalDateTime})을 가진 타입에 설치하면
 * 해당 타입의 unit은 만료 시각이 지나면 더 이상 recall되지 않습니다.</p>
 *
 * <p><strong>recall 시 동작:</strong></p>
 * <pre>
 * 1. Expiration == null  → 영구 unit, 그대로 반환
 * 2. Expiration &lt;= now  → unit.forget() 후 UnrecallableException (recall 거부)
 * 3. Expiration &gt; now   → decay 만큼 만료 시각 연장
 * </pre>
 *
 * <p>만료된 unit은 sandbox에서 제거되고 저장소에서도 삭제됩니다.
 * 접근되지 않는 만료 unit은 {@link TemporarySweeper}가 주기적으로 정리합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class TemporaryHooks implements UnitHooks {

    /** 만료 시각 속성 이름. */
    public static final String EXPIRATION = "Expiration";

    /** recall 시 기본 연장 시간. */
    public static final Duration DEFAULT_DECAY = Duration.ofMinutes(15);

    private final Clock clock;
    private final Duration decay;

    public TemporaryHooks() {
        this(Clock.systemDefaultZone(), DEFAULT_DECAY);
    }

    /**
     * 생성자.
     *
     * @param clock 만료 판정용 시계
     * @param decay recall 시 연장 시간 (양수)
     * @throws IllegalArgumentException clock이 null이거나 decay가 양수가 아닌 경우
     */
    public TemporaryHooks(Clock clock, Duration decay) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (decay == null || decay.isNegative() || decay.isZero()) {
            throw new IllegalArgumentException("decay must be positive (current: " + decay + ")");
        }
        this.clock = clock;
        this.decay = decay;
    }

    /**
     * @return 타입 선언에 추가할 {@value #EXPIRATION} 속성
     */
    public static Property expirationProperty() {
        return Property.of(EXPIRATION, LocalDateTime.class);
    }

    /**
     * @param type 엔티티 타입
     * @return {@link TemporaryHooks}가 설치되어 있고 {@value #EXPIRATION} 속성을 선언한 경우 true
     */
    public static boolean isTemporary(EntityType type) {
        return type.hooks() instanceof TemporaryHooks && type.hasProperty(EXPIRATION);
    }

    /**
     * @throws UnrecallableException 만료된 경우 (unit은 이미 forget 처리됨)
     */
    @Override
    public void onRecall(Unit unit) {
        LocalDateTime expiration = unit.get(EXPIRATION, LocalDateTime.class);
        if (expiration == null) {
            return;
        }
        if (!expiration.isAfter(now())) {
            unit.forget();
            throw new UnrecallableException(unit.type().name() + " expired at " + expiration);
        }
        decay(unit);
    }

    /**
     * 만료 시각을 now + 기본 decay로 설정.
     *
     * @param unit 임시 unit
     */
    public void decay(Unit unit) {
        decay(unit, decay);
    }

    /**
     * 만료 시각을 now + lifetime으로 설정.
     *
     * @param unit 임시 unit
     * @param lifetime 남은 수명
     */
    public void decay(Unit unit, Duration lifetime) {
        unit.set(EXPIRATION, now().plus(lifetime));
    }

    /**
     * 만료 시각 제거 (영구 unit으로 전환).
     *
     * @param unit 임시 unit
     */
    public void persist(Unit unit) {
        unit.set(EXPIRATION, null);
    }

    /**
     * @param unit 임시 unit
     * @return 만료 시각이 있고 now 이전(또는 같음)이면 true
     */
    public boolean isExpired(Unit unit) {
        LocalDateTime expiration = unit.get(EXPIRATION, LocalDateTime.class);
        return expiration != null && !expiration.isAfter(now());
    }

    /**
     * @return hook 시계 기준 현재 시각
     */
    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}

package com.ryuqq.mnemo.core.spi;

import com.ryuqq.mnemo.core.exception.MappingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * DDL 호출마다 전달하는 conflict handler.
 *
 * <p>저장소는 감지한 불일치마다 {@link #report(String)}를 호출합니다.
 * 이후 동작은 {@link ConflictMode}에 따라 다릅니다:</p>
 *
 * <ul>
 *   <li><strong>ERROR</strong> - {@link MappingException} 발생</li>
 *   <li><strong>WARN</strong> - WARN 로그 후 {@link #warnings()}에 수집</li>
 *   <li><strong>REPAIR</strong> - leaf 저장소는 report 전에 {@link #repairing()}으로 분기하며,
 *       그래도 {@code report}까지 온 문제는 복구 불가이므로 예외 발생</li>
 *   <li><strong>IGNORE</strong> - 아무것도 하지 않음</li>
 * </ul>
 *
 * <p>proxy와 mediator는 같은 인스턴스를 하위 저장소에 넘기므로 WARN handler 하나로
 * 하위에서 감지된 모든 문제를 모을 수 있습니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 경고 수집은 synchronized입니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Conflicts {

    private static final Logger log = LoggerFactory.getLogger(Conflicts.class);

    private final ConflictMode mode;
    private final List<String> warnings = new ArrayList<>();

    private Conflicts(ConflictMode mode) {
        this.mode = mode;
    }

    /**
     * @param mode conflict mode
     * @return new handler
     * @throws IllegalArgumentException if mode is null
     */
    public static Conflicts of(ConflictMode mode) {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        return new Conflicts(mode);
    }

    /**
     * @param mode mode name, parsed with {@link ConflictMode#of(String)}
     * @return new handler
     */
    public static Conflicts of(String mode) {
        return new Conflicts(ConflictMode.of(mode));
    }

    public static Conflicts error() {
        return new Conflicts(ConflictMode.ERROR);
    }

    public static Conflicts warn() {
        return new Conflicts(ConflictMode.WARN);
    }

    public static Conflicts repair() {
        return new Conflicts(ConflictMode.REPAIR);
    }

    public static Conflicts ignore() {
        return new Conflicts(ConflictMode.IGNORE);
    }

    /**
     * @return the mode of this handler
     */
    public ConflictMode mode() {
        return mode;
    }

    /**
     * @return true if stores should reconcile storage instead of reporting
     */
    public boolean repairing() {
        return mode == ConflictMode.REPAIR;
    }

    /**
     * Reports one conflict.
     *
     * @param message description of the mismatch
     * @throws MappingException in ERROR and REPAIR mode
     */
    public void report(String message) {
        switch (mode) {
            case ERROR, REPAIR -> throw new MappingException(message);
            case WARN -> {
                log.warn("Mapping conflict: {}", message);
                synchronized (warnings) {
                    warnings.add(message);
                }
            }
            case IGNORE -> {
            }
        }
    }

    /**
     * @return every warning collected so far, in report order
     */
    public List<String> warnings() {
        synchronized (warnings) {
            return Collections.unmodifiableList(new ArrayList<>(warnings));
        }
    }

    /**
     * @return true if at least one warning was collected
     */
    public boolean hasWarnings() {
        synchronized (warnings) {
            return !warnings.isEmpty();
        }
    }

    @Override
    public String toString() {
        return "Conflicts{" + mode.value() + "}";
    }
}

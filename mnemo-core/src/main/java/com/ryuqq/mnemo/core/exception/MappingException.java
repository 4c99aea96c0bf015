package com.ryuqq.mnemo.core.exception;

/**
 * 선언된 entity type과 실제 저장소가 맞지 않을 때 발생하는 예외.
 *
 * <p><strong>대표 원인:</strong></p>
 * <ul>
 *   <li>타입의 storage가 없거나 중복됨</li>
 *   <li>property 컬럼 누락</li>
 *   <li>이미 존재하는 index</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.mnemo.core.spi.ConflictMode#ERROR}일 때 DDL 호출이 이 예외를 던지며,
 * 다른 conflict mode에서는 같은 문제가 경고, 복구 또는 무시로 처리됩니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class MappingException extends MnemoException {

    /**
     * 생성자.
     *
     * @param message description of the conflict
     */
    public MappingException(String message) {
        super(message);
    }

    /**
     * Creates a mapping error wrapping another one, typically to add the
     * name of the delegate store that raised it.
     *
     * @param message description of the conflict
     * @param cause the original mapping error
     */
    public MappingException(String message, Throwable cause) {
        super(message, cause);
    }
}

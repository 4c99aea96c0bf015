package com.ryuqq.mnemo.core.exception;

/**
 * 연관 경로를 찾을 수 없는 join 예외.
 *
 * <p>두 entity type 사이에 발견 가능한 (또는 명시한) association이 없을 때 발생합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class AssociationException extends MnemoException {

    /**
     * 생성자.
     *
     * @param message description of the missing association
     */
    public AssociationException(String message) {
        super(message);
    }
}

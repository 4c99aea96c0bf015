package com.ryuqq.mnemo.core.exception;

/**
 * recall hook이 방금 읽어온 unit을 거부할 때 던지는 예외.
 *
 * <p>거부된 unit은 없는 것으로 취급됩니다. sandbox는 순회 중에는 건너뛰고
 * 단건 조회에서는 {@code null}을 반환합니다. 오류로 보고되지 않습니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class UnrecallableException extends MnemoException {

    /**
     * 생성자.
     *
     * @param message why the unit cannot be recalled
     */
    public UnrecallableException(String message) {
        super(message);
    }
}

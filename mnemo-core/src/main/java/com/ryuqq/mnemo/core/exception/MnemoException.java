package com.ryuqq.mnemo.core.exception;

/**
 * Mnemo 저장소와 sandbox 예외의 기반 클래스.
 *
 * <p>모든 Mnemo 예외는 unchecked입니다. 백엔드 I/O 실패는 이 계층으로 감싸지 않고
 * {@link java.io.UncheckedIOException}으로 전파됩니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class MnemoException extends RuntimeException {

    /**
     * 생성자.
     *
     * @param message the detail message
     */
    public MnemoException(String message) {
        super(message);
    }

    /**
     * 생성자 (메시지와 원인).
     *
     * @param message the detail message
     * @param cause the underlying cause
     */
    public MnemoException(String message, Throwable cause) {
        super(message, cause);
    }
}

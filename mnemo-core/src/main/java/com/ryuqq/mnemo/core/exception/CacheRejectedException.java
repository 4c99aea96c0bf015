package com.ryuqq.mnemo.core.exception;

/**
 * 캐시 백엔드가 unit 저장을 거부했음을 나타내는 예외.
 *
 * <p>보통 캐시 용량이 가득 찬 경우 발생합니다. 캐시 계층은 쓰기 경로에서 이 예외를
 * 삼킵니다. 캐시는 데이터를 조용히 잃어도 되지만 원본 저장소는 그렇지 않습니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class CacheRejectedException extends MnemoException {

    /**
     * 생성자.
     *
     * @param message why the insert was refused
     */
    public CacheRejectedException(String message) {
        super(message);
    }
}

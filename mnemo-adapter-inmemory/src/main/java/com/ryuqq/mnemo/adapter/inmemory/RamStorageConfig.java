package com.ryuqq.mnemo.adapter.inmemory;

/**
 * RamStorage 설정 (불변 record).
 *
 * <p>이 record는 RamStorage의 용량과 트랜잭션 동작을 제어합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxEntriesPerType: 타입당 최대 보관 개수 (기본 0 = 무제한)</li>
 *   <li>transactional: start/commit/rollback 지원 여부 (기본 false)</li>
 * </ul>
 *
 * <p><strong>캐시 백엔드로 사용할 때:</strong></p>
 * <ul>
 *   <li>maxEntriesPerType를 지정하면 한도를 넘는 신규 항목은 CacheRejectedException으로 거부됨</li>
 *   <li>ObjectCache는 이 예외를 삼키고 다음 저장소만 사용</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 * @param maxEntriesPerType 타입당 최대 개수 (0 이상, 0은 무제한)
 * @param transactional 트랜잭션 지원 여부
 */
public record RamStorageConfig(
    int maxEntriesPerType,
    boolean transactional
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxEntriesPerType=0 (무제한), transactional=false</p>
     */
    public RamStorageConfig() {
        this(0, false);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RamStorageConfig {
        if (maxEntriesPerType < 0) {
            throw new IllegalArgumentException(
                "maxEntriesPerType cannot be negative (current: " + maxEntriesPerType + ")"
            );
        }
    }

    /**
     * @return 용량 제한이 있으면 true
     */
    public boolean bounded() {
        return maxEntriesPerType > 0;
    }

    /**
     * maxEntriesPerType만 변경한 새 인스턴스 생성.
     */
    public RamStorageConfig withMaxEntriesPerType(int maxEntriesPerType) {
        return new RamStorageConfig(maxEntriesPerType, transactional);
    }

    /**
     * transactional만 변경한 새 인스턴스 생성.
     */
    public RamStorageConfig withTransactional(boolean transactional) {
        return new RamStorageConfig(maxEntriesPerType, transactional);
    }
}

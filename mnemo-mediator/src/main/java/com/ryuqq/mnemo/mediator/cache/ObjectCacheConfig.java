package com.ryuqq.mnemo.mediator.cache;

/**
 * ObjectCache 설정 (불변 record).
 *
 * <p>이 record는 캐시 조회 경로를 제어하는 설정값을 담고 있습니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>fullQuery: recall 시 캐시를 먼저 조회할지 여부 (기본 false)</li>
 *   <li>fullJoin: join recall을 캐시 기준으로 메모리에서 조합할지 여부 (기본 false)</li>
 *   <li>databaseScope: createDatabase/dropDatabase를 next 저장소까지 전달할지 여부 (기본 true)</li>
 * </ul>
 *
 * <p><strong>fullQuery 설정 가이드:</strong></p>
 * <ul>
 *   <li>RAM 캐시: true 권장 (스캔 비용이 낮음)</li>
 *   <li>원격 key-value 캐시: false 권장 (스캔이 느림)</li>
 * </ul>
 *
 * <p>fullQuery가 false여도 next 저장소에서 읽은 unit은 항상 캐시에 채워집니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 * @param fullQuery 캐시 우선 조회 여부
 * @param fullJoin 캐시 기반 join 여부
 * @param databaseScope database DDL 전달 여부
 */
public record ObjectCacheConfig(
    boolean fullQuery,
    boolean fullJoin,
    boolean databaseScope
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: fullQuery=false, fullJoin=false, databaseScope=true</p>
     */
    public ObjectCacheConfig() {
        this(false, false, true);
    }

    /**
     * fullQuery만 변경한 새 인스턴스 생성.
     */
    public ObjectCacheConfig withFullQuery(boolean fullQuery) {
        return new ObjectCacheConfig(fullQuery, fullJoin, databaseScope);
    }

    /**
     * fullJoin만 변경한 새 인스턴스 생성.
     */
    public ObjectCacheConfig withFullJoin(boolean fullJoin) {
        return new ObjectCacheConfig(fullQuery, fullJoin, databaseScope);
    }

    /**
     * databaseScope만 변경한 새 인스턴스 생성.
     */
    public ObjectCacheConfig withDatabaseScope(boolean databaseScope) {
        return new ObjectCacheConfig(fullQuery, fullJoin, databaseScope);
    }
}

/**
 * 캐시 mediator.
 *
 * <p>각 캐시는 원본 next 저장소와 캐시 저장소를 참조로 보관하는
 * {@link com.ryuqq.mnemo.core.spi.StorageManager}입니다:</p>
 * <ul>
 *   <li>{@link com.ryuqq.mnemo.mediator.cache.ObjectCache}: read-through, write-through</li>
 *   <li>{@link com.ryuqq.mnemo.mediator.cache.AgedCache}: 마지막 접근 추적,
 *       {@link com.ryuqq.mnemo.mediator.cache.CacheSweeper}가 스윕</li>
 *   <li>{@link com.ryuqq.mnemo.mediator.cache.BurnedCache}: 타입 전체를 미리 적재</li>
 * </ul>
 *
 * <p>캐시 저장소가 가득 차도 호출자는 실패하지 않으며, 거부된 쓰기는 버려집니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
package com.ryuqq.mnemo.mediator.cache;

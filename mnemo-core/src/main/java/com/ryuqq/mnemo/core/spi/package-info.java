/**
 * Service Provider Interface (SPI) 패키지.
 *
 * <p>모든 백엔드, proxy, 캐시, partitioner가 구현하는
 * {@link com.ryuqq.mnemo.core.spi.StorageManager} 계약과 DDL이 사용하는 conflict 처리를 정의합니다.</p>
 *
 * <h2>SPI 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.mnemo.core.spi.StorageManager} - 등록, DDL, DML, view, 트랜잭션</li>
 *   <li>{@link com.ryuqq.mnemo.core.spi.UnitCodec} - 백엔드의 분리된 unit 표현</li>
 *   <li>{@link com.ryuqq.mnemo.core.spi.CacheIntrospection} - 캐시 백엔드 보관 현황</li>
 * </ul>
 *
 * <h2>구현 책임</h2>
 * <p>어댑터 모듈 (mnemo-adapter-inmemory, mnemo-adapter-json)은 leaf 구현을,
 * mnemo-mediator는 조합 구현을 제공합니다. leaf 구현은
 * {@link com.ryuqq.mnemo.core.storage.AbstractStorageManager}를 상속해 join, pagination,
 * 집계 기본 구현을 물려받습니다.</p>
 *
 * @since 1.0.0
 * @author Mnemo Team
 */
package com.ryuqq.mnemo.core.spi;

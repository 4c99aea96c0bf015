/**
 * 저장소 구현용 재사용 구성 요소.
 *
 * <p>{@link com.ryuqq.mnemo.core.storage.AbstractStorageManager}는 leaf 백엔드에 기본 구현을,
 * {@link com.ryuqq.mnemo.core.storage.ProxyStorage}는 명시적 전달을 제공합니다.
 * {@link com.ryuqq.mnemo.core.storage.Paginator}, {@link com.ryuqq.mnemo.core.storage.Joins},
 * {@link com.ryuqq.mnemo.core.storage.Views}는 양쪽이 쓰는 메모리 알고리즘입니다.</p>
 *
 * @since 1.0.0
 * @author Mnemo Team
 */
package com.ryuqq.mnemo.core.storage;

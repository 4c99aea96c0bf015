/**
 * 예외 계층.
 *
 * <ul>
 *   <li>{@link com.ryuqq.mnemo.core.exception.MappingException} - 모델과 storage 불일치, conflict mode로 제어</li>
 *   <li>{@link com.ryuqq.mnemo.core.exception.AssociationException} - association path 없는 join</li>
 *   <li>{@link com.ryuqq.mnemo.core.exception.UnrecallableException} - 로드 후 거부, "없음"으로 취급</li>
 *   <li>{@link com.ryuqq.mnemo.core.exception.CacheRejectedException} - 캐시 쓰기 거부</li>
 * </ul>
 *
 * <p>지원하지 않는 기능은 {@link java.lang.UnsupportedOperationException}으로 알리며
 * conflict mode로 완화되지 않습니다.</p>
 *
 * @since 1.0.0
 * @author Mnemo Team
 */
package com.ryuqq.mnemo.core.exception;

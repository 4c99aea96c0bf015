/**
 * 파일 기반 StorageManager 어댑터 패키지.
 *
 * <p>{@link com.ryuqq.mnemo.adapter.json.JsonFolderStorage}는 entity type마다 디렉토리 하나,
 * unit마다 JSON 문서 하나를 저장하며 {@link com.ryuqq.mnemo.adapter.json.JsonUnitCodec}
 * (Jackson + JSR-310 모듈)으로 인코딩합니다.</p>
 *
 * <p><strong>제약 사항:</strong></p>
 * <ul>
 *   <li>recall마다 타입의 모든 파일을 읽음</li>
 *   <li>index, 트랜잭션 미지원</li>
 *   <li>대량 데이터는 파일 시스템의 디렉토리 한계에 좌우됨</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
package com.ryuqq.mnemo.adapter.json;

package com.ryuqq.mnemo.adapter.json;

import java.nio.file.Path;
import java.time.Duration;

/**
 * JsonFolderStorage 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>root: 데이터베이스 루트 디렉토리 (필수, 절대 경로로 정규화)</li>
 *   <li>idSeparator: 복합 식별자를 파일명으로 합칠 때의 구분자 (기본 "_")</li>
 *   <li>lockPollInterval: class.lock 획득 재시도 간격 (기본 100ms)</li>
 *   <li>lockTimeout: class.lock 획득 최대 대기 시간 (기본 10초)</li>
 *   <li>prettyPrint: 들여쓰기된 JSON 출력 여부 (기본 false)</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 * @param root 루트 디렉토리
 * @param idSeparator 식별자 구분자 (비어 있거나 '%'를 포함하면 안 됨)
 * @param lockPollInterval lock 재시도 간격 (양수)
 * @param lockTimeout lock 최대 대기 시간 (lockPollInterval 이상)
 * @param prettyPrint 들여쓰기 여부
 */
public record JsonStorageConfig(
    Path root,
    String idSeparator,
    Duration lockPollInterval,
    Duration lockTimeout,
    boolean prettyPrint
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public JsonStorageConfig {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        if (idSeparator == null || idSeparator.isEmpty()) {
            throw new IllegalArgumentException("idSeparator cannot be null or empty");
        }
        if (idSeparator.indexOf('%') >= 0) {
            throw new IllegalArgumentException("idSeparator cannot contain '%' (current: " + idSeparator + ")");
        }
        if (lockPollInterval == null || lockPollInterval.isNegative() || lockPollInterval.isZero()) {
            throw new IllegalArgumentException(
                "lockPollInterval must be positive (current: " + lockPollInterval + ")"
            );
        }
        if (lockTimeout == null || lockTimeout.compareTo(lockPollInterval) < 0) {
            throw new IllegalArgumentException(
                "lockTimeout must be >= lockPollInterval (current: " + lockTimeout + ")"
            );
        }
        root = root.toAbsolutePath().normalize();
    }

    /**
     * 기본 설정으로 루트만 지정한 인스턴스 생성.
     *
     * <p>기본값: idSeparator="_", lockPollInterval=100ms, lockTimeout=10s, prettyPrint=false</p>
     */
    public static JsonStorageConfig at(Path root) {
        return new JsonStorageConfig(root, "_", Duration.ofMillis(100), Duration.ofSeconds(10), false);
    }

    /**
     * idSeparator만 변경한 새 인스턴스 생성.
     */
    public JsonStorageConfig withIdSeparator(String idSeparator) {
        return new JsonStorageConfig(root, idSeparator, lockPollInterval, lockTimeout, prettyPrint);
    }

    /**
     * lockPollInterval만 변경한 새 인스턴스 생성.
     */
    public JsonStorageConfig withLockPollInterval(Duration lockPollInterval) {
        return new JsonStorageConfig(root, idSeparator, lockPollInterval, lockTimeout, prettyPrint);
    }

    /**
     * lockTimeout만 변경한 새 인스턴스 생성.
     */
    public JsonStorageConfig withLockTimeout(Duration lockTimeout) {
        return new JsonStorageConfig(root, idSeparator, lockPollInterval, lockTimeout, prettyPrint);
    }

    /**
     * prettyPrint만 변경한 새 인스턴스 생성.
     */
    public JsonStorageConfig withPrettyPrint(boolean prettyPrint) {
        return new JsonStorageConfig(root, idSeparator, lockPollInterval, lockTimeout, prettyPrint);
    }
}

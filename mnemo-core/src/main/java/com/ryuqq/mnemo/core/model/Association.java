package com.ryuqq.mnemo.core.model;

/**
 * 한 entity type에서 다른 type으로의 이름 있는 연결: {@code near.nearKey == far.farKey}.
 *
 * <p>join은 path로 association을 찾습니다. 따로 이름을 주지 않으면 path는
 * 상대 타입의 이름입니다.</p>
 *
 * @param path association 조회 이름
 * @param nearKey 선언한 타입의 property
 * @param farType 연결된 타입 이름
 * @param farKey 연결된 타입의 property
 * @param cardinality near unit 하나당 far unit 수
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Association(
    String path,
    String nearKey,
    String farType,
    String farKey,
    Cardinality cardinality
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException if any argument is null or blank
     */
    public Association {
        requireText(path, "path");
        requireText(nearKey, "nearKey");
        requireText(farType, "farType");
        requireText(farKey, "farKey");
        if (cardinality == null) {
            throw new IllegalArgumentException("cardinality cannot be null");
        }
    }

    /**
     * Many-to-one association whose path is the far type's name.
     *
     * @param nearKey property on the declaring type
     * @param farType name of the associated type
     * @param farKey property on the associated type
     * @return new Association
     */
    public static Association toOne(String nearKey, String farType, String farKey) {
        return new Association(farType, nearKey, farType, farKey, Cardinality.ONE);
    }

    /**
     * One-to-many association whose path is the far type's name.
     *
     * @param nearKey property on the declaring type
     * @param farType name of the associated type
     * @param farKey property on the associated type
     * @return new Association
     */
    public static Association toMany(String nearKey, String farType, String farKey) {
        return new Association(farType, nearKey, farType, farKey, Cardinality.MANY);
    }

    /**
     * @param newPath lookup name
     * @return copy reachable under another path
     */
    public Association named(String newPath) {
        return new Association(newPath, nearKey, farType, farKey, cardinality);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be null or blank");
        }
    }
}

package com.ryuqq.mnemo.core.model;

/**
 * entity type에 선언된 타입 있는 속성.
 *
 * <p>컬럼 힌트({@code maxBytes}, {@code precision}, {@code scale})는 참고용이며,
 * 컬럼 개념이 없는 저장소는 무시합니다.</p>
 *
 * @param name property 이름 (타입 내에서 유일)
 * @param type Java 값 타입 (저장 값은 이 타입의 인스턴스여야 함)
 * @param defaultValue 새 unit의 기본값 (null 허용)
 * @param maxBytes 최대 인코딩 크기 힌트 (제한 없으면 null)
 * @param precision decimal 전체 자릿수 힌트 (없으면 null)
 * @param scale decimal 소수 자릿수 힌트 (없으면 null)
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Property(
    String name,
    Class<?> type,
    Object defaultValue,
    Integer maxBytes,
    Integer precision,
    Integer scale
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException if name is blank, type is null or the
     *         default value is not an instance of type
     */
    public Property {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (defaultValue != null && !type.isInstance(defaultValue)) {
            throw new IllegalArgumentException(
                "default value of " + name + " must be " + type.getSimpleName()
                    + " but was " + defaultValue.getClass().getSimpleName());
        }
        if (maxBytes != null && maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        if (precision != null && precision <= 0) {
            throw new IllegalArgumentException("precision must be positive");
        }
        if (scale != null && scale < 0) {
            throw new IllegalArgumentException("scale cannot be negative");
        }
    }

    /**
     * 기본값과 힌트 없는 property 생성.
     *
     * @param name property name
     * @param type value type
     * @return new Property
     */
    public static Property of(String name, Class<?> type) {
        return new Property(name, type, null, null, null, null);
    }

    /**
     * @param defaultValue new default value
     * @return copy with the given default
     */
    public Property withDefault(Object defaultValue) {
        return new Property(name, type, defaultValue, maxBytes, precision, scale);
    }

    /**
     * @param maxBytes new size hint
     * @return copy with the given size hint
     */
    public Property withMaxBytes(int maxBytes) {
        return new Property(name, type, defaultValue, maxBytes, precision, scale);
    }

    /**
     * @param precision total digits
     * @param scale fractional digits
     * @return copy with the given decimal hints
     */
    public Property withPrecision(int precision, int scale) {
        return new Property(name, type, defaultValue, maxBytes, precision, scale);
    }

    /**
     * @param newName new property name
     * @return renamed copy
     */
    public Property withName(String newName) {
        return new Property(newName, type, defaultValue, maxBytes, precision, scale);
    }

    /**
     * @param value candidate value
     * @return true if the value may be stored in this property
     */
    public boolean accepts(Object value) {
        return value == null || type.isInstance(value);
    }
}

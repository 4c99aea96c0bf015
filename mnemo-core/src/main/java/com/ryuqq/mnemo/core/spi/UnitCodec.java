package com.ryuqq.mnemo.core.spi;

import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;

/**
 * unit과 백엔드 저장 표현 사이의 변환.
 *
 * <p>인코딩된 값은 unit과 분리되어야 합니다. 이후 unit을 수정해도 저장된 레코드는 바뀌지 않고,
 * 디코딩은 항상 새 unit을 만듭니다.</p>
 *
 * @param <T> 저장 표현
 * @author Mnemo Team
 * @since 1.0.0
 */
public interface UnitCodec<T> {

    /**
     * @param unit unit to encode
     * @return detached representation of every declared property
     */
    T encode(Unit unit);

    /**
     * @param type type to materialize, possibly a schema-evolved copy
     * @param stored stored representation
     * @return new, clean, unbound unit
     */
    Unit decode(EntityType type, T stored);

    /**
     * @param unit unit to copy
     * @return detached copy holding the same values
     */
    default Unit copy(Unit unit) {
        return decode(unit.type(), encode(unit));
    }
}

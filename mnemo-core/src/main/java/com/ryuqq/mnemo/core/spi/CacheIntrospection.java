package com.ryuqq.mnemo.core.spi;

import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;

import java.util.List;

/**
 * 캐시 백엔드로 쓸 수 있는 저장소의 기능.
 *
 * <p>priming 캐시는 타입별 보관 개수를 알아야 하고,
 * 일부만 채워진 타입을 비울 수 있어야 합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public interface CacheIntrospection {

    /**
     * @param type entity type
     * @return number of units held for the type, 0 if none or no storage
     */
    int cachedCount(EntityType type);

    /**
     * @param type entity type
     * @return detached copies of every unit held for the type
     */
    List<Unit> cachedUnits(EntityType type);

    /**
     * Drops every unit held for the type, keeping its storage.
     *
     * @param type entity type
     */
    void flush(EntityType type);
}

package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.spi.UnitCodec;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * unit을 분리된 property map으로 인코딩.
 *
 * <p>변경 가능한 컨테이너 값 ({@link List}, {@link Set}, {@link Map}, {@link Date}, 배열)은
 * 인코딩과 디코딩 모두에서 재귀적으로 복사합니다. 그 외 값은 불변으로 취급합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class MapUnitCodec implements UnitCodec<Map<String, Object>> {

    @Override
    public Map<String, Object> encode(Unit unit) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : unit.values().entrySet()) {
            encoded.put(entry.getKey(), detach(entry.getValue()));
        }
        return encoded;
    }

    @Override
    public Unit decode(EntityType type, Map<String, Object> stored) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : stored.entrySet()) {
            if (type.hasProperty(entry.getKey())) {
                values.put(entry.getKey(), detach(entry.getValue()));
            }
        }
        return type.newUnit().load(values);
    }

    /**
     * @param value any stored value
     * @return a copy for mutable containers, the value itself otherwise
     */
    static Object detach(Object value) {
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                copy.add(detach(item));
            }
            return copy;
        }
        if (value instanceof Set) {
            Set<Object> copy = new LinkedHashSet<>();
            for (Object item : (Collection<?>) value) {
                copy.add(detach(item));
            }
            return copy;
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                copy.put(entry.getKey(), detach(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        if (value instanceof Object[]) {
            Object[] source = (Object[]) value;
            Object[] copy = Arrays.copyOf(source, source.length);
            for (int i = 0; i < copy.length; i++) {
                copy[i] = detach(source[i]);
            }
            return copy;
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            Object copy = Array.newInstance(value.getClass().getComponentType(), length);
            System.arraycopy(value, 0, copy, 0, length);
            return copy;
        }
        return value;
    }
}

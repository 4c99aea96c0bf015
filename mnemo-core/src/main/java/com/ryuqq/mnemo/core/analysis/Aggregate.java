package com.ryuqq.mnemo.core.analysis;

import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.storage.Views;

import java.util.Arrays;
import java.util.function.Function;

/**
 * CrossTab 셀 집계 함수.
 *
 * <p>셀마다 이전 집계값(처음에는 null)과 unit 하나를 받아 새 집계값을 반환합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Aggregate {

    /**
     * @param unit 셀에 속한 unit
     * @param current 현재 집계값, 첫 unit이면 null
     * @return 새 집계값
     */
    Object apply(Unit unit, Object current);

    /**
     * @return unit 개수 ({@code Long})
     */
    static Aggregate count() {
        return (unit, current) -> current == null ? 1L : (Long) current + 1L;
    }

    /**
     * @param attribute 합산할 숫자 속성
     * @return null을 건너뛰는 합계
     */
    static Aggregate sum(String attribute) {
        return sum(unit -> unit.get(attribute));
    }

    /**
     * 결과 타입은 {@link Views#total}을 따릅니다 (정수는 Long, BigDecimal 포함 시 BigDecimal, 그 외 Double).
     *
     * @param value unit에서 합산할 값을 꺼내는 함수
     * @return null을 건너뛰는 합계
     */
    static Aggregate sum(Function<Unit, ?> value) {
        return (unit, current) -> {
            Object next = value.apply(unit);
            if (current == null && next == null) {
                return null;
            }
            return Views.total(Arrays.asList(current, next));
        };
    }
}

package com.ryuqq.mnemo.core.analysis;

import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.expr.Values;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.sandbox.Sandbox;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Unit 속성값 교차표.
 *
 * <p>group 함수들의 값 조합이 행, pivot 값이 열이 되고, 각 셀에는
 * {@link Aggregate}로 누적한 값이 들어갑니다.</p>
 *
 * <pre>{@code
 * CrossTab.Result result = CrossTab.recall(sandbox, ANIMAL, null)
 *     .groupBy("ZooID")
 *     .pivot("Legs")
 *     .aggregate(Aggregate.count())
 *     .build()
 *     .results();
 * result.cell(List.of(1), 4);   // zoo 1의 네 발 동물 수
 * }</pre>
 *
 * <p>source는 생성 시점에 복사되므로 {@link #results()}는 여러 번 호출해도 같은 결과를 냅니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class CrossTab {

    private final List<Unit> source;
    private final List<Function<Unit, ?>> groups;
    private final Function<Unit, ?> pivot;
    private final Aggregate aggregate;

    private CrossTab(Builder builder) {
        this.source = List.copyOf(builder.source);
        this.groups = List.copyOf(builder.groups);
        this.pivot = builder.pivot;
        this.aggregate = builder.aggregate;
    }

    /**
     * @param source 집계할 unit
     * @return 새 Builder
     */
    public static Builder of(Collection<Unit> source) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        return new Builder(source);
    }

    /**
     * Sandbox에서 recall한 unit으로 교차표 구성.
     *
     * @param sandbox recall할 sandbox
     * @param type 엔티티 타입
     * @param restriction 행 필터, null 가능
     * @return 새 Builder
     */
    public static Builder recall(Sandbox sandbox, EntityType type, Expr restriction) {
        if (sandbox == null) {
            throw new IllegalArgumentException("sandbox cannot be null");
        }
        return of(sandbox.recall(type, restriction));
    }

    /**
     * 교차표 계산.
     *
     * @return 행 (group 값 목록 → 열 → 집계값) 과 정렬된 열 목록
     */
    public Result results() {
        Map<List<Object>, Map<Object, Object>> rows = new LinkedHashMap<>();
        Set<Object> columns = new LinkedHashSet<>();
        for (Unit unit : source) {
            List<Object> key = new ArrayList<>(groups.size());
            for (Function<Unit, ?> group : groups) {
                key.add(group.apply(unit));
            }
            Object column = pivot.apply(unit);
            columns.add(column);
            Map<Object, Object> row = rows.computeIfAbsent(Collections.unmodifiableList(key), k -> new LinkedHashMap<>());
            row.put(column, aggregate.apply(unit, row.get(column)));
        }
        List<Object> sorted = new ArrayList<>(columns);
        sorted.sort(Values::compare);
        return new Result(rows, sorted);
    }

    /**
     * 교차표 결과.
     *
     * @param rows group 값 목록별 (열 → 집계값)
     * @param columns 정렬된 pivot 값 (null 먼저)
     */
    public record Result(Map<List<Object>, Map<Object, Object>> rows, List<Object> columns) {

        public Result {
            rows = Collections.unmodifiableMap(rows);
            columns = Collections.unmodifiableList(columns);
        }

        /**
         * @param rowKey group 값 목록
         * @param column pivot 값
         * @return 집계값, 해당 셀에 unit이 없으면 null
         */
        public Object cell(List<?> rowKey, Object column) {
            Map<Object, Object> row = rows.get(rowKey);
            return row == null ? null : row.get(column);
        }
    }

    /**
     * Builder for {@link CrossTab}.
     */
    public static final class Builder {

        private final List<Unit> source;
        private final List<Function<Unit, ?>> groups = new ArrayList<>();
        private Function<Unit, ?> pivot;
        private Aggregate aggregate = Aggregate.count();

        private Builder(Collection<Unit> source) {
            this.source = new ArrayList<>(source);
        }

        public Builder groupBy(String... attributes) {
            for (String attribute : attributes) {
                groups.add(unit -> unit.get(attribute));
            }
            return this;
        }

        public Builder groupBy(Function<Unit, ?> group) {
            if (group == null) {
                throw new IllegalArgumentException("group cannot be null");
            }
            groups.add(group);
            return this;
        }

        public Builder pivot(String attribute) {
            return pivot(unit -> unit.get(attribute));
        }

        public Builder pivot(Function<Unit, ?> pivot) {
            this.pivot = pivot;
            return this;
        }

        /**
         * @param aggregate 셀 집계 함수 (기본 {@link Aggregate#count()})
         */
        public Builder aggregate(Aggregate aggregate) {
            if (aggregate == null) {
                throw new IllegalArgumentException("aggregate cannot be null");
            }
            this.aggregate = aggregate;
            return this;
        }

        /**
         * @throws IllegalStateException pivot이 지정되지 않은 경우
         */
        public CrossTab build() {
            if (pivot == null) {
                throw new IllegalStateException("pivot must be set before build");
            }
            return new CrossTab(this);
        }
    }
}

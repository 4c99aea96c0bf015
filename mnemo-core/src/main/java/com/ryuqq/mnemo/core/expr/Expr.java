package com.ryuqq.mnemo.core.expr;

import com.ryuqq.mnemo.core.model.Unit;

import java.util.Arrays;
import java.util.List;

/**
 * 하나 이상의 unit에 대한 조건식 및 projection 표현식.
 *
 * <p>표현식은 <em>row</em> 단위로 평가됩니다. row는 조회 대상 relation의 위치마다
 * unit 하나를 가집니다 (단일 recall은 unit 하나, join은 타입마다 하나).
 * 저장소는 트리를 분석해 처리를 위임할 수 있고, 변환하지 못한 부분은
 * {@link #evaluate(List)}로 메모리에서 평가합니다.</p>
 *
 * <p><strong>노드 종류:</strong></p>
 * <ul>
 *   <li>{@link Const} - 상수</li>
 *   <li>{@link Attr} - row 위치의 unit property</li>
 *   <li>{@link Compare} - 이항 비교</li>
 *   <li>{@link And}, {@link Or}, {@link Not} - 논리 연산</li>
 *   <li>{@link Call} - {@link Functions} 함수 호출</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 * @see Exprs
 */
public sealed interface Expr permits Const, Attr, Compare, And, Or, Not, Call {

    /**
     * Evaluates this expression.
     *
     * @param row one unit per relation position
     * @return the value, Boolean for predicates
     */
    Object evaluate(List<Unit> row);

    /**
     * @param row one unit per relation position
     * @return true only if the expression evaluates to {@link Boolean#TRUE}
     */
    default boolean test(List<Unit> row) {
        return Boolean.TRUE.equals(evaluate(row));
    }

    /**
     * @param units one unit per relation position
     * @return true only if the expression evaluates to {@link Boolean#TRUE}
     */
    default boolean test(Unit... units) {
        return test(Arrays.asList(units));
    }

    /**
     * @param other right-hand predicate
     * @return conjunction of this and other
     */
    default Expr and(Expr other) {
        return Exprs.and(this, other);
    }

    /**
     * @param other right-hand predicate
     * @return disjunction of this and other
     */
    default Expr or(Expr other) {
        return Exprs.or(this, other);
    }

    /**
     * @return negation of this predicate
     */
    default Expr not() {
        return new Not(this);
    }
}

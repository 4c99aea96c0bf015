package com.ryuqq.mnemo.core.expr;

import com.ryuqq.mnemo.core.model.Unit;

import java.util.List;

/**
 * 이항 비교.
 *
 * @param op 비교 연산자
 * @param left 왼쪽 피연산자
 * @param right 오른쪽 피연산자
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Compare(CompareOp op, Expr left, Expr right) implements Expr {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException if any component is null
     */
    public Compare {
        if (op == null || left == null || right == null) {
            throw new IllegalArgumentException("op, left and right cannot be null");
        }
    }

    @Override
    public Object evaluate(List<Unit> row) {
        return op.apply(left.evaluate(row), right.evaluate(row));
    }

    @Override
    public String toString() {
        return "(" + left + " " + op.symbol() + " " + right + ")";
    }
}

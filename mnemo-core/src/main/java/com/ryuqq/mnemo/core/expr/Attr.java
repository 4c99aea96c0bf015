package com.ryuqq.mnemo.core.expr;

import com.ryuqq.mnemo.core.model.Unit;

import java.util.Arrays;
import java.util.List;

/**
 * row의 한 위치에 있는 unit의 property.
 *
 * <p>조건식 fluent DSL의 시작점이기도 합니다:</p>
 * <pre>{@code
 * Exprs.attr("Legs").ge(2).and(Exprs.attr("Species").startsWith("S"))
 * }</pre>
 *
 * @param arg row 위치 (0부터 시작)
 * @param name property 이름
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Attr(int arg, String name) implements Expr {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException if arg is negative or name blank
     */
    public Attr {
        if (arg < 0) {
            throw new IllegalArgumentException("arg cannot be negative");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    @Override
    public Object evaluate(List<Unit> row) {
        if (arg >= row.size()) {
            throw new IllegalArgumentException("Row has no unit at position " + arg + " for " + name);
        }
        return row.get(arg).get(name);
    }

    public Compare eq(Object value) {
        return new Compare(CompareOp.EQ, this, Exprs.value(value));
    }

    public Compare ne(Object value) {
        return new Compare(CompareOp.NE, this, Exprs.value(value));
    }

    public Compare lt(Object value) {
        return new Compare(CompareOp.LT, this, Exprs.value(value));
    }

    public Compare le(Object value) {
        return new Compare(CompareOp.LE, this, Exprs.value(value));
    }

    public Compare gt(Object value) {
        return new Compare(CompareOp.GT, this, Exprs.value(value));
    }

    public Compare ge(Object value) {
        return new Compare(CompareOp.GE, this, Exprs.value(value));
    }

    public Call isNull() {
        return new Call(Functions.IS_NULL, List.of(this));
    }

    public Call notNull() {
        return new Call(Functions.NOT_NULL, List.of(this));
    }

    public Call startsWith(String prefix) {
        return new Call(Functions.STARTS_WITH, List.of(this, new Const(prefix)));
    }

    public Call endsWith(String suffix) {
        return new Call(Functions.ENDS_WITH, List.of(this, new Const(suffix)));
    }

    public Call contains(Object element) {
        return new Call(Functions.CONTAINS, List.of(this, new Const(element)));
    }

    public Call in(Object... candidates) {
        return new Call(Functions.IN, List.of(this, new Const(Arrays.asList(candidates))));
    }

    public Call lower() {
        return new Call(Functions.LOWER, List.of(this));
    }

    public Call upper() {
        return new Call(Functions.UPPER, List.of(this));
    }

    public Call length() {
        return new Call(Functions.LENGTH, List.of(this));
    }

    @Override
    public String toString() {
        return "x" + arg + "." + name;
    }
}

package com.ryuqq.mnemo.core.expr;

import com.ryuqq.mnemo.core.model.Unit;

import java.util.List;

/**
 * 상수 값.
 *
 * @param value 상수 (null 허용)
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Const(Object value) implements Expr {

    @Override
    public Object evaluate(List<Unit> row) {
        return value;
    }

    @Override
    public String toString() {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}

package com.ryuqq.mnemo.core.expr;

import com.ryuqq.mnemo.core.model.Unit;

import java.util.List;

/**
 * 부정.
 *
 * @param term 부정할 조건
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Not(Expr term) implements Expr {

    public Not {
        if (term == null) {
            throw new IllegalArgumentException("term cannot be null");
        }
    }

    @Override
    public Object evaluate(List<Unit> row) {
        return !term.test(row);
    }

    @Override
    public String toString() {
        return "not " + term;
    }
}

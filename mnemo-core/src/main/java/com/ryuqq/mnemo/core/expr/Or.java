package com.ryuqq.mnemo.core.expr;

import com.ryuqq.mnemo.core.model.Unit;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 논리합. 왼쪽부터 평가하며 short-circuit 합니다.
 *
 * @param terms 하나 이상 참이어야 하는 조건들
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Or(List<Expr> terms) implements Expr {

    public Or {
        if (terms == null || terms.isEmpty()) {
            throw new IllegalArgumentException("terms cannot be null or empty");
        }
        terms = List.copyOf(terms);
    }

    @Override
    public Object evaluate(List<Unit> row) {
        for (Expr term : terms) {
            if (term.test(row)) {
                return Boolean.TRUE;
            }
        }
        return Boolean.FALSE;
    }

    @Override
    public String toString() {
        return terms.stream().map(String::valueOf).collect(Collectors.joining(" or ", "(", ")"));
    }
}

package com.ryuqq.mnemo.core.expr;

import com.ryuqq.mnemo.core.model.Unit;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 고정 함수 테이블 호출.
 *
 * @param function 함수 이름 ({@link Functions#names()} 중 하나)
 * @param args 인자 표현식
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Call(String function, List<Expr> args) implements Expr {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException if the function is unknown
     */
    public Call {
        if (!Functions.isKnown(function)) {
            throw new IllegalArgumentException("Unknown function: " + function);
        }
        args = args == null ? List.of() : List.copyOf(args);
    }

    @Override
    public Object evaluate(List<Unit> row) {
        List<Object> values = new ArrayList<>(args.size());
        for (Expr arg : args) {
            values.add(arg.evaluate(row));
        }
        return Functions.apply(function, values);
    }

    @Override
    public String toString() {
        return args.stream().map(String::valueOf).collect(Collectors.joining(", ", function + "(", ")"));
    }
}

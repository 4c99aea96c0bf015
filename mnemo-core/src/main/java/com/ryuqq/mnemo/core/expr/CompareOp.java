package com.ryuqq.mnemo.core.expr;

/**
 * 이항 비교 연산자.
 *
 * <p>{@code null}이 포함된 대소 비교는 항상 false입니다.
 * {@link #EQ}와 {@link #NE}만 null을 비교 가능한 값으로 취급합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public enum CompareOp {

    EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    private final String symbol;

    CompareOp(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return operator symbol used in toString output
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @param left left operand
     * @param right right operand
     * @return comparison result
     */
    public boolean apply(Object left, Object right) {
        return switch (this) {
            case EQ -> Values.equal(left, right);
            case NE -> !Values.equal(left, right);
            case LT -> bothPresent(left, right) && Values.compare(left, right) < 0;
            case LE -> bothPresent(left, right) && Values.compare(left, right) <= 0;
            case GT -> bothPresent(left, right) && Values.compare(left, right) > 0;
            case GE -> bothPresent(left, right) && Values.compare(left, right) >= 0;
        };
    }

    private static boolean bothPresent(Object left, Object right) {
        return left != null && right != null;
    }
}

package com.ryuqq.mnemo.core.query;

/**
 * query와 결과 형태 (정렬, limit, offset, distinct).
 *
 * @param query projection
 * @param order 정렬 순서 (null이면 저장 순서)
 * @param limit 최대 row 수 (null이면 제한 없음)
 * @param offset 건너뛸 row 수 (양수이면 order 필수)
 * @param distinct 중복 row 제거 여부
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Statement(Query query, Order order, Integer limit, Integer offset, boolean distinct) {

    public Statement {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative");
        }
    }

    /**
     * @param query the projection
     * @return unordered, unbounded statement keeping duplicates
     */
    public static Statement of(Query query) {
        return new Statement(query, null, null, null, false);
    }

    public Statement orderBy(Order newOrder) {
        return new Statement(query, newOrder, limit, offset, distinct);
    }

    public Statement withLimit(Integer newLimit) {
        return new Statement(query, order, newLimit, offset, distinct);
    }

    public Statement withOffset(Integer newOffset) {
        return new Statement(query, order, limit, newOffset, distinct);
    }

    public Statement withDistinct(boolean newDistinct) {
        return new Statement(query, order, limit, offset, newDistinct);
    }

    public Statement withQuery(Query newQuery) {
        return new Statement(newQuery, order, limit, offset, distinct);
    }
}

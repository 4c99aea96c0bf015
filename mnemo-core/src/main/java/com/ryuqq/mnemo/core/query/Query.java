package com.ryuqq.mnemo.core.query;

import com.ryuqq.mnemo.core.expr.Attr;
import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;

/**
 * relation의 projection. restriction을 만족하는 row마다 만들 값을 정합니다.
 *
 * <p>attribute를 주지 않으면 모든 타입의 모든 property를 선언 순서대로 projection합니다.</p>
 *
 * @param relation 조회 대상 relation
 * @param attributes projection 표현식
 * @param restriction row 필터 (null이면 전체)
 * @author Mnemo Team
 * @since 1.0.0
 */
public record Query(Relation relation, List<Expr> attributes, Expr restriction) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException if relation is null
     */
    public Query {
        if (relation == null) {
            throw new IllegalArgumentException("relation cannot be null");
        }
        attributes = attributes == null || attributes.isEmpty()
            ? allAttributes(relation)
            : List.copyOf(attributes);
    }

    /**
     * @param type queried type
     * @param attributeNames properties to project, all when empty
     * @return query without restriction
     */
    public static Query of(EntityType type, String... attributeNames) {
        List<Expr> attributes = new ArrayList<>();
        for (String name : attributeNames) {
            attributes.add(new Attr(0, name));
        }
        return new Query(type, attributes, null);
    }

    /**
     * @param relation queried relation
     * @param attributes projected expressions
     * @return query without restriction
     */
    public static Query of(Relation relation, List<Expr> attributes) {
        return new Query(relation, attributes, null);
    }

    /**
     * @param newRestriction row filter
     * @return copy with the given restriction
     */
    public Query where(Expr newRestriction) {
        return new Query(relation, attributes, newRestriction);
    }

    private static List<Expr> allAttributes(Relation relation) {
        List<Expr> attributes = new ArrayList<>();
        List<EntityType> types = relation.types();
        for (int arg = 0; arg < types.size(); arg++) {
            for (String name : types.get(arg).propertyNames()) {
                attributes.add(new Attr(arg, name));
            }
        }
        return List.copyOf(attributes);
    }

    @Override
    public String toString() {
        return "Query{" + relation + " " + attributes + (restriction == null ? "" : " where " + restriction) + "}";
    }
}

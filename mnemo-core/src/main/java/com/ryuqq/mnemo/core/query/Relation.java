package com.ryuqq.mnemo.core.query;

import com.ryuqq.mnemo.core.model.EntityType;

import java.util.List;

/**
 * recall 가능한 대상: 단일 entity type 또는 relation의 join.
 *
 * <p>relation의 row는 {@link #types()}의 항목마다 unit 하나를 순서대로 가집니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public interface Relation {

    /**
     * @return entity types of each row position, left to right
     */
    List<EntityType> types();

    /**
     * @param right relation to join
     * @return inner join on the discovered association
     */
    default Join join(Relation right) {
        return new Join(this, right, JoinKind.INNER, null);
    }

    /**
     * @param right relation to join
     * @param path association path to use
     * @return inner join on the named association
     */
    default Join join(Relation right, String path) {
        return new Join(this, right, JoinKind.INNER, path);
    }

    /**
     * @param right relation to join
     * @return left outer join; unmatched left rows get empty right units
     */
    default Join leftJoin(Relation right) {
        return new Join(this, right, JoinKind.LEFT, null);
    }

    /**
     * @param right relation to join
     * @return right outer join; unmatched right rows get empty left units
     */
    default Join rightJoin(Relation right) {
        return new Join(this, right, JoinKind.RIGHT, null);
    }
}

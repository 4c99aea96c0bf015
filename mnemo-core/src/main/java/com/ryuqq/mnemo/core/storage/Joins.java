package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.exception.AssociationException;
import com.ryuqq.mnemo.core.expr.Values;
import com.ryuqq.mnemo.core.model.Association;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Join;
import com.ryuqq.mnemo.core.query.Relation;
import com.ryuqq.mnemo.core.spi.StorageManager;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * native join을 못 하는 백엔드를 위한 메모리 join.
 *
 * <p>join 양쪽을 원본 저장소에서 모두 recall하고 association 키로 짝을 짓습니다.
 * outer join에서 짝이 없는 row는 빠진 타입의 빈 unit (식별자 null)으로 채웁니다.</p>
 *
 * <p><strong>Association 탐색</strong> (처음 찾은 것 사용):</p>
 * <ol>
 *   <li>왼쪽 타입에서 join path 또는 오른쪽 타입 이름의 association</li>
 *   <li>오른쪽 타입에서 join path 또는 왼쪽 타입 이름의 association</li>
 * </ol>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Joins {

    private Joins() {
    }

    /**
     * Materializes the rows of a relation.
     *
     * @param source store to recall each type from
     * @param relation single type or join
     * @return rows, one unit per position of {@code relation.types()}
     * @throws AssociationException if two joined types have no association
     */
    public static List<List<Unit>> combine(StorageManager source, Relation relation) {
        if (relation instanceof EntityType) {
            List<List<Unit>> rows = new ArrayList<>();
            for (Unit unit : source.recall((EntityType) relation)) {
                List<Unit> row = new ArrayList<>(1);
                row.add(unit);
                rows.add(row);
            }
            return rows;
        }
        Join join = (Join) relation;
        List<List<Unit>> leftRows = combine(source, join.left());
        List<List<Unit>> rightRows = combine(source, join.right());
        KeyPair keys = discover(join);

        List<List<Unit>> rows = new ArrayList<>();
        switch (join.kind()) {
            case INNER -> {
                for (List<Unit> left : leftRows) {
                    for (List<Unit> right : rightRows) {
                        if (keys.matches(left, right)) {
                            rows.add(concat(left, right));
                        }
                    }
                }
            }
            case LEFT -> {
                for (List<Unit> left : leftRows) {
                    boolean found = false;
                    for (List<Unit> right : rightRows) {
                        if (keys.matches(left, right)) {
                            rows.add(concat(left, right));
                            found = true;
                        }
                    }
                    if (!found) {
                        rows.add(concat(left, placeholders(join.right())));
                    }
                }
            }
            case RIGHT -> {
                for (List<Unit> right : rightRows) {
                    boolean found = false;
                    for (List<Unit> left : leftRows) {
                        if (keys.matches(left, right)) {
                            rows.add(concat(left, right));
                            found = true;
                        }
                    }
                    if (!found) {
                        rows.add(concat(placeholders(join.left()), right));
                    }
                }
            }
        }
        return rows;
    }

    private static KeyPair discover(Join join) {
        List<EntityType> leftTypes = join.left().types();
        List<EntityType> rightTypes = join.right().types();
        for (int a = 0; a < leftTypes.size(); a++) {
            EntityType typeA = leftTypes.get(a);
            for (int b = 0; b < rightTypes.size(); b++) {
                EntityType typeB = rightTypes.get(b);
                Optional<Association> forward = typeA.association(join.path() != null ? join.path() : typeB.name());
                if (forward.isPresent() && forward.get().farType().equals(typeB.name())) {
                    return new KeyPair(a, forward.get().nearKey(), b, forward.get().farKey());
                }
                Optional<Association> backward = typeB.association(join.path() != null ? join.path() : typeA.name());
                if (backward.isPresent() && backward.get().farType().equals(typeA.name())) {
                    return new KeyPair(a, backward.get().farKey(), b, backward.get().nearKey());
                }
            }
        }
        throw new AssociationException("No association found between " + join.left() + " and " + join.right() + ".");
    }

    private static List<Unit> placeholders(Relation relation) {
        List<Unit> row = new ArrayList<>();
        for (EntityType type : relation.types()) {
            row.add(type.newUnit());
        }
        return row;
    }

    private static List<Unit> concat(List<Unit> left, List<Unit> right) {
        List<Unit> row = new ArrayList<>(left.size() + right.size());
        row.addAll(left);
        row.addAll(right);
        return row;
    }

    private static final class KeyPair {

        private final int leftIndex;
        private final String leftKey;
        private final int rightIndex;
        private final String rightKey;

        KeyPair(int leftIndex, String leftKey, int rightIndex, String rightKey) {
            this.leftIndex = leftIndex;
            this.leftKey = leftKey;
            this.rightIndex = rightIndex;
            this.rightKey = rightKey;
        }

        boolean matches(List<Unit> left, List<Unit> right) {
            Object near = left.get(leftIndex).get(leftKey);
            return near != null && Values.equal(near, right.get(rightIndex).get(rightKey));
        }
    }
}

package com.ryuqq.mnemo.core.expr;

import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Identity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 표현식 트리 생성 factory.
 *
 * <pre>{@code
 * Expr adults = Exprs.attr("Legs").ge(2).and(Exprs.attr("Lifespan").notNull());
 * Expr byKeys = Exprs.filter(Map.of("Species", "Slug"));
 * Expr zooOfAnimal = Exprs.attr(1, "Name").eq("Wild Animal Park");
 * }</pre>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Exprs {

    private Exprs() {
    }

    /**
     * @param name property of the unit at position 0
     * @return attribute node
     */
    public static Attr attr(String name) {
        return new Attr(0, name);
    }

    /**
     * @param arg row position
     * @param name property name
     * @return attribute node
     */
    public static Attr attr(int arg, String name) {
        return new Attr(arg, name);
    }

    /**
     * @param value literal, or an expression returned as is
     * @return constant node
     */
    public static Expr value(Object value) {
        if (value instanceof Expr) {
            return (Expr) value;
        }
        return new Const(value);
    }

    /**
     * Conjunction that flattens nested {@link And} nodes and skips nulls.
     *
     * @param terms predicates, null entries meaning "no restriction"
     * @return conjunction, the single term, or null if all terms were null
     */
    public static Expr and(Expr... terms) {
        List<Expr> flat = new ArrayList<>();
        for (Expr term : terms) {
            if (term instanceof And) {
                flat.addAll(((And) term).terms());
            } else if (term != null) {
                flat.add(term);
            }
        }
        if (flat.isEmpty()) {
            return null;
        }
        return flat.size() == 1 ? flat.get(0) : new And(flat);
    }

    /**
     * Disjunction that flattens nested {@link Or} nodes.
     *
     * @param terms predicates
     * @return disjunction or the single term
     */
    public static Expr or(Expr... terms) {
        List<Expr> flat = new ArrayList<>();
        for (Expr term : Arrays.asList(terms)) {
            if (term instanceof Or) {
                flat.addAll(((Or) term).terms());
            } else if (term != null) {
                flat.add(term);
            }
        }
        if (flat.isEmpty()) {
            throw new IllegalArgumentException("terms cannot be empty");
        }
        return flat.size() == 1 ? flat.get(0) : new Or(flat);
    }

    /**
     * @param term predicate
     * @return negation
     */
    public static Expr not(Expr term) {
        return new Not(term);
    }

    /**
     * @param function function name
     * @param args argument expressions
     * @return call node
     */
    public static Call call(String function, Expr... args) {
        return new Call(function, List.of(args));
    }

    /**
     * Equality conjunction over property values of the unit at position 0.
     *
     * @param values property name to required value
     * @return predicate, or null for an empty map
     */
    public static Expr filter(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        List<Expr> terms = new ArrayList<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            terms.add(attr(entry.getKey()).eq(entry.getValue()));
        }
        return terms.size() == 1 ? terms.get(0) : new And(terms);
    }

    /**
     * Detects a restriction of the form {@code identifier == constant}.
     *
     * <p>Only recognized for types with a single identifier; either operand
     * order is accepted.</p>
     *
     * @param restriction predicate to inspect, may be null
     * @param type queried type
     * @return the identity the predicate selects, or empty if it selects otherwise
     */
    public static Optional<Identity> identifierEquality(Expr restriction, EntityType type) {
        if (!(restriction instanceof Compare) || type.identifiers().size() != 1) {
            return Optional.empty();
        }
        Compare compare = (Compare) restriction;
        if (compare.op() != CompareOp.EQ) {
            return Optional.empty();
        }
        String identifier = type.identifiers().get(0);
        if (isIdentifier(compare.left(), identifier) && compare.right() instanceof Const) {
            return Optional.of(Identity.of(((Const) compare.right()).value()));
        }
        if (isIdentifier(compare.right(), identifier) && compare.left() instanceof Const) {
            return Optional.of(Identity.of(((Const) compare.left()).value()));
        }
        return Optional.empty();
    }

    private static boolean isIdentifier(Expr expr, String identifier) {
        return expr instanceof Attr && ((Attr) expr).arg() == 0 && ((Attr) expr).name().equals(identifier);
    }
}

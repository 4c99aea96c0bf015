package com.ryuqq.mnemo.core.query;

import com.ryuqq.mnemo.core.expr.Values;
import com.ryuqq.mnemo.core.model.Unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 정렬 명세. {@link OrderTerm} 목록을 왼쪽부터 적용합니다.
 *
 * <p>null은 오름차순에서 가장 앞, 내림차순에서 가장 뒤에 옵니다.</p>
 *
 * <pre>{@code
 * Order.by("Species", "Legs DESC")          // 단일 타입 recall
 * Order.of(new OrderTerm(1, "Name", false)) // join의 두 번째 타입
 * }</pre>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Order {

    private static final Order NONE = new Order(Collections.emptyList());

    private final List<OrderTerm> terms;

    private Order(List<OrderTerm> terms) {
        this.terms = terms;
    }

    /**
     * @param specs terms on row position 0, e.g. {@code "Name DESC"}
     * @return parsed order
     */
    public static Order by(String... specs) {
        List<OrderTerm> terms = new ArrayList<>();
        for (String spec : specs) {
            terms.add(OrderTerm.parse(0, spec));
        }
        return of(terms);
    }

    /**
     * @param terms explicit terms
     * @return order
     */
    public static Order of(OrderTerm... terms) {
        return of(List.of(terms));
    }

    /**
     * @param terms explicit terms
     * @return order
     */
    public static Order of(List<OrderTerm> terms) {
        if (terms == null) {
            throw new IllegalArgumentException("terms cannot be null");
        }
        return terms.isEmpty() ? NONE : new Order(List.copyOf(terms));
    }

    /**
     * @return order with no terms
     */
    public static Order none() {
        return NONE;
    }

    /**
     * @param order possibly null order
     * @return true if the order is null or has no terms
     */
    public static boolean isEmpty(Order order) {
        return order == null || order.terms.isEmpty();
    }

    /**
     * @return sort terms
     */
    public List<OrderTerm> terms() {
        return terms;
    }

    /**
     * @return comparator over rows of units
     */
    public Comparator<List<Unit>> rowComparator() {
        return (x, y) -> {
            for (OrderTerm term : terms) {
                int cmp = Values.compare(x.get(term.arg()).get(term.attribute()), y.get(term.arg()).get(term.attribute()));
                if (cmp != 0) {
                    return term.descending() ? -cmp : cmp;
                }
            }
            return 0;
        };
    }

    /**
     * @return comparator over single units, using the terms on position 0
     */
    public Comparator<Unit> unitComparator() {
        Comparator<List<Unit>> rows = rowComparator();
        return (x, y) -> rows.compare(List.of(x), List.of(y));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Order)) {
            return false;
        }
        return terms.equals(((Order) o).terms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(terms);
    }

    @Override
    public String toString() {
        return "Order" + terms;
    }
}

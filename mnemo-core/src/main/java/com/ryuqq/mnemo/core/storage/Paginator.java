package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Order;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * 메모리 기반 order/limit/offset. 위임할 수 없는 모든 백엔드가 공유합니다.
 *
 * <p><strong>계약:</strong></p>
 * <ol>
 *   <li>order 없는 offset &gt; 0은 호출 시점에 거부</li>
 *   <li>limit 0이면 빈 결과</li>
 *   <li>order는 전체 결과를 정렬</li>
 *   <li>offset을 먼저 건너뛰고 limit 적용</li>
 * </ol>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Paginator {

    private Paginator() {
    }

    /**
     * Validates paging arguments.
     *
     * @param order sort order, may be null
     * @param limit maximum count, may be null
     * @param offset rows to skip, may be null
     * @throws IllegalArgumentException if offset is positive without order, or a bound is negative
     */
    public static void validate(Order order, Integer limit, Integer offset) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative");
        }
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset cannot be negative");
        }
        if (offset != null && offset > 0 && Order.isEmpty(order)) {
            throw new IllegalArgumentException("Order argument expected when offset is provided.");
        }
    }

    /**
     * @param limit maximum count, may be null
     * @return true if the result is known to be empty
     */
    public static boolean isEmptyLimit(Integer limit) {
        return limit != null && limit == 0;
    }

    /**
     * Pages a stream of single units.
     *
     * @param units unsorted units
     * @param order sort order, may be null
     * @param limit maximum count, may be null
     * @param offset rows to skip, may be null
     * @return paged stream
     */
    public static Stream<Unit> units(Stream<Unit> units, Order order, Integer limit, Integer offset) {
        validate(order, limit, offset);
        return paginate(units, Order.isEmpty(order) ? null : order.unitComparator(), limit, offset);
    }

    /**
     * Pages a stream of joined rows.
     *
     * @param rows unsorted rows
     * @param order sort order over row positions, may be null
     * @param limit maximum count, may be null
     * @param offset rows to skip, may be null
     * @return paged stream
     */
    public static Stream<List<Unit>> rows(Stream<List<Unit>> rows, Order order, Integer limit, Integer offset) {
        validate(order, limit, offset);
        return paginate(rows, Order.isEmpty(order) ? null : order.rowComparator(), limit, offset);
    }

    /**
     * Pages an arbitrary stream. Arguments must already be validated.
     *
     * @param items unsorted items
     * @param comparator sort order, null to keep stream order
     * @param limit maximum count, may be null
     * @param offset items to skip, may be null
     * @param <T> item type
     * @return paged stream
     */
    public static <T> Stream<T> paginate(Stream<T> items, Comparator<? super T> comparator, Integer limit, Integer offset) {
        if (isEmptyLimit(limit)) {
            items.close();
            return Stream.empty();
        }
        Stream<T> paged = comparator == null ? items : items.sorted(comparator);
        if (offset != null && offset > 0) {
            paged = paged.skip(offset);
        }
        if (limit != null) {
            paged = paged.limit(limit);
        }
        return paged;
    }
}

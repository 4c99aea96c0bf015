package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.expr.Attr;
import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.expr.Exprs;
import com.ryuqq.mnemo.core.expr.Values;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Join;
import com.ryuqq.mnemo.core.query.Query;
import com.ryuqq.mnemo.core.query.Relation;
import com.ryuqq.mnemo.core.query.Statement;
import com.ryuqq.mnemo.core.spi.StorageManager;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * projection과 집계의 공통 구현.
 *
 * <p>집계는 {@link ViewSource} 위에서 계산하므로 sandbox와 저장소가 각자의 데이터를
 * 제공하면서 같은 count, range, sum 규칙을 공유합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public final class Views {

    private static final Set<Class<?>> INTEGRAL_TYPES = Set.of(
        Byte.class, Short.class, Integer.class, Long.class, BigInteger.class);

    private Views() {
    }

    /**
     * Something that can produce projected rows of a query.
     */
    @FunctionalInterface
    public interface ViewSource {

        /**
         * @param query projection
         * @param distinct true to drop duplicate rows
         * @return value rows
         */
        Stream<List<Object>> view(Query query, boolean distinct);
    }

    /**
     * @param store storage manager
     * @return view source backed by the store's {@code xview}
     */
    public static ViewSource of(StorageManager store) {
        return (query, distinct) -> store.xview(Statement.of(query).withDistinct(distinct));
    }

    /**
     * Evaluates a statement in memory over units recalled from the source.
     *
     * @param source store to recall from
     * @param statement projection with shaping
     * @return value rows
     */
    public static Stream<List<Object>> view(StorageManager source, Statement statement) {
        Paginator.validate(statement.order(), statement.limit(), statement.offset());
        if (Paginator.isEmptyLimit(statement.limit())) {
            return Stream.empty();
        }
        Query query = statement.query();
        Expr restriction = query.restriction();
        Relation relation = query.relation();

        Stream<List<Unit>> rows;
        if (relation instanceof EntityType) {
            rows = source.xrecall((EntityType) relation, restriction).map(List::of);
        } else {
            rows = Joins.combine(source, (Join) relation).stream()
                .filter(row -> restriction == null || restriction.test(row));
        }
        if (statement.order() != null && !statement.order().terms().isEmpty()) {
            rows = rows.sorted(statement.order().rowComparator());
        }
        Stream<List<Object>> values = rows.map(row -> project(query.attributes(), row));
        if (statement.distinct()) {
            values = values.distinct();
        }
        return Paginator.paginate(values, null, statement.limit(), statement.offset());
    }

    /**
     * @param attributes projected expressions
     * @param row one unit per relation position
     * @return projected values
     */
    public static List<Object> project(List<Expr> attributes, List<Unit> row) {
        List<Object> values = new ArrayList<>(attributes.size());
        for (Expr attribute : attributes) {
            values.add(attribute.evaluate(row));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Counts distinct units: by identity when the type has identifiers, by
     * all property values otherwise.
     *
     * @param source view source
     * @param type entity type
     * @param restriction row filter, may be null
     * @return unit count
     */
    public static long count(ViewSource source, EntityType type, Expr restriction) {
        List<String> names = type.hasIdentifiers() ? type.identifiers() : type.propertyNames();
        try (Stream<List<Object>> rows = source.view(new Query(type, attributes(names), restriction), true)) {
            return rows.count();
        }
    }

    /**
     * Sorted distinct non-null values of a property; dense for integral and date properties.
     *
     * @param source view source
     * @param type entity type
     * @param attribute property name
     * @param restriction row filter, may be null
     * @return sorted values
     */
    public static List<Object> range(ViewSource source, EntityType type, String attribute, Expr restriction) {
        Class<?> valueType = type.property(attribute).type();
        TreeSet<Object> distinct = new TreeSet<>(Values::compare);
        try (Stream<List<Object>> rows = source.view(new Query(type, List.of(new Attr(0, attribute)), restriction), true)) {
            rows.map(row -> row.get(0)).filter(value -> value != null).forEach(distinct::add);
        }
        if (distinct.isEmpty()) {
            return new ArrayList<>();
        }
        if (INTEGRAL_TYPES.contains(valueType)) {
            return denseIntegers(valueType, (Number) distinct.first(), (Number) distinct.last());
        }
        if (valueType == LocalDate.class) {
            LocalDate first = (LocalDate) distinct.first();
            LocalDate last = (LocalDate) distinct.last();
            return first.datesUntil(last.plusDays(1)).collect(Collectors.toList());
        }
        return new ArrayList<>(distinct);
    }

    /**
     * Sums the non-null values of a property over all matching units, duplicates included.
     *
     * @param source view source
     * @param type entity type
     * @param attribute numeric property name
     * @param restriction row filter, may be null
     * @return the total
     */
    public static Number sum(ViewSource source, EntityType type, String attribute, Expr restriction) {
        Expr notNull = Exprs.and(Exprs.attr(attribute).notNull(), restriction);
        List<Object> values;
        try (Stream<List<Object>> rows = source.view(new Query(type, List.of(new Attr(0, attribute)), notNull), false)) {
            values = rows.map(row -> row.get(0)).collect(Collectors.toList());
        }
        return total(values);
    }

    /**
     * Adds numbers, choosing the widest result type present.
     *
     * <p>{@code Long} if every value is integral, {@code BigDecimal} if any value
     * is a BigDecimal and none is infinite or NaN, {@code Double} otherwise;
     * {@code 0L} for no values.</p>
     *
     * @param values numbers, nulls skipped
     * @return the total
     */
    public static Number total(Collection<?> values) {
        boolean integral = true;
        boolean decimal = false;
        boolean finite = true;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException("Cannot sum " + value.getClass().getSimpleName() + " values");
            }
            integral &= Values.isIntegral(value);
            decimal |= value instanceof BigDecimal;
            finite &= Values.isFinite(value);
        }
        if (integral) {
            long total = 0L;
            for (Object value : values) {
                if (value != null) {
                    total = Math.addExact(total, ((Number) value).longValue());
                }
            }
            return total;
        }
        if (decimal && finite) {
            BigDecimal total = BigDecimal.ZERO;
            for (Object value : values) {
                if (value != null) {
                    total = total.add(Values.toBigDecimal((Number) value));
                }
            }
            return total;
        }
        double total = 0d;
        for (Object value : values) {
            if (value != null) {
                total += ((Number) value).doubleValue();
            }
        }
        return total;
    }

    private static List<Expr> attributes(List<String> names) {
        List<Expr> attributes = new ArrayList<>(names.size());
        for (String name : names) {
            attributes.add(new Attr(0, name));
        }
        return attributes;
    }

    private static List<Object> denseIntegers(Class<?> valueType, Number first, Number last) {
        List<Object> values = new ArrayList<>();
        for (long i = first.longValue(); i <= last.longValue(); i++) {
            values.add(box(valueType, i));
        }
        return values;
    }

    private static Object box(Class<?> valueType, long value) {
        if (valueType == Integer.class) {
            return (int) value;
        }
        if (valueType == Short.class) {
            return (short) value;
        }
        if (valueType == Byte.class) {
            return (byte) value;
        }
        if (valueType == BigInteger.class) {
            return BigInteger.valueOf(value);
        }
        return value;
    }
}

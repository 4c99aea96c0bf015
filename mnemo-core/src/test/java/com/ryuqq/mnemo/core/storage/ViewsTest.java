package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.expr.Exprs;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Query;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Views 집계 테스트.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class ViewsTest {

    private final EntityType animal = EntityType.builder("Animal")
        .property("ID", Integer.class)
        .property("Species", String.class)
        .property("Legs", Integer.class)
        .property("Born", LocalDate.class)
        .property("Weight", Double.class)
        .property("Price", BigDecimal.class)
        .identifiers("ID")
        .build();

    private Unit unit(int id, String species, Integer legs, LocalDate born) {
        Map<String, Object> values = new HashMap<>();
        values.put("ID", id);
        values.put("Species", species);
        values.put("Legs", legs);
        values.put("Born", born);
        return animal.newUnit(values);
    }

    private Unit weighed(int id, double weight) {
        Unit unit = unit(id, "Elephant", 4, null);
        unit.set("Weight", weight);
        return unit;
    }

    private Views.ViewSource over(List<Unit> units) {
        return (query, distinct) -> {
            Stream<List<Object>> rows = units.stream()
                .filter(u -> query.restriction() == null || query.restriction().test(u))
                .map(u -> Views.project(query.attributes(), List.of(u)));
            return distinct ? rows.distinct() : rows;
        };
    }

    @Test
    void range_IntegerProperty_IsDense() {
        // Given
        List<Unit> units = List.of(
            unit(1, "Slug", 1, null), unit(2, "Ape", 2, null), unit(3, "Bear", 4, null),
            unit(4, "Centipede", 100, null), unit(5, "Bird", 2, null));

        // When
        List<Object> range = Views.range(over(units), animal, "Legs", null);

        // Then
        assertThat(range).hasSize(100);
        assertThat(range).isEqualTo(IntStream.rangeClosed(1, 100).boxed().collect(Collectors.toList()));
    }

    @Test
    void range_DateProperty_IsDenseByDay() {
        // Given
        List<Unit> units = List.of(
            unit(1, "Slug", 1, LocalDate.of(2024, 2, 27)),
            unit(2, "Ape", 2, LocalDate.of(2024, 3, 2)));

        // When
        List<Object> range = Views.range(over(units), animal, "Born", null);

        // Then
        assertThat(range).containsExactly(
            LocalDate.of(2024, 2, 27), LocalDate.of(2024, 2, 28), LocalDate.of(2024, 2, 29),
            LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2));
    }

    @Test
    void range_StringProperty_IsSortedDistinct() {
        List<Unit> units = List.of(unit(1, "Slug", 1, null), unit(2, "Ape", 2, null), unit(3, "Slug", 4, null));
        assertThat(Views.range(over(units), animal, "Species", null)).containsExactly("Ape", "Slug");
    }

    @Test
    void range_NoMatch_IsEmpty() {
        List<Unit> units = List.of(unit(1, "Slug", 1, null));
        assertThat(Views.range(over(units), animal, "Legs", Exprs.attr("Legs").gt(10))).isEmpty();
    }

    @Test
    void count_CountsDistinctIdentities() {
        List<Unit> units = List.of(unit(1, "Slug", 1, null), unit(2, "Ape", 2, null), unit(3, "Bear", 4, null));
        assertEquals(2L, Views.count(over(units), animal, Exprs.attr("Legs").ge(2)));
    }

    @Test
    void sum_IntegralValues_ReturnsLongIncludingDuplicates() {
        // Given
        List<Unit> units = List.of(unit(1, "Ape", 2, null), unit(2, "Bird", 2, null), unit(3, "Slug", null, null));

        // When
        Number total = Views.sum(over(units), animal, "Legs", null);

        // Then
        assertEquals(4L, total);
    }

    @Test
    void total_ResultTypeFollowsWidestValue() {
        assertEquals(0L, Views.total(List.of()));
        assertEquals(3.5d, Views.total(List.of(1, 2.5d)));
        assertEquals(0, new BigDecimal("3.75").compareTo((BigDecimal) Views.total(List.of(1, new BigDecimal("2.75")))));
    }

    @Test
    void range_NonFiniteDoubles_SortedAtTheEnds() {
        // Given
        List<Unit> units = List.of(
            weighed(1, 3.5), weighed(2, Double.POSITIVE_INFINITY), weighed(3, Double.NaN),
            weighed(4, Double.NEGATIVE_INFINITY), weighed(5, 3.5));

        // When
        List<Object> range = Views.range(over(units), animal, "Weight", null);

        // Then
        assertThat(range).containsExactly(Double.NEGATIVE_INFINITY, 3.5, Double.POSITIVE_INFINITY, Double.NaN);
    }

    @Test
    void total_NonFiniteValueWithDecimals_FallsBackToDouble() {
        assertEquals(Double.POSITIVE_INFINITY, Views.total(List.of(new BigDecimal("1.25"), Double.POSITIVE_INFINITY)));
    }

    @Test
    void project_UsesAttributeExpressions() {
        Unit slug = unit(1, "Slug", 1, null);
        Query query = Query.of(animal, "Species", "Legs");
        assertEquals(List.of("Slug", 1), Views.project(query.attributes(), List.of(slug)));
    }
}

package com.ryuqq.mnemo.core.query;

import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Order 테스트.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class OrderTest {

    private final EntityType animal = EntityType.builder("Animal")
        .property("Species", String.class)
        .property("Legs", Integer.class)
        .build();

    private Unit unit(String species, Integer legs) {
        Map<String, Object> values = new HashMap<>();
        values.put("Species", species);
        values.put("Legs", legs);
        return animal.newUnit(values);
    }

    @Test
    void by_ParsesDirection() {
        // When
        Order order = Order.by("Legs DESC", "Species");

        // Then
        assertEquals(List.of(new OrderTerm(0, "Legs", true), new OrderTerm(0, "Species", false)), order.terms());
    }

    @Test
    void parse_UnknownDirection_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Order.by("Legs SIDEWAYS"));
    }

    @Test
    void unitComparator_SortsByTermsWithNullsFirst() {
        // Given
        List<Unit> units = new ArrayList<>(Arrays.asList(
            unit("Slug", 1), unit("Ape", 2), unit("Bear", 4), unit("Cat", null), unit("Ant", 2)));

        // When
        units.sort(Order.by("Legs", "Species").unitComparator());

        // Then
        assertThat(units.stream().map(u -> u.get("Species")).collect(Collectors.toList()))
            .containsExactly("Cat", "Slug", "Ant", "Ape", "Bear");
    }

    @Test
    void unitComparator_Descending_ReversesTerm() {
        List<Unit> units = new ArrayList<>(List.of(unit("Slug", 1), unit("Bear", 4), unit("Ape", 2)));
        units.sort(Order.by("Legs DESC").unitComparator());
        assertThat(units.stream().map(u -> u.get("Legs")).collect(Collectors.toList())).containsExactly(4, 2, 1);
    }

    @Test
    void isEmpty_NullOrNoTerms() {
        assertTrue(Order.isEmpty(null));
        assertTrue(Order.isEmpty(Order.none()));
        assertFalse(Order.isEmpty(Order.by("Legs")));
    }
}

package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Order;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Paginator 테스트.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class PaginatorTest {

    private final EntityType animal = EntityType.builder("Animal")
        .property("Rank", Integer.class)
        .build();

    private Stream<Unit> shuffled() {
        return Stream.of(7, 2, 9, 1, 5, 3, 10, 4, 8, 6).map(rank -> animal.newUnit(Map.of("Rank", rank)));
    }

    @Test
    void units_OrderLimitOffset_ReturnsRanksThreeToSeven() {
        // When
        List<Object> ranks = Paginator.units(shuffled(), Order.by("Rank"), 5, 2)
            .map(u -> u.get("Rank"))
            .collect(Collectors.toList());

        // Then
        assertThat(ranks).containsExactly(3, 4, 5, 6, 7);
    }

    @Test
    void units_OffsetWithoutOrder_ThrowsAtCallTime() {
        assertThatThrownBy(() -> Paginator.units(shuffled(), null, null, 2))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Order argument expected");
    }

    @Test
    void units_LimitZero_ReturnsNothing() {
        assertThat(Paginator.units(shuffled(), Order.by("Rank"), 0, null)).isEmpty();
    }

    @Test
    void units_ZeroOffsetWithoutOrder_IsAccepted() {
        assertThat(Paginator.units(shuffled(), null, 3, 0)).hasSize(3);
    }

    @Test
    void paginate_OffsetBeyondEnd_ReturnsNothing() {
        assertThat(Paginator.paginate(IntStream.range(0, 5).boxed(), Integer::compare, null, 10)).isEmpty();
    }
}

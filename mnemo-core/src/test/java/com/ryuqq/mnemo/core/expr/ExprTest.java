package com.ryuqq.mnemo.core.expr;

import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Identity;
import com.ryuqq.mnemo.core.model.Unit;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Expr 평가 테스트.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class ExprTest {

    private final EntityType animal = EntityType.builder("Animal")
        .property("ID", Integer.class)
        .property("Species", String.class)
        .property("Legs", Integer.class)
        .property("Lifespan", Double.class)
        .property("Price", BigDecimal.class)
        .identifiers("ID")
        .build();

    private final EntityType zoo = EntityType.builder("Zoo")
        .property("ID", Integer.class)
        .property("Name", String.class)
        .identifiers("ID")
        .build();

    private Unit slug() {
        return animal.newUnit(Map.of("ID", 1, "Species", "Slug", "Legs", 1, "Price", new BigDecimal("2.50")));
    }

    // ============================================================
    // Comparisons
    // ============================================================

    @Test
    void compare_MixedNumericTypes_ComparesByValue() {
        Unit slug = slug();
        assertTrue(Exprs.attr("Legs").eq(1L).test(slug));
        assertTrue(Exprs.attr("Legs").lt(1.5d).test(slug));
        assertTrue(Exprs.attr("Price").ge(2.5d).test(slug));
        assertFalse(Exprs.attr("Price").gt(new BigDecimal("2.5")).test(slug));
    }

    @Test
    void compare_NullOperand_OnlyEqualityHolds() {
        // Given
        Unit slug = slug();

        // When & Then
        assertFalse(Exprs.attr("Lifespan").lt(10).test(slug));
        assertFalse(Exprs.attr("Lifespan").ge(0).test(slug));
        assertTrue(Exprs.attr("Lifespan").eq(null).test(slug));
        assertTrue(Exprs.attr("Lifespan").ne(3).test(slug));
    }

    @Test
    void compare_NonFiniteDoubles_OrderOutsideFiniteValues() {
        // Given
        Unit immortal = animal.newUnit(Map.of("ID", 2, "Lifespan", Double.POSITIVE_INFINITY, "Price", new BigDecimal("9.99")));
        Unit unknown = animal.newUnit(Map.of("ID", 3, "Lifespan", Double.NaN));

        // When & Then
        assertTrue(Exprs.attr("Lifespan").gt(100.0).test(immortal));
        assertTrue(Exprs.attr("Lifespan").eq(Float.POSITIVE_INFINITY).test(immortal));
        assertFalse(Exprs.attr("Price").ge(Double.POSITIVE_INFINITY).test(immortal));
        assertTrue(Exprs.attr("Price").gt(Double.NEGATIVE_INFINITY).test(immortal));
        assertTrue(Exprs.attr("Lifespan").eq(Double.NaN).test(unknown));
        assertFalse(Exprs.attr("Lifespan").eq(1.0).test(unknown));
    }

    @Test
    void values_NonFiniteNumbers_HashConsistentWithEqual() {
        assertTrue(Values.equal(Double.NaN, Float.NaN));
        assertEquals(Values.hash(Double.NaN), Values.hash(Float.NaN));
        assertEquals(Values.hash(Double.NEGATIVE_INFINITY), Values.hash(Float.NEGATIVE_INFINITY));
        assertTrue(Values.compare(Double.NaN, Double.POSITIVE_INFINITY) > 0);
        assertTrue(Values.compare(Double.NEGATIVE_INFINITY, Long.MIN_VALUE) < 0);
        assertFalse(Values.isFinite(Double.NaN));
        assertTrue(Values.isFinite(new BigDecimal("1.5")));
    }

    @Test
    void logic_AndOrNot_Combine() {
        Unit slug = slug();
        Expr expr = Exprs.attr("Legs").eq(1).and(Exprs.attr("Species").eq("Snake").or(Exprs.attr("ID").eq(1)));
        assertTrue(expr.test(slug));
        assertFalse(expr.not().test(slug));
    }

    @Test
    void and_FlattensNestedTermsAndSkipsNulls() {
        // When
        Expr expr = Exprs.and(Exprs.attr("Legs").eq(1).and(Exprs.attr("ID").eq(1)), null, Exprs.attr("Species").notNull());

        // Then
        assertThat(expr).isInstanceOf(And.class);
        assertThat(((And) expr).terms()).hasSize(3);
        assertNull(Exprs.and((Expr) null));
    }

    // ============================================================
    // Functions
    // ============================================================

    @Test
    void functions_StringFunctions_Evaluate() {
        Unit slug = slug();
        assertTrue(Exprs.attr("Species").startsWith("Sl").test(slug));
        assertTrue(Exprs.attr("Species").endsWith("ug").test(slug));
        assertTrue(Exprs.attr("Species").contains("lu").test(slug));
        assertEquals("slug", Exprs.attr("Species").lower().evaluate(List.of(slug)));
        assertEquals(4, Exprs.attr("Species").length().evaluate(List.of(slug)));
        assertTrue(Exprs.attr("Species").in("Slug", "Snail").test(slug));
        assertFalse(Exprs.attr("Lifespan").startsWith("x").test(slug));
    }

    @Test
    void call_UnknownFunction_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Exprs.call("soundex", Exprs.attr("Species")));
    }

    @Test
    void filter_BuildsEqualityConjunction() {
        // Given
        Expr expr = Exprs.filter(Map.of("Species", "Slug", "Legs", 1));

        // When & Then
        assertTrue(expr.test(slug()));
        assertNull(Exprs.filter(Map.of()));
    }

    // ============================================================
    // Joined rows
    // ============================================================

    @Test
    void attr_SecondPosition_ReadsJoinedUnit() {
        // Given
        Unit park = zoo.newUnit(Map.of("ID", 1, "Name", "Wild Animal Park"));
        Expr expr = Exprs.attr(1, "Name").eq("Wild Animal Park").and(Exprs.attr(0, "Legs").eq(1));

        // When & Then
        assertTrue(expr.test(slug(), park));
    }

    // ============================================================
    // Identifier equality detection
    // ============================================================

    @Test
    void identifierEquality_EitherOperandOrder_Detected() {
        assertEquals(Optional.of(Identity.of(5)), Exprs.identifierEquality(Exprs.attr("ID").eq(5), animal));
        Expr reversed = new Compare(CompareOp.EQ, new Const(5), new Attr(0, "ID"));
        assertEquals(Optional.of(Identity.of(5)), Exprs.identifierEquality(reversed, animal));
    }

    @Test
    void identifierEquality_OtherShapes_NotDetected() {
        assertTrue(Exprs.identifierEquality(Exprs.attr("ID").ge(5), animal).isEmpty());
        assertTrue(Exprs.identifierEquality(Exprs.attr("Legs").eq(5), animal).isEmpty());
        assertTrue(Exprs.identifierEquality(Exprs.attr("ID").eq(5).and(Exprs.attr("Legs").eq(1)), animal).isEmpty());
        assertTrue(Exprs.identifierEquality(null, animal).isEmpty());
    }
}

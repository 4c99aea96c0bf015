package com.ryuqq.mnemo.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sequencer 테스트.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class SequencerTest {

    private final EntityType zoo = EntityType.builder("Zoo")
        .property("ID", Integer.class)
        .property("Name", String.class)
        .identifiers("ID")
        .sequencer(Sequencer.integer())
        .build();

    private final EntityType ticket = EntityType.builder("Ticket")
        .property("Number", Long.class)
        .identifiers("Number")
        .sequencer(Sequencer.integer(100))
        .build();

    @Test
    void integer_EmptyType_AssignsInitialValue() {
        // Given
        Unit unit = zoo.newUnit();

        // When
        zoo.sequencer().assign(unit, List.of());

        // Then
        assertEquals(1, unit.get("ID"));
    }

    @Test
    void integer_ExistingIdentities_AssignsMaxPlusOne() {
        // Given
        Unit unit = zoo.newUnit();

        // When
        zoo.sequencer().assign(unit, List.of(Identity.of(3), Identity.of(9), Identity.of(4)));

        // Then
        assertEquals(10, unit.get("ID"));
    }

    @Test
    void integer_LongIdentifier_AssignsLong() {
        Unit unit = ticket.newUnit();
        ticket.sequencer().assign(unit, List.of(Identity.of(120L)));
        assertEquals(121L, unit.get("Number"));
    }

    @Test
    void validId_NullIdentifier_IsInvalid() {
        assertFalse(zoo.sequencer().validId(Identity.of((Object) null)));
        assertTrue(zoo.sequencer().validId(Identity.of(1)));
    }

    @Test
    void manual_Assign_ThrowsException() {
        // Given
        EntityType manual = EntityType.builder("Vet").property("Name", String.class).identifiers("Name").build();
        Unit unit = manual.newUnit();

        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> manual.sequencer().assign(unit, List.of())
        );
        assertTrue(exception.getMessage().contains("manual identifiers"));
    }

    @Test
    void dynamic_FallsBackToClientSideAllocation() {
        // Given
        EntityType visit = EntityType.builder("Visit")
            .property("ID", Integer.class)
            .identifiers("ID")
            .sequencer(Sequencer.dynamic())
            .build();
        Unit unit = visit.newUnit();

        // When
        visit.sequencer().assign(unit, List.of(Identity.of(5)));

        // Then
        assertEquals(6, unit.get("ID"));
    }
}

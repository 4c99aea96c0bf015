package com.ryuqq.mnemo.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * EntityType 테스트.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class EntityTypeTest {

    private static EntityType animal() {
        return EntityType.builder("Animal")
            .property("ID", Integer.class)
            .property("Species", String.class)
            .property(Property.of("Legs", Integer.class).withDefault(4))
            .identifiers("ID")
            .sequencer(Sequencer.integer())
            .associate(Association.toOne("ZooID", "Zoo", "ID"))
            .build();
    }

    @Test
    void build_ValidDeclaration_KeepsPropertyOrder() {
        // When
        EntityType type = animal();

        // Then
        assertEquals("Animal", type.name());
        assertThat(type.propertyNames()).containsExactly("ID", "Species", "Legs");
        assertThat(type.identifiers()).containsExactly("ID");
        assertTrue(type.hasIdentifiers());
        assertTrue(type.association("Zoo").isPresent());
    }

    @Test
    void build_IdentifierWithoutProperty_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> EntityType.builder("Broken").property("Name", String.class).identifiers("ID").build()
        );
        assertTrue(exception.getMessage().contains("identifier 'ID'"));
    }

    @Test
    void build_DuplicateProperty_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EntityType.builder("Broken")
            .property("Name", String.class)
            .property("Name", String.class)
            .build());
    }

    @Test
    void builder_BlankName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> EntityType.builder("  "));
    }

    @Test
    void newUnit_AppliesDeclaredDefaults() {
        // When
        Unit unit = animal().newUnit();

        // Then
        assertEquals(4, unit.get("Legs"));
        assertNull(unit.get("ID"));
        assertFalse(unit.isDirty());
        assertTrue(unit.isZombie());
    }

    @Test
    void withProperty_EvolvedCopy_IsSameLogicalType() {
        // Given
        EntityType type = animal();

        // When
        EntityType evolved = type.withProperty(Property.of("Lifespan", Double.class));

        // Then
        assertEquals(type, evolved);
        assertEquals(type.hashCode(), evolved.hashCode());
        assertThat(evolved.propertyNames()).containsExactly("ID", "Species", "Legs", "Lifespan");
        assertFalse(type.hasProperty("Lifespan"));
    }

    @Test
    void withRenamedProperty_RenamesInPlace() {
        // When
        EntityType renamed = animal().withRenamedProperty("Species", "Kind");

        // Then
        assertThat(renamed.propertyNames()).containsExactly("ID", "Kind", "Legs");
    }

    @Test
    void withoutProperty_Identifier_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> animal().withoutProperty("ID"));
    }

    @Test
    void types_SingleType_ReturnsItself() {
        EntityType type = animal();
        assertEquals(List.of(type), type.types());
    }

    @Test
    void newUnit_WithValues_IsDirty() {
        Unit unit = animal().newUnit(Map.of("Species", "Slug"));
        assertEquals("Slug", unit.get("Species"));
        assertTrue(unit.isDirty());
    }
}

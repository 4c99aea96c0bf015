package com.ryuqq.mnemo.core.spi;

import com.ryuqq.mnemo.core.exception.MappingException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Conflicts / ConflictMode 테스트.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class ConflictsTest {

    @Test
    void report_Error_ThrowsMappingException() {
        Conflicts conflicts = Conflicts.error();
        MappingException exception = assertThrows(MappingException.class, () -> conflicts.report("no storage"));
        assertEquals("no storage", exception.getMessage());
    }

    @Test
    void report_Warn_CollectsEveryIssue() {
        // Given
        Conflicts conflicts = Conflicts.warn();

        // When
        conflicts.report("first");
        conflicts.report("second");

        // Then
        assertThat(conflicts.warnings()).containsExactly("first", "second");
        assertTrue(conflicts.hasWarnings());
    }

    @Test
    void report_Ignore_DoesNothing() {
        Conflicts conflicts = Conflicts.ignore();
        conflicts.report("whatever");
        assertFalse(conflicts.hasWarnings());
    }

    @Test
    void report_RepairUnrepairable_ThrowsMappingException() {
        Conflicts conflicts = Conflicts.repair();
        assertTrue(conflicts.repairing());
        assertThrows(MappingException.class, () -> conflicts.report("cannot repair"));
    }

    @Test
    void of_ParsesCaseInsensitively() {
        assertEquals(ConflictMode.WARN, Conflicts.of("Warn").mode());
        assertEquals(ConflictMode.ERROR, ConflictMode.of(null));
        assertEquals("repair", ConflictMode.REPAIR.value());
    }

    @Test
    void of_UnknownMode_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ConflictMode.of("panic"));
    }
}

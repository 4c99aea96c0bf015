package com.ryuqq.mnemo.core.storage;

import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.expr.Exprs;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.query.Query;
import com.ryuqq.mnemo.core.query.Statement;
import com.ryuqq.mnemo.core.spi.Conflicts;
import com.ryuqq.mnemo.core.spi.StorageManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * ProxyStorage 포워딩 테스트.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ProxyStorageTest {

    private static final EntityType ZOO = EntityType.builder("Zoo")
        .property("ID", Integer.class)
        .property("Name", String.class)
        .identifiers("ID")
        .build();

    @Mock
    private StorageManager next;

    private ProxyStorage proxy;

    @BeforeEach
    void setUp() {
        proxy = new ProxyStorage(next);
    }

    @Test
    void constructor_NullNext_ThrowsException() {
        assertThatThrownBy(() -> new ProxyStorage(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("next cannot be null");
    }

    @Test
    void dml_ForwardsEveryCall() {
        // Given
        Unit unit = ZOO.newUnit(Map.of("ID", 1, "Name", "Wild Animal Park"));
        Expr restriction = Exprs.attr("Name").startsWith("W");
        when(next.xrecall(ZOO, restriction, null, null, null)).thenReturn(Stream.of(unit));
        when(next.unit(ZOO, Map.of("ID", 1))).thenReturn(unit);

        // When
        proxy.reserve(unit);
        proxy.save(unit, true);
        proxy.destroy(unit);
        List<Unit> recalled = proxy.recall(ZOO, restriction);
        Unit found = proxy.unit(ZOO, Map.of("ID", 1));

        // Then
        verify(next).reserve(unit);
        verify(next).save(unit, true);
        verify(next).destroy(unit);
        assertThat(recalled).containsExactly(unit);
        assertThat(found).isSameAs(unit);
    }

    @Test
    void ddl_ForwardsWithSameConflicts() {
        // Given
        Conflicts conflicts = Conflicts.warn();

        // When
        proxy.createStorage(ZOO, conflicts);
        proxy.addProperty(ZOO, "Name", conflicts);
        proxy.renameProperty(ZOO, "Name", "Title", conflicts);
        proxy.addIndex(ZOO, "Title", conflicts);
        proxy.map(List.of(ZOO), conflicts);

        // Then
        verify(next).createStorage(ZOO, conflicts);
        verify(next).addProperty(ZOO, "Name", conflicts);
        verify(next).renameProperty(ZOO, "Name", "Title", conflicts);
        verify(next).addIndex(ZOO, "Title", conflicts);
        verify(next).map(List.of(ZOO), conflicts);
    }

    @Test
    void createDatabase_WithoutDatabaseScope_StopsAtProxy() {
        // Given
        ProxyStorage scoped = new ProxyStorage(next, false);

        // When
        scoped.createDatabase(Conflicts.error());
        scoped.dropDatabase(Conflicts.error());

        // Then
        verify(next, never()).createDatabase(any());
        verify(next, never()).dropDatabase(any());
    }

    @Test
    void createDatabase_WithDatabaseScope_Forwards() {
        Conflicts conflicts = Conflicts.error();
        proxy.createDatabase(conflicts);
        verify(next).createDatabase(conflicts);
    }

    @Test
    void xrecall_OffsetWithoutOrder_ThrowsBeforeForwarding() {
        assertThatThrownBy(() -> proxy.xrecall(ZOO, null, null, 5, 3))
            .isInstanceOf(IllegalArgumentException.class);
        verify(next, never()).xrecall(any(), any(), any(), any(), any());
    }

    @Test
    void xview_And_Aggregates_Forward() {
        // Given
        Statement statement = Statement.of(Query.of(ZOO, "Name")).orderBy(Order.by("Name"));
        when(next.xview(statement)).thenReturn(Stream.of(List.of("Wild Animal Park")));
        when(next.count(ZOO, null)).thenReturn(1L);
        when(next.sum(ZOO, "ID", null)).thenReturn(1L);

        // When & Then
        assertThat(proxy.xview(statement).collect(Collectors.toList())).containsExactly(List.of("Wild Animal Park"));
        assertThat(proxy.count(ZOO, null)).isEqualTo(1L);
        assertThat(proxy.sum(ZOO, "ID", null)).isEqualTo(1L);
    }

    @Test
    void transactions_Forward() {
        // Given
        when(next.supportsTransactions()).thenReturn(true);

        // When
        boolean supported = proxy.supportsTransactions();
        proxy.start();
        proxy.rollback();
        proxy.commit();

        // Then
        assertThat(supported).isTrue();
        verify(next).start();
        verify(next).rollback();
        verify(next).commit();
    }

    @Test
    void register_IsLocalToProxy() {
        // When
        proxy.register(ZOO);

        // Then
        assertThat(proxy.classes()).containsExactly(ZOO);
        assertThat(proxy.typeByName("Zoo")).isSameAs(ZOO);
        verify(next, never()).register(any());
    }
}

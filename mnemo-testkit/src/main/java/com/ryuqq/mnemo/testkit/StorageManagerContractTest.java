package com.ryuqq.mnemo.testkit;

import com.ryuqq.mnemo.core.exception.AssociationException;
import com.ryuqq.mnemo.core.exception.MappingException;
import com.ryuqq.mnemo.core.expr.Exprs;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Property;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Join;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.query.OrderTerm;
import com.ryuqq.mnemo.core.query.Query;
import com.ryuqq.mnemo.core.query.Statement;
import com.ryuqq.mnemo.core.spi.Conflicts;
import com.ryuqq.mnemo.core.spi.StorageManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.ryuqq.mnemo.testkit.ZooFixture.ANIMAL;
import static com.ryuqq.mnemo.testkit.ZooFixture.EXHIBIT;
import static com.ryuqq.mnemo.testkit.ZooFixture.LOG_ENTRY;
import static com.ryuqq.mnemo.testkit.ZooFixture.ZOO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Abstract contract test every {@link StorageManager} implementation must pass.
 *
 * <p>Subclasses supply a fresh, empty store through {@link #createStore()}. Before
 * each test the zoo fixture types are registered, the database is created and
 * storage is created for every type.</p>
 *
 * <p><strong>Contract Coverage:</strong></p>
 * <ul>
 *   <li>Identifier assignment and round trip of every fixture value type</li>
 *   <li>Save semantics (dirty vs forced), destroy, detached units</li>
 *   <li>Restrictions, order/limit/offset and the pagination errors</li>
 *   <li>Inner, left and right joins</li>
 *   <li>Views and aggregates (count, dense range, sum)</li>
 *   <li>Conflict modes on DDL, schema evolution of properties</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class RamStorageContractTest extends StorageManagerContractTest {
 *     {@literal @}Override
 *     protected StorageManager createStore() {
 *         return new RamStorage();
 *     }
 * }
 * </pre>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public abstract class StorageManagerContractTest {

    protected StorageManager store;

    /**
     * @return a new store holding no data
     */
    protected abstract StorageManager createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
        for (EntityType type : ZooFixture.types()) {
            store.register(type);
        }
        store.createDatabase(Conflicts.ignore());
        for (EntityType type : ZooFixture.types()) {
            store.createStorage(type, Conflicts.error());
        }
    }

    @AfterEach
    void tearDownStore() {
        if (store != null) {
            store.dropDatabase(Conflicts.ignore());
            store.shutdown(Conflicts.ignore());
        }
    }

    // ============================================================
    // Helpers
    // ============================================================

    /**
     * Reserves a unit and returns it.
     *
     * @param unit new unit
     * @return the same unit, identifiers assigned
     */
    protected Unit reserved(Unit unit) {
        store.reserve(unit);
        return unit;
    }

    /**
     * Seeds ten animals with lifespans 1.0 to 10.0 in shuffled order.
     */
    protected void seedLifespans() {
        int[] order = {7, 2, 9, 4, 1, 10, 3, 6, 8, 5};
        for (int lifespan : order) {
            reserved(ZooFixture.animal("Species" + lifespan, null, 4, (double) lifespan));
        }
    }

    /**
     * Seeds two zoos with three animals between them, one animal without zoo
     * and one zoo without animals.
     *
     * @return the zoo identifiers in creation order (A, B, empty)
     */
    protected List<Integer> seedZoo() {
        Unit a = reserved(ZooFixture.zoo("Zoo A", LocalDate.of(2001, 1, 1), new BigDecimal("10.00")));
        Unit b = reserved(ZooFixture.zoo("Zoo B", LocalDate.of(2001, 1, 4), new BigDecimal("5.50")));
        Unit empty = reserved(ZooFixture.zoo("Empty Zoo", LocalDate.of(2001, 1, 2), null));
        int idA = a.get("ID", Integer.class);
        int idB = b.get("ID", Integer.class);
        reserved(ZooFixture.animal("Tiger", idA, 4, 12.0));
        reserved(ZooFixture.animal("Ostrich", idA, 2, 40.5));
        reserved(ZooFixture.animal("Ape", idB, 2, 30.0));
        reserved(ZooFixture.animal("Wild Dog", null, 6, null));
        return List.of(idA, idB, empty.get("ID", Integer.class));
    }

    private static List<Object> column(List<Unit> units, String name) {
        return units.stream().map(unit -> unit.get(name)).collect(Collectors.toList());
    }

    // ============================================================
    // 1. Identifiers and round trip
    // ============================================================

    @Test
    void reserve_IntegerSequencer_AssignsIncreasingIdentifiers() {
        // When
        Unit first = reserved(ZooFixture.zoo("First", null, null));
        Unit second = reserved(ZooFixture.zoo("Second", null, null));
        Unit third = reserved(ZooFixture.zoo("Third", null, null));

        // Then
        assertThat(first.get("ID")).isEqualTo(1);
        assertThat(second.get("ID")).isEqualTo(2);
        assertThat(third.get("ID")).isEqualTo(3);
    }

    @Test
    void reserve_CompositeManualIdentifier_KeepsGivenValues() {
        // When
        reserved(ZooFixture.exhibit(1, "Savannah", 3.5));
        reserved(ZooFixture.exhibit(1, "Aviary", 0.5));

        // Then
        Unit found = store.unit(EXHIBIT, Map.of("ZooID", 1, "Name", "Aviary"));
        assertThat(found).isNotNull();
        assertThat(found.get("Acreage")).isEqualTo(0.5);
    }

    @Test
    void reserve_ThenUnit_RoundTripsDeclaredValueTypes() {
        // Given
        Unit zoo = ZooFixture.zoo("Round Trip", LocalDate.of(1999, 12, 31), new BigDecimal("12.50"));
        zoo.set("LastEscape", LocalDateTime.of(2004, 2, 29, 13, 45, 10));
        reserved(zoo);

        // When
        Unit found = store.unit(ZOO, Map.of("ID", zoo.get("ID")));

        // Then
        assertThat(found).isNotNull().isNotSameAs(zoo);
        assertThat(found.isDirty()).isFalse();
        assertThat(found.get("Name")).isEqualTo("Round Trip");
        assertThat(found.get("Founded")).isEqualTo(LocalDate.of(1999, 12, 31));
        assertThat(found.get("Admission", BigDecimal.class)).isEqualByComparingTo("12.50");
        assertThat(found.get("LastEscape")).isEqualTo(LocalDateTime.of(2004, 2, 29, 13, 45, 10));
        assertThat(found.identity()).isEqualTo(zoo.identity());
    }

    @Test
    void reserve_DefaultValue_IsStored() {
        // Given
        Unit snake = ANIMAL.newUnit(Map.of("Species", "Snake"));

        // When
        reserved(snake);

        // Then
        Unit found = store.unit(ANIMAL, Map.of("Species", "Snake"));
        assertThat(found.get("Legs")).isEqualTo(4);
    }

    @Test
    void unit_NoMatch_ReturnsNull() {
        assertThat(store.unit(ZOO, Map.of("ID", 404))).isNull();
    }

    // ============================================================
    // 2. Save and destroy
    // ============================================================

    @Test
    void save_DirtyUnit_PersistsAndCleanses() {
        // Given
        Unit zoo = reserved(ZooFixture.zoo("Old Name", null, null));
        zoo.set("Name", "New Name");

        // When
        store.save(zoo);

        // Then
        assertThat(zoo.isDirty()).isFalse();
        assertThat(store.unit(ZOO, Map.of("ID", zoo.get("ID"))).get("Name")).isEqualTo("New Name");
    }

    @Test
    void save_CleanUnitNotForced_IsSkipped_ForcedIsWritten() {
        // Given
        Unit zoo = reserved(ZooFixture.zoo("Stored", null, null));
        zoo.set("Name", "Unsaved");
        zoo.cleanse();

        // When
        store.save(zoo, false);

        // Then
        assertThat(store.unit(ZOO, Map.of("ID", zoo.get("ID"))).get("Name")).isEqualTo("Stored");

        // When
        store.save(zoo, true);

        // Then
        assertThat(store.unit(ZOO, Map.of("ID", zoo.get("ID"))).get("Name")).isEqualTo("Unsaved");
    }

    @Test
    void recall_ReturnsDetachedUnits() {
        // Given
        Unit zoo = reserved(ZooFixture.zoo("Detached", null, null));
        Unit recalled = store.unit(ZOO, Map.of("ID", zoo.get("ID")));

        // When
        recalled.set("Name", "Edited but not saved");

        // Then
        assertThat(store.unit(ZOO, Map.of("ID", zoo.get("ID"))).get("Name")).isEqualTo("Detached");
    }

    @Test
    void destroy_RemovesUnit_AbsentUnitIgnored() {
        // Given
        Unit zoo = reserved(ZooFixture.zoo("Doomed", null, null));

        // When
        store.destroy(zoo);

        // Then
        assertThat(store.unit(ZOO, Map.of("ID", zoo.get("ID")))).isNull();
        assertThatCode(() -> store.destroy(zoo)).doesNotThrowAnyException();
    }

    @Test
    void identifierLessUnits_AreStoredAndDestroyedByValue() {
        // Given
        Unit started = reserved(ZooFixture.logEntry("started", 1));
        reserved(ZooFixture.logEntry("stopped", 2));

        // When
        List<Unit> before = store.recall(LOG_ENTRY);
        store.destroy(started);
        List<Unit> after = store.recall(LOG_ENTRY);

        // Then
        assertThat(column(before, "Message")).containsExactlyInAnyOrder("started", "stopped");
        assertThat(column(after, "Message")).containsExactly("stopped");
    }

    // ============================================================
    // 3. Recall, order, pagination
    // ============================================================

    @Test
    void recall_Restriction_FiltersUnits() {
        // Given
        seedZoo();

        // When
        List<Unit> bipeds = store.recall(ANIMAL, Exprs.attr("Legs").eq(2));

        // Then
        assertThat(column(bipeds, "Species")).containsExactlyInAnyOrder("Ostrich", "Ape");
    }

    @Test
    void recall_OrderLimitOffset_ReturnsRanksThreeToSeven() {
        // Given
        seedLifespans();

        // When
        List<Unit> page = store.recall(ANIMAL, null, Order.by("Lifespan"), 5, 2);

        // Then
        assertThat(column(page, "Lifespan")).containsExactly(3.0, 4.0, 5.0, 6.0, 7.0);
    }

    @Test
    void recall_DescendingOrder_SortsReversed() {
        // Given
        seedLifespans();

        // When
        List<Unit> top = store.recall(ANIMAL, null, Order.by("Lifespan DESC"), 3, null);

        // Then
        assertThat(column(top, "Lifespan")).containsExactly(10.0, 9.0, 8.0);
    }

    @Test
    void recall_OffsetWithoutOrder_ThrowsIllegalArgumentException() {
        assertThatThrownBy(() -> store.xrecall(ANIMAL, null, null, null, 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Order argument expected");
    }

    @Test
    void recall_LimitZero_ReturnsNothing() {
        // Given
        seedLifespans();

        // When & Then
        assertThat(store.recall(ANIMAL, null, null, 0, null)).isEmpty();
    }

    @Test
    void unit_NonIdentifierFilter_FindsMatch() {
        // Given
        seedZoo();

        // When
        Unit ape = store.unit(ANIMAL, Map.of("Species", "Ape"));

        // Then
        assertThat(ape).isNotNull();
        assertThat(ape.get("Legs")).isEqualTo(2);
    }

    // ============================================================
    // 4. Joins
    // ============================================================

    @Test
    void multirecall_InnerJoin_PairsAssociatedUnits() {
        // Given
        seedZoo();

        // When
        List<List<Unit>> rows = store.multirecall(ZOO.join(ANIMAL), null);

        // Then
        assertThat(rows).hasSize(3);
        assertThat(rows).allSatisfy(row ->
            assertThat(row.get(1).get("ZooID")).isEqualTo(row.get(0).get("ID")));
    }

    @Test
    void multirecall_ReverseJoin_UsesDeclaredAssociation() {
        // Given
        seedZoo();

        // When
        List<List<Unit>> rows = store.multirecall(ANIMAL.join(ZOO), Exprs.attr(1, "Name").eq("Zoo A"));

        // Then
        assertThat(rows).extracting(row -> row.get(0).get("Species"))
            .containsExactlyInAnyOrder("Tiger", "Ostrich");
    }

    @Test
    void multirecall_LeftJoin_KeepsUnmatchedLeftRows() {
        // Given
        List<Integer> ids = seedZoo();

        // When
        List<List<Unit>> rows = store.multirecall(ZOO.leftJoin(ANIMAL), null);

        // Then
        assertThat(rows).hasSize(4);
        List<Unit> emptyZooRow = rows.stream()
            .filter(row -> ids.get(2).equals(row.get(0).get("ID")))
            .findFirst()
            .orElseThrow();
        assertThat(emptyZooRow.get(1).get("ID")).isNull();
    }

    @Test
    void multirecall_RightJoin_KeepsUnmatchedRightRows() {
        // Given
        seedZoo();

        // When
        List<List<Unit>> rows = store.multirecall(ZOO.rightJoin(ANIMAL), null);

        // Then
        assertThat(rows).hasSize(4);
        List<Unit> strayRow = rows.stream()
            .filter(row -> "Wild Dog".equals(row.get(1).get("Species")))
            .findFirst()
            .orElseThrow();
        assertThat(strayRow.get(0).get("ID")).isNull();
    }

    @Test
    void multirecall_OrderedAndPaged() {
        // Given
        seedZoo();
        Join join = ZOO.join(ANIMAL);

        // When
        List<List<Unit>> rows = store.multirecall(join, null, Order.of(OrderTerm.parse(1, "Species")), 2, 1);

        // Then
        assertThat(rows).extracting(row -> row.get(1).get("Species")).containsExactly("Ostrich", "Tiger");
    }

    @Test
    void multirecall_NoAssociation_ThrowsAssociationException() {
        assertThatThrownBy(() -> store.multirecall(ANIMAL.join(EXHIBIT), null))
            .isInstanceOf(AssociationException.class);
    }

    // ============================================================
    // 5. Views and aggregates
    // ============================================================

    @Test
    void view_ProjectsRequestedAttributes() {
        // Given
        seedZoo();

        // When
        List<List<Object>> rows = store.view(Query.of(ZOO, "Name"));

        // Then
        assertThat(rows).containsExactlyInAnyOrder(List.of("Zoo A"), List.of("Zoo B"), List.of("Empty Zoo"));
    }

    @Test
    void view_DistinctAndOrdered() {
        // Given
        seedZoo();
        Statement statement = Statement.of(Query.of(ANIMAL, "Legs"))
            .orderBy(Order.by("Legs"))
            .withDistinct(true);

        // When
        List<List<Object>> rows = store.view(statement);

        // Then
        assertThat(rows).containsExactly(List.of(2), List.of(4), List.of(6));
    }

    @Test
    void count_CountsMatchingUnits() {
        // Given
        seedZoo();

        // When & Then
        assertThat(store.count(ANIMAL, null)).isEqualTo(4L);
        assertThat(store.count(ANIMAL, Exprs.attr("Legs").lt(4))).isEqualTo(2L);
        assertThat(store.count(ANIMAL, Exprs.attr("Legs").gt(100))).isZero();
    }

    @Test
    void sum_UsesWidestValueType() {
        // Given
        seedZoo();

        // When & Then
        assertThat(store.sum(ANIMAL, "Legs", null)).isEqualTo(14L);
        assertThat(store.sum(ANIMAL, "Lifespan", null)).isEqualTo(82.5);
        assertThat((BigDecimal) store.sum(ZOO, "Admission", null)).isEqualByComparingTo("15.50");
        assertThat(store.sum(ANIMAL, "Legs", Exprs.attr("Legs").gt(100))).isEqualTo(0L);
    }

    @Test
    void range_IntegralProperty_IsDense() {
        // Given
        seedZoo();

        // When
        List<Object> legs = store.range(ANIMAL, "Legs", null);

        // Then
        assertThat(legs).containsExactly(2, 3, 4, 5, 6);
    }

    @Test
    void range_DateProperty_IsDenseByDay() {
        // Given
        seedZoo();

        // When
        List<Object> founded = store.range(ZOO, "Founded", null);

        // Then
        assertThat(founded).containsExactly(
            LocalDate.of(2001, 1, 1), LocalDate.of(2001, 1, 2),
            LocalDate.of(2001, 1, 3), LocalDate.of(2001, 1, 4));
    }

    @Test
    void range_OtherProperty_IsDistinctSorted() {
        // Given
        seedZoo();
        reserved(ZooFixture.animal("Ape", null, 2, null));

        // When
        List<Object> species = store.range(ANIMAL, "Species", null);

        // Then
        assertThat(species).containsExactly("Ape", "Ostrich", "Tiger", "Wild Dog");
    }

    // ============================================================
    // 6. Conflict modes and DDL
    // ============================================================

    @Test
    void createStorage_Existing_ErrorModeThrowsMappingException() {
        assertThatThrownBy(() -> store.createStorage(ZOO, Conflicts.error()))
            .isInstanceOf(MappingException.class);
    }

    @Test
    void createStorage_Existing_WarnModeCollectsEveryIssue() {
        // Given
        Conflicts conflicts = Conflicts.warn();

        // When
        store.createStorage(ZOO, conflicts);
        store.createStorage(ANIMAL, conflicts);

        // Then
        assertThat(conflicts.warnings()).hasSizeGreaterThanOrEqualTo(2);
        assertThat(conflicts.warnings()).anySatisfy(warning -> assertThat(warning).contains("Zoo"));
        assertThat(conflicts.warnings()).anySatisfy(warning -> assertThat(warning).contains("Animal"));
    }

    @Test
    void createStorage_Existing_IgnoreModeIsSilent() {
        // Given
        Conflicts conflicts = Conflicts.ignore();

        // When & Then
        assertThatCode(() -> store.createStorage(ZOO, conflicts)).doesNotThrowAnyException();
        assertThat(conflicts.warnings()).isEmpty();
    }

    @Test
    void createStorage_Existing_RepairModeKeepsData() {
        // Given
        Unit zoo = reserved(ZooFixture.zoo("Survivor", null, null));

        // When
        store.createStorage(ZOO, Conflicts.repair());

        // Then
        assertThat(store.unit(ZOO, Map.of("ID", zoo.get("ID")))).isNotNull();
    }

    @Test
    void dropStorage_ThenMapAll_RepairRecreatesErrorReports() {
        // Given
        store.dropStorage(LOG_ENTRY, Conflicts.error());
        assertThat(store.hasStorage(LOG_ENTRY)).isFalse();

        // When & Then
        assertThatThrownBy(() -> store.mapAll(Conflicts.error())).isInstanceOf(MappingException.class);
        store.mapAll(Conflicts.repair());
        assertThat(store.hasStorage(LOG_ENTRY)).isTrue();
    }

    @Test
    void dropStorage_Missing_ReportsConflict() {
        // Given
        store.dropStorage(LOG_ENTRY, Conflicts.error());
        Conflicts conflicts = Conflicts.warn();

        // When
        store.dropStorage(LOG_ENTRY, conflicts);

        // Then
        assertThat(conflicts.hasWarnings()).isTrue();
        assertThatThrownBy(() -> store.dropStorage(LOG_ENTRY, Conflicts.error()))
            .isInstanceOf(MappingException.class);
    }

    @Test
    void propertyEvolution_AddRenameDrop() {
        // Given
        Unit zoo = reserved(ZooFixture.zoo("Evolving", null, null));
        EntityType withMotto = ZOO.withProperty(Property.of("Motto", String.class).withDefault("Roar"));

        // When: add
        store.addProperty(withMotto, "Motto", Conflicts.error());

        // Then
        assertThat(store.hasProperty(withMotto, "Motto")).isTrue();
        assertThat(store.unit(withMotto, Map.of("ID", zoo.get("ID"))).get("Motto")).isEqualTo("Roar");

        // When: rename
        EntityType withSlogan = withMotto.withRenamedProperty("Motto", "Slogan");
        store.renameProperty(withSlogan, "Motto", "Slogan", Conflicts.error());

        // Then
        assertThat(store.hasProperty(withSlogan, "Slogan")).isTrue();
        assertThat(store.hasProperty(withSlogan, "Motto")).isFalse();
        assertThat(store.unit(withSlogan, Map.of("ID", zoo.get("ID"))).get("Slogan")).isEqualTo("Roar");

        // When: drop
        store.dropProperty(ZOO, "Slogan", Conflicts.error());

        // Then
        assertThat(store.hasProperty(ZOO, "Slogan")).isFalse();
        assertThat(store.unit(ZOO, Map.of("ID", zoo.get("ID"))).get("Name")).isEqualTo("Evolving");
    }

    @Test
    void typeByName_UnknownName_ThrowsIllegalArgumentException() {
        assertThat(store.typeByName("Zoo")).isEqualTo(ZOO);
        assertThatThrownBy(() -> store.typeByName("Aquarium"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Aquarium");
    }

    @Test
    void recall_RepeatedCalls_ReturnSameIdentities() {
        // Given
        seedLifespans();

        // When
        List<Object> first = new ArrayList<>(column(store.recall(ANIMAL), "ID"));
        List<Object> second = new ArrayList<>(column(store.recall(ANIMAL), "ID"));

        // Then
        assertThat(first).hasSize(10).containsExactlyInAnyOrderElementsOf(second);
    }
}

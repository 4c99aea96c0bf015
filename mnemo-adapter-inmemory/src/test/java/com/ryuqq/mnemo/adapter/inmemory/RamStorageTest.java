package com.ryuqq.mnemo.adapter.inmemory;

import com.ryuqq.mnemo.core.exception.CacheRejectedException;
import com.ryuqq.mnemo.core.exception.MappingException;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Property;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.spi.Conflicts;
import com.ryuqq.mnemo.testkit.ZooFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.ryuqq.mnemo.testkit.ZooFixture.ANIMAL;
import static com.ryuqq.mnemo.testkit.ZooFixture.ZOO;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * RamStorage 테스트.
 *
 * <p>Contract Test에서 다루지 않는 RAM 전용 동작을 검증합니다:</p>
 * <ul>
 *   <li>타입별 lock 하의 동시 식별자 할당</li>
 *   <li>용량 제한과 CacheRejectedException</li>
 *   <li>트랜잭션 snapshot / rollback</li>
 *   <li>CacheIntrospection, 인덱스, REPAIR 모드</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class RamStorageTest {

    private RamStorage store;

    @BeforeEach
    void setUp() {
        store = create(new RamStorageConfig());
    }

    private static RamStorage create(RamStorageConfig config) {
        RamStorage ram = new RamStorage(config);
        for (EntityType type : ZooFixture.types()) {
            ram.register(type);
            ram.createStorage(type, Conflicts.error());
        }
        return ram;
    }

    // ============================================================
    // 1. Concurrency
    // ============================================================

    @Test
    void reserve_ConcurrentThreads_AssignDistinctIdentifiers() throws Exception {
        // given
        int threads = 8;
        int perThread = 50;
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        ConcurrentLinkedQueue<Object> ids = new ConcurrentLinkedQueue<>();
        List<Future<?>> futures = new ArrayList<>();

        // when: 모든 스레드가 동시에 같은 타입에 reserve
        for (int t = 0; t < threads; t++) {
            futures.add(executorService.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    Unit zoo = ZooFixture.zoo("Zoo", null, null);
                    store.reserve(zoo);
                    ids.add(zoo.get("ID"));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        // then
        Set<Object> distinct = new HashSet<>(ids);
        assertEquals(threads * perThread, distinct.size());
        assertThat(store.cachedCount(ZOO)).isEqualTo(threads * perThread);
        assertThat(store.range(ZOO, "ID", null)).hasSize(threads * perThread).startsWith(1);
    }

    // ============================================================
    // 2. Capacity
    // ============================================================

    @Test
    void reserve_BeyondCapacity_ThrowsCacheRejectedException() {
        // Given
        RamStorage bounded = create(new RamStorageConfig().withMaxEntriesPerType(2));
        Unit first = ZooFixture.zoo("One", null, null);
        bounded.reserve(first);
        bounded.reserve(ZooFixture.zoo("Two", null, null));

        // When & Then
        assertThatThrownBy(() -> bounded.reserve(ZooFixture.zoo("Three", null, null)))
            .isInstanceOf(CacheRejectedException.class)
            .hasMessageContaining("Zoo");
        assertThat(bounded.cachedCount(ZOO)).isEqualTo(2);

        // Then: updating a stored identity is not an insert
        first.set("Name", "Uno");
        bounded.save(first);
        assertThat(bounded.unit(ZOO, Map.of("ID", first.get("ID"))).get("Name")).isEqualTo("Uno");
    }

    @Test
    void config_NegativeCapacity_ThrowsException() {
        assertThatThrownBy(() -> new RamStorageConfig(-1, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxEntriesPerType");
    }

    // ============================================================
    // 3. Transactions
    // ============================================================

    @Test
    void rollback_RestoresContentsCapturedAtStart() {
        // Given
        RamStorage transactional = create(new RamStorageConfig().withTransactional(true));
        Unit kept = ZooFixture.zoo("Kept", null, null);
        transactional.reserve(kept);
        transactional.start();

        // When
        transactional.reserve(ZooFixture.zoo("Discarded", null, null));
        kept.set("Name", "Changed");
        transactional.save(kept);
        transactional.rollback();

        // Then
        assertThat(transactional.cachedCount(ZOO)).isEqualTo(1);
        assertThat(transactional.unit(ZOO, Map.of("ID", kept.get("ID"))).get("Name")).isEqualTo("Kept");
    }

    @Test
    void commit_KeepsChanges() {
        // Given
        RamStorage transactional = create(new RamStorageConfig().withTransactional(true));
        transactional.start();
        transactional.reserve(ZooFixture.zoo("Committed", null, null));

        // When
        transactional.commit();
        transactional.rollback();

        // Then
        assertThat(transactional.cachedCount(ZOO)).isEqualTo(1);
    }

    @Test
    void start_NotTransactional_ThrowsUnsupportedOperationException() {
        assertThat(store.supportsTransactions()).isFalse();
        assertThatThrownBy(() -> store.start())
            .isInstanceOf(UnsupportedOperationException.class)
            .hasMessage("RamStorage has no start method");
    }

    // ============================================================
    // 4. CacheIntrospection
    // ============================================================

    @Test
    void cachedUnits_ReturnsDetachedCopies() {
        // Given
        Unit zoo = ZooFixture.zoo("Original", null, null);
        store.reserve(zoo);

        // When
        List<Unit> cached = store.cachedUnits(ZOO);
        cached.get(0).set("Name", "Mutated copy");

        // Then
        assertThat(cached.get(0)).isNotSameAs(zoo);
        assertThat(store.unit(ZOO, Map.of("ID", zoo.get("ID"))).get("Name")).isEqualTo("Original");
    }

    @Test
    void flush_DropsUnitsButKeepsStorage() {
        // Given
        store.reserve(ZooFixture.zoo("Flushed", null, null));

        // When
        store.flush(ZOO);

        // Then
        assertThat(store.cachedCount(ZOO)).isZero();
        assertThat(store.hasStorage(ZOO)).isTrue();
    }

    @Test
    void cachedCount_NoStorage_ReturnsZero() {
        // Given
        store.dropStorage(ZOO, Conflicts.error());

        // When & Then
        assertThat(store.cachedCount(ZOO)).isZero();
        assertThat(store.cachedUnits(ZOO)).isEmpty();
    }

    // ============================================================
    // 5. DDL specifics
    // ============================================================

    @Test
    void indexes_AddHasDrop() {
        // When
        store.addIndex(ANIMAL, "Species", Conflicts.error());

        // Then
        assertThat(store.hasIndex(ANIMAL, "Species")).isTrue();
        assertThatThrownBy(() -> store.addIndex(ANIMAL, "Species", Conflicts.error()))
            .isInstanceOf(MappingException.class);
        assertThatThrownBy(() -> store.addIndex(ANIMAL, "Wingspan", Conflicts.error()))
            .isInstanceOf(MappingException.class)
            .hasMessageContaining("Wingspan");

        // When
        store.dropIndex(ANIMAL, "Species", Conflicts.error());

        // Then
        assertThat(store.hasIndex(ANIMAL, "Species")).isFalse();
    }

    @Test
    void createStorage_RepairMode_ReconcilesRowsWithDeclaredProperties() {
        // Given
        Unit animal = ZooFixture.animal("Heron", null, 2, 15.0);
        store.reserve(animal);
        EntityType evolved = ANIMAL
            .withoutProperty("Lifespan")
            .withProperty(Property.of("Wingspan", Double.class).withDefault(1.5));

        // When
        store.createStorage(evolved, Conflicts.repair());

        // Then
        assertThat(store.hasProperty(evolved, "Wingspan")).isTrue();
        assertThat(store.hasProperty(evolved, "Lifespan")).isFalse();
        Unit reloaded = store.unit(evolved, Map.of("ID", animal.get("ID")));
        assertThat(reloaded.get("Wingspan")).isEqualTo(1.5);
        assertThat(reloaded.get("Species")).isEqualTo("Heron");
    }

    @Test
    void reserve_NoStorage_ThrowsIllegalStateException() {
        // Given
        store.dropStorage(ZOO, Conflicts.error());

        // When & Then
        assertThatThrownBy(() -> store.reserve(ZooFixture.zoo("Homeless", null, null)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Zoo");
    }

    @Test
    void shutdown_DropsAllTables() {
        // When
        store.shutdown(Conflicts.error());

        // Then
        assertThat(store.hasStorage(ZOO)).isFalse();
        assertThat(store.classes()).contains(ZOO);
    }
}

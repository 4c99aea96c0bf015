package com.ryuqq.mnemo.core.spi;

import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Join;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.query.Query;
import com.ryuqq.mnemo.core.query.Statement;
import com.ryuqq.mnemo.core.sandbox.Sandbox;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Storage Manager SPI.
 *
 * <p>sandbox와 unit을 영속화하는 모든 것 사이의 공통 계약입니다. leaf 백엔드 (RAM, JSON 폴더),
 * 전달 proxy, 캐시, partitioner가 모두 같은 계약을 구현하므로 계층을 자유롭게 조합할 수 있습니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>타입 등록과 선언된 타입의 storage 매핑</li>
 *   <li>스키마 DDL (database, storage, property, index), 각각 {@link Conflicts}로 제어</li>
 *   <li>Unit DML: reserve, save, destroy, 단건 조회, recall stream</li>
 *   <li>Join, projection (view), 집계 (count, range, sum)</li>
 *   <li>선택적 트랜잭션 경계</li>
 * </ul>
 *
 * <p><strong>Pagination 계약</strong> (모든 recall, view 작업):</p>
 * <pre>
 * order 없이 offset &gt; 0 → 호출 시점에 IllegalArgumentException
 * limit == 0            → 빈 결과
 * order                 → 전체 결과에 적용
 * offset                → limit보다 먼저 적용
 * </pre>
 *
 * <p><strong>Lazy 결과:</strong> {@code x}로 시작하는 작업은 소비하는 동안 백엔드를 읽을 수 있는
 * stream을 반환합니다. {@code x}가 없는 작업은 이를 list로 모읍니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 여러 sandbox에서 동시에 호출 가능해야 함</li>
 *   <li>내어주는 unit은 분리된 사본: 저장소를 통해 두 호출자가 인스턴스를 공유하지 않음</li>
 *   <li>지원하지 않는 기능은 {@link UnsupportedOperationException}, conflict mode로 완화하지 않음</li>
 * </ul>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public interface StorageManager {

    // ========================================
    // Registration
    // ========================================

    /**
     * Declares that this manager handles units of the type.
     *
     * @param type entity type
     * @throws IllegalArgumentException if type is null
     */
    void register(EntityType type);

    /**
     * Stops handling the type. Stored data is left untouched.
     *
     * @param type entity type
     */
    void unregister(EntityType type);

    /**
     * @return snapshot of the registered types
     */
    Set<EntityType> classes();

    /**
     * @param type entity type
     * @return true if the type is registered
     */
    default boolean handles(EntityType type) {
        return classes().contains(type);
    }

    /**
     * @param name type name
     * @return the registered type with that name
     * @throws IllegalArgumentException if no registered type has the name
     */
    default EntityType typeByName(String name) {
        for (EntityType type : classes()) {
            if (type.name().equals(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("No registered type found for '" + name + "'");
    }

    /**
     * Checks that every given type has storage.
     *
     * <p>Types without storage are reported to {@code conflicts}; in REPAIR mode
     * their storage is created instead.</p>
     *
     * @param types types to map
     * @param conflicts conflict handler
     */
    void map(Collection<EntityType> types, Conflicts conflicts);

    /**
     * Maps every registered type.
     *
     * @param conflicts conflict handler
     */
    default void mapAll(Conflicts conflicts) {
        map(classes(), conflicts);
    }

    /**
     * Releases resources held by this manager.
     *
     * @param conflicts conflict handler
     */
    void shutdown(Conflicts conflicts);

    // ========================================
    // DDL
    // ========================================

    void createDatabase(Conflicts conflicts);

    boolean hasDatabase();

    void dropDatabase(Conflicts conflicts);

    /**
     * Creates storage for the type.
     *
     * <p>Existing storage is a conflict; in REPAIR mode it is reconciled with
     * the type's declared properties instead.</p>
     *
     * @param type entity type
     * @param conflicts conflict handler
     */
    void createStorage(EntityType type, Conflicts conflicts);

    boolean hasStorage(EntityType type);

    void dropStorage(EntityType type, Conflicts conflicts);

    /**
     * Adds a property to every stored unit of the type.
     *
     * @param type the (evolved) type declaring the property
     * @param name property name
     * @param conflicts conflict handler
     */
    void addProperty(EntityType type, String name, Conflicts conflicts);

    boolean hasProperty(EntityType type, String name);

    void dropProperty(EntityType type, String name, Conflicts conflicts);

    void renameProperty(EntityType type, String oldName, String newName, Conflicts conflicts);

    void addIndex(EntityType type, String name, Conflicts conflicts);

    boolean hasIndex(EntityType type, String name);

    void dropIndex(EntityType type, String name, Conflicts conflicts);

    default void createDatabase() {
        createDatabase(Conflicts.error());
    }

    default void createStorage(EntityType type) {
        createStorage(type, Conflicts.error());
    }

    default void dropStorage(EntityType type) {
        dropStorage(type, Conflicts.error());
    }

    // ========================================
    // DML
    // ========================================

    /**
     * Reserves storage for a new unit, assigning its identifiers when the
     * type's sequencer reports them invalid.
     *
     * @param unit new unit
     */
    void reserve(Unit unit);

    /**
     * Persists the unit if it is dirty, or unconditionally when forced.
     * Cleanses the unit afterwards.
     *
     * @param unit unit to persist
     * @param force save even if the unit is clean
     */
    void save(Unit unit, boolean force);

    default void save(Unit unit) {
        save(unit, false);
    }

    /**
     * Removes the unit from storage. Absent units are ignored.
     *
     * @param unit unit to remove
     */
    void destroy(Unit unit);

    /**
     * Returns one unit whose properties equal the filter values.
     *
     * @param type entity type
     * @param filter property name to required value
     * @return a matching unit, or null if none
     */
    Unit unit(EntityType type, Map<String, ?> filter);

    /**
     * Recalls units of a type lazily.
     *
     * @param type entity type
     * @param restriction row filter, null for all
     * @param order sort order, null for storage order
     * @param limit maximum count, null for unbounded
     * @param offset rows to skip; requires order when positive
     * @return stream of detached units
     * @throws IllegalArgumentException if offset is given without order
     */
    Stream<Unit> xrecall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset);

    default Stream<Unit> xrecall(EntityType type, Expr restriction) {
        return xrecall(type, restriction, null, null, null);
    }

    default Stream<Unit> xrecall(EntityType type) {
        return xrecall(type, null, null, null, null);
    }

    default List<Unit> recall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        try (Stream<Unit> units = xrecall(type, restriction, order, limit, offset)) {
            return units.collect(Collectors.toList());
        }
    }

    default List<Unit> recall(EntityType type, Expr restriction) {
        return recall(type, restriction, null, null, null);
    }

    default List<Unit> recall(EntityType type) {
        return recall(type, null, null, null, null);
    }

    /**
     * Recalls rows of joined units lazily.
     *
     * @param join joined relation
     * @param restriction row filter over joined positions, null for all
     * @param order sort order over joined positions
     * @param limit maximum count
     * @param offset rows to skip; requires order when positive
     * @return stream of rows, one unit per joined type
     * @throws com.ryuqq.mnemo.core.exception.AssociationException if two joined types have no association
     */
    Stream<List<Unit>> xmultirecall(Join join, Expr restriction, Order order, Integer limit, Integer offset);

    default Stream<List<Unit>> xmultirecall(Join join, Expr restriction) {
        return xmultirecall(join, restriction, null, null, null);
    }

    default List<List<Unit>> multirecall(Join join, Expr restriction, Order order, Integer limit, Integer offset) {
        try (Stream<List<Unit>> rows = xmultirecall(join, restriction, order, limit, offset)) {
            return rows.collect(Collectors.toList());
        }
    }

    default List<List<Unit>> multirecall(Join join, Expr restriction) {
        return multirecall(join, restriction, null, null, null);
    }

    /**
     * Produces projected value rows lazily.
     *
     * @param statement projection with its shaping
     * @return stream of value rows, one value per projected attribute
     */
    Stream<List<Object>> xview(Statement statement);

    default List<List<Object>> view(Statement statement) {
        try (Stream<List<Object>> rows = xview(statement)) {
            return rows.collect(Collectors.toList());
        }
    }

    default List<List<Object>> view(Query query) {
        return view(Statement.of(query));
    }

    /**
     * @param type entity type
     * @param restriction row filter, null for all
     * @return number of distinct units satisfying the restriction
     */
    long count(EntityType type, Expr restriction);

    /**
     * Returns the distinct values of a property, sorted.
     *
     * <p>Integral and date properties produce a dense range from the smallest
     * to the largest value, with every intermediate value filled in.</p>
     *
     * @param type entity type
     * @param attribute property name
     * @param restriction row filter, null for all
     * @return sorted values, empty if no unit matches
     */
    List<Object> range(EntityType type, String attribute, Expr restriction);

    /**
     * @param type entity type
     * @param attribute numeric property name
     * @param restriction row filter, null for all
     * @return sum of the non-null values, {@code 0L} when there are none
     */
    Number sum(EntityType type, String attribute, Expr restriction);

    // ========================================
    // Transactions
    // ========================================

    /**
     * @return true if start/commit/rollback are available
     */
    default boolean supportsTransactions() {
        return false;
    }

    default void start() {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no start method");
    }

    default void commit() {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no commit method");
    }

    default void rollback() {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " has no rollback method");
    }

    /**
     * @return new sandbox over this manager
     */
    default Sandbox newSandbox() {
        return new Sandbox(this);
    }
}

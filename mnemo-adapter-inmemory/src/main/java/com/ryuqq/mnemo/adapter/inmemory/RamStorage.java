package com.ryuqq.mnemo.adapter.inmemory;

import com.ryuqq.mnemo.core.exception.CacheRejectedException;
import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Identity;
import com.ryuqq.mnemo.core.model.Property;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.spi.CacheIntrospection;
import com.ryuqq.mnemo.core.spi.Conflicts;
import com.ryuqq.mnemo.core.spi.UnitCodec;
import com.ryuqq.mnemo.core.storage.AbstractStorageManager;
import com.ryuqq.mnemo.core.storage.MapUnitCodec;
import com.ryuqq.mnemo.core.storage.Paginator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * StorageManager SPI의 프로세스 메모리 구현.
 *
 * <p>타입마다 identity를 키로 인코딩된 property map 테이블을 가집니다. unit은 참조로
 * 저장하거나 내어주지 않으며, {@link MapUnitCodec}이 들어올 때와 나갈 때 값을 복사합니다.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>tables:</strong> ConcurrentHashMap&lt;String, Table&gt; - 타입 이름별 테이블</li>
 *   <li><strong>Table.rows:</strong> LinkedHashMap&lt;Object, Map&gt; - identity (식별자 없는 타입은
 *       property map 자체)에서 인코딩된 값으로, 삽입 순서 유지</li>
 *   <li><strong>Table.columns / Table.indexes:</strong> 선언된 property와 index 이름</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> 테이블마다 {@link ReentrantLock}을 가지며, 식별자 할당을 포함한
 * 모든 read-modify-write는 이 lock 안에서 실행됩니다. lock은 한 번에 하나만 잡고 중첩하지 않습니다.</p>
 *
 * <p><strong>캐시 백엔드:</strong> {@link RamStorageConfig#maxEntriesPerType()}를 지정하면 한도를
 * 넘는 삽입은 {@link CacheRejectedException}을 던집니다. priming 캐시는 {@link CacheIntrospection}
 * 메서드로 타입별 현황을 확인하고 비울 수 있습니다.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RamStorage store = new RamStorage();
 * store.register(zooType);
 * store.createStorage(zooType, Conflicts.error());
 *
 * Sandbox box = store.newSandbox();
 * box.memorize(zooType.newUnit(Map.of("Name", "Zoo A")));
 * box.flushAll();
 * </pre>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class RamStorage extends AbstractStorageManager implements CacheIntrospection {

    private static final Logger log = LoggerFactory.getLogger(RamStorage.class);

    private final RamStorageConfig config;
    private final UnitCodec<Map<String, Object>> codec = new MapUnitCodec();
    private final ConcurrentHashMap<String, Table> tables = new ConcurrentHashMap<>();

    /**
     * Table contents captured by {@link #start()}; null outside a transaction.
     */
    private Map<String, Table> snapshot;

    /**
     * 기본 설정 생성자.
     */
    public RamStorage() {
        this(new RamStorageConfig());
    }

    /**
     * @param config capacity and transaction settings
     * @throws IllegalArgumentException if config is null
     */
    public RamStorage(RamStorageConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * @return the configuration
     */
    public RamStorageConfig config() {
        return config;
    }

    // ========================================
    // DML
    // ========================================

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Identifier assignment and insert happen under the type's lock</li>
     *   <li>Stores every property value, so the unit is cleansed afterwards</li>
     *   <li>Throws CacheRejectedException when a bounded table is full</li>
     * </ul>
     */
    @Override
    public void reserve(Unit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        EntityType type = unit.type();
        Table table = table(type);
        locked(table, () -> {
            if (type.hasIdentifiers() && !type.sequencer().validId(unit.identity())) {
                type.sequencer().assign(unit, table.identities());
            }
            write(table, unit);
            return null;
        });
        storageLog.reserve(unit);
    }

    @Override
    public void save(Unit unit, boolean force) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (!force && !unit.isDirty()) {
            return;
        }
        Table table = table(unit.type());
        locked(table, () -> {
            write(table, unit);
            return null;
        });
        storageLog.save(unit, force);
    }

    @Override
    public void destroy(Unit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        Table table = table(unit.type());
        Object key = keyOf(unit, codec.encode(unit));
        locked(table, () -> table.rows.remove(key));
        storageLog.destroy(unit);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Filters on exactly the identifiers are answered by a direct table lookup.</p>
     */
    @Override
    public Unit unit(EntityType type, Map<String, ?> filter) {
        if (type.hasIdentifiers() && filter.keySet().equals(new HashSet<>(type.identifiers()))) {
            List<Object> ids = new ArrayList<>();
            for (String identifier : type.identifiers()) {
                ids.add(filter.get(identifier));
            }
            Table table = table(type);
            Map<String, Object> row = locked(table, () -> table.rows.get(Identity.of(ids)));
            return row == null ? null : codec.decode(type, row);
        }
        return super.unit(type, filter);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Rows are copied out under the lock, then decoded, filtered and paginated
     * in memory without holding it.</p>
     */
    @Override
    public Stream<Unit> xrecall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        Paginator.validate(order, limit, offset);
        storageLog.recall(type, restriction);
        if (Paginator.isEmptyLimit(limit)) {
            return Stream.empty();
        }
        Table table = table(type);
        List<Map<String, Object>> rows = locked(table, () -> new ArrayList<>(table.rows.values()));
        Stream<Unit> units = rows.stream()
            .map(row -> codec.decode(type, row))
            .filter(unit -> restriction == null || restriction.test(unit));
        return Paginator.units(units, order, limit, offset);
    }

    // ========================================
    // DDL
    // ========================================

    @Override
    public void createDatabase(Conflicts conflicts) {
        storageLog.ddl("create database", this);
    }

    @Override
    public boolean hasDatabase() {
        return true;
    }

    @Override
    public void dropDatabase(Conflicts conflicts) {
        storageLog.ddl("drop database", this);
        tables.clear();
    }

    /**
     * {@inheritDoc}
     *
     * <p>In REPAIR mode an existing table is reconciled with the declared
     * properties: missing ones are filled with their defaults, undeclared ones
     * removed.</p>
     */
    @Override
    public void createStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("create storage", type);
        Table created = new Table(type.propertyNames());
        Table existing = tables.putIfAbsent(type.name(), created);
        if (existing == null) {
            return;
        }
        if (conflicts.repairing()) {
            locked(existing, () -> {
                existing.reconcile(type);
                return null;
            });
            log.debug("Repaired RAM storage of {}", type.name());
        } else {
            conflicts.report(describe() + ": storage for " + type.name() + " already exists.");
        }
    }

    @Override
    public boolean hasStorage(EntityType type) {
        return tables.containsKey(type.name());
    }

    @Override
    public void dropStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("drop storage", type);
        if (tables.remove(type.name()) == null) {
            conflicts.report(describe() + ": no storage found for " + type.name() + ".");
        }
    }

    @Override
    public void addProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("add property " + name, type);
        Table table = tables.get(type.name());
        if (table == null) {
            conflicts.report(describe() + ": no storage found for " + type.name() + ".");
            return;
        }
        Property property = type.property(name);
        boolean added = locked(table, () -> {
            if (!table.columns.add(name)) {
                return false;
            }
            table.rewrite(row -> row.put(name, property.defaultValue()));
            return true;
        });
        if (!added) {
            conflicts.report(describe() + ": " + type.name() + "." + name + " already exists.");
        }
    }

    @Override
    public boolean hasProperty(EntityType type, String name) {
        Table table = tables.get(type.name());
        return table != null && locked(table, () -> table.columns.contains(name));
    }

    @Override
    public void dropProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("drop property " + name, type);
        Table table = tables.get(type.name());
        if (table == null) {
            conflicts.report(describe() + ": no storage found for " + type.name() + ".");
            return;
        }
        boolean dropped = locked(table, () -> {
            if (!table.columns.remove(name)) {
                return false;
            }
            table.indexes.remove(name);
            table.rewrite(row -> row.remove(name));
            return true;
        });
        if (!dropped) {
            conflicts.report(describe() + ": " + type.name() + "." + name + " not found.");
        }
    }

    @Override
    public void renameProperty(EntityType type, String oldName, String newName, Conflicts conflicts) {
        storageLog.ddl("rename property " + oldName + " to " + newName, type);
        Table table = tables.get(type.name());
        if (table == null) {
            conflicts.report(describe() + ": no storage found for " + type.name() + ".");
            return;
        }
        String problem = locked(table, () -> {
            if (!table.columns.contains(oldName)) {
                return type.name() + "." + oldName + " not found.";
            }
            if (table.columns.contains(newName)) {
                return type.name() + "." + newName + " already exists.";
            }
            table.columns = renamed(table.columns, oldName, newName);
            if (table.indexes.remove(oldName)) {
                table.indexes.add(newName);
            }
            table.rewriteAll(row -> {
                Map<String, Object> copy = new LinkedHashMap<>();
                for (Map.Entry<String, Object> entry : row.entrySet()) {
                    copy.put(entry.getKey().equals(oldName) ? newName : entry.getKey(), entry.getValue());
                }
                return copy;
            });
            return null;
        });
        if (problem != null) {
            conflicts.report(describe() + ": " + problem);
        }
    }

    @Override
    public void addIndex(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("add index " + name, type);
        Table table = tables.get(type.name());
        if (table == null) {
            conflicts.report(describe() + ": no storage found for " + type.name() + ".");
            return;
        }
        String problem = locked(table, () -> {
            if (!table.columns.contains(name)) {
                return "cannot index unknown property " + type.name() + "." + name + ".";
            }
            return table.indexes.add(name) ? null : "index on " + type.name() + "." + name + " already exists.";
        });
        if (problem != null) {
            conflicts.report(describe() + ": " + problem);
        }
    }

    @Override
    public boolean hasIndex(EntityType type, String name) {
        Table table = tables.get(type.name());
        return table != null && locked(table, () -> table.indexes.contains(name));
    }

    @Override
    public void dropIndex(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("drop index " + name, type);
        Table table = tables.get(type.name());
        boolean dropped = table != null && locked(table, () -> table.indexes.remove(name));
        if (!dropped) {
            conflicts.report(describe() + ": no index on " + type.name() + "." + name + ".");
        }
    }

    @Override
    public void shutdown(Conflicts conflicts) {
        storageLog.ddl("shutdown", this);
        tables.clear();
        synchronized (this) {
            snapshot = null;
        }
    }

    // ========================================
    // Transactions
    // ========================================

    @Override
    public boolean supportsTransactions() {
        return config.transactional();
    }

    /**
     * Captures the contents of every table.
     *
     * @throws UnsupportedOperationException if not configured as transactional
     */
    @Override
    public synchronized void start() {
        if (!config.transactional()) {
            throw unsupported("start");
        }
        Map<String, Table> captured = new LinkedHashMap<>();
        for (Map.Entry<String, Table> entry : tables.entrySet()) {
            Table table = entry.getValue();
            captured.put(entry.getKey(), locked(table, table::copy));
        }
        snapshot = captured;
        log.debug("RAM transaction started over {} tables", captured.size());
    }

    @Override
    public synchronized void commit() {
        if (!config.transactional()) {
            throw unsupported("commit");
        }
        snapshot = null;
    }

    /**
     * Restores the tables captured by {@link #start()}; without a started
     * transaction there is nothing to restore.
     */
    @Override
    public synchronized void rollback() {
        if (!config.transactional()) {
            throw unsupported("rollback");
        }
        if (snapshot == null) {
            return;
        }
        tables.clear();
        tables.putAll(snapshot);
        log.debug("RAM transaction rolled back to {} tables", snapshot.size());
        snapshot = null;
    }

    // ========================================
    // CacheIntrospection
    // ========================================

    @Override
    public int cachedCount(EntityType type) {
        Table table = tables.get(type.name());
        return table == null ? 0 : locked(table, table.rows::size);
    }

    @Override
    public List<Unit> cachedUnits(EntityType type) {
        Table table = tables.get(type.name());
        if (table == null) {
            return new ArrayList<>();
        }
        List<Map<String, Object>> rows = locked(table, () -> new ArrayList<>(table.rows.values()));
        return rows.stream().map(row -> codec.decode(type, row)).collect(Collectors.toList());
    }

    @Override
    public void flush(EntityType type) {
        Table table = tables.get(type.name());
        if (table != null) {
            locked(table, () -> {
                table.rows.clear();
                return null;
            });
        }
    }

    // ========================================
    // Internals
    // ========================================

    /**
     * @throws IllegalStateException if the type has no storage
     */
    private Table table(EntityType type) {
        Table table = tables.get(type.name());
        if (table == null) {
            throw new IllegalStateException(describe() + " has no storage for " + type.name());
        }
        return table;
    }

    /**
     * Stores the unit's values and cleanses it. Caller holds the table lock.
     */
    private void write(Table table, Unit unit) {
        Map<String, Object> encoded = codec.encode(unit);
        Object key = keyOf(unit, encoded);
        if (config.bounded() && !table.rows.containsKey(key) && table.rows.size() >= config.maxEntriesPerType()) {
            throw new CacheRejectedException(
                describe() + " is full for " + unit.type().name() + " (" + config.maxEntriesPerType() + " entries)");
        }
        table.rows.put(key, encoded);
        unit.cleanse();
    }

    private static Object keyOf(Unit unit, Map<String, Object> encoded) {
        return unit.type().hasIdentifiers() ? unit.identity() : encoded;
    }

    private static <T> T locked(Table table, Supplier<T> work) {
        table.lock.lock();
        try {
            return work.get();
        } finally {
            table.lock.unlock();
        }
    }

    private static Set<String> renamed(Set<String> names, String oldName, String newName) {
        Set<String> result = new LinkedHashSet<>();
        for (String name : names) {
            result.add(name.equals(oldName) ? newName : name);
        }
        return result;
    }

    private String describe() {
        return getClass().getSimpleName();
    }

    /**
     * Rows, declared columns and indexes of one type.
     *
     * <p>Row maps are replaced, never edited in place, so copies of the row
     * collection can be read without the lock.</p>
     */
    private static final class Table {

        final ReentrantLock lock = new ReentrantLock();
        final LinkedHashMap<Object, Map<String, Object>> rows = new LinkedHashMap<>();
        Set<String> columns;
        final Set<String> indexes = new LinkedHashSet<>();

        Table(List<String> columns) {
            this.columns = new LinkedHashSet<>(columns);
        }

        List<Identity> identities() {
            List<Identity> identities = new ArrayList<>(rows.size());
            for (Object key : rows.keySet()) {
                if (key instanceof Identity) {
                    identities.add((Identity) key);
                }
            }
            return identities;
        }

        void rewrite(Consumer<Map<String, Object>> edit) {
            rewriteAll(row -> {
                Map<String, Object> copy = new LinkedHashMap<>(row);
                edit.accept(copy);
                return copy;
            });
        }

        /**
         * Replaces every row; identifier-less rows are re-keyed by their new values.
         */
        void rewriteAll(UnaryOperator<Map<String, Object>> edit) {
            List<Map.Entry<Object, Map<String, Object>>> entries = new ArrayList<>(rows.entrySet());
            rows.clear();
            for (Map.Entry<Object, Map<String, Object>> entry : entries) {
                Map<String, Object> row = edit.apply(entry.getValue());
                rows.put(entry.getKey() instanceof Identity ? entry.getKey() : row, row);
            }
        }

        void reconcile(EntityType type) {
            columns = new LinkedHashSet<>(type.propertyNames());
            rewriteAll(row -> {
                Map<String, Object> copy = new LinkedHashMap<>();
                for (Property property : type.properties()) {
                    copy.put(property.name(),
                        row.containsKey(property.name()) ? row.get(property.name()) : property.defaultValue());
                }
                return copy;
            });
            indexes.retainAll(columns);
        }

        Table copy() {
            Table copy = new Table(new ArrayList<>(columns));
            copy.rows.putAll(rows);
            copy.indexes.addAll(indexes);
            return copy;
        }
    }
}

package com.ryuqq.mnemo.mediator.partition;

import com.ryuqq.mnemo.core.exception.MappingException;
import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Join;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.query.Relation;
import com.ryuqq.mnemo.core.query.Statement;
import com.ryuqq.mnemo.core.spi.Conflicts;
import com.ryuqq.mnemo.core.spi.LogFlag;
import com.ryuqq.mnemo.core.spi.StorageManager;
import com.ryuqq.mnemo.core.storage.StorageLog;
import com.ryuqq.mnemo.core.storage.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * entity type마다 하나 이상의 이름 있는 저장소로 라우팅하는 StorageManager.
 *
 * <p><strong>라우팅:</strong></p>
 * <ul>
 *   <li>타입의 DDL은 라우팅된 모든 저장소로, priority가 낮은 순서대로</li>
 *   <li>타입의 DML은 라우팅된 첫 저장소로</li>
 *   <li>join과 view는 모든 join 타입을 처리하는 저장소 하나로: 명시한 {@link #routeJoin} 항목,
 *       없으면 첫 공통 저장소</li>
 *   <li>database DDL, 트랜잭션, shutdown은 모든 저장소로</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * VerticalPartitioner partitioner = new VerticalPartitioner();
 * partitioner.addStore("archive", jsonStorage);
 * partitioner.addStore("live", ramStorage, 1);
 * partitioner.mapAll(Conflicts.repair());
 *
 * // Visit unit을 RAM에서 JSON 폴더로 이동
 * partitioner.migrate(List.of(visitType), "archive", "live", false);
 * </pre>
 *
 * <p>서로 다른 저장소의 타입을 한 join에 섞는 것은 지원하지 않습니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class VerticalPartitioner implements StorageManager {

    private static final Logger log = LoggerFactory.getLogger(VerticalPartitioner.class);

    /** Priority given to stores added without one. */
    public static final int DEFAULT_PRIORITY = 5;

    /**
     * A store registered under a name.
     *
     * @param name registered name
     * @param store the store
     * @param priority DDL, mapping and shutdown order, lower first
     */
    public record Delegate(String name, StorageManager store, int priority) {

        public Delegate {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (store == null) {
                throw new IllegalArgumentException("store cannot be null");
            }
        }
    }

    private static final Comparator<Delegate> BY_PRIORITY = Comparator.comparingInt(Delegate::priority);

    private final Map<String, Delegate> stores = new LinkedHashMap<>();
    private final Map<EntityType, List<Delegate>> routes = new HashMap<>();
    private final Map<List<EntityType>, Delegate> joinRoutes = new HashMap<>();
    private final TypeRegistry registry = new TypeRegistry();
    private final StorageLog storageLog = new StorageLog(VerticalPartitioner.class);

    /**
     * @param flags logging categories to emit at DEBUG
     */
    public void setLogFlags(Set<LogFlag> flags) {
        storageLog.setFlags(flags);
    }

    // ========================================
    // Store routing
    // ========================================

    public Delegate addStore(String name, StorageManager store) {
        return addStore(name, store, DEFAULT_PRIORITY);
    }

    /**
     * Adds a store and routes every type it has registered to it.
     *
     * <p>The new store becomes the first route of each of its types, so it
     * receives their DML from now on.</p>
     *
     * @param name unique store name
     * @param store the store
     * @param priority DDL, mapping and shutdown order, lower first
     * @return the registered delegate
     * @throws IllegalArgumentException if the name is already taken
     */
    public synchronized Delegate addStore(String name, StorageManager store, int priority) {
        if (stores.containsKey(name)) {
            throw new IllegalArgumentException("Store already added: " + name);
        }
        Delegate delegate = new Delegate(name, store, priority);
        stores.put(name, delegate);
        for (EntityType type : store.classes()) {
            routes.computeIfAbsent(type, t -> new ArrayList<>()).add(0, delegate);
            register(type);
        }
        log.debug("Added store {} ({}) routing {}", name, store, store.classes());
        return delegate;
    }

    /**
     * Removes a store and every route to it.
     *
     * <p>Types left without a store are unregistered.</p>
     *
     * @param name store name
     */
    public synchronized void removeStore(String name) {
        Delegate delegate = stores.remove(name);
        if (delegate == null) {
            return;
        }
        for (EntityType type : new ArrayList<>(routes.keySet())) {
            List<Delegate> delegates = routes.get(type);
            delegates.remove(delegate);
            if (delegates.isEmpty()) {
                routes.remove(type);
                registry.unregister(type);
            }
        }
        joinRoutes.values().removeIf(d -> d.equals(delegate));
    }

    /**
     * Replaces the routes of a type.
     *
     * @param type entity type
     * @param names store names, first one receives DML
     * @throws IllegalArgumentException if a name is unknown or none is given
     */
    public synchronized void route(EntityType type, String... names) {
        if (names.length == 0) {
            throw new IllegalArgumentException("names cannot be empty");
        }
        List<Delegate> delegates = new ArrayList<>();
        for (String name : names) {
            Delegate delegate = delegate(name);
            delegate.store().register(type);
            delegates.add(delegate);
        }
        routes.put(type, delegates);
        register(type);
    }

    /**
     * Sends joins over exactly these types, in this order, to one store.
     *
     * @param types joined types in join order
     * @param name store name
     */
    public synchronized void routeJoin(List<EntityType> types, String name) {
        joinRoutes.put(List.copyOf(types), delegate(name));
    }

    /**
     * @param type entity type
     * @return the stores routed for the type, first one receives DML
     */
    public synchronized List<Delegate> storesFor(EntityType type) {
        return List.copyOf(routes.getOrDefault(type, List.of()));
    }

    /**
     * @param name store name
     * @return the registered delegate
     * @throws IllegalArgumentException if no store has the name
     */
    public synchronized Delegate delegate(String name) {
        Delegate delegate = stores.get(name);
        if (delegate == null) {
            throw new IllegalArgumentException("No store named '" + name + "'");
        }
        return delegate;
    }

    /**
     * @return every registered delegate, in registration order
     */
    public synchronized List<Delegate> delegates() {
        return List.copyOf(stores.values());
    }

    // ========================================
    // Migration
    // ========================================

    /**
     * Copies every unit of the given types to another store.
     *
     * <p>Unless {@code copyOnly}, the units are then destroyed at the source,
     * the source store stops handling the types and the target store is
     * appended to their routes.</p>
     *
     * @param types types to move
     * @param newStoreName target store
     * @param oldStoreName source store, or null for the current first route of each type
     * @param copyOnly true to leave the source and routes untouched
     */
    public void migrate(Collection<EntityType> types, String newStoreName, String oldStoreName, boolean copyOnly) {
        Delegate target = delegate(newStoreName);
        Delegate named = oldStoreName == null ? null : delegate(oldStoreName);
        for (EntityType type : types) {
            Delegate source = named == null ? primary(type) : named;
            if (source.equals(target)) {
                throw new IllegalArgumentException(
                    "Cannot migrate " + type.name() + " from " + source.name() + " to itself");
            }
            StorageManager into = target.store();
            into.register(type);
            if (!into.hasStorage(type)) {
                into.createStorage(type);
            }

            List<Unit> units = source.store().recall(type);
            for (Unit unit : units) {
                into.reserve(unit);
                into.save(unit, true);
                if (!copyOnly) {
                    source.store().destroy(unit);
                }
            }

            if (!copyOnly) {
                reroute(type, source, target, named == null);
            }
            log.info("Migrated {} {} units from {} to {}{}",
                units.size(), type.name(), source.name(), target.name(), copyOnly ? " (copy only)" : "");
        }
    }

    /**
     * Migrates every type of a store, or of every store.
     *
     * @param newStoreName target store
     * @param oldStoreName source store, or null for every type routed elsewhere
     * @param copyOnly true to leave the sources and routes untouched
     */
    public void migrateAll(String newStoreName, String oldStoreName, boolean copyOnly) {
        Delegate target = delegate(newStoreName);
        List<EntityType> types;
        synchronized (this) {
            if (oldStoreName == null) {
                types = routes.entrySet().stream()
                    .filter(e -> !e.getValue().get(0).equals(target))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
            } else {
                Delegate source = delegate(oldStoreName);
                types = routes.entrySet().stream()
                    .filter(e -> e.getValue().contains(source))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toList());
            }
        }
        migrate(types, newStoreName, oldStoreName, copyOnly);
    }

    private synchronized void reroute(EntityType type, Delegate source, Delegate target, boolean allSources) {
        List<Delegate> delegates = routes.computeIfAbsent(type, t -> new ArrayList<>());
        List<Delegate> dropped = allSources ? new ArrayList<>(delegates) : List.of(source);
        for (Delegate delegate : dropped) {
            if (!delegate.equals(target)) {
                delegate.store().unregister(type);
                delegates.remove(delegate);
            }
        }
        if (!delegates.contains(target)) {
            delegates.add(target);
        }
    }

    // ========================================
    // Registration
    // ========================================

    @Override
    public void register(EntityType type) {
        registry.register(type);
        storageLog.register(type);
    }

    @Override
    public synchronized void unregister(EntityType type) {
        registry.unregister(type);
        routes.remove(type);
    }

    @Override
    public Set<EntityType> classes() {
        return registry.snapshot();
    }

    @Override
    public boolean handles(EntityType type) {
        return registry.contains(type);
    }

    /**
     * {@inheritDoc}
     *
     * <p>Types are grouped per store and each store maps its group, lowest
     * priority first.</p>
     *
     * @throws MappingException naming the store that failed
     */
    @Override
    public void map(Collection<EntityType> types, Conflicts conflicts) {
        Map<Delegate, List<EntityType>> groups = new LinkedHashMap<>();
        for (EntityType type : types) {
            for (Delegate delegate : delegatesFor(type)) {
                groups.computeIfAbsent(delegate, d -> new ArrayList<>()).add(type);
            }
        }
        List<Delegate> ordered = new ArrayList<>(groups.keySet());
        ordered.sort(BY_PRIORITY);
        for (Delegate delegate : ordered) {
            try {
                delegate.store().map(groups.get(delegate), conflicts);
            } catch (MappingException e) {
                throw new MappingException(e.getMessage() + " (store: " + delegate.name() + ")", e);
            }
        }
    }

    @Override
    public void shutdown(Conflicts conflicts) {
        for (Delegate delegate : byPriority(delegates())) {
            delegate.store().shutdown(conflicts);
        }
    }

    // ========================================
    // DDL
    // ========================================

    @Override
    public void createDatabase(Conflicts conflicts) {
        storageLog.ddl("create database", this);
        for (Delegate delegate : byPriority(delegates())) {
            delegate.store().createDatabase(conflicts);
        }
    }

    @Override
    public boolean hasDatabase() {
        List<Delegate> all = delegates();
        return !all.isEmpty() && all.stream().allMatch(d -> d.store().hasDatabase());
    }

    @Override
    public void dropDatabase(Conflicts conflicts) {
        storageLog.ddl("drop database", this);
        for (Delegate delegate : byPriority(delegates())) {
            delegate.store().dropDatabase(conflicts);
        }
    }

    @Override
    public void createStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("create storage", type);
        for (Delegate delegate : delegatesFor(type)) {
            delegate.store().createStorage(type, conflicts);
        }
    }

    @Override
    public boolean hasStorage(EntityType type) {
        List<Delegate> delegates = storesFor(type);
        return !delegates.isEmpty() && delegates.stream().allMatch(d -> d.store().hasStorage(type));
    }

    @Override
    public void dropStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("drop storage", type);
        for (Delegate delegate : delegatesFor(type)) {
            delegate.store().dropStorage(type, conflicts);
        }
    }

    @Override
    public void addProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("add property " + name, type);
        for (Delegate delegate : delegatesFor(type)) {
            delegate.store().addProperty(type, name, conflicts);
        }
    }

    @Override
    public boolean hasProperty(EntityType type, String name) {
        List<Delegate> delegates = storesFor(type);
        return !delegates.isEmpty() && delegates.stream().allMatch(d -> d.store().hasProperty(type, name));
    }

    @Override
    public void dropProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("drop property " + name, type);
        for (Delegate delegate : delegatesFor(type)) {
            delegate.store().dropProperty(type, name, conflicts);
        }
    }

    @Override
    public void renameProperty(EntityType type, String oldName, String newName, Conflicts conflicts) {
        storageLog.ddl("rename property " + oldName + " to " + newName, type);
        for (Delegate delegate : delegatesFor(type)) {
            delegate.store().renameProperty(type, oldName, newName, conflicts);
        }
    }

    @Override
    public void addIndex(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("add index " + name, type);
        for (Delegate delegate : delegatesFor(type)) {
            delegate.store().addIndex(type, name, conflicts);
        }
    }

    @Override
    public boolean hasIndex(EntityType type, String name) {
        List<Delegate> delegates = storesFor(type);
        return !delegates.isEmpty() && delegates.stream().allMatch(d -> d.store().hasIndex(type, name));
    }

    @Override
    public void dropIndex(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("drop index " + name, type);
        for (Delegate delegate : delegatesFor(type)) {
            delegate.store().dropIndex(type, name, conflicts);
        }
    }

    // ========================================
    // DML
    // ========================================

    @Override
    public void reserve(Unit unit) {
        storageLog.reserve(unit);
        primary(unit.type()).store().reserve(unit);
    }

    @Override
    public void save(Unit unit, boolean force) {
        storageLog.save(unit, force);
        primary(unit.type()).store().save(unit, force);
    }

    @Override
    public void destroy(Unit unit) {
        storageLog.destroy(unit);
        primary(unit.type()).store().destroy(unit);
    }

    @Override
    public Unit unit(EntityType type, Map<String, ?> filter) {
        return primary(type).store().unit(type, filter);
    }

    @Override
    public Stream<Unit> xrecall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        storageLog.recall(type, restriction);
        return primary(type).store().xrecall(type, restriction, order, limit, offset);
    }

    @Override
    public Stream<List<Unit>> xmultirecall(Join join, Expr restriction, Order order, Integer limit, Integer offset) {
        storageLog.recall(join, restriction);
        return singleStore(join).store().xmultirecall(join, restriction, order, limit, offset);
    }

    @Override
    public Stream<List<Object>> xview(Statement statement) {
        storageLog.view(statement);
        return singleStore(statement.query().relation()).store().xview(statement);
    }

    @Override
    public long count(EntityType type, Expr restriction) {
        return primary(type).store().count(type, restriction);
    }

    @Override
    public List<Object> range(EntityType type, String attribute, Expr restriction) {
        return primary(type).store().range(type, attribute, restriction);
    }

    @Override
    public Number sum(EntityType type, String attribute, Expr restriction) {
        return primary(type).store().sum(type, attribute, restriction);
    }

    /**
     * Picks the one store that answers a relation.
     *
     * @param relation single type or join
     * @return the explicit join route, else the first store routed for every type
     * @throws UnsupportedOperationException if no store handles every type
     */
    public synchronized Delegate singleStore(Relation relation) {
        if (relation instanceof EntityType) {
            return primary((EntityType) relation);
        }
        List<EntityType> types = relation.types();
        Delegate explicit = joinRoutes.get(types);
        if (explicit != null) {
            return explicit;
        }
        for (Delegate candidate : routesFor(types.get(0))) {
            boolean common = true;
            for (EntityType type : types) {
                if (!routes.getOrDefault(type, List.of()).contains(candidate)) {
                    common = false;
                    break;
                }
            }
            if (common) {
                return candidate;
            }
        }
        throw new UnsupportedOperationException(
            "This operation does not support multiple types in disparate stores: " + relation);
    }

    // ========================================
    // Transactions
    // ========================================

    @Override
    public boolean supportsTransactions() {
        return delegates().stream().anyMatch(d -> d.store().supportsTransactions());
    }

    @Override
    public void start() {
        for (Delegate delegate : delegates()) {
            if (delegate.store().supportsTransactions()) {
                delegate.store().start();
            }
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>Stores commit one after another; a failure leaves earlier stores committed.</p>
     */
    @Override
    public void commit() {
        for (Delegate delegate : delegates()) {
            if (delegate.store().supportsTransactions()) {
                delegate.store().commit();
            }
        }
    }

    @Override
    public void rollback() {
        for (Delegate delegate : delegates()) {
            if (delegate.store().supportsTransactions()) {
                delegate.store().rollback();
            }
        }
    }

    // ========================================
    // Internals
    // ========================================

    private synchronized Delegate primary(EntityType type) {
        return routesFor(type).get(0);
    }

    private synchronized List<Delegate> delegatesFor(EntityType type) {
        return byPriority(routesFor(type));
    }

    private List<Delegate> routesFor(EntityType type) {
        List<Delegate> delegates = routes.get(type);
        if (delegates == null || delegates.isEmpty()) {
            throw new IllegalStateException("No store handles " + type.name());
        }
        return delegates;
    }

    private static List<Delegate> byPriority(List<Delegate> delegates) {
        List<Delegate> sorted = new ArrayList<>(delegates);
        sorted.sort(BY_PRIORITY);
        return sorted;
    }

    @Override
    public String toString() {
        return "VerticalPartitioner" + delegates().stream().map(Delegate::name).collect(Collectors.toList());
    }
}

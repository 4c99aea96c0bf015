package com.ryuqq.mnemo.mediator.cache;

import com.ryuqq.mnemo.adapter.inmemory.RamStorage;
import com.ryuqq.mnemo.core.exception.CacheRejectedException;
import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Identity;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Join;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.query.Statement;
import com.ryuqq.mnemo.core.spi.CacheIntrospection;
import com.ryuqq.mnemo.core.spi.Conflicts;
import com.ryuqq.mnemo.core.spi.LogFlag;
import com.ryuqq.mnemo.core.spi.StorageManager;
import com.ryuqq.mnemo.core.storage.Joins;
import com.ryuqq.mnemo.core.storage.Paginator;
import com.ryuqq.mnemo.core.storage.StorageLog;
import com.ryuqq.mnemo.core.storage.TypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 원본 next 저장소 앞에서 recall된 unit을 캐시 저장소에 보관하는 StorageManager.
 *
 * <p>두 저장소 모두 참조로 보관하고 명시적으로 호출합니다. 식별자를 선언하고 캐시 저장소가
 * 처리하는 타입만 캐시하며, 나머지 타입은 next 저장소로 바로 갑니다.</p>
 *
 * <p><strong>쓰기 경로:</strong></p>
 * <ul>
 *   <li>{@code reserve}, {@code save}: next 저장소 먼저, 그 다음 캐시</li>
 *   <li>{@code destroy}: next 저장소 후 캐시 항목 무효화</li>
 *   <li>캐시의 {@link CacheRejectedException}은 DEBUG 로그 후 무시</li>
 * </ul>
 *
 * <p><strong>읽기 경로:</strong></p>
 * <ul>
 *   <li>{@code unit}: 캐시, miss이면 next 저장소</li>
 *   <li>{@code fullQuery}인 {@code xrecall}: 캐시 먼저, 이후 캐시에 없던 identity를 next 저장소에서.
 *       fullQuery가 아니거나 order가 있으면 next 저장소만</li>
 *   <li>{@code fullJoin}인 {@code xmultirecall}: 이 캐시 위에서 메모리 join. 아니면 next 저장소만</li>
 *   <li>next 저장소에서 읽은 unit은 캐시에 기록</li>
 *   <li>view와 집계는 항상 next 저장소</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * RamStorage ram = new RamStorage(new RamStorageConfig().withMaxEntriesPerType(10_000));
 * ObjectCache store = new ObjectCache(database, ram, new ObjectCacheConfig().withFullQuery(true));
 * store.register(zooType);
 * store.cacheTypes(zooType);
 * store.mapAll(Conflicts.repair());
 * </pre>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class ObjectCache implements StorageManager {

    private static final Logger log = LoggerFactory.getLogger(ObjectCache.class);

    protected final StorageManager next;
    protected final StorageManager cache;
    protected final StorageLog storageLog;
    private final ObjectCacheConfig config;
    private final TypeRegistry registry = new TypeRegistry();

    /**
     * 무제한 {@link RamStorage}를 캐시로 쓰는 기본 설정 생성자.
     *
     * @param next authoritative store
     */
    public ObjectCache(StorageManager next) {
        this(next, new RamStorage(), new ObjectCacheConfig());
    }

    /**
     * @param next authoritative store
     * @param cache store holding cached copies
     * @param config read path settings
     * @throws IllegalArgumentException if any argument is null
     */
    public ObjectCache(StorageManager next, StorageManager cache, ObjectCacheConfig config) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.next = next;
        this.cache = cache;
        this.config = config;
        this.storageLog = new StorageLog(getClass());
    }

    /**
     * @return the authoritative store
     */
    public StorageManager next() {
        return next;
    }

    /**
     * @return the store holding cached copies
     */
    public StorageManager cache() {
        return cache;
    }

    /**
     * @return the read path settings
     */
    public ObjectCacheConfig config() {
        return config;
    }

    /**
     * @param flags logging categories to emit at DEBUG
     */
    public void setLogFlags(Set<LogFlag> flags) {
        storageLog.setFlags(flags);
    }

    /**
     * Registers types with the cache store, making them cached.
     *
     * @param types types to cache
     */
    public void cacheTypes(EntityType... types) {
        for (EntityType type : types) {
            cache.register(type);
        }
    }

    /**
     * @param type entity type
     * @return true if units of the type are kept in the cache store
     */
    public boolean caches(EntityType type) {
        return type.hasIdentifiers() && cache.handles(type);
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
    public void unregister(EntityType type) {
        registry.unregister(type);
    }

    @Override
    public Set<EntityType> classes() {
        return registry.snapshot();
    }

    @Override
    public boolean handles(EntityType type) {
        return registry.contains(type);
    }

    @Override
    public void map(Collection<EntityType> types, Conflicts conflicts) {
        next.map(types, conflicts);
        List<EntityType> cached = types.stream().filter(cache::handles).collect(Collectors.toList());
        if (!cached.isEmpty()) {
            cache.map(cached, conflicts);
        }
    }

    @Override
    public void shutdown(Conflicts conflicts) {
        cache.shutdown(conflicts);
        next.shutdown(conflicts);
    }

    // ========================================
    // DDL
    // ========================================

    @Override
    public void createDatabase(Conflicts conflicts) {
        storageLog.ddl("create database", this);
        if (config.databaseScope()) {
            next.createDatabase(conflicts);
        }
        cache.createDatabase(conflicts);
    }

    @Override
    public boolean hasDatabase() {
        return next.hasDatabase();
    }

    @Override
    public void dropDatabase(Conflicts conflicts) {
        storageLog.ddl("drop database", this);
        if (config.databaseScope()) {
            next.dropDatabase(conflicts);
        }
        cache.dropDatabase(conflicts);
    }

    @Override
    public void createStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("create storage", type);
        next.createStorage(type, conflicts);
        if (cache.handles(type)) {
            cache.createStorage(type, conflicts);
        }
    }

    @Override
    public boolean hasStorage(EntityType type) {
        return next.hasStorage(type);
    }

    @Override
    public void dropStorage(EntityType type, Conflicts conflicts) {
        storageLog.ddl("drop storage", type);
        next.dropStorage(type, conflicts);
        if (cache.handles(type)) {
            cache.dropStorage(type, conflicts);
        }
    }

    @Override
    public void addProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("add property " + name, type);
        next.addProperty(type, name, conflicts);
        if (cache.handles(type)) {
            cache.addProperty(type, name, conflicts);
        }
    }

    @Override
    public boolean hasProperty(EntityType type, String name) {
        return next.hasProperty(type, name);
    }

    @Override
    public void dropProperty(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("drop property " + name, type);
        next.dropProperty(type, name, conflicts);
        if (cache.handles(type)) {
            cache.dropProperty(type, name, conflicts);
        }
    }

    @Override
    public void renameProperty(EntityType type, String oldName, String newName, Conflicts conflicts) {
        storageLog.ddl("rename property " + oldName + " to " + newName, type);
        next.renameProperty(type, oldName, newName, conflicts);
        if (cache.handles(type)) {
            cache.renameProperty(type, oldName, newName, conflicts);
        }
    }

    @Override
    public void addIndex(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("add index " + name, type);
        next.addIndex(type, name, conflicts);
    }

    @Override
    public boolean hasIndex(EntityType type, String name) {
        return next.hasIndex(type, name);
    }

    @Override
    public void dropIndex(EntityType type, String name, Conflicts conflicts) {
        storageLog.ddl("drop index " + name, type);
        next.dropIndex(type, name, conflicts);
    }

    // ========================================
    // DML
    // ========================================

    /**
     * {@inheritDoc}
     *
     * <p>The next store assigns identifiers; the unit is cached only if the
     * next store left it clean.</p>
     */
    @Override
    public void reserve(Unit unit) {
        storageLog.reserve(unit);
        next.reserve(unit);
        if (caches(unit.type()) && !unit.isDirty()) {
            try {
                cache.reserve(unit);
            } catch (CacheRejectedException e) {
                log.debug("Cache refused reserved {}: {}", unit, e.getMessage());
            }
        }
    }

    @Override
    public void save(Unit unit, boolean force) {
        storageLog.save(unit, force);
        boolean updateCache = caches(unit.type()) && (force || unit.isDirty());
        next.save(unit, force);
        if (updateCache) {
            remember(unit);
        }
    }

    @Override
    public void destroy(Unit unit) {
        storageLog.destroy(unit);
        next.destroy(unit);
        if (caches(unit.type())) {
            invalidate(unit);
        }
    }

    @Override
    public Unit unit(EntityType type, Map<String, ?> filter) {
        if (!caches(type)) {
            return next.unit(type, filter);
        }
        Unit cached = cache.unit(type, filter);
        if (cached != null) {
            return cached;
        }
        Unit stored = next.unit(type, filter);
        if (stored != null) {
            remember(stored);
        }
        return stored;
    }

    /**
     * {@inheritDoc}
     *
     * <p>With {@code fullQuery} the limit spans both passes: cached units
     * count against it before the next store is asked for the rest.</p>
     */
    @Override
    public Stream<Unit> xrecall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        Paginator.validate(order, limit, offset);
        storageLog.recall(type, restriction);
        if (!caches(type)) {
            return next.xrecall(type, restriction, order, limit, offset);
        }
        if (Paginator.isEmptyLimit(limit)) {
            return Stream.empty();
        }
        if (order != null || !config.fullQuery()) {
            return next.xrecall(type, restriction, order, limit, offset).map(this::remembered);
        }

        List<Unit> cached = cache.recall(type, restriction, null, limit, null);
        if (limit != null && cached.size() >= limit) {
            return cached.stream();
        }
        Set<Identity> seen = new HashSet<>();
        for (Unit unit : cached) {
            seen.add(unit.identity());
        }
        Stream<Unit> stored = next.xrecall(type, restriction)
            .filter(unit -> !seen.contains(unit.identity()))
            .map(this::remembered);
        if (limit != null) {
            stored = stored.limit(limit - cached.size());
        }
        return Stream.concat(cached.stream(), stored);
    }

    @Override
    public Stream<List<Unit>> xmultirecall(Join join, Expr restriction, Order order, Integer limit, Integer offset) {
        Paginator.validate(order, limit, offset);
        storageLog.recall(join, restriction);
        if (Paginator.isEmptyLimit(limit)) {
            return Stream.empty();
        }
        if (config.fullJoin()) {
            Stream<List<Unit>> rows = Joins.combine(this, join).stream()
                .filter(row -> restriction == null || restriction.test(row));
            return Paginator.rows(rows, order, limit, offset);
        }
        List<Set<Identity>> seen = new ArrayList<>();
        for (int i = 0; i < join.types().size(); i++) {
            seen.add(new HashSet<>());
        }
        return next.xmultirecall(join, restriction, order, limit, offset).map(row -> {
            for (int i = 0; i < row.size(); i++) {
                Unit unit = row.get(i);
                if (unit != null
                    && caches(unit.type())
                    && unit.type().sequencer().validId(unit.identity())
                    && seen.get(i).add(unit.identity())) {
                    remember(unit);
                }
            }
            return row;
        });
    }

    @Override
    public Stream<List<Object>> xview(Statement statement) {
        storageLog.view(statement);
        return next.xview(statement);
    }

    @Override
    public long count(EntityType type, Expr restriction) {
        return next.count(type, restriction);
    }

    @Override
    public List<Object> range(EntityType type, String attribute, Expr restriction) {
        return next.range(type, attribute, restriction);
    }

    @Override
    public Number sum(EntityType type, String attribute, Expr restriction) {
        return next.sum(type, attribute, restriction);
    }

    // ========================================
    // Transactions
    // ========================================

    @Override
    public boolean supportsTransactions() {
        return next.supportsTransactions();
    }

    @Override
    public void start() {
        next.start();
        if (cache.supportsTransactions()) {
            cache.start();
        }
    }

    @Override
    public void commit() {
        next.commit();
        if (cache.supportsTransactions()) {
            cache.commit();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>A cache store without transactions is emptied instead, since it may
     * hold writes the next store just discarded.</p>
     */
    @Override
    public void rollback() {
        next.rollback();
        if (cache.supportsTransactions()) {
            cache.rollback();
            return;
        }
        for (EntityType type : cache.classes()) {
            if (cache.hasStorage(type)) {
                evict(type);
            }
        }
    }

    // ========================================
    // Cache maintenance
    // ========================================

    /**
     * Drops a unit from the cache store.
     *
     * @param unit unit whose cached copy is no longer valid
     */
    protected void invalidate(Unit unit) {
        cache.destroy(unit);
    }

    /**
     * Drops every cached unit of a type.
     *
     * @param type entity type
     */
    protected void evict(EntityType type) {
        if (cache instanceof CacheIntrospection) {
            ((CacheIntrospection) cache).flush(type);
            return;
        }
        for (Unit unit : cache.recall(type)) {
            invalidate(unit);
        }
    }

    /**
     * Writes a copy of the unit to the cache store, dropping rejections.
     *
     * @param unit unit read from or written to the next store
     */
    protected void remember(Unit unit) {
        try {
            cache.save(unit, true);
        } catch (CacheRejectedException e) {
            log.debug("Cache refused {}: {}", unit, e.getMessage());
        }
    }

    private Unit remembered(Unit unit) {
        remember(unit);
        return unit;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + next + ", cache=" + cache + ")";
    }
}

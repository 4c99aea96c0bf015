package com.ryuqq.mnemo.core.sandbox;

import com.ryuqq.mnemo.core.exception.UnrecallableException;
import com.ryuqq.mnemo.core.expr.Attr;
import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.expr.Exprs;
import com.ryuqq.mnemo.core.expr.Values;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Identity;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Join;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.query.Query;
import com.ryuqq.mnemo.core.query.Statement;
import com.ryuqq.mnemo.core.spi.StorageManager;
import com.ryuqq.mnemo.core.storage.Paginator;
import com.ryuqq.mnemo.core.storage.Views;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 저장소 하나 위의 unit identity map.
 *
 * <p>sandbox는 하나의 실행 흐름이 쓰는 작업 집합입니다. 내어준 모든 unit을 타입과
 * identity로 캐시하므로 같은 entity는 항상 같은 객체로 표현되고, 저장 전의 수정도
 * 이후 조회에서 보입니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>(type, identity)당 살아 있는 unit은 최대 하나. 같은 identity를 다시 읽으면 캐시된 인스턴스 반환</li>
 *   <li>Read-your-own-writes: memorize하거나 수정한 unit은 이후 조회에서 보임</li>
 *   <li>캐시 상태가 우선: 이미 캐시된 identity의 저장된 row는 건너뜀</li>
 * </ul>
 *
 * <p><strong>생명주기:</strong></p>
 * <pre>
 * memorize  → 저장소에 reserve, 캐시, bind
 * unit / xrecall / recall → 캐시 또는 저장소에서 읽고 캐시, bind (recall hook이 거부 가능)
 * forget    → 캐시에서 제거, 저장소에서 삭제, unbind
 * repress   → repress hook, 저장, 캐시에서 제거, unbind
 * flushAll  → 전체 repress hook, 저장 후 전체 제거, commit
 * rollback  → 캐시 폐기, 저장소 rollback
 * </pre>
 *
 * <p><strong>Join 격리:</strong> join recall은 sandbox에 이미 있는 identity를 캐시된
 * 인스턴스로 바꾸지만 row 선택은 저장소가 합니다. 저장하지 않은 수정 값으로 제한한
 * join은 저장된 값 기준으로 row를 놓치거나 포함할 수 있습니다.</p>
 *
 * <p><strong>Thread-safety:</strong> thread-safe하지 않습니다. 스레드마다 sandbox를 하나씩 쓰고,
 * 그 아래의 저장소를 공유합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class Sandbox {

    private static final Logger log = LoggerFactory.getLogger(Sandbox.class);

    private final StorageManager store;
    private final Map<EntityType, Map<Object, Unit>> caches = new LinkedHashMap<>();
    private final Map<String, Recaller> recallers;

    /**
     * 생성자. 저장소에 등록된 타입으로 recaller 테이블을 구성합니다.
     *
     * @param store storage manager underneath
     * @throws IllegalArgumentException if store is null
     */
    public Sandbox(StorageManager store) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        this.store = store;
        this.recallers = buildRecallers(store);
    }

    /**
     * @return the storage manager underneath
     */
    public StorageManager store() {
        return store;
    }

    // ========================================
    // Scoped use
    // ========================================

    /**
     * Runs work in this sandbox: flushes once on success, rolls back once on failure.
     *
     * @param work the unit of work
     * @param <T> result type
     * @return the work's result
     */
    public <T> T execute(SandboxWork<T> work) {
        T result;
        try {
            result = work.apply(this);
        } catch (RuntimeException | Error e) {
            log.debug("Sandbox work failed, rolling back: {}", e.toString());
            rollback();
            throw e;
        }
        flushAll();
        return result;
    }

    /**
     * @param work the unit of work
     * @see #execute(SandboxWork)
     */
    public void run(Consumer<Sandbox> work) {
        execute(sandbox -> {
            work.accept(sandbox);
            return null;
        });
    }

    // ========================================
    // Recallers
    // ========================================

    /**
     * @param typeName registered type name
     * @return positional lookup for the type
     * @throws IllegalArgumentException if the store had no such type when this sandbox was created
     */
    public Recaller recaller(String typeName) {
        Recaller recaller = recallers.get(typeName);
        if (recaller == null) {
            throw new IllegalArgumentException("No registered type found for '" + typeName + "'");
        }
        return recaller;
    }

    private Map<String, Recaller> buildRecallers(StorageManager source) {
        Map<String, Recaller> table = new LinkedHashMap<>();
        for (EntityType type : source.classes()) {
            List<String> keys = type.hasIdentifiers() ? type.identifiers() : type.propertyNames();
            table.put(type.name(), values -> {
                if (values.length > keys.size()) {
                    throw new IllegalArgumentException(
                        type.name() + " takes at most " + keys.size() + " lookup values " + keys);
                }
                Map<String, Object> filter = new LinkedHashMap<>();
                for (int i = 0; i < values.length; i++) {
                    filter.put(keys.get(i), values[i]);
                }
                return unit(type, filter);
            });
        }
        return Collections.unmodifiableMap(table);
    }

    // ========================================
    // Memorize / forget / repress
    // ========================================

    /**
     * Reserves new units in the store and caches them.
     *
     * <p>A unit whose reserve fails is left unbound and uncached.</p>
     *
     * @param units new units
     */
    public void memorize(Unit... units) {
        for (Unit unit : units) {
            unit.bindTo(this);
            try {
                store.reserve(unit);
            } catch (RuntimeException e) {
                unit.bindTo(null);
                throw e;
            }
            cache(unit.type()).put(keyOf(unit), unit);
            unit.type().hooks().onMemorize(unit);
        }
    }

    /**
     * Removes units from this sandbox and destroys them in the store.
     *
     * @param units units to forget
     */
    public void forget(Unit... units) {
        for (Unit unit : units) {
            cache(unit.type()).remove(keyOf(unit));
            store.destroy(unit);
            unit.type().hooks().onForget(unit);
            unit.bindTo(null);
        }
    }

    /**
     * Saves units and evicts them from this sandbox.
     *
     * @param units units to repress
     */
    public void repress(Unit... units) {
        for (Unit unit : units) {
            unit.type().hooks().onRepress(unit);
            store.save(unit);
            cache(unit.type()).remove(keyOf(unit));
            unit.bindTo(null);
        }
    }

    // ========================================
    // Single-unit lookup
    // ========================================

    /**
     * Returns the unit whose properties equal the filter values.
     *
     * <p>A filter on exactly the identifiers of the type is answered from the
     * cache when possible. Any other filter scans the cached units first, so
     * uncommitted edits are honoured, before asking the store.</p>
     *
     * @param type entity type
     * @param filter property name to value
     * @return the unit, or null if none matches or the recall hook vetoed it
     */
    public Unit unit(EntityType type, Map<String, ?> filter) {
        Map<Object, Unit> cache = cache(type);

        if (type.hasIdentifiers() && filter.keySet().equals(new HashSet<>(type.identifiers()))) {
            List<Object> ids = new ArrayList<>();
            for (String identifier : type.identifiers()) {
                ids.add(filter.get(identifier));
            }
            Unit cached = cache.get(Identity.of(ids));
            if (cached != null) {
                return cached;
            }
            Unit loaded = store.unit(type, filter);
            return loaded == null ? null : admit(loaded);
        }

        for (Unit cached : new ArrayList<>(cache.values())) {
            if (matches(cached, filter)) {
                return cached;
            }
        }
        Unit loaded = store.unit(type, filter);
        if (loaded == null) {
            return null;
        }
        if (!type.hasIdentifiers()) {
            return recallDetached(loaded);
        }
        return admit(loaded);
    }

    /**
     * @param type entity type
     * @param keyValues alternating property names and values
     * @return the unit, or null
     * @see #unit(EntityType, Map)
     */
    public Unit unit(EntityType type, Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("keyValues must alternate names and values");
        }
        Map<String, Object> filter = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            filter.put((String) keyValues[i], keyValues[i + 1]);
        }
        return unit(type, filter);
    }

    // ========================================
    // Recall
    // ========================================

    /**
     * Recalls units lazily, cached instances first.
     *
     * <p>Without order or offset the cached units are scanned first and the store
     * second, skipping stored rows whose identity was cached when the call started.
     * With an order, order/limit/offset are pushed to the store and cached instances
     * are substituted for identities already in this sandbox.</p>
     *
     * @param type entity type
     * @param restriction row filter, null for all
     * @param order sort order, may be null
     * @param limit maximum count over both passes, may be null
     * @param offset rows to skip; requires order
     * @return stream of sandboxed units
     * @throws IllegalArgumentException if offset is given without order
     */
    public Stream<Unit> xrecall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        Paginator.validate(order, limit, offset);
        if (Paginator.isEmptyLimit(limit)) {
            return Stream.empty();
        }
        boolean ordered = !Order.isEmpty(order);
        boolean offsetGiven = offset != null && offset > 0;

        if (!type.hasIdentifiers()) {
            return store.xrecall(type, restriction, order, limit, offset)
                .map(this::recallDetached)
                .filter(Objects::nonNull);
        }

        Map<Object, Unit> cache = cache(type);

        if (!ordered && !offsetGiven) {
            Optional<Identity> identity = Exprs.identifierEquality(restriction, type);
            if (identity.isPresent()) {
                Unit cached = cache.get(identity.get());
                if (cached != null) {
                    return Stream.of(cached);
                }
            }
        }

        if (ordered) {
            return store.xrecall(type, restriction, order, limit, offset)
                .map(this::admit)
                .filter(Objects::nonNull);
        }

        List<Object> keys = new ArrayList<>(cache.keySet());
        Set<Object> seen = new HashSet<>(keys);
        Stream<Unit> cachePass = keys.stream()
            .map(cache::get)
            .filter(Objects::nonNull)
            .filter(unit -> restriction == null || restriction.test(unit));
        Stream<Unit> storePass = Stream.of(type)
            .flatMap(t -> store.xrecall(t, restriction))
            .filter(unit -> !seen.contains(unit.identity()))
            .map(this::admit)
            .filter(Objects::nonNull);
        Stream<Unit> units = Stream.concat(cachePass, storePass);
        return limit == null ? units : units.limit(limit);
    }

    public Stream<Unit> xrecall(EntityType type, Expr restriction) {
        return xrecall(type, restriction, null, null, null);
    }

    public Stream<Unit> xrecall(EntityType type) {
        return xrecall(type, null, null, null, null);
    }

    public List<Unit> recall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        try (Stream<Unit> units = xrecall(type, restriction, order, limit, offset)) {
            return units.collect(Collectors.toList());
        }
    }

    public List<Unit> recall(EntityType type, Expr restriction) {
        return recall(type, restriction, null, null, null);
    }

    public List<Unit> recall(EntityType type) {
        return recall(type, null, null, null, null);
    }

    /**
     * Recalls joined rows lazily, substituting cached instances.
     *
     * <p>Positions holding an outer-join placeholder (an identity the sequencer
     * rejects) are passed through unchanged.</p>
     *
     * @param join joined relation
     * @param restriction row filter over joined positions
     * @param order sort order
     * @param limit maximum count
     * @param offset rows to skip; requires order
     * @return stream of rows
     */
    public Stream<List<Unit>> xrecall(Join join, Expr restriction, Order order, Integer limit, Integer offset) {
        return store.xmultirecall(join, restriction, order, limit, offset)
            .map(this::admitRow)
            .filter(Objects::nonNull);
    }

    public List<List<Unit>> recall(Join join, Expr restriction, Order order, Integer limit, Integer offset) {
        try (Stream<List<Unit>> rows = xrecall(join, restriction, order, limit, offset)) {
            return rows.collect(Collectors.toList());
        }
    }

    public List<List<Unit>> recall(Join join, Expr restriction) {
        return recall(join, restriction, null, null, null);
    }

    // ========================================
    // Views and aggregates
    // ========================================

    /**
     * Projects rows, cached units first.
     *
     * <p>Identifier columns missing from the projection are added for the store
     * query, used to skip identities already cached, and stripped again.
     * Joins and identifier-less types are answered by the store alone.</p>
     *
     * @param query projection
     * @param distinct true to drop duplicate rows
     * @return value rows
     */
    public Stream<List<Object>> xview(Query query, boolean distinct) {
        Statement statement = Statement.of(query).withDistinct(distinct);
        if (!(query.relation() instanceof EntityType)) {
            return store.xview(statement);
        }
        EntityType type = (EntityType) query.relation();
        if (!type.hasIdentifiers()) {
            return store.xview(statement);
        }

        List<Expr> fields = new ArrayList<>(query.attributes());
        List<Integer> identityColumns = new ArrayList<>();
        int added = 0;
        for (String identifier : type.identifiers()) {
            int column = indexOfAttribute(fields, identifier);
            if (column < 0) {
                fields.add(new Attr(0, identifier));
                added++;
                column = fields.size() - 1;
            }
            identityColumns.add(column);
        }
        int width = fields.size() - added;

        Map<Object, Unit> cache = cache(type);
        List<Unit> cachedUnits = new ArrayList<>(cache.values());
        Set<Object> cachedIds = new HashSet<>(cache.keySet());
        Expr restriction = query.restriction();

        Stream<List<Object>> cachePass = cachedUnits.stream()
            .filter(unit -> restriction == null || restriction.test(unit))
            .map(unit -> Views.project(query.attributes(), List.of(unit)));
        Stream<List<Object>> storePass = Stream.of(new Query(type, fields, restriction))
            .flatMap(augmented -> store.xview(Statement.of(augmented).withDistinct(distinct)))
            .filter(row -> !cachedIds.contains(identityOf(row, identityColumns)))
            .map(row -> Collections.unmodifiableList(new ArrayList<>(row.subList(0, width))));
        Stream<List<Object>> rows = Stream.concat(cachePass, storePass);
        return distinct ? rows.distinct() : rows;
    }

    public List<List<Object>> view(Query query, boolean distinct) {
        try (Stream<List<Object>> rows = xview(query, distinct)) {
            return rows.collect(Collectors.toList());
        }
    }

    public List<List<Object>> view(Query query) {
        return view(query, false);
    }

    /**
     * @param type entity type
     * @param restriction row filter, may be null
     * @return number of distinct units, edits in this sandbox included
     */
    public long count(EntityType type, Expr restriction) {
        return Views.count(this::xview, type, restriction);
    }

    /**
     * @param type entity type
     * @param attribute property name
     * @param restriction row filter, may be null
     * @return sorted distinct values, dense for integral and date properties
     */
    public List<Object> range(EntityType type, String attribute, Expr restriction) {
        return Views.range(this::xview, type, attribute, restriction);
    }

    /**
     * @param type entity type
     * @param attribute numeric property name
     * @param restriction row filter, may be null
     * @return sum of the non-null values
     */
    public Number sum(EntityType type, String attribute, Expr restriction) {
        return Views.sum(this::xview, type, attribute, restriction);
    }

    // ========================================
    // Flush and transactions
    // ========================================

    /**
     * Represses every cached unit, then commits the store.
     *
     * <p>All repress hooks run before any unit is saved, so hooks may still edit
     * other cached units.</p>
     */
    public void flushAll() {
        List<Map<Object, Unit>> all = new ArrayList<>(caches.values());
        for (Map<Object, Unit> cache : all) {
            for (Unit unit : new ArrayList<>(cache.values())) {
                unit.type().hooks().onRepress(unit);
            }
        }
        int flushed = 0;
        for (Map<Object, Unit> cache : all) {
            List<Unit> units = new ArrayList<>(cache.values());
            cache.clear();
            for (Unit unit : units) {
                store.save(unit);
                unit.bindTo(null);
                flushed++;
            }
        }
        log.debug("Sandbox flushed {} units", flushed);
        commit();
    }

    /**
     * Starts a store transaction if the store supports them.
     */
    public void start() {
        if (store.supportsTransactions()) {
            store.start();
        }
    }

    /**
     * Commits the store transaction if the store supports them.
     */
    public void commit() {
        if (store.supportsTransactions()) {
            store.commit();
        }
    }

    /**
     * Discards every cached unit and rolls back the store if it supports transactions.
     */
    public void rollback() {
        for (Map<Object, Unit> cache : caches.values()) {
            for (Unit unit : cache.values()) {
                unit.bindTo(null);
            }
        }
        caches.clear();
        if (store.supportsTransactions()) {
            store.rollback();
        }
    }

    /**
     * Discards the cached units of one type without saving them.
     *
     * @param type entity type
     */
    public void purge(EntityType type) {
        Map<Object, Unit> cache = caches.remove(type);
        if (cache != null) {
            for (Unit unit : cache.values()) {
                unit.bindTo(null);
            }
        }
    }

    // ========================================
    // Diagnostics
    // ========================================

    /**
     * @param type entity type
     * @return number of cached units of the type
     */
    public int cachedCount(EntityType type) {
        Map<Object, Unit> cache = caches.get(type);
        return cache == null ? 0 : cache.size();
    }

    /**
     * @param unit any unit
     * @return true if this exact instance is cached here
     */
    public boolean contains(Unit unit) {
        Map<Object, Unit> cache = caches.get(unit.type());
        return cache != null && cache.get(keyOf(unit)) == unit;
    }

    // ========================================
    // Internals
    // ========================================

    private Map<Object, Unit> cache(EntityType type) {
        return caches.computeIfAbsent(type, t -> new LinkedHashMap<>());
    }

    private static Object keyOf(Unit unit) {
        if (unit.type().hasIdentifiers()) {
            return unit.identity();
        }
        return new InstanceKey(unit);
    }

    /**
     * Caches a freshly loaded unit, unless its identity is already cached,
     * in which case the cached instance wins.
     */
    private Unit admit(Unit loaded) {
        Map<Object, Unit> cache = cache(loaded.type());
        Identity identity = loaded.identity();
        Unit existing = cache.get(identity);
        if (existing != null) {
            return existing;
        }
        loaded.bindTo(this);
        cache.put(identity, loaded);
        if (!recalled(loaded)) {
            cache.remove(identity);
            loaded.bindTo(null);
            return null;
        }
        return loaded;
    }

    private Unit recallDetached(Unit loaded) {
        loaded.bindTo(this);
        if (!recalled(loaded)) {
            loaded.bindTo(null);
            return null;
        }
        return loaded;
    }

    private List<Unit> admitRow(List<Unit> row) {
        List<Unit> admitted = new ArrayList<>(row);
        for (int i = 0; i < admitted.size(); i++) {
            Unit unit = admitted.get(i);
            EntityType type = unit.type();
            if (!type.hasIdentifiers() || !type.sequencer().validId(unit.identity())) {
                continue;
            }
            Unit sandboxed = admit(unit);
            if (sandboxed == null) {
                return null;
            }
            admitted.set(i, sandboxed);
        }
        return admitted;
    }

    private boolean recalled(Unit unit) {
        try {
            unit.type().hooks().onRecall(unit);
            return true;
        } catch (UnrecallableException e) {
            log.debug("Recall of {} vetoed: {}", unit, e.getMessage());
            return false;
        }
    }

    private static boolean matches(Unit unit, Map<String, ?> filter) {
        for (Map.Entry<String, ?> entry : filter.entrySet()) {
            if (!Values.equal(unit.get(entry.getKey()), entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static int indexOfAttribute(List<Expr> fields, String name) {
        for (int i = 0; i < fields.size(); i++) {
            Expr field = fields.get(i);
            if (field instanceof Attr && ((Attr) field).arg() == 0 && ((Attr) field).name().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    private static Identity identityOf(List<Object> row, List<Integer> columns) {
        List<Object> ids = new ArrayList<>(columns.size());
        for (int column : columns) {
            ids.add(row.get(column));
        }
        return Identity.of(ids);
    }

    /**
     * Cache key of units without identifiers: the instance itself.
     */
    private static final class InstanceKey {

        private final Unit unit;

        InstanceKey(Unit unit) {
            this.unit = unit;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof InstanceKey && ((InstanceKey) o).unit == unit;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(unit);
        }
    }
}

package com.ryuqq.mnemo.mediator.cache;

import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Identity;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.spi.StorageManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 캐시된 unit의 마지막 접근 시각을 기록하고, cutoff 이후 접근되지 않은 unit을 제거하는 object cache.
 *
 * <p><strong>접근 기록 시점:</strong></p>
 * <ul>
 *   <li>{@code reserve}</li>
 *   <li>{@code unit} - 반환된 unit</li>
 *   <li>{@code xrecall} - 반환된 모든 unit, recall 시작 시각으로 기록</li>
 * </ul>
 *
 * <p>스윕은 명시적으로 호출합니다. 주기 실행은 {@link CacheSweeper}가 담당합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 * @see CacheSweeper
 */
public class AgedCache extends ObjectCache {

    private static final Logger log = LoggerFactory.getLogger(AgedCache.class);

    private final Clock clock;
    private final Map<EntityType, Map<Identity, Instant>> lastAccess = new ConcurrentHashMap<>();

    public AgedCache(StorageManager next) {
        super(next);
        this.clock = Clock.systemUTC();
    }

    public AgedCache(StorageManager next, StorageManager cache, ObjectCacheConfig config) {
        this(next, cache, config, Clock.systemUTC());
    }

    /**
     * @param next authoritative store
     * @param cache store holding cached copies
     * @param config read path settings
     * @param clock source of access times
     */
    public AgedCache(StorageManager next, StorageManager cache, ObjectCacheConfig config, Clock clock) {
        super(next, cache, config);
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public void reserve(Unit unit) {
        super.reserve(unit);
        touch(unit, clock.instant());
    }

    @Override
    public Unit unit(EntityType type, Map<String, ?> filter) {
        Unit unit = super.unit(type, filter);
        if (unit != null) {
            touch(unit, clock.instant());
        }
        return unit;
    }

    @Override
    public Stream<Unit> xrecall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        Instant start = clock.instant();
        return super.xrecall(type, restriction, order, limit, offset).peek(unit -> touch(unit, start));
    }

    @Override
    protected void invalidate(Unit unit) {
        super.invalidate(unit);
        Map<Identity, Instant> times = lastAccess.get(unit.type());
        if (times != null) {
            times.remove(unit.identity());
        }
    }

    /**
     * Drops cached units of a type not touched since the cutoff.
     *
     * <p>Units with no recorded access are always dropped. A null cutoff drops
     * every cached unit of the type.</p>
     *
     * @param type cached entity type
     * @param cutoff oldest access time kept, or null
     * @return number of units dropped
     */
    public int sweep(EntityType type, Instant cutoff) {
        if (!caches(type) || !cache.hasStorage(type)) {
            return 0;
        }
        List<Unit> cached = cache.recall(type);
        int dropped = 0;
        for (Unit unit : cached) {
            Instant last = lastAccess(type, unit.identity()).orElse(null);
            if (last == null || cutoff == null || last.isBefore(cutoff)) {
                invalidate(unit);
                dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Swept {} idle {} units from {}", dropped, type.name(), cache);
        }
        return dropped;
    }

    /**
     * Sweeps every cached type.
     *
     * @param cutoff oldest access time kept, or null
     * @return number of units dropped
     */
    public int sweepAll(Instant cutoff) {
        int dropped = 0;
        for (EntityType type : cachedTypes()) {
            dropped += sweep(type, cutoff);
        }
        return dropped;
    }

    /**
     * @return types the cache store holds units for
     */
    public Set<EntityType> cachedTypes() {
        return cache.classes().stream()
            .filter(EntityType::hasIdentifiers)
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @param type entity type
     * @param identity unit identity
     * @return last recorded access, empty if none
     */
    public Optional<Instant> lastAccess(EntityType type, Identity identity) {
        return Optional.ofNullable(lastAccess.getOrDefault(type, Collections.emptyMap()).get(identity));
    }

    private void touch(Unit unit, Instant at) {
        if (!caches(unit.type())) {
            return;
        }
        lastAccess.computeIfAbsent(unit.type(), t -> new ConcurrentHashMap<>()).put(unit.identity(), at);
    }
}

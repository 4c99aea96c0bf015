package com.ryuqq.mnemo.mediator.cache;

import com.ryuqq.mnemo.adapter.inmemory.RamStorage;
import com.ryuqq.mnemo.core.exception.CacheRejectedException;
import com.ryuqq.mnemo.core.expr.Expr;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.model.Unit;
import com.ryuqq.mnemo.core.query.Order;
import com.ryuqq.mnemo.core.spi.CacheIntrospection;
import com.ryuqq.mnemo.core.spi.StorageManager;
import com.ryuqq.mnemo.core.storage.Paginator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 타입의 모든 unit을 처음 사용할 때 캐시 저장소에 올리고, 이후 그 타입의 recall은 캐시만으로 처리하는 object cache.
 *
 * <p>priming은 전부 아니면 전무입니다. 로드 중 캐시 저장소가 unit을 거부하면 일부 로드된
 * 내용을 비우고, 이후 시도가 성공할 때까지 그 타입의 recall은 next 저장소로 갑니다.</p>
 *
 * <p>캐시 저장소가 타입의 unit이 없다고 보고하면 (예: rollback으로 비워진 경우) 다시 priming합니다.</p>
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
public class BurnedCache extends ObjectCache {

    private static final Logger log = LoggerFactory.getLogger(BurnedCache.class);

    private final CacheIntrospection introspection;
    private final Set<EntityType> primed = new HashSet<>();

    public BurnedCache(StorageManager next) {
        this(next, new RamStorage(), new ObjectCacheConfig());
    }

    /**
     * @param next authoritative store
     * @param cache store holding cached copies, must implement {@link CacheIntrospection}
     * @param config read path settings
     * @throws IllegalArgumentException if the cache store cannot report its contents
     */
    public BurnedCache(StorageManager next, StorageManager cache, ObjectCacheConfig config) {
        super(next, cache, config);
        if (!(cache instanceof CacheIntrospection)) {
            throw new IllegalArgumentException(
                "cache must implement CacheIntrospection (current: " + cache.getClass().getSimpleName() + ")");
        }
        this.introspection = (CacheIntrospection) cache;
    }

    @Override
    public Unit unit(EntityType type, Map<String, ?> filter) {
        if (caches(type) && ensurePrimed(type)) {
            return cache.unit(type, filter);
        }
        return super.unit(type, filter);
    }

    @Override
    public Stream<Unit> xrecall(EntityType type, Expr restriction, Order order, Integer limit, Integer offset) {
        if (caches(type) && ensurePrimed(type)) {
            Paginator.validate(order, limit, offset);
            storageLog.recall(type, restriction);
            return cache.xrecall(type, restriction, order, limit, offset);
        }
        return super.xrecall(type, restriction, order, limit, offset);
    }

    /**
     * @param type cached entity type
     * @return true if the type is fully loaded in the cache store
     */
    public synchronized boolean isPrimed(EntityType type) {
        return primed.contains(type);
    }

    /**
     * Loads the type into the cache store unless it is already loaded.
     *
     * @param type cached entity type
     * @return true if the cache store now holds every unit of the type
     */
    synchronized boolean ensurePrimed(EntityType type) {
        if (primed.contains(type) && introspection.cachedCount(type) > 0) {
            return true;
        }
        primed.remove(type);
        try {
            int loaded = 0;
            try (Stream<Unit> units = next.xrecall(type)) {
                for (Unit unit : (Iterable<Unit>) units::iterator) {
                    cache.save(unit, true);
                    loaded++;
                }
            }
            primed.add(type);
            log.debug("Primed {} with {} units", type.name(), loaded);
            return true;
        } catch (CacheRejectedException e) {
            introspection.flush(type);
            log.warn("Cache cannot hold every {} unit, reading from {}: {}", type.name(), next, e.getMessage());
            return false;
        }
    }

    @Override
    public void rollback() {
        super.rollback();
        synchronized (this) {
            primed.clear();
        }
    }
}

package com.ryuqq.mnemo.mediator.cache;

import com.ryuqq.mnemo.adapter.inmemory.RamStorage;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.spi.StorageManager;
import com.ryuqq.mnemo.testkit.StorageManagerContractTest;
import com.ryuqq.mnemo.testkit.ZooFixture;

/**
 * Contract Tests for ObjectCache reading recalls and joins from the cache first.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class ObjectCacheFullQueryContractTest extends StorageManagerContractTest {

    @Override
    protected StorageManager createStore() {
        ObjectCacheConfig config = new ObjectCacheConfig().withFullQuery(true).withFullJoin(true);
        ObjectCache cache = new ObjectCache(new RamStorage(), new RamStorage(), config);
        cache.cacheTypes(ZooFixture.types().toArray(new EntityType[0]));
        return cache;
    }
}

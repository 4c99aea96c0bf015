package com.ryuqq.mnemo.mediator.cache;

import com.ryuqq.mnemo.adapter.inmemory.RamStorage;
import com.ryuqq.mnemo.adapter.inmemory.RamStorageConfig;
import com.ryuqq.mnemo.core.model.EntityType;
import com.ryuqq.mnemo.core.spi.StorageManager;
import com.ryuqq.mnemo.testkit.SandboxContractTest;
import com.ryuqq.mnemo.testkit.ZooFixture;

/**
 * Sandbox Contract Tests over an ObjectCache whose next store is transactional
 * and whose cache store is not.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class ObjectCacheSandboxContractTest extends SandboxContractTest {

    @Override
    protected StorageManager createStore() {
        RamStorage next = new RamStorage(new RamStorageConfig().withTransactional(true));
        ObjectCache cache = new ObjectCache(next, new RamStorage(), new ObjectCacheConfig().withFullQuery(true));
        cache.cacheTypes(ZooFixture.types().toArray(new EntityType[0]));
        return cache;
    }
}

package com.ryuqq.mnemo.adapter.inmemory;

import com.ryuqq.mnemo.core.spi.StorageManager;
import com.ryuqq.mnemo.testkit.SandboxContractTest;

/**
 * Sandbox Contract Tests over a transactional RamStorage.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class RamSandboxContractTest extends SandboxContractTest {

    @Override
    protected StorageManager createStore() {
        return new RamStorage(new RamStorageConfig().withTransactional(true));
    }
}

package com.ryuqq.mnemo.mediator.partition;

import com.ryuqq.mnemo.adapter.inmemory.RamStorage;
import com.ryuqq.mnemo.adapter.inmemory.RamStorageConfig;
import com.ryuqq.mnemo.core.spi.StorageManager;
import com.ryuqq.mnemo.testkit.SandboxContractTest;
import com.ryuqq.mnemo.testkit.ZooFixture;

/**
 * Sandbox Contract Tests over a VerticalPartitioner with a transactional RAM store.
 *
 * @author Mnemo Team
 * @since 1.0.0
 */
class PartitionerSandboxContractTest extends SandboxContractTest {

    @Override
    protected StorageManager createStore() {
        RamStorage ram = new RamStorage(new RamStorageConfig().withTransactional(true));
        ZooFixture.types().forEach(ram::register);
        VerticalPartitioner partitioner = new VerticalPartitioner();
        partitioner.addStore("ram", ram);
        return partitioner;
    }
}

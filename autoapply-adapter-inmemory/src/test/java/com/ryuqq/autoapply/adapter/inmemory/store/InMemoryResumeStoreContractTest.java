package com.ryuqq.autoapply.adapter.inmemory.store;

import com.ryuqq.autoapply.core.spi.ResumeStore;
import com.ryuqq.autoapply.testkit.contract.ResumeStoreContractTest;

/**
 * Contract Tests for InMemoryResumeStore.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class InMemoryResumeStoreContractTest extends ResumeStoreContractTest {

    @Override
    protected ResumeStore createStore() {
        return new InMemoryResumeStore();
    }
}

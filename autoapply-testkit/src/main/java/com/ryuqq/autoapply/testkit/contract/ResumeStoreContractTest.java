package com.ryuqq.autoapply.testkit.contract;

import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.model.Resume;
import com.ryuqq.autoapply.core.model.ResumeId;
import com.ryuqq.autoapply.core.model.ResumeLineage;
import com.ryuqq.autoapply.core.model.TailoringMode;
import com.ryuqq.autoapply.core.spi.ResumeStore;
import com.ryuqq.autoapply.testkit.fixture.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract every {@link ResumeStore} implementation must satisfy.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class ResumeStoreContractTest {

    protected ResumeStore store;

    protected abstract ResumeStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @Test
    void 파생_이력서는_부모로_조회된다() {
        // given
        Resume base = Fixtures.resume("Base resume");
        store.save(base);
        Resume tailored = base.derive(ResumeId.generate(), TailoringMode.MODERATE, "Tailored resume",
            new ResumeLineage(JobId.generate(), ApplicationId.generate(), 1), Fixtures.EPOCH);

        // when
        store.save(tailored);

        // then
        assertThat(store.find(tailored.id())).contains(tailored);
        assertThat(store.findDerivedFrom(base.id())).containsExactly(tailored);
        assertThat(store.findDerivedFrom(tailored.id())).isEmpty();
    }

    @Test
    void 부모가_없는_파생_이력서는_저장할_수_없다() {
        Resume orphanParent = Fixtures.resume("Never stored");
        Resume tailored = orphanParent.derive(ResumeId.generate(), TailoringMode.AGGRESSIVE, "Tailored",
            new ResumeLineage(JobId.generate(), ApplicationId.generate(), 1), Fixtures.EPOCH);

        assertThatThrownBy(() -> store.save(tailored)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 이력서는_덮어쓸_수_없다() {
        Resume base = Fixtures.resume("Base resume");
        store.save(base);

        assertThatThrownBy(() -> store.save(base)).isInstanceOf(IllegalStateException.class);
    }
}

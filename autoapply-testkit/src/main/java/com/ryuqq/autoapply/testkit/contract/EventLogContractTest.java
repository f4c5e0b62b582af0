package com.ryuqq.autoapply.testkit.contract;

import com.ryuqq.autoapply.core.event.EventCause;
import com.ryuqq.autoapply.core.event.LifecycleEvent;
import com.ryuqq.autoapply.core.event.Subscription;
import com.ryuqq.autoapply.core.model.ApplicationId;
import com.ryuqq.autoapply.core.model.JobId;
import com.ryuqq.autoapply.core.spi.EventLog;
import com.ryuqq.autoapply.core.statemachine.ApplicationState;
import com.ryuqq.autoapply.core.statemachine.LifecycleTrigger;
import com.ryuqq.autoapply.core.statemachine.StateTransition;
import com.ryuqq.autoapply.testkit.fixture.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract every {@link EventLog} implementation must satisfy.
 *
 * <p>Sequences are assigned by the log, strictly increasing and gap free; per-application
 * history keeps append order; listeners see every appended event once.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class EventLogContractTest {

    private static final JobId JOB = JobId.of("job-contract");

    protected EventLog eventLog;

    protected abstract EventLog createEventLog();

    @BeforeEach
    void setUpEventLog() {
        eventLog = createEventLog();
    }

    @Test
    void append는_1부터_순번을_부여한다() {
        ApplicationId id = ApplicationId.generate();

        LifecycleEvent first = eventLog.append(draft(id, ApplicationState.DISCOVERED, LifecycleTrigger.ANALYSIS_SUCCEEDED));
        LifecycleEvent second = eventLog.append(draft(id, ApplicationState.ANALYZED, LifecycleTrigger.TAILORING_SUCCEEDED));

        assertThat(first.sequence()).isEqualTo(1);
        assertThat(second.sequence()).isEqualTo(2);
    }

    @Test
    void 순번이_있는_이벤트는_append할_수_없다() {
        LifecycleEvent sequenced = draft(ApplicationId.generate(), ApplicationState.DISCOVERED,
            LifecycleTrigger.ANALYSIS_SUCCEEDED).withSequence(5);

        assertThatThrownBy(() -> eventLog.append(sequenced))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void history는_지원서별로_append_순서를_유지한다() {
        // given
        ApplicationId a = ApplicationId.generate();
        ApplicationId b = ApplicationId.generate();
        eventLog.append(draft(a, ApplicationState.DISCOVERED, LifecycleTrigger.ANALYSIS_SUCCEEDED));
        eventLog.append(draft(b, ApplicationState.DISCOVERED, LifecycleTrigger.STAGE_RETRY));
        eventLog.append(draft(a, ApplicationState.ANALYZED, LifecycleTrigger.TAILORING_SUCCEEDED));

        // when
        List<LifecycleEvent> history = eventLog.history(a);

        // then
        assertThat(history).extracting(LifecycleEvent::trigger)
            .containsExactly(LifecycleTrigger.ANALYSIS_SUCCEEDED, LifecycleTrigger.TAILORING_SUCCEEDED);
        assertThat(eventLog.history(ApplicationId.generate())).isEmpty();
    }

    @Test
    void readFrom은_순번_이후의_이벤트를_limit만큼_반환한다() {
        ApplicationId id = ApplicationId.generate();
        for (int i = 0; i < 5; i++) {
            eventLog.append(draft(id, ApplicationState.DISCOVERED, LifecycleTrigger.STAGE_RETRY));
        }

        assertThat(eventLog.readFrom(0, 10)).hasSize(5);
        assertThat(eventLog.readFrom(2, 2)).extracting(LifecycleEvent::sequence).containsExactly(3L, 4L);
        assertThat(eventLog.readFrom(5, 10)).isEmpty();
    }

    @Test
    void 구독자는_구독_이후의_이벤트를_받고_해지하면_더_받지_않는다() {
        // given
        ApplicationId id = ApplicationId.generate();
        eventLog.append(draft(id, ApplicationState.DISCOVERED, LifecycleTrigger.STAGE_RETRY));
        List<LifecycleEvent> received = new ArrayList<>();
        Subscription subscription = eventLog.subscribe(received::add);

        // when
        eventLog.append(draft(id, ApplicationState.DISCOVERED, LifecycleTrigger.ANALYSIS_SUCCEEDED));
        subscription.close();
        eventLog.append(draft(id, ApplicationState.ANALYZED, LifecycleTrigger.TAILORING_SUCCEEDED));

        // then
        assertThat(received).extracting(LifecycleEvent::sequence).containsExactly(2L);
    }

    @Test
    void 실패하는_구독자가_append를_막지_않는다() {
        ApplicationId id = ApplicationId.generate();
        List<LifecycleEvent> received = new ArrayList<>();
        eventLog.subscribe(event -> {
            throw new IllegalStateException("dashboard offline");
        });
        eventLog.subscribe(received::add);

        LifecycleEvent appended = eventLog.append(draft(id, ApplicationState.DISCOVERED, LifecycleTrigger.STAGE_RETRY));

        assertThat(appended.sequence()).isEqualTo(1);
        assertThat(received).hasSize(1);
    }

    @Test
    void 동시_append에도_순번은_중복이나_빈틈이_없다() throws InterruptedException {
        // given
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        List<Long> sequences = new CopyOnWriteArrayList<>();

        // when
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                try {
                    start.await();
                    ApplicationId id = ApplicationId.generate();
                    for (int i = 0; i < perThread; i++) {
                        sequences.add(eventLog.append(
                            draft(id, ApplicationState.DISCOVERED, LifecycleTrigger.STAGE_RETRY)).sequence());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();

        // then
        assertThat(sequences).hasSize(threads * perThread).doesNotHaveDuplicates();
        assertThat(sequences.stream().mapToLong(Long::longValue).max().orElse(0)).isEqualTo(threads * perThread);
    }

    protected static LifecycleEvent draft(ApplicationId id, ApplicationState from, LifecycleTrigger trigger) {
        ApplicationState to = StateTransition.next(from, trigger);
        return new LifecycleEvent(0, id, JOB, from, to, trigger, EventCause.STAGE_SUCCESS, 0,
            null, null, null, null, Fixtures.EPOCH);
    }
}

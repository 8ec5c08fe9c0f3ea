package com.universe.manager.commandcenter.polling;

import com.universe.manager.commandcenter.model.ErrorKind;
import com.universe.manager.commandcenter.model.FetchOutcome;
import com.universe.manager.commandcenter.testutil.ScriptedStatusFetcher;
import com.universe.manager.commandcenter.testutil.TestFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.universe.manager.commandcenter.testutil.TestFactory.snapshot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

public class PollingLoopTest {

    private static final class RecordingPublisher implements OutcomePublisher {
        final List<FetchOutcome> outcomes = new CopyOnWriteArrayList<>();
        final List<Long> sequences = new CopyOnWriteArrayList<>();

        @Override
        public void publish(FetchOutcome outcome, long sequence) {
            outcomes.add(outcome);
            sequences.add(sequence);
        }
    }

    private Thread runInBackground(PollingLoop loop, PollingSession session) {
        Thread t = new Thread(() -> loop.run(session), "test-poller");
        t.setDaemon(true);
        t.start();
        return t;
    }

    @Test
    void testExhaustedFailureDoesNotStopLoop() throws Exception {
        ScriptedStatusFetcher fetcher = new ScriptedStatusFetcher().fail(ErrorKind.TRANSPORT, 1);
        RecordingPublisher publisher = new RecordingPublisher();
        PollingLoop loop = new PollingLoop(TestFactory.retryingFetch(3, 0), fetcher, publisher, Duration.ofMillis(20));
        PollingSession session = new PollingSession(1);

        Thread t = runInBackground(loop, session);

        await().atMost(5, TimeUnit.SECONDS).until(() -> publisher.outcomes.size() >= 3);
        session.cancel();
        t.join(2000);

        assertThat(t.isAlive()).isFalse();
        assertThat(publisher.outcomes).allMatch(o -> !o.isSuccess());
        // 4 attempts per tick
        assertThat(fetcher.calls()).isGreaterThanOrEqualTo(12);
        assertThat(publisher.sequences).isSorted().doesNotHaveDuplicates();
    }

    @Test
    void testCancelDuringTickWaitStopsWithoutAnotherFetch() throws Exception {
        ScriptedStatusFetcher fetcher = new ScriptedStatusFetcher().succeed(snapshot("v1"));
        RecordingPublisher publisher = new RecordingPublisher();
        PollingLoop loop = new PollingLoop(TestFactory.retryingFetch(3, 0), fetcher, publisher, Duration.ofMinutes(10));
        PollingSession session = new PollingSession(1);

        Thread t = runInBackground(loop, session);
        await().atMost(5, TimeUnit.SECONDS).until(() -> publisher.outcomes.size() == 1);

        session.cancel();
        t.join(2000);

        assertThat(t.isAlive()).isFalse();
        assertThat(fetcher.calls()).isEqualTo(1);
        assertThat(publisher.outcomes).hasSize(1);
    }

    @Test
    void testCancelDuringBackoffPublishesNothing() throws Exception {
        ScriptedStatusFetcher fetcher = new ScriptedStatusFetcher().fail(ErrorKind.TRANSPORT, 1);
        RecordingPublisher publisher = new RecordingPublisher();
        PollingLoop loop = new PollingLoop(TestFactory.retryingFetch(3, 600_000), fetcher, publisher, Duration.ofMinutes(10));
        PollingSession session = new PollingSession(1);

        Thread t = runInBackground(loop, session);
        await().atMost(5, TimeUnit.SECONDS).until(() -> fetcher.calls() == 1);

        session.cancel();
        t.join(2000);

        assertThat(t.isAlive()).isFalse();
        assertThat(fetcher.calls()).isEqualTo(1);
        assertThat(publisher.outcomes).isEmpty();
    }

    @Test
    void testCancelledSessionNeverFetches() {
        ScriptedStatusFetcher fetcher = new ScriptedStatusFetcher().succeed(snapshot("v1"));
        RecordingPublisher publisher = new RecordingPublisher();
        PollingLoop loop = new PollingLoop(TestFactory.retryingFetch(3, 0), fetcher, publisher, Duration.ofMillis(10));
        PollingSession session = new PollingSession(1);
        session.cancel();

        loop.run(session);

        assertThat(fetcher.calls()).isZero();
        assertThat(publisher.outcomes).isEmpty();
    }

    @Test
    void testNonPositiveIntervalRejected() {
        ScriptedStatusFetcher fetcher = new ScriptedStatusFetcher().succeed(snapshot("v1"));
        assertThatThrownBy(() -> new PollingLoop(TestFactory.retryingFetch(3, 0), fetcher,
                new RecordingPublisher(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

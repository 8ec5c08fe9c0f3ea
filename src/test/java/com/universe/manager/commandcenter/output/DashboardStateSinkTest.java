package com.universe.manager.commandcenter.output;

import com.universe.manager.commandcenter.model.ErrorDetail;
import com.universe.manager.commandcenter.model.ErrorKind;
import com.universe.manager.commandcenter.model.FetchOutcome;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.universe.manager.commandcenter.testutil.TestFactory.NOW;
import static com.universe.manager.commandcenter.testutil.TestFactory.snapshot;
import static org.assertj.core.api.Assertions.assertThat;

public class DashboardStateSinkTest {

    private static FetchOutcome exhausted(String lastMessage) {
        return FetchOutcome.failure(ErrorDetail.exhausted(3, 4,
                ErrorDetail.of(ErrorKind.TRANSPORT, lastMessage, 4)));
    }

    @Test
    void testInitialStateIsLoading() {
        DashboardState state = new DashboardStateSink().current();

        assertThat(state.loading()).isTrue();
        assertThat(state.snapshot()).isNull();
        assertThat(state.error()).isNull();
        assertThat(state.lastUpdated()).isNull();
    }

    @Test
    void testSuccessStoresSnapshotAndCompletionTime() {
        DashboardStateSink sink = new DashboardStateSink();

        sink.onFetchStarted();
        sink.onUpdate(FetchOutcome.success(snapshot("v1")), NOW);

        DashboardState state = sink.current();
        assertThat(state.loading()).isFalse();
        assertThat(state.snapshot().getVersion()).isEqualTo("v1");
        assertThat(state.lastUpdated()).isEqualTo(NOW);
        assertThat(state.consecutiveFailures()).isZero();
    }

    @Test
    void testFailureKeepsLastGoodSnapshot() {
        DashboardStateSink sink = new DashboardStateSink();
        sink.onUpdate(FetchOutcome.success(snapshot("v1")), NOW);

        sink.onFetchStarted();
        sink.onUpdate(exhausted("connection refused"), NOW.plusSeconds(30));

        DashboardState state = sink.current();
        assertThat(state.snapshot().getVersion()).isEqualTo("v1");
        assertThat(state.lastUpdated()).isEqualTo(NOW);
        assertThat(state.loading()).isFalse();
        assertThat(state.error())
                .isEqualTo("System monitoring error: System health failed after 3 retries: connection refused");
        assertThat(state.consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void testFetchStartClearsErrorAndSuccessResetsFailureCount() {
        DashboardStateSink sink = new DashboardStateSink();
        sink.onUpdate(exhausted("timeout"), NOW);
        sink.onUpdate(exhausted("timeout"), NOW.plusSeconds(30));
        assertThat(sink.current().consecutiveFailures()).isEqualTo(2);

        sink.onFetchStarted();
        assertThat(sink.current().error()).isNull();
        assertThat(sink.current().loading()).isTrue();

        Instant later = NOW.plusSeconds(60);
        sink.onUpdate(FetchOutcome.success(snapshot("v2")), later);
        assertThat(sink.current().consecutiveFailures()).isZero();
        assertThat(sink.current().lastUpdated()).isEqualTo(later);
    }

    @Test
    void testStopClearsLoadingAndKeepsData() {
        DashboardStateSink sink = new DashboardStateSink();
        sink.onUpdate(FetchOutcome.success(snapshot("v1")), NOW);
        sink.onFetchStarted();

        sink.onStopped();

        DashboardState state = sink.current();
        assertThat(state.loading()).isFalse();
        assertThat(state.snapshot().getVersion()).isEqualTo("v1");
        assertThat(state.lastUpdated()).isEqualTo(NOW);
    }
}

package de.bsommerfeld.dashboard.polling.state;

import de.bsommerfeld.dashboard.polling.FetchOutcome;
import de.bsommerfeld.dashboard.polling.error.ClassifiedError;
import de.bsommerfeld.dashboard.polling.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TransitionsTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T1 = T0.plusSeconds(2);

    private static final ClassifiedError NETWORK = new ClassifiedError(ErrorKind.TRANSIENT_NETWORK, "connection refused");
    private static final ClassifiedError WARMING_UP = new ClassifiedError(ErrorKind.STILL_LOADING, "Loading Jira tickets...");

    @Test
    void next_shouldMoveLoadingToReadyOnSuccess() {
        WidgetState<String> next = Transitions.next(WidgetState.loading(), FetchOutcome.success("a"), null, T0);

        assertEquals(new WidgetState.Ready<>("a", T0), next);
    }

    @Test
    void next_shouldStayLoadingWhileSourceWarmsUp() {
        WidgetState<String> loading = WidgetState.loading();

        WidgetState<String> next = Transitions.next(loading, FetchOutcome.failure(WARMING_UP.message()), WARMING_UP, T0);

        assertSame(loading, next);
    }

    @Test
    void next_shouldDegradeLoadingWithoutPayload() {
        WidgetState<String> next = Transitions.next(WidgetState.loading(), FetchOutcome.failure("x"), NETWORK, T0);

        WidgetState.Degraded<String> degraded = assertInstanceOf(WidgetState.Degraded.class, next);
        assertFalse(degraded.hasLastGood());
        assertEquals(NETWORK, degraded.error());
        assertEquals(T0, degraded.failedAt());
    }

    @Test
    void next_shouldRefreshReadyOnSuccess() {
        WidgetState<String> next = Transitions.next(new WidgetState.Ready<>("a", T0), FetchOutcome.success("b"), null, T1);

        assertEquals(new WidgetState.Ready<>("b", T1), next);
    }

    @Test
    void next_shouldKeepReadyPayloadWhenDegrading() {
        WidgetState<String> next = Transitions.next(new WidgetState.Ready<>("a", T0), FetchOutcome.failure("x"), NETWORK, T1);

        assertEquals(new WidgetState.Degraded<>("a", NETWORK, T1), next);
    }

    @Test
    void next_shouldDegradeReadyEvenWhenSourceReportsLoading() {
        WidgetState<String> next = Transitions.next(new WidgetState.Ready<>("a", T0),
                FetchOutcome.failure(WARMING_UP.message()), WARMING_UP, T1);

        assertEquals(new WidgetState.Degraded<>("a", WARMING_UP, T1), next);
    }

    @Test
    void next_shouldRecoverDegradedOnSuccess() {
        WidgetState<String> next = Transitions.next(new WidgetState.Degraded<>("a", NETWORK, T0),
                FetchOutcome.success("b"), null, T1);

        assertEquals(new WidgetState.Ready<>("b", T1), next);
    }

    @Test
    void next_shouldReplaceErrorButKeepPayloadWhileDegraded() {
        ClassifiedError auth = new ClassifiedError(ErrorKind.AUTH_FAILURE, "401");

        WidgetState<String> next = Transitions.next(new WidgetState.Degraded<>("a", NETWORK, T0),
                FetchOutcome.failure("401"), auth, T1);

        assertEquals(new WidgetState.Degraded<>("a", auth, T1), next);
    }

    @Test
    void next_shouldRejectFailureWithoutClassification() {
        assertThrows(IllegalArgumentException.class,
                () -> Transitions.next(WidgetState.loading(), FetchOutcome.failure("x"), null, T0));
    }
}

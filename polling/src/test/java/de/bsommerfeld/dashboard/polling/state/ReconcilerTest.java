package de.bsommerfeld.dashboard.polling.state;

import de.bsommerfeld.dashboard.core.domain.CpuUsage;
import de.bsommerfeld.dashboard.core.event.ApplicationEventBus;
import de.bsommerfeld.dashboard.polling.FetchOutcome;
import de.bsommerfeld.dashboard.polling.SourceKind;
import de.bsommerfeld.dashboard.polling.WidgetId;
import de.bsommerfeld.dashboard.polling.error.ClassifiedError;
import de.bsommerfeld.dashboard.polling.error.ErrorClassifier;
import de.bsommerfeld.dashboard.polling.error.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ReconcilerTest {

    private static final WidgetId CPU = WidgetId.of(SourceKind.CPU);
    private static final WidgetId TICKETS = WidgetId.of(SourceKind.TICKETS);
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private Clock clock;
    private WidgetStateStore store;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0, T0.plusSeconds(2), T0.plusSeconds(4), T0.plusSeconds(6),
                T0.plusSeconds(8));
        store = new WidgetStateStore(new ApplicationEventBus());
        reconciler = new Reconciler(store, new ErrorClassifier(), clock);
    }

    @Test
    void reconcile_shouldStoreSuccessfulPayloadVerbatim() {
        store.open(CPU, SourceKind.CPU);
        CpuUsage usage = new CpuUsage(37.5,
                List.of(new CpuUsage.CpuCore(0, 40.0), new CpuUsage.CpuCore(1, 35.0)),
                List.of(new CpuUsage.CpuProcessInfo("java", 12.5)));

        reconciler.reconcile(CPU, FetchOutcome.success(usage));

        WidgetState<?> state = store.get(CPU).orElseThrow();
        WidgetState.Ready<?> ready = assertInstanceOf(WidgetState.Ready.class, state);
        assertSame(usage, ready.payload());
        assertEquals(T0, ready.fetchedAt());
    }

    @Test
    void reconcile_shouldKeepLastGoodPayloadAcrossRepeatedFailures() {
        store.open(CPU, SourceKind.CPU);
        reconciler.reconcile(CPU, FetchOutcome.success("good"));

        for (int i = 0; i < 3; i++) {
            reconciler.reconcile(CPU, FetchOutcome.failure("connection refused"));
        }

        WidgetState.Degraded<?> degraded = assertInstanceOf(WidgetState.Degraded.class, store.get(CPU).orElseThrow());
        assertEquals("good", degraded.lastGood());
        assertEquals(ErrorKind.TRANSIENT_NETWORK, degraded.error().kind());
        assertEquals(T0.plusSeconds(6), degraded.failedAt());
    }

    @Test
    void reconcile_shouldStayLoadingWhileSourceWarmsUp() {
        store.open(TICKETS, SourceKind.TICKETS);

        reconciler.reconcile(TICKETS, FetchOutcome.failure("Loading Jira tickets..."));

        assertEquals(Optional.of(WidgetState.loading()), store.get(TICKETS));
    }

    @Test
    void reconcile_shouldClassifyWithWidgetSourceRules() {
        store.open(TICKETS, SourceKind.TICKETS);

        reconciler.reconcile(TICKETS, FetchOutcome.failure("JIRA_API_TOKEN environment variable not set"));

        WidgetState.Degraded<?> degraded = assertInstanceOf(WidgetState.Degraded.class, store.get(TICKETS).orElseThrow());
        assertFalse(degraded.hasLastGood());
        assertEquals(new ClassifiedError(ErrorKind.NOT_CONFIGURED, "JIRA_API_TOKEN environment variable not set"),
                degraded.error());
    }

    @Test
    void reconcile_shouldDiscardOutcomeOfStaleLease() {
        WidgetLease stale = store.open(CPU, SourceKind.CPU);
        store.close(stale);
        store.open(CPU, SourceKind.CPU);

        reconciler.reconcile(stale, FetchOutcome.success("late"));

        assertEquals(Optional.of(WidgetState.loading()), store.get(CPU));
    }

    @Test
    void reconcile_shouldIgnoreWidgetThatIsNotOpen() {
        assertDoesNotThrow(() -> reconciler.reconcile(CPU, FetchOutcome.success("data")));
        assertTrue(store.get(CPU).isEmpty());
    }

    @Test
    void reconcile_shouldNeverLetExceptionsEscape() {
        ErrorClassifier broken = mock(ErrorClassifier.class);
        when(broken.classify(any(SourceKind.class), anyString())).thenThrow(new IllegalStateException("boom"));
        Reconciler reconciler = new Reconciler(store, broken, clock);
        store.open(CPU, SourceKind.CPU);

        assertDoesNotThrow(() -> reconciler.reconcile(CPU, FetchOutcome.failure("x")));
        assertEquals(Optional.of(WidgetState.loading()), store.get(CPU));
    }

    @Test
    void reset_shouldReturnWidgetToLoading() {
        store.open(CPU, SourceKind.CPU);
        reconciler.reconcile(CPU, FetchOutcome.success("data"));

        assertTrue(reconciler.reset(CPU));
        assertEquals(Optional.of(WidgetState.loading()), store.get(CPU));
    }

    @Test
    void reset_shouldReportClosedWidget() {
        assertFalse(reconciler.reset(CPU));
    }
}

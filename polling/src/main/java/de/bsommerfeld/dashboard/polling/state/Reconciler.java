package de.bsommerfeld.dashboard.polling.state;

import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.polling.FetchOutcome;
import de.bsommerfeld.dashboard.polling.WidgetId;
import de.bsommerfeld.dashboard.polling.error.ClassifiedError;
import de.bsommerfeld.dashboard.polling.error.ErrorClassifier;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Turns raw fetch outcomes into widget states and commits them to the
 * {@link WidgetStateStore}.
 *
 * <p>
 * Failures are classified with the widget's source rules and fed through
 * {@link Transitions}. Nothing thrown while reconciling escapes this class:
 * a broken outcome is logged and dropped, and the widget keeps its previous
 * state until the next poll.
 *
 * <p>
 * Calls for different widgets may run concurrently. Calls for one widget
 * are serialized by its poller.
 */
@Singleton
public class Reconciler {

    private static final Logger LOG = LoggerFactory.getLogger(Reconciler.class);

    private final WidgetStateStore store;
    private final ErrorClassifier classifier;
    private final Clock clock;

    @Inject
    public Reconciler(WidgetStateStore store, ErrorClassifier classifier, Clock clock) {
        this.store = store;
        this.classifier = classifier;
        this.clock = clock;
    }

    /**
     * Applies {@code outcome} to the currently open widget {@code widgetId}.
     * Outcomes for widgets that are not open are discarded.
     */
    public void reconcile(WidgetId widgetId, FetchOutcome<?> outcome) {
        Optional<WidgetLease> lease = store.lease(widgetId);
        if (lease.isEmpty()) {
            LOG.debug("Discarding outcome for closed widget {}", widgetId);
            return;
        }
        reconcile(lease.get(), outcome);
    }

    /**
     * Applies {@code outcome} through {@code lease}. If the lease was closed
     * meanwhile, the outcome is discarded.
     */
    public void reconcile(WidgetLease lease, FetchOutcome<?> outcome) {
        try {
            Instant now = clock.instant();
            ClassifiedError error = outcome instanceof FetchOutcome.Failure<?> failure
                    ? classifier.classify(lease.kind(), failure.message())
                    : null;

            Optional<WidgetStateChangedEvent> change = store.update(lease,
                    current -> transition(current, outcome, error, now));

            if (change.isEmpty()) {
                LOG.debug("Discarding outcome for stopped widget {} (epoch {})", lease.widgetId(), lease.epoch());
                return;
            }
            logChange(change.get());
        } catch (RuntimeException e) {
            LOG.error("Failed to reconcile outcome for widget {}", lease.widgetId(), e);
        }
    }

    /**
     * Explicitly returns an open widget to Loading, dropping its data. This is
     * the only way back to Loading once a fetch has completed.
     *
     * @return {@code true} if the widget was open
     */
    public boolean reset(WidgetId widgetId) {
        Optional<WidgetLease> lease = store.lease(widgetId);
        if (lease.isEmpty()) {
            return false;
        }
        boolean applied = store.update(lease.get(), current -> WidgetState.loading()).isPresent();
        if (applied) {
            LOG.info("Widget {} reset to loading", widgetId);
        }
        return applied;
    }

    /** Voids {@code lease}; later outcomes through it are discarded. */
    public void release(WidgetLease lease) {
        store.close(lease);
    }

    @SuppressWarnings("unchecked")
    private static WidgetState<?> transition(WidgetState<?> current, FetchOutcome<?> outcome,
            ClassifiedError error, Instant now) {
        return Transitions.next((WidgetState<Object>) current, (FetchOutcome<Object>) outcome, error, now);
    }

    private static void logChange(WidgetStateChangedEvent change) {
        WidgetState<?> previous = change.previous();
        WidgetState<?> current = change.current();

        if (current instanceof WidgetState.Degraded<?> degraded) {
            if (!(previous instanceof WidgetState.Degraded<?> before)
                    || before.error().kind() != degraded.error().kind()) {
                LOG.warn("Widget {} degraded ({}): {}", change.widgetId(),
                        degraded.error().kind(), degraded.error().message());
            } else {
                LOG.debug("Widget {} still degraded ({})", change.widgetId(), degraded.error().kind());
            }
        } else if (current instanceof WidgetState.Ready<?> && previous instanceof WidgetState.Degraded<?>) {
            LOG.info("Widget {} recovered", change.widgetId());
        } else if (previous.getClass() != current.getClass()) {
            LOG.debug("Widget {} {} -> {}", change.widgetId(),
                    previous.getClass().getSimpleName(), current.getClass().getSimpleName());
        }
    }
}

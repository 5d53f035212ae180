package de.bsommerfeld.dashboard.polling;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.dashboard.polling.state.Reconciler;
import de.bsommerfeld.dashboard.polling.state.WidgetLease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls one widget's adapter on its own scheduler thread.
 *
 * <h3>Scheduling</h3>
 * The first fetch runs immediately on {@link #start}. Each following fetch
 * starts {@code interval} after the previous one <em>completed</em>, so calls
 * to an adapter never overlap: a slow fetch pushes the next tick back instead
 * of stacking requests. Because every poller owns its thread, a hanging
 * adapter only stalls its own widget.
 *
 * <h3>Outcomes</h3>
 * Every result, including an unchecked exception thrown by the adapter, is
 * handed to the {@link Reconciler} on the polling thread right after the
 * fetch returns. Stopping closes the widget's store slot, so a result that
 * completes after {@link #stop} returns can no longer be committed.
 *
 * @param <T> payload type of the adapter
 */
public final class Poller<T> {

    private static final Logger LOG = LoggerFactory.getLogger(Poller.class);

    private final WidgetLease lease;
    private final Reconciler reconciler;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private volatile ScheduledFuture<?> task;

    public Poller(WidgetLease lease, Reconciler reconciler) {
        this.lease = lease;
        this.reconciler = reconciler;
        this.executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("poller-" + lease.widgetId() + "-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Starts polling. The first fetch is submitted immediately.
     *
     * @throws IllegalStateException if the poller was already started or
     *                               has been stopped
     */
    public void start(PollSchedule<T> schedule) {
        if (stopped.get()) {
            throw new IllegalStateException("Poller for " + lease.widgetId() + " has been stopped");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Poller for " + lease.widgetId() + " already started");
        }

        LOG.info("Polling {} every {} ms", lease.widgetId(), schedule.intervalMs());
        task = executor.scheduleWithFixedDelay(() -> poll(schedule.adapter()),
                0, schedule.intervalMs(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stops polling and releases the scheduler thread. A fetch already in
     * flight is allowed to finish but its result is discarded: the lease is
     * voided in the store before this returns. Safe to call any number of
     * times.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        reconciler.release(lease);
        ScheduledFuture<?> scheduled = task;
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        executor.shutdown();
        LOG.info("Stopped polling {}", lease.widgetId());
    }

    public boolean isRunning() {
        return started.get() && !stopped.get();
    }

    public boolean isStopped() {
        return stopped.get();
    }

    public WidgetLease lease() {
        return lease;
    }

    private void poll(SourceAdapter<T> adapter) {
        if (stopped.get()) {
            return;
        }

        FetchOutcome<T> outcome = fetch(adapter);

        if (stopped.get()) {
            LOG.debug("Dropping result for {} fetched after stop", lease.widgetId());
            return;
        }
        reconciler.reconcile(lease, outcome);
    }

    private FetchOutcome<T> fetch(SourceAdapter<T> adapter) {
        try {
            T data = adapter.fetch();
            if (data == null) {
                return FetchOutcome.failure("Adapter for " + lease.widgetId() + " returned no data");
            }
            return FetchOutcome.success(data);
        } catch (SourceException e) {
            LOG.debug("Fetch for {} failed: {}", lease.widgetId(), e.getMessage());
            return FetchOutcome.failure(e.getMessage());
        } catch (RuntimeException e) {
            // A throwing periodic task would silently cancel all future ticks
            LOG.warn("Adapter for {} threw unexpectedly", lease.widgetId(), e);
            return FetchOutcome.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}

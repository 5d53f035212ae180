package de.bsommerfeld.dashboard.polling.subscription;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.dashboard.polling.WidgetId;
import de.bsommerfeld.dashboard.polling.state.WidgetState;
import de.bsommerfeld.dashboard.polling.state.WidgetStateChangedEvent;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One consumer's view of a widget. Delivers every state change of its widget
 * to the listener, on the widget's polling thread, until
 * {@link #unsubscribe()} is called.
 */
public final class WidgetSubscription implements AutoCloseable {

    private final WidgetId widgetId;
    private final Consumer<WidgetState<?>> listener;
    private final WidgetSubscriptions owner;
    private final AtomicBoolean active = new AtomicBoolean(true);

    WidgetSubscription(WidgetId widgetId, Consumer<WidgetState<?>> listener, WidgetSubscriptions owner) {
        this.widgetId = widgetId;
        this.listener = listener;
        this.owner = owner;
    }

    public WidgetId widgetId() {
        return widgetId;
    }

    /**
     * The widget's state right now. Loading once the subscription has been
     * cancelled.
     */
    public WidgetState<?> current() {
        if (!active.get()) {
            return WidgetState.loading();
        }
        return owner.currentState(widgetId);
    }

    public boolean isActive() {
        return active.get();
    }

    /**
     * Stops delivery to this subscription. The widget's poller stops when no
     * other subscription remains. Idempotent.
     */
    public void unsubscribe() {
        if (active.compareAndSet(true, false)) {
            owner.release(this);
        }
    }

    /** Deactivates without going back to the owner, which is already tearing down. */
    void cancel() {
        active.set(false);
    }

    @Override
    public void close() {
        unsubscribe();
    }

    @Subscribe
    public void onStateChanged(WidgetStateChangedEvent event) {
        if (active.get() && event.widgetId().equals(widgetId)) {
            listener.accept(event.current());
        }
    }

    @Override
    public String toString() {
        return "WidgetSubscription[" + widgetId + (active.get() ? "" : ", cancelled") + "]";
    }
}

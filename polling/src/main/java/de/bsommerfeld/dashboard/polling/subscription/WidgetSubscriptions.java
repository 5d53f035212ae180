package de.bsommerfeld.dashboard.polling.subscription;

import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.core.event.ApplicationEventBus;
import de.bsommerfeld.dashboard.polling.Poller;
import de.bsommerfeld.dashboard.polling.WidgetCatalog;
import de.bsommerfeld.dashboard.polling.WidgetDefinition;
import de.bsommerfeld.dashboard.polling.WidgetId;
import de.bsommerfeld.dashboard.polling.state.Reconciler;
import de.bsommerfeld.dashboard.polling.state.WidgetLease;
import de.bsommerfeld.dashboard.polling.state.WidgetState;
import de.bsommerfeld.dashboard.polling.state.WidgetStateStore;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Entry point for the presentation layer. Owns the lifecycle of every
 * widget pipeline: the first subscription to a widget opens its store slot
 * and starts its {@link Poller}; the last unsubscribe stops the poller and
 * closes the slot, which voids any result still in flight.
 */
@Singleton
public class WidgetSubscriptions {

    private static final Logger LOG = LoggerFactory.getLogger(WidgetSubscriptions.class);

    private final WidgetStateStore store;
    private final Reconciler reconciler;
    private final ApplicationEventBus eventBus;
    private final WidgetCatalog catalog;

    private final Map<WidgetId, ActiveWidget> active = new HashMap<>();

    private static final class ActiveWidget {
        final Poller<?> poller;
        final Set<WidgetSubscription> subscriptions = new LinkedHashSet<>();

        ActiveWidget(Poller<?> poller) {
            this.poller = poller;
        }
    }

    @Inject
    public WidgetSubscriptions(WidgetStateStore store, Reconciler reconciler, ApplicationEventBus eventBus,
            WidgetCatalog catalog) {
        this.store = store;
        this.reconciler = reconciler;
        this.eventBus = eventBus;
        this.catalog = catalog;
    }

    /**
     * Subscribes to a widget, starting its pipeline if this is the first
     * subscriber. The returned subscription's {@link WidgetSubscription#current()}
     * is the state at subscription time; later states go to {@code listener}.
     *
     * @throws IllegalArgumentException if the catalog has no such widget
     */
    public synchronized WidgetSubscription subscribe(WidgetId widgetId, Consumer<WidgetState<?>> listener) {
        WidgetDefinition<?> definition = catalog.definition(widgetId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown widget: " + widgetId));

        WidgetSubscription subscription = new WidgetSubscription(widgetId, listener, this);
        ActiveWidget widget = active.get(widgetId);
        if (widget == null) {
            WidgetLease lease = store.open(widgetId, definition.kind());
            // Register before the first fetch so no change is missed
            eventBus.register(subscription);
            widget = new ActiveWidget(startPoller(lease, definition));
            active.put(widgetId, widget);
        } else {
            eventBus.register(subscription);
        }
        widget.subscriptions.add(subscription);
        LOG.debug("Subscribed to {} ({} subscriber(s))", widgetId, widget.subscriptions.size());
        return subscription;
    }

    /** Subscribes to every widget of the catalog. */
    public List<WidgetSubscription> subscribeAll(Consumer<WidgetState<?>> listener) {
        return catalog.definitions().stream()
                .map(definition -> subscribe(definition.id(), listener))
                .toList();
    }

    public synchronized boolean isPolling(WidgetId widgetId) {
        ActiveWidget widget = active.get(widgetId);
        return widget != null && widget.poller.isRunning();
    }

    public synchronized int subscriberCount(WidgetId widgetId) {
        ActiveWidget widget = active.get(widgetId);
        return widget == null ? 0 : widget.subscriptions.size();
    }

    /**
     * Stops every pipeline and cancels every subscription. Used on
     * application shutdown.
     */
    public synchronized void closeAll() {
        active.forEach((id, widget) -> {
            for (WidgetSubscription subscription : widget.subscriptions) {
                subscription.cancel();
                eventBus.unregister(subscription);
            }
            widget.subscriptions.clear();
            widget.poller.stop();
        });
        active.clear();
        LOG.info("All widget pipelines stopped");
    }

    WidgetState<?> currentState(WidgetId widgetId) {
        return store.get(widgetId).orElse(WidgetState.loading());
    }

    synchronized void release(WidgetSubscription subscription) {
        WidgetId widgetId = subscription.widgetId();
        ActiveWidget widget = active.get(widgetId);
        // A subscription from an earlier pipeline of the same widget must not touch this one
        if (widget == null || !widget.subscriptions.remove(subscription)) {
            return;
        }
        eventBus.unregister(subscription);

        if (!widget.subscriptions.isEmpty()) {
            LOG.debug("Unsubscribed from {} ({} subscriber(s) left)", widgetId, widget.subscriptions.size());
            return;
        }

        widget.poller.stop();
        active.remove(widgetId);
        LOG.debug("Last subscriber left {}, pipeline stopped", widgetId);
    }

    private <T> Poller<T> startPoller(WidgetLease lease, WidgetDefinition<T> definition) {
        Poller<T> poller = new Poller<>(lease, reconciler);
        poller.start(definition.schedule());
        return poller;
    }
}

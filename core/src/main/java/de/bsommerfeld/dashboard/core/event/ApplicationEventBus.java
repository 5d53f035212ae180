package de.bsommerfeld.dashboard.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} that decouples state
 * producers (reconcilers) from consumers (subscriptions, view models).
 *
 * <p>
 * Delivery is synchronous on the posting thread. A listener that throws is
 * logged and skipped; the exception never reaches the poster, so a broken
 * view cannot stall a widget's polling thread.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::handleSubscriberException);
    }

    public void post(Object event) {
        // Metric widgets publish every two seconds
        if (event instanceof DashboardEvents.FrequentEvent) {
            LOG.trace("Posting event: {}", event);
        } else {
            LOG.debug("Posting event: {}", event);
        }
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        try {
            eventBus.unregister(listener);
        } catch (IllegalArgumentException e) {
            LOG.debug("Listener was not registered: {}", listener.getClass().getName());
        }
    }

    private static void handleSubscriberException(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Listener {} failed on event {}",
                context.getSubscriber().getClass().getName(), context.getEvent(), exception);
    }
}

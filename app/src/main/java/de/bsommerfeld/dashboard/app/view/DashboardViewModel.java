package de.bsommerfeld.dashboard.app.view;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.core.config.WidgetsConfig;
import de.bsommerfeld.dashboard.core.domain.Linkable;
import de.bsommerfeld.dashboard.core.event.ApplicationEventBus;
import de.bsommerfeld.dashboard.core.event.DashboardEvents.LanguageChangedEvent;
import de.bsommerfeld.dashboard.core.event.DashboardEvents.OpenLinkEvent;
import de.bsommerfeld.dashboard.polling.SourceKind;
import de.bsommerfeld.dashboard.polling.WidgetCatalog;
import de.bsommerfeld.dashboard.polling.WidgetDefinition;
import de.bsommerfeld.dashboard.polling.WidgetId;
import de.bsommerfeld.dashboard.polling.aggregate.Aggregator;
import de.bsommerfeld.dashboard.polling.aggregate.ServiceTally;
import de.bsommerfeld.dashboard.polling.state.WidgetState;
import de.bsommerfeld.dashboard.polling.subscription.WidgetSubscription;
import de.bsommerfeld.dashboard.polling.subscription.WidgetSubscriptions;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Model backing the dashboard grid. Subscribes to every enabled widget and
 * keeps a render-ready {@link WidgetView} per widget, in configured order.
 *
 * <p>
 * Views are rebuilt on the polling thread of the widget that changed and
 * read from any thread. Each view is rebuilt atomically per widget, so a
 * re-render for another reason never overwrites a newer state.
 */
@Singleton
public class DashboardViewModel {

    private static final Logger LOG = LoggerFactory.getLogger(DashboardViewModel.class);

    private final WidgetSubscriptions subscriptions;
    private final WidgetCatalog catalog;
    private final WidgetsConfig widgetsConfig;
    private final WidgetStatusFormatter formatter;
    private final Aggregator aggregator;
    private final ApplicationEventBus eventBus;

    private final Map<WidgetId, WidgetSubscription> active = new LinkedHashMap<>();
    private final Map<WidgetId, SourceKind> kinds = new ConcurrentHashMap<>();
    private final Map<WidgetId, WidgetView> views = new ConcurrentHashMap<>();

    @Inject
    public DashboardViewModel(WidgetSubscriptions subscriptions, WidgetCatalog catalog, WidgetsConfig widgetsConfig,
            WidgetStatusFormatter formatter, Aggregator aggregator, ApplicationEventBus eventBus) {
        this.subscriptions = subscriptions;
        this.catalog = catalog;
        this.widgetsConfig = widgetsConfig;
        this.formatter = formatter;
        this.aggregator = aggregator;
        this.eventBus = eventBus;
        eventBus.register(this);
    }

    /**
     * Subscribes to the widgets listed in {@code [widgets] enabled}. Unknown
     * keys are logged and skipped. Calling it again has no effect.
     */
    public synchronized void start() {
        if (!active.isEmpty()) {
            return;
        }
        LOG.info("Initializing dashboard with widgets {}", widgetsConfig.getEnabled());

        for (String key : widgetsConfig.getEnabled()) {
            Optional<SourceKind> kind = SourceKind.fromKey(key);
            if (kind.isEmpty()) {
                LOG.warn("Ignoring unknown widget '{}' in configuration", key);
                continue;
            }
            WidgetId id = WidgetId.of(kind.get());
            if (active.containsKey(id)) {
                continue;
            }
            Optional<WidgetDefinition<?>> definition = catalog.definition(id);
            if (definition.isEmpty()) {
                LOG.warn("Widget '{}' is not available", key);
                continue;
            }

            kinds.put(id, definition.get().kind());
            WidgetSubscription subscription = subscriptions.subscribe(id, state -> onStateChanged(id, state));
            active.put(id, subscription);
            render(id, subscription::current);
        }
    }

    /** Unsubscribes from every widget; their pollers stop. */
    public synchronized void stop() {
        active.values().forEach(WidgetSubscription::unsubscribe);
        active.clear();
        views.clear();
        LOG.info("Dashboard stopped");
    }

    /** Current views in configured order. */
    public synchronized List<WidgetView> views() {
        List<WidgetView> ordered = new ArrayList<>();
        for (WidgetId id : active.keySet()) {
            WidgetView view = views.get(id);
            if (view != null) {
                ordered.add(view);
            }
        }
        return ordered;
    }

    public Optional<WidgetView> view(WidgetId id) {
        return Optional.ofNullable(views.get(id));
    }

    /** "Last check" footer over all displayed widgets. */
    public synchronized String lastCheck() {
        return formatter.lastCheck(aggregator.latestCheckTime(List.copyOf(active.keySet())));
    }

    /** "Last check" of the service health widget, from its probe times. */
    public String lastServiceCheck() {
        return formatter.lastCheck(aggregator.latestServiceCheck(WidgetId.of(SourceKind.SERVICE_HEALTH)));
    }

    public ServiceTally servicesUp() {
        return aggregator.servicesUp(WidgetId.of(SourceKind.SERVICE_HEALTH));
    }

    /**
     * Requests the {@code index}th linkable record of a widget to be opened.
     *
     * @return {@code false} if there is no such record
     */
    public boolean select(WidgetId id, int index) {
        List<Linkable> links = view(id).map(WidgetView::links).orElse(List.of());
        if (index < 0 || index >= links.size()) {
            return false;
        }
        eventBus.post(new OpenLinkEvent(links.get(index).url()));
        return true;
    }

    /** Re-renders every widget in the new language. */
    @Subscribe
    public void onLanguageChanged(LanguageChangedEvent event) {
        List<WidgetSubscription> current;
        synchronized (this) {
            current = List.copyOf(active.values());
        }
        for (WidgetSubscription subscription : current) {
            // Read the state inside the widget's render so a concurrent change cannot be overwritten
            render(subscription.widgetId(), subscription::current);
        }
    }

    private void onStateChanged(WidgetId id, WidgetState<?> state) {
        render(id, () -> state);
    }

    private void render(WidgetId id, Supplier<WidgetState<?>> state) {
        SourceKind kind = kinds.get(id);
        if (kind == null) {
            return;
        }
        views.compute(id, (key, previous) -> {
            WidgetView view = formatter.format(id, kind, state.get());
            if (previous == null || !previous.line().equals(view.line())) {
                LOG.info("{}", view.line());
            }
            return view;
        });
    }
}

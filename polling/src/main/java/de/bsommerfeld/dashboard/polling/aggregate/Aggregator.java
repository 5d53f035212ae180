package de.bsommerfeld.dashboard.polling.aggregate;

import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.core.domain.ServiceHealth;
import de.bsommerfeld.dashboard.polling.WidgetId;
import de.bsommerfeld.dashboard.polling.state.WidgetState;
import de.bsommerfeld.dashboard.polling.state.WidgetStateStore;
import jakarta.inject.Inject;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derived values across widget states. Every method reads one store snapshot
 * and computes its answer from scratch; nothing is cached between calls.
 */
@Singleton
public class Aggregator {

    private final WidgetStateStore store;

    @Inject
    public Aggregator(WidgetStateStore store) {
        this.store = store;
    }

    /**
     * The most recent fetch completion (success or failure) across the named
     * widgets. Loading widgets and ids that are not open contribute nothing.
     *
     * @return the latest instant, or {@link CheckTime#NO_DATA_YET}
     */
    public CheckTime latestCheckTime(Collection<WidgetId> widgetIds) {
        Map<WidgetId, WidgetState<?>> snapshot = store.snapshot();
        CheckTime latest = CheckTime.NO_DATA_YET;
        for (WidgetId id : widgetIds) {
            WidgetState<?> state = snapshot.get(id);
            if (state != null) {
                latest = state.completedAt().map(CheckTime::at).orElse(CheckTime.NO_DATA_YET).max(latest);
            }
        }
        return latest;
    }

    /**
     * The most recent probe time across the services held by a service health
     * widget, taken from its fresh or last good payload.
     */
    public CheckTime latestServiceCheck(WidgetId widgetId) {
        CheckTime latest = CheckTime.NO_DATA_YET;
        for (ServiceHealth service : services(widgetId)) {
            if (service.checkedAt() != null) {
                latest = latest.max(CheckTime.at(service.checkedAt()));
            }
        }
        return latest;
    }

    /** Up/total count of the services held by a service health widget. */
    public ServiceTally servicesUp(WidgetId widgetId) {
        List<ServiceHealth> services = services(widgetId);
        if (services.isEmpty()) {
            return ServiceTally.EMPTY;
        }
        int up = (int) services.stream().filter(ServiceHealth::up).count();
        return new ServiceTally(up, services.size());
    }

    private List<ServiceHealth> services(WidgetId widgetId) {
        Optional<?> data = store.get(widgetId).flatMap(WidgetState::data);
        if (data.isEmpty() || !(data.get() instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(ServiceHealth.class::isInstance)
                .map(ServiceHealth.class::cast)
                .toList();
    }
}

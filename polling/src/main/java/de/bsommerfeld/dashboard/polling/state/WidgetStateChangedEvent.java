package de.bsommerfeld.dashboard.polling.state;

import de.bsommerfeld.dashboard.core.event.DashboardEvents;
import de.bsommerfeld.dashboard.polling.WidgetId;

/**
 * Published on the application event bus after every committed store write.
 */
public record WidgetStateChangedEvent(WidgetId widgetId, WidgetState<?> previous, WidgetState<?> current)
        implements DashboardEvents.FrequentEvent {
}

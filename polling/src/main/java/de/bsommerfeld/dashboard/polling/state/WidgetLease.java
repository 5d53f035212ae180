package de.bsommerfeld.dashboard.polling.state;

import de.bsommerfeld.dashboard.polling.SourceKind;
import de.bsommerfeld.dashboard.polling.WidgetId;

/**
 * Write permission for one store slot. A lease is issued when a widget is
 * opened and becomes void when it is closed; writes through a void lease are
 * dropped, which is how results of fetches that outlive their subscription
 * are discarded.
 *
 * @param epoch distinguishes successive openings of the same widget id
 */
public record WidgetLease(WidgetId widgetId, SourceKind kind, long epoch) {
}

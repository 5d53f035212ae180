package de.bsommerfeld.dashboard.polling;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Everything needed to start polling one widget.
 */
public record WidgetDefinition<T>(WidgetId id, SourceKind kind, PollSchedule<T> schedule) {

    public WidgetDefinition {
        checkNotNull(id, "id");
        checkNotNull(kind, "kind");
        checkNotNull(schedule, "schedule");
    }

    /** The default widget of a kind, polled at the kind's interval. */
    public static <T> WidgetDefinition<T> of(SourceKind kind, SourceAdapter<T> adapter) {
        return new WidgetDefinition<>(WidgetId.of(kind), kind, PollSchedule.forKind(kind, adapter));
    }
}

package de.bsommerfeld.dashboard.polling;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Identifies one widget on the grid. The default widget of each kind uses
 * the kind's key as its id.
 */
public record WidgetId(String value) {

    public WidgetId {
        checkArgument(value != null && !value.isBlank(), "widget id must not be blank");
    }

    public static WidgetId of(SourceKind kind) {
        return new WidgetId(kind.key());
    }

    @Override
    public String toString() {
        return value;
    }
}

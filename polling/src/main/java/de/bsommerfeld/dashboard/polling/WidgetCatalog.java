package de.bsommerfeld.dashboard.polling;

import java.util.List;
import java.util.Optional;

/**
 * Source of widget definitions. Decides which adapter backs which widget.
 */
public interface WidgetCatalog {

    /** All widgets this catalog can serve, in grid order. */
    List<WidgetDefinition<?>> definitions();

    default Optional<WidgetDefinition<?>> definition(WidgetId id) {
        return definitions().stream()
                .filter(definition -> definition.id().equals(id))
                .findFirst();
    }
}

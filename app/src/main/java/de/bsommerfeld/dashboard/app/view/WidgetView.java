package de.bsommerfeld.dashboard.app.view;

import de.bsommerfeld.dashboard.core.domain.Linkable;
import de.bsommerfeld.dashboard.polling.WidgetId;
import de.bsommerfeld.dashboard.polling.error.ErrorKind;

import java.util.List;
import java.util.Optional;

/**
 * Render-ready text of one widget.
 *
 * @param summary one-line rendering of the payload, empty if there is none
 * @param status  loading or error text, empty when the widget is Ready
 * @param error   kind of the current failure, {@code null} unless degraded
 * @param links   records of the payload that can be opened
 */
public record WidgetView(WidgetId id, String title, String summary, String status, ErrorKind error,
        List<Linkable> links) {

    public WidgetView {
        links = List.copyOf(links);
    }

    public boolean isDegraded() {
        return error != null;
    }

    public Optional<ErrorKind> errorKind() {
        return Optional.ofNullable(error);
    }

    /** Title, summary and status on one line. */
    public String line() {
        StringBuilder line = new StringBuilder(title).append(": ");
        if (!summary.isEmpty()) {
            line.append(summary);
            if (!status.isEmpty()) {
                line.append(" | ");
            }
        }
        return line.append(status).toString();
    }
}

package de.bsommerfeld.dashboard.core.event;

/**
 * Cross-module events that are not tied to a single widget's state.
 */
public class DashboardEvents {

    /**
     * Marker for events published on every poll tick. The bus logs them at
     * TRACE instead of DEBUG.
     */
    public interface FrequentEvent {
    }

    /**
     * Fired when the user selects a record that carries an external URL
     * (ticket, issue, monitored service).
     */
    public record OpenLinkEvent(String url) {
    }

    /**
     * Fired when the display language is changed. Views re-render titles and
     * status texts.
     */
    public record LanguageChangedEvent() {
    }
}

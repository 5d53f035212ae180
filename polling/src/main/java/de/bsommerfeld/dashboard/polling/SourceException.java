package de.bsommerfeld.dashboard.polling;

/**
 * Thrown by a {@link SourceAdapter} when a fetch fails. The message is the
 * only thing the dashboard looks at: it is classified by substring markers,
 * so adapters should keep the backend's wording (status codes, variable
 * names) intact.
 */
public class SourceException extends Exception {

    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

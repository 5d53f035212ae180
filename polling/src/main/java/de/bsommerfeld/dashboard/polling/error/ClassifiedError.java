package de.bsommerfeld.dashboard.polling.error;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An adapter failure after classification.
 *
 * @param kind    category derived from the message
 * @param message the adapter's original failure text, empty if it had none
 */
public record ClassifiedError(ErrorKind kind, String message) {

    public ClassifiedError {
        checkNotNull(kind, "kind");
        message = message == null ? "" : message;
    }
}

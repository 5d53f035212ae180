package de.bsommerfeld.dashboard.polling.state;

import de.bsommerfeld.dashboard.polling.FetchOutcome;
import de.bsommerfeld.dashboard.polling.error.ClassifiedError;
import de.bsommerfeld.dashboard.polling.error.ErrorKind;

import java.time.Instant;

/**
 * The per-widget state machine as a pure function.
 *
 * <pre>
 * Loading  --success-------------------&gt; Ready
 * Loading  --failure STILL_LOADING-----&gt; Loading
 * Loading  --failure other-------------&gt; Degraded(no data)
 * Ready    --success-------------------&gt; Ready
 * Ready    --failure any---------------&gt; Degraded(Ready payload)
 * Degraded --success-------------------&gt; Ready
 * Degraded --failure any---------------&gt; Degraded(new error and time, payload kept)
 * </pre>
 *
 * There is no terminal state. Only an explicit reset returns a widget to
 * Loading once it has completed a fetch.
 */
public final class Transitions {

    private Transitions() {
    }

    /**
     * @param current the widget's state before the outcome
     * @param outcome the adapter result
     * @param error   classification of a failure outcome, ignored on success
     * @param now     completion time of the fetch
     * @return the widget's next state
     */
    public static <T> WidgetState<T> next(WidgetState<T> current, FetchOutcome<T> outcome,
            ClassifiedError error, Instant now) {
        if (outcome instanceof FetchOutcome.Success<T> success) {
            return new WidgetState.Ready<>(success.data(), now);
        }
        if (error == null) {
            throw new IllegalArgumentException("failure outcome requires a classified error");
        }

        if (current instanceof WidgetState.Loading<T> && error.kind() == ErrorKind.STILL_LOADING) {
            return current;
        }
        if (current instanceof WidgetState.Ready<T> ready) {
            return new WidgetState.Degraded<>(ready.payload(), error, now);
        }
        if (current instanceof WidgetState.Degraded<T> degraded) {
            return new WidgetState.Degraded<>(degraded.lastGood(), error, now);
        }
        return new WidgetState.Degraded<>(null, error, now);
    }
}

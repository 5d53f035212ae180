package de.bsommerfeld.dashboard.polling.state;

import de.bsommerfeld.dashboard.polling.error.ClassifiedError;

import java.time.Instant;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * What a widget currently shows. Exactly one of {@link Loading},
 * {@link Ready} or {@link Degraded}.
 *
 * <p>
 * Loading is the initial state only; see {@link Transitions} for the full
 * state machine.
 *
 * @param <T> payload type of the widget's source
 */
public interface WidgetState<T> {

    @SuppressWarnings("unchecked")
    static <T> WidgetState<T> loading() {
        return (WidgetState<T>) Loading.INSTANCE;
    }

    /**
     * The payload to display: the fresh data when Ready, the last good data
     * when Degraded, empty otherwise.
     */
    Optional<T> data();

    /** When the last fetch completed (successfully or not), empty while Loading. */
    Optional<Instant> completedAt();

    /** No fetch has completed yet, or the adapter is still warming up. */
    record Loading<T>() implements WidgetState<T> {

        private static final Loading<Object> INSTANCE = new Loading<>();

        @Override
        public Optional<T> data() {
            return Optional.empty();
        }

        @Override
        public Optional<Instant> completedAt() {
            return Optional.empty();
        }
    }

    /** The last fetch succeeded. */
    record Ready<T>(T payload, Instant fetchedAt) implements WidgetState<T> {

        public Ready {
            checkNotNull(payload, "payload");
            checkNotNull(fetchedAt, "fetchedAt");
        }

        @Override
        public Optional<T> data() {
            return Optional.of(payload);
        }

        @Override
        public Optional<Instant> completedAt() {
            return Optional.of(fetchedAt);
        }
    }

    /**
     * The last fetch failed.
     *
     * @param lastGood payload of the most recent successful fetch, {@code null}
     *                 if there never was one
     */
    record Degraded<T>(T lastGood, ClassifiedError error, Instant failedAt) implements WidgetState<T> {

        public Degraded {
            checkNotNull(error, "error");
            checkNotNull(failedAt, "failedAt");
        }

        @Override
        public Optional<T> data() {
            return Optional.ofNullable(lastGood);
        }

        @Override
        public Optional<Instant> completedAt() {
            return Optional.of(failedAt);
        }

        public boolean hasLastGood() {
            return lastGood != null;
        }
    }
}

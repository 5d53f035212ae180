package de.bsommerfeld.dashboard.polling;

/**
 * Raw result of one adapter call as handed from the poller to the
 * reconciler.
 */
public interface FetchOutcome<T> {

    static <T> FetchOutcome<T> success(T data) {
        return new Success<>(data);
    }

    static <T> FetchOutcome<T> failure(String message) {
        return new Failure<>(message);
    }

    record Success<T>(T data) implements FetchOutcome<T> {
    }

    /**
     * @param message adapter failure text, may be {@code null} if the
     *                adapter gave none
     */
    record Failure<T>(String message) implements FetchOutcome<T> {
    }
}

package de.bsommerfeld.dashboard.polling;

/**
 * Fetches the current data of one backend. Implementations may block; each
 * adapter is only ever called from its own poller thread and never
 * concurrently with itself.
 *
 * <p>
 * Adapters do not retry. The next scheduled poll is the retry.
 *
 * @param <T> payload type, e.g. {@code CpuUsage} or {@code List<Ticket>}
 */
@FunctionalInterface
public interface SourceAdapter<T> {

    /**
     * @return the fetched payload, never {@code null}
     * @throws SourceException with a human-readable reason if the fetch failed
     */
    T fetch() throws SourceException;
}

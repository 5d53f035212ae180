package de.bsommerfeld.dashboard.sources.demo;

import de.bsommerfeld.dashboard.polling.SourceAdapter;
import de.bsommerfeld.dashboard.polling.SourceException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fails its first call with a loading message, like a backend whose client is
 * still being set up, then delegates.
 */
final class WarmUpAdapter<T> implements SourceAdapter<T> {

    private final String loadingMessage;
    private final SourceAdapter<T> delegate;
    private final AtomicBoolean warm = new AtomicBoolean();

    WarmUpAdapter(String loadingMessage, SourceAdapter<T> delegate) {
        this.loadingMessage = loadingMessage;
        this.delegate = delegate;
    }

    @Override
    public T fetch() throws SourceException {
        if (warm.compareAndSet(false, true)) {
            throw new SourceException(loadingMessage);
        }
        return delegate.fetch();
    }
}

package de.bsommerfeld.dashboard.sources.live;

import de.bsommerfeld.dashboard.polling.SourceAdapter;
import de.bsommerfeld.dashboard.polling.SourceException;
import de.bsommerfeld.dashboard.polling.SourceKind;

/** Placeholder for a kind nobody contributed an adapter for. */
final class MissingAdapter implements SourceAdapter<Object> {

    private final SourceKind kind;

    MissingAdapter(SourceKind kind) {
        this.kind = kind;
    }

    @Override
    public Object fetch() throws SourceException {
        throw new SourceException("No adapter installed for " + kind.key());
    }
}

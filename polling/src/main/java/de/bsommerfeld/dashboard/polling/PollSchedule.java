package de.bsommerfeld.dashboard.polling;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * How often one adapter is polled. The interval is the pause between the
 * end of one fetch and the start of the next.
 */
public record PollSchedule<T>(Duration interval, SourceAdapter<T> adapter) {

    public PollSchedule {
        checkNotNull(interval, "interval");
        checkNotNull(adapter, "adapter");
        checkArgument(interval.toMillis() > 0, "interval must be at least 1ms, was %s", interval);
    }

    /** Schedule using the kind's fixed default interval. */
    public static <T> PollSchedule<T> forKind(SourceKind kind, SourceAdapter<T> adapter) {
        return new PollSchedule<>(kind.defaultInterval(), adapter);
    }

    public long intervalMs() {
        return interval.toMillis();
    }
}

package de.bsommerfeld.dashboard.polling.aggregate;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Result of a "latest check" aggregate: either an instant or the explicit
 * {@link #NO_DATA_YET} sentinel. Never the epoch as a stand-in for "nothing".
 */
public final class CheckTime {

    public static final CheckTime NO_DATA_YET = new CheckTime(null);

    private final Instant instant;

    private CheckTime(Instant instant) {
        this.instant = instant;
    }

    public static CheckTime at(Instant instant) {
        return new CheckTime(checkNotNull(instant, "instant"));
    }

    public boolean hasData() {
        return instant != null;
    }

    public Optional<Instant> instant() {
        return Optional.ofNullable(instant);
    }

    /** The later of the two; {@link #NO_DATA_YET} loses to any instant. */
    CheckTime max(CheckTime other) {
        if (!other.hasData()) {
            return this;
        }
        if (!hasData() || other.instant.isAfter(instant)) {
            return other;
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CheckTime other && Objects.equals(instant, other.instant);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(instant);
    }

    @Override
    public String toString() {
        return hasData() ? "CheckTime[" + instant + "]" : "CheckTime[NO_DATA_YET]";
    }
}

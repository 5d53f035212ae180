package de.bsommerfeld.dashboard.polling.error;

/**
 * Failure categories, declared in precedence order. When a message carries
 * markers of several kinds, the kind declared first wins.
 */
public enum ErrorKind {

    /** Credentials or configuration are missing. */
    NOT_CONFIGURED,

    /** The backend rejected the credentials. */
    AUTH_FAILURE,

    /** The capability is absent on this host (wrong OS, app not running). */
    UNSUPPORTED_PLATFORM,

    /** The adapter is still warming up. Not shown as an error. */
    STILL_LOADING,

    /** The backend was reachable in principle but the request failed. */
    TRANSIENT_NETWORK,

    /** No marker matched. */
    UNKNOWN;

    /** Kinds the user can fix with a concrete action. */
    public boolean isActionable() {
        return this == NOT_CONFIGURED || this == AUTH_FAILURE;
    }

    /**
     * @return {@code true} if this kind outranks {@code other}
     */
    public boolean outranks(ErrorKind other) {
        return ordinal() < other.ordinal();
    }
}

package de.bsommerfeld.dashboard.core.config;

/**
 * Read access to process environment variables. Credentials for remote
 * sources (Jira, Sentry) are only ever read through this interface so that
 * credential checks can run against a fixed map in tests.
 */
@FunctionalInterface
public interface Environment {

    /**
     * @param name variable name
     * @return the value, or {@code null} if the variable is not set
     */
    String get(String name);

    /** Returns {@code true} if the variable is set to a non-blank value. */
    default boolean isSet(String name) {
        String value = get(name);
        return value != null && !value.isBlank();
    }

    /** The real process environment. */
    static Environment system() {
        return System::getenv;
    }
}

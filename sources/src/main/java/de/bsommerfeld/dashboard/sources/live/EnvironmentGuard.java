package de.bsommerfeld.dashboard.sources.live;

import de.bsommerfeld.dashboard.core.config.Environment;
import de.bsommerfeld.dashboard.polling.SourceAdapter;
import de.bsommerfeld.dashboard.polling.SourceException;
import de.bsommerfeld.dashboard.polling.SourceKind;

import java.util.List;

/**
 * Checks the credentials a backend needs before its adapter runs, so a
 * missing variable surfaces as a precise message instead of an opaque
 * HTTP error. Variables are checked on every fetch; exporting one takes
 * effect on the next poll.
 */
public final class EnvironmentGuard<T> implements SourceAdapter<T> {

    private final List<String> required;
    private final Environment environment;
    private final SourceAdapter<T> delegate;

    EnvironmentGuard(List<String> required, Environment environment, SourceAdapter<T> delegate) {
        this.required = List.copyOf(required);
        this.environment = environment;
        this.delegate = delegate;
    }

    /** Credentials of {@code kind}, in the order they are reported missing. */
    public static List<String> requiredVariables(SourceKind kind) {
        return switch (kind) {
            case TICKETS -> List.of("JIRA_API_TOKEN", "JIRA_EMAIL");
            case ISSUES -> List.of("SENTRY_AUTH_TOKEN");
            default -> List.of();
        };
    }

    /** Wraps {@code adapter} if {@code kind} needs credentials. */
    public static <T> SourceAdapter<T> wrap(SourceKind kind, Environment environment, SourceAdapter<T> adapter) {
        List<String> required = requiredVariables(kind);
        return required.isEmpty() ? adapter : new EnvironmentGuard<>(required, environment, adapter);
    }

    @Override
    public T fetch() throws SourceException {
        for (String variable : required) {
            if (!environment.isSet(variable)) {
                throw new SourceException(variable + " environment variable not set");
            }
        }
        return delegate.fetch();
    }
}

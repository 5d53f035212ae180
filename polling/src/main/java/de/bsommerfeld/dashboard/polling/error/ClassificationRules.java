package de.bsommerfeld.dashboard.polling.error;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.dashboard.polling.SourceKind;

import java.util.List;

import static de.bsommerfeld.dashboard.polling.error.ClassificationRule.contains;
import static de.bsommerfeld.dashboard.polling.error.ClassificationRule.regex;
import static de.bsommerfeld.dashboard.polling.error.ErrorKind.AUTH_FAILURE;
import static de.bsommerfeld.dashboard.polling.error.ErrorKind.NOT_CONFIGURED;
import static de.bsommerfeld.dashboard.polling.error.ErrorKind.STILL_LOADING;
import static de.bsommerfeld.dashboard.polling.error.ErrorKind.TRANSIENT_NETWORK;
import static de.bsommerfeld.dashboard.polling.error.ErrorKind.UNSUPPORTED_PLATFORM;

/**
 * Ordered marker table used by {@link ErrorClassifier}. Rules shared by all
 * sources come from {@link #common()}; {@link #forKind(SourceKind)} adds the
 * markers specific to one backend in front of them.
 *
 * <p>
 * To teach the dashboard a new failure text, add a row here.
 */
public final class ClassificationRules {

    private static final ClassificationRules COMMON = builder()
            .add(contains(NOT_CONFIGURED, "environment variable not set"))
            .add(contains(NOT_CONFIGURED, "not configured"))
            .add(contains(NOT_CONFIGURED, "not installed"))
            .add(contains(NOT_CONFIGURED, "no adapter"))
            .add(regex(AUTH_FAILURE, "\\b40[13]\\b"))
            .add(contains(AUTH_FAILURE, "unauthorized"))
            .add(contains(AUTH_FAILURE, "forbidden"))
            .add(contains(AUTH_FAILURE, "authentication failed"))
            .add(contains(AUTH_FAILURE, "invalid token"))
            .add(contains(UNSUPPORTED_PLATFORM, "only supported"))
            .add(contains(UNSUPPORTED_PLATFORM, "not supported"))
            .add(contains(UNSUPPORTED_PLATFORM, "not running"))
            // "Loading Jira tickets..." but not "Error loading ..."
            .add(regex(STILL_LOADING, "^\\W*loading\\b"))
            .add(regex(STILL_LOADING, "\\b(still|is) loading\\b"))
            .add(contains(TRANSIENT_NETWORK, "connection refused"))
            .add(contains(TRANSIENT_NETWORK, "connection reset"))
            .add(contains(TRANSIENT_NETWORK, "timed out"))
            .add(contains(TRANSIENT_NETWORK, "timeout"))
            .add(contains(TRANSIENT_NETWORK, "failed to fetch"))
            .add(contains(TRANSIENT_NETWORK, "error sending request"))
            .add(regex(TRANSIENT_NETWORK, "\\bdns\\b"))
            .add(regex(TRANSIENT_NETWORK, "\\b50[234]\\b"))
            .add(contains(TRANSIENT_NETWORK, "unreachable"))
            .add(contains(TRANSIENT_NETWORK, "temporarily unavailable"))
            .build();

    private final ImmutableList<ClassificationRule> rules;

    private ClassificationRules(ImmutableList<ClassificationRule> rules) {
        this.rules = rules;
    }

    /** Markers every source understands. */
    public static ClassificationRules common() {
        return COMMON;
    }

    /** Source-specific markers followed by the common ones. */
    public static ClassificationRules forKind(SourceKind kind) {
        Builder builder = builder();
        switch (kind) {
            case TICKETS -> builder
                    .add(regex(NOT_CONFIGURED, "\\bJIRA_(API_TOKEN|EMAIL|BASE_URL)\\b.*\\b(not set|missing)\\b"));
            case ISSUES -> builder
                    .add(regex(NOT_CONFIGURED, "\\bSENTRY_AUTH_TOKEN\\b.*\\b(not set|missing)\\b"));
            case CONTAINERS -> builder
                    .add(contains(NOT_CONFIGURED, "failed to execute docker"))
                    .add(contains(NOT_CONFIGURED, "executable file not found"))
                    .add(contains(TRANSIENT_NETWORK, "docker daemon"));
            case MEDIA -> builder
                    .add(contains(TRANSIENT_NETWORK, "failed to parse"))
                    .add(contains(UNSUPPORTED_PLATFORM, "failed to execute applescript"));
            default -> {
            }
        }
        return builder.addAll(COMMON).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ClassificationRule> rules() {
        return rules;
    }

    /** Rows of one kind, in table order. */
    public List<ClassificationRule> rulesFor(ErrorKind kind) {
        return rules.stream().filter(rule -> rule.kind() == kind).collect(ImmutableList.toImmutableList());
    }

    public static final class Builder {

        private final ImmutableList.Builder<ClassificationRule> rules = ImmutableList.builder();

        private Builder() {
        }

        public Builder add(ClassificationRule rule) {
            rules.add(rule);
            return this;
        }

        public Builder addAll(ClassificationRules other) {
            rules.addAll(other.rules);
            return this;
        }

        public ClassificationRules build() {
            return new ClassificationRules(rules.build());
        }
    }
}

package de.bsommerfeld.dashboard.polling.error;

import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One row of the classification table: if {@link #pattern()} is found in an
 * adapter message, the message carries a marker of {@link #kind()}.
 * Matching is case-insensitive.
 */
public record ClassificationRule(ErrorKind kind, Pattern pattern) {

    public ClassificationRule {
        checkNotNull(kind, "kind");
        checkNotNull(pattern, "pattern");
    }

    /** Rule matching a literal substring. */
    public static ClassificationRule contains(ErrorKind kind, String marker) {
        return new ClassificationRule(kind,
                Pattern.compile(Pattern.quote(marker), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    /** Rule matching a regular expression anywhere in the message. */
    public static ClassificationRule regex(ErrorKind kind, String regex) {
        return new ClassificationRule(kind,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    public boolean matches(String message) {
        return pattern.matcher(message).find();
    }

    @Override
    public String toString() {
        return kind + " <- /" + pattern.pattern() + "/";
    }
}

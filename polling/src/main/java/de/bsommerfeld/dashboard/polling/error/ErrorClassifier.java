package de.bsommerfeld.dashboard.polling.error;

import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.polling.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps free-text adapter failures to an {@link ErrorKind}.
 *
 * <p>
 * The function is total: {@code null}, blank or unrecognized messages yield
 * {@link ErrorKind#UNKNOWN}. When markers of several kinds are present, the
 * kind that comes first in {@link ErrorKind}'s declaration order wins, so an
 * auth marker beats a network marker in the same message.
 */
@Singleton
public class ErrorClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorClassifier.class);

    private final Map<SourceKind, ClassificationRules> rulesByKind = new EnumMap<>(SourceKind.class);

    public ErrorClassifier() {
        for (SourceKind kind : SourceKind.values()) {
            rulesByKind.put(kind, ClassificationRules.forKind(kind));
        }
    }

    /** Classifies using the rules of {@code kind}. */
    public ClassifiedError classify(SourceKind kind, String message) {
        return classify(rulesByKind.get(kind), message);
    }

    /** Classifies using only the common rules. */
    public ClassifiedError classify(String message) {
        return classify(ClassificationRules.common(), message);
    }

    static ClassifiedError classify(ClassificationRules rules, String message) {
        if (message == null || message.isBlank()) {
            return new ClassifiedError(ErrorKind.UNKNOWN, message);
        }

        ClassificationRule best = null;
        for (ClassificationRule rule : rules.rules()) {
            if ((best == null || rule.kind().outranks(best.kind())) && rule.matches(message)) {
                best = rule;
            }
        }

        if (best == null) {
            LOG.debug("No marker matched '{}', classifying as {}", message, ErrorKind.UNKNOWN);
            return new ClassifiedError(ErrorKind.UNKNOWN, message);
        }
        LOG.trace("'{}' matched {}", message, best);
        return new ClassifiedError(best.kind(), message);
    }
}

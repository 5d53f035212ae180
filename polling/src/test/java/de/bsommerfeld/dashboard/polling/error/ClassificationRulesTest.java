package de.bsommerfeld.dashboard.polling.error;

import de.bsommerfeld.dashboard.polling.SourceKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClassificationRulesTest {

    @Test
    void forKind_shouldPlaceSourceMarkersBeforeCommonOnes() {
        ClassificationRules rules = ClassificationRules.forKind(SourceKind.TICKETS);

        assertTrue(rules.rules().size() > ClassificationRules.common().rules().size());
        assertTrue(rules.rules().get(0).matches("JIRA_EMAIL environment variable not set"));
    }

    @Test
    void forKind_shouldReuseCommonRulesForPlainKinds() {
        assertEquals(ClassificationRules.common().rules(), ClassificationRules.forKind(SourceKind.CPU).rules());
    }

    @Test
    void rulesFor_shouldFilterByKind() {
        assertFalse(ClassificationRules.common().rulesFor(ErrorKind.STILL_LOADING).isEmpty());
        assertTrue(ClassificationRules.common().rulesFor(ErrorKind.UNKNOWN).isEmpty());
        assertTrue(ClassificationRules.common().rulesFor(ErrorKind.AUTH_FAILURE).stream()
                .allMatch(rule -> rule.kind() == ErrorKind.AUTH_FAILURE));
    }

    @Test
    void builder_shouldSupportCustomTables() {
        ClassificationRules rules = ClassificationRules.builder()
                .add(ClassificationRule.contains(ErrorKind.AUTH_FAILURE, "Bad Credentials"))
                .build();

        assertEquals(ErrorKind.AUTH_FAILURE, ErrorClassifier.classify(rules, "bad credentials supplied").kind());
        assertEquals(ErrorKind.UNKNOWN, ErrorClassifier.classify(rules, "connection refused").kind());
    }

    @Test
    void contains_shouldQuoteRegexCharacters() {
        ClassificationRule rule = ClassificationRule.contains(ErrorKind.UNKNOWN, "a.b");

        assertTrue(rule.matches("xx A.B yy"));
        assertFalse(rule.matches("axb"));
    }
}

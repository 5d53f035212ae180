package de.bsommerfeld.dashboard.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SourceModeTest {

    private String original;

    @BeforeEach
    void rememberProperty() {
        original = System.getProperty(SourceMode.PROPERTY);
    }

    @AfterEach
    void restoreProperty() {
        if (original != null)
            System.setProperty(SourceMode.PROPERTY, original);
        else
            System.clearProperty(SourceMode.PROPERTY);
    }

    @Test
    void get_shouldResolveFromSystemProperty() {
        System.setProperty(SourceMode.PROPERTY, "TEST");
        assertEquals(SourceMode.TEST, SourceMode.get());
    }

    @Test
    void get_shouldBeCaseInsensitiveAndTrim() {
        System.setProperty(SourceMode.PROPERTY, " test ");
        assertEquals(SourceMode.TEST, SourceMode.get());
    }

    @Test
    void get_shouldFallBackToProdForInvalidValue() {
        System.setProperty(SourceMode.PROPERTY, "STAGING");
        assertEquals(SourceMode.PROD, SourceMode.get());
    }

    @Test
    void get_shouldNeverReturnNull() {
        System.clearProperty(SourceMode.PROPERTY);
        // DASHBOARD_MODE may or may not be set on the build machine
        assertNotNull(SourceMode.get());
    }

    @Test
    void isTest_shouldOnlyBeTrueForTestMode() {
        assertTrue(SourceMode.TEST.isTest());
        assertFalse(SourceMode.PROD.isTest());
    }
}

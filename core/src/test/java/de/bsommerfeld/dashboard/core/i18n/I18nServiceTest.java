package de.bsommerfeld.dashboard.core.i18n;

import de.bsommerfeld.dashboard.core.config.DashboardConfig;
import de.bsommerfeld.dashboard.core.config.UserConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class I18nServiceTest {

    private I18nService service;

    @BeforeEach
    void setUp() {
        DashboardConfig config = mock(DashboardConfig.class);
        UserConfig userConfig = mock(UserConfig.class);
        when(config.getUser()).thenReturn(userConfig);
        when(userConfig.getLanguage()).thenReturn("en");
        service = new I18nService(config);
    }

    @Test
    void getCurrentLocale_shouldReturnConfiguredLocale() {
        assertEquals(Locale.ENGLISH, service.getCurrentLocale());
    }

    @Test
    void get_shouldReturnTranslatedString() {
        assertEquals("Jira Tickets", service.get("widget.tickets.title"));
    }

    @Test
    void get_shouldThrowForMissingKey() {
        assertThrows(IllegalStateException.class,
                () -> service.get("nonexistent.key.that.does.not.exist"));
    }

    @Test
    void getFormatted_shouldReplacePlaceholders() {
        String result = service.get("status.error", "CPU");
        assertEquals("Error loading CPU", result);
    }

    @Test
    void has_shouldReportKeyPresence() {
        assertTrue(service.has("status.not_configured.tickets"));
        assertFalse(service.has("status.not_configured.cpu"));
    }

    @Test
    void setLocale_shouldSwitchLanguage() {
        service.setLocale(Locale.GERMAN);

        assertEquals(Locale.GERMAN, service.getCurrentLocale());
        assertEquals("Fehler beim Laden von CPU", service.get("status.error", "CPU"));
    }

    @Test
    void setLocale_shouldFallBackToDefaultBundleForUnsupportedLocale() {
        service.setLocale(Locale.JAPANESE);
        assertNotNull(service.get("status.loading", "CPU"));
    }
}

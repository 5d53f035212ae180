package de.bsommerfeld.dashboard.app.link;

import de.bsommerfeld.dashboard.core.config.WidgetsConfig;
import de.bsommerfeld.dashboard.core.event.ApplicationEventBus;
import de.bsommerfeld.dashboard.core.event.DashboardEvents.OpenLinkEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkServiceTest {

    @Mock
    private LinkOpener opener;

    private ApplicationEventBus eventBus;
    private WidgetsConfig config;
    private LinkService service;

    @BeforeEach
    void setUp() {
        eventBus = new ApplicationEventBus();
        config = new WidgetsConfig();
        service = new LinkService(eventBus, opener, config);
    }

    @Test
    void open_shouldHandUrlToOpener() throws IOException {
        assertTrue(service.open("https://example.atlassian.net/browse/OPS-1"));

        verify(opener).open(URI.create("https://example.atlassian.net/browse/OPS-1"));
    }

    @Test
    void open_shouldSwallowOpenerFailures() throws IOException {
        doThrow(new IOException("no browser")).when(opener).open(any());

        assertFalse(assertDoesNotThrow(() -> service.open("https://example.com")));
    }

    @Test
    void open_shouldSwallowUnsupportedPlatform() throws IOException {
        doThrow(new UnsupportedOperationException("headless")).when(opener).open(any());

        assertFalse(service.open("https://example.com"));
    }

    @Test
    void open_shouldRejectMalformedUrlQuietly() throws IOException {
        assertFalse(service.open("not a url"));
        verify(opener, never()).open(any());
    }

    @Test
    void open_shouldRespectDisabledSetting() throws IOException {
        config.setOpenLinks(false);

        assertFalse(service.open("https://example.com"));
        verify(opener, never()).open(any());
    }

    @Test
    void open_shouldIgnoreBlankUrl() throws IOException {
        assertFalse(service.open(" "));
        verify(opener, never()).open(any());
    }

    @Test
    void onOpenLink_shouldOpenPostedUrl() throws IOException {
        eventBus.post(new OpenLinkEvent("https://example.sentry.io/issues/1/"));

        verify(opener).open(URI.create("https://example.sentry.io/issues/1/"));
    }
}

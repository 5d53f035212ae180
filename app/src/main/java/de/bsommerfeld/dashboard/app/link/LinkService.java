package de.bsommerfeld.dashboard.app.link;

import com.google.common.eventbus.Subscribe;
import com.google.inject.Singleton;
import de.bsommerfeld.dashboard.core.config.WidgetsConfig;
import de.bsommerfeld.dashboard.core.event.ApplicationEventBus;
import de.bsommerfeld.dashboard.core.event.DashboardEvents.OpenLinkEvent;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;

/**
 * Opens the URL of a selected ticket, issue or service.
 *
 * <p>
 * Opening a link is a fire-and-forget side effect: failures are logged and
 * never reach the caller or any widget's state.
 */
@Singleton
public class LinkService {

    private static final Logger LOG = LoggerFactory.getLogger(LinkService.class);

    private final LinkOpener opener;
    private final WidgetsConfig config;

    @Inject
    public LinkService(ApplicationEventBus eventBus, LinkOpener opener, WidgetsConfig config) {
        this.opener = opener;
        this.config = config;
        eventBus.register(this);
    }

    @Subscribe
    public void onOpenLink(OpenLinkEvent event) {
        open(event.url());
    }

    /**
     * @return {@code true} if the URL was handed to the system handler
     */
    public boolean open(String url) {
        if (!config.isOpenLinks()) {
            LOG.debug("Link opening disabled, ignoring {}", url);
            return false;
        }
        if (url == null || url.isBlank()) {
            LOG.debug("Selected record has no link");
            return false;
        }

        try {
            opener.open(URI.create(url));
            LOG.debug("Opened {}", url);
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to open link {}: {}", url, e.getMessage());
            return false;
        }
    }
}

package de.bsommerfeld.dashboard.app.link;

import java.io.IOException;
import java.net.URI;

/**
 * Hands a URL to the system's default handler.
 */
public interface LinkOpener {

    /**
     * @throws IOException                   if the handler could not be launched
     * @throws UnsupportedOperationException if the platform cannot open links
     */
    void open(URI uri) throws IOException;
}

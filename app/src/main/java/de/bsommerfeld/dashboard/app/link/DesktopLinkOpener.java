package de.bsommerfeld.dashboard.app.link;

import java.awt.Desktop;
import java.io.IOException;
import java.net.URI;

/** Opens links in the default browser through AWT's {@link Desktop}. */
public class DesktopLinkOpener implements LinkOpener {

    @Override
    public void open(URI uri) throws IOException {
        if (!Desktop.isDesktopSupported() || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            throw new UnsupportedOperationException("Opening links is not supported on this system");
        }
        Desktop.getDesktop().browse(uri);
    }
}

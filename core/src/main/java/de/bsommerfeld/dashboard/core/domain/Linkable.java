package de.bsommerfeld.dashboard.core.domain;

/**
 * A record that can be opened in the system's default handler when selected.
 */
public interface Linkable {

    /** Absolute URL of the record, or an empty string if it has none. */
    String url();
}

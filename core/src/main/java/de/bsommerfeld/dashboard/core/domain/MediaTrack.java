package de.bsommerfeld.dashboard.core.domain;

/**
 * The track currently loaded in the local media player.
 *
 * @param playing {@code false} when the player is paused
 */
public record MediaTrack(String trackName, String artist, String album, String artworkUrl, boolean playing) {
}

package de.bsommerfeld.dashboard.core.domain;

/**
 * An unresolved error group from the error tracker (Sentry).
 *
 * @param lastSeen  RFC 3339 timestamp as reported by the tracker
 * @param firstSeen RFC 3339 timestamp as reported by the tracker
 * @param age       compact age since {@code firstSeen}, e.g. {@code 3d}
 * @param events    total event count
 * @param users     affected user count
 * @param bot       {@code true} if the events come from a scripted client
 */
public record TrackedIssue(String title, String lastSeen, String firstSeen, String age,
        long events, long users, boolean bot, String url) implements Linkable {
}

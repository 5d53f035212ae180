package de.bsommerfeld.dashboard.core.domain;

/**
 * A ticket from the issue tracker board (Jira).
 *
 * @param key      ticket key, e.g. {@code OPS-42}
 * @param assignee display name, {@code Unassigned} if nobody is assigned
 * @param url      browse URL of the ticket
 */
public record Ticket(String key, String summary, String status, String assignee, String url) implements Linkable {
}

package de.bsommerfeld.dashboard.core.domain;

import java.time.Instant;

/**
 * Result of one uptime probe against a monitored service.
 *
 * @param statusCode HTTP status, {@code null} if no response was received
 * @param latencyMs  round trip time, {@code null} if not measured
 * @param checkedAt  when the probe was sent
 * @param error      transport error text, {@code null} when a response came back
 */
public record ServiceHealth(String name, String url, boolean up, Integer statusCode, Long latencyMs,
        Instant checkedAt, String error) implements Linkable {
}

package de.bsommerfeld.dashboard.core.domain;

/**
 * A running container as listed by the container runtime.
 *
 * @param name   display name; compose containers read {@code folder - service}
 * @param ports  published host ports, comma separated (e.g. {@code 80, 3306})
 * @param uptime human readable running time as reported by the runtime
 */
public record DockerContainer(String id, String name, String image, String status, String ports, String uptime) {
}

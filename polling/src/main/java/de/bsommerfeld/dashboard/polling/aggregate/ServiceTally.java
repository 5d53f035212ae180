package de.bsommerfeld.dashboard.polling.aggregate;

/**
 * How many monitored services answered successfully in the latest probe.
 */
public record ServiceTally(int up, int total) {

    public static final ServiceTally EMPTY = new ServiceTally(0, 0);

    public boolean allUp() {
        return total > 0 && up == total;
    }

    public int down() {
        return total - up;
    }
}

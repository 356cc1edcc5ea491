package dev.unitrain.training;

/**
 * Prints how long a block took when closed:
 * <pre>{@code
 * try (SimpleTimer timer = new SimpleTimer("train epoch 3", verbose)) {
 *     ...
 * }
 * }</pre>
 */
public final class SimpleTimer implements AutoCloseable {

    private final String label;
    private final boolean verbose;
    private final long start = System.nanoTime();

    public SimpleTimer(String label, boolean verbose) {
        this.label = label;
        this.verbose = verbose;
    }

    public long elapsedMillis() {
        return (System.nanoTime() - start) / 1_000_000;
    }

    @Override
    public void close() {
        if (verbose)
            System.out.printf("%s took %s%n", label, formatTime(elapsedMillis()));
    }

    static String formatTime(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        } else if (millis < 60000) {
            return String.format("%.1fs", millis / 1000.0);
        } else {
            long minutes = millis / 60000;
            long seconds = (millis % 60000) / 1000;
            return String.format("%dm %ds", minutes, seconds);
        }
    }
}

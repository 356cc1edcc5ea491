package dev.unitrain.metrics;

/**
 * Which way a metric improves.
 */
public enum Direction {
    LOWER_IS_BETTER,
    HIGHER_IS_BETTER;

    /**
     * True only if {@code candidate} is strictly better than {@code best}.
     */
    public boolean improves(double candidate, double best) {
        return this == LOWER_IS_BETTER ? candidate < best : candidate > best;
    }
}

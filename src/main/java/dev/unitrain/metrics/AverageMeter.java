package dev.unitrain.metrics;

/**
 * Running, sample-weighted average of a per-batch value, plus the best average seen.
 *
 * <p>{@link #reset()} starts a new epoch: it clears the last value, sum and count but
 * keeps the best.
 */
public final class AverageMeter {

    private double value;
    private double sum;
    private long count;
    private double best = Double.NaN;

    /**
     * Record a batch value that stands for {@code n} samples.
     */
    public void update(double value, int n) {
        if (n <= 0)
            throw new IllegalArgumentException("Sample count must be positive: " + n);
        this.value = value;
        this.sum += value * n;
        this.count += n;
    }

    /**
     * Average since the last reset, or NaN if nothing was recorded.
     */
    public double average() {
        return count == 0 ? Double.NaN : sum / count;
    }

    /**
     * Replace the best with the current average if it is strictly better.
     * The first recorded average always becomes the best. An empty meter never improves.
     *
     * @return whether the best changed
     */
    public boolean updateBest(Direction direction) {
        double average = average();
        if (Double.isNaN(average))
            return false;
        if (Double.isNaN(best) || direction.improves(average, best)) {
            best = average;
            return true;
        }
        return false;
    }

    public void reset() {
        value = 0;
        sum = 0;
        count = 0;
    }

    public double getValue() {
        return value;
    }

    public double getSum() {
        return sum;
    }

    public long getCount() {
        return count;
    }

    /**
     * Best average so far, or NaN before the first {@link #updateBest}.
     */
    public double getBest() {
        return best;
    }

    @Override
    public String toString() {
        return String.format("AverageMeter[avg=%.6f, count=%d, best=%.6f]", average(), count, best);
    }
}

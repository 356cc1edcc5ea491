package dev.unitrain.training;

/**
 * Fixed-size store for predictions (and labels) collected batch by batch.
 *
 * <p>Sized {@code numBatches * batchSize}; batch {@code b} occupies the slots starting at
 * {@code b * batchSize}. A mask records which slots were written, so a short final batch
 * leaves trailing slots unfilled and {@link #predictions()} / {@link #labels()} return only
 * the filled ones, in order. Any value, zero and negatives included, is a legitimate entry.
 */
public final class PredictionBuffer {

    private final int batchSize;
    private final float[] predictions;
    private final float[] labels;
    private final boolean[] filled;
    private int filledCount;

    /**
     * @param withLabels whether labels are stored next to predictions
     */
    public PredictionBuffer(int numBatches, int batchSize, boolean withLabels) {
        if (numBatches < 0)
            throw new IllegalArgumentException("Number of batches cannot be negative: " + numBatches);
        if (batchSize <= 0)
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        this.batchSize = batchSize;
        int capacity = Math.multiplyExact(numBatches, batchSize);
        this.predictions = new float[capacity];
        this.labels = withLabels ? new float[capacity] : null;
        this.filled = new boolean[capacity];
    }

    public void put(int batchIndex, float[] batchPredictions, float[] batchLabels) {
        if (batchPredictions.length > batchSize)
            throw new IllegalArgumentException(String.format(
                "Batch %d has %d predictions, more than the batch size %d", batchIndex, batchPredictions.length, batchSize));
        int offset = batchIndex * batchSize;
        if (batchIndex < 0 || offset >= filled.length)
            throw new IllegalArgumentException(String.format(
                "Batch index %d outside [0, %d)", batchIndex, filled.length / batchSize));
        if (labels != null && (batchLabels == null || batchLabels.length != batchPredictions.length))
            throw new IllegalArgumentException("Batch " + batchIndex + " needs one label per prediction");

        for (int i = 0; i < batchPredictions.length; i++) {
            int slot = offset + i;
            if (filled[slot])
                throw new IllegalStateException("Slot " + slot + " of batch " + batchIndex + " already filled");
            predictions[slot] = batchPredictions[i];
            if (labels != null)
                labels[slot] = batchLabels[i];
            filled[slot] = true;
            filledCount++;
        }
    }

    public int capacity() {
        return filled.length;
    }

    public int size() {
        return filledCount;
    }

    public float[] predictions() {
        return compact(predictions);
    }

    /**
     * Labels of the filled slots, or {@code null} if the buffer stores no labels.
     */
    public float[] labels() {
        return labels == null ? null : compact(labels);
    }

    private float[] compact(float[] values) {
        float[] result = new float[filledCount];
        int next = 0;
        for (int slot = 0; slot < filled.length; slot++) {
            if (filled[slot])
                result[next++] = values[slot];
        }
        return result;
    }
}

package dev.unitrain.data;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.random.RandomGenerator;

/**
 * In-memory data source over pre-flattened rows.
 *
 * <p>When constructed with a generator the row order is reshuffled on every pass;
 * without one rows are delivered in their stored order.
 */
public class ArrayDataSource implements DataSource {

    private final float[][] inputs;
    private final float[] labels;
    private final int batchSize;
    private final DataShape shape;
    private final RandomGenerator shuffleRandom;

    public ArrayDataSource(float[][] inputs, float[] labels, int batchSize, DataShape shape) {
        this(inputs, labels, batchSize, shape, null);
    }

    /**
     * @param labels per-row labels, or {@code null} for unlabeled data
     * @param shuffleRandom generator used to shuffle each pass, or {@code null} to keep order
     */
    public ArrayDataSource(float[][] inputs, float[] labels, int batchSize, DataShape shape,
                           RandomGenerator shuffleRandom) {
        if (inputs == null || inputs.length == 0)
            throw new IllegalArgumentException("Inputs cannot be null or empty");
        if (labels != null && labels.length != inputs.length)
            throw new IllegalArgumentException(String.format(
                "Inputs and labels must have same length: %d != %d", inputs.length, labels.length));
        if (batchSize <= 0)
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        for (float[] row : inputs) {
            if (row.length != shape.rowWidth())
                throw new IllegalArgumentException(String.format(
                    "Row width %d does not match shape %d x %d", row.length, shape.seqLen(), shape.featureWidth()));
        }

        this.inputs = inputs;
        this.labels = labels;
        this.batchSize = batchSize;
        this.shape = shape;
        this.shuffleRandom = shuffleRandom;
    }

    @Override
    public int numBatches() {
        return (inputs.length + batchSize - 1) / batchSize;
    }

    @Override
    public DataShape shape() {
        return shape;
    }

    @Override
    public int batchSize() {
        return batchSize;
    }

    public int size() {
        return inputs.length;
    }

    @Override
    public Iterator<Batch> iterator() {
        int[] order = new int[inputs.length];
        for (int i = 0; i < order.length; i++)
            order[i] = i;

        if (shuffleRandom != null) {
            // Fisher-Yates
            for (int i = order.length - 1; i > 0; i--) {
                int j = shuffleRandom.nextInt(i + 1);
                int tmp = order[i];
                order[i] = order[j];
                order[j] = tmp;
            }
        }

        return new Iterator<>() {
            private int position;

            @Override
            public boolean hasNext() {
                return position < order.length;
            }

            @Override
            public Batch next() {
                if (!hasNext())
                    throw new NoSuchElementException();

                int size = Math.min(batchSize, order.length - position);
                float[][] batchInputs = new float[size][];
                float[] batchLabels = labels == null ? null : new float[size];
                for (int i = 0; i < size; i++) {
                    int row = order[position + i];
                    batchInputs[i] = inputs[row];
                    if (batchLabels != null)
                        batchLabels[i] = labels[row];
                }
                position += size;
                return new Batch(batchInputs, batchLabels);
            }
        };
    }
}

package dev.unitrain.data;

/**
 * One batch of samples as handed to a backend.
 *
 * <p>{@code inputs[i]} is the flattened, time-major feature row of sample {@code i}
 * ({@code t * featureWidth + f}). {@code labels[i]} is a class index for classification
 * or a target value for regression; {@code labels} is {@code null} for unlabeled data.
 */
public record Batch(float[][] inputs, float[] labels) {

    public Batch {
        if (inputs == null)
            throw new IllegalArgumentException("Batch inputs cannot be null");
        if (labels != null && labels.length != inputs.length)
            throw new IllegalArgumentException(String.format(
                "Batch has %d input rows but %d labels", inputs.length, labels.length));
    }

    public static Batch unlabeled(float[][] inputs) {
        return new Batch(inputs, null);
    }

    public int size() {
        return inputs.length;
    }

    public boolean isLabeled() {
        return labels != null;
    }
}

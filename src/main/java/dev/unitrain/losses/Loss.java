package dev.unitrain.losses;

/**
 * Batch loss over raw model outputs.
 *
 * <p>{@code outputs[i]} holds the raw outputs of sample {@code i} (logits for
 * classification, a single value for regression) and {@code labels[i]} its target.
 */
public interface Loss {

    public float loss(float[][] outputs, float[] labels);

    /**
     * Gradient of {@link #loss} with respect to every output, same shape as {@code outputs}.
     */
    public float[][] derivatives(float[][] outputs, float[] labels);

}

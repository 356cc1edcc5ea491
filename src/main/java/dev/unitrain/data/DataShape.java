package dev.unitrain.data;

/**
 * Sizing metadata of a data source, used once to parametrize the backend.
 *
 * <p>Dimensions that do not apply to a source are zero.
 */
public record DataShape(int featureWidth, int seqLen, int normWidth,
                        int imageHeight, int imageWidth, int channels) {

    public DataShape {
        if (featureWidth <= 0)
            throw new IllegalArgumentException("Feature width must be positive: " + featureWidth);
        if (seqLen <= 0)
            throw new IllegalArgumentException("Sequence length must be positive: " + seqLen);
        if (normWidth < 0 || imageHeight < 0 || imageWidth < 0 || channels < 0)
            throw new IllegalArgumentException("Shape dimensions cannot be negative");
    }

    /**
     * Shape of a plain sequence source whose normalization runs over every feature channel.
     */
    public static DataShape sequence(int featureWidth, int seqLen) {
        return new DataShape(featureWidth, seqLen, featureWidth, 0, 0, 0);
    }

    /**
     * Shape of a flat tabular source: one timestep of {@code featureWidth} columns.
     */
    public static DataShape tabular(int featureWidth) {
        return new DataShape(featureWidth, 1, featureWidth, 0, 0, 0);
    }

    public int rowWidth() {
        return featureWidth * seqLen;
    }
}

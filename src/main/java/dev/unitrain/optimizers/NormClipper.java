package dev.unitrain.optimizers;

/**
 * Global L2 norm gradient clipper.
 *
 * <p><b>Algorithm:</b>
 * <pre>
 * norm = sqrt(sum over all parameters of gradient[i]^2)
 * if (norm > maxNorm):
 *     gradient[i] *= maxNorm / norm   // for all i
 * </pre>
 *
 * <p>A max norm of zero disables clipping.
 */
public final class NormClipper {

    private final float maxNorm;

    public NormClipper(float maxNorm) {
        if (maxNorm < 0)
            throw new IllegalArgumentException("Max norm must be non-negative, got: " + maxNorm);
        this.maxNorm = maxNorm;
    }

    /**
     * @return the norm before clipping
     */
    public float clipInPlace(Gradients gradients) {
        float norm = gradients.globalNorm();
        if (maxNorm > 0 && norm > maxNorm)
            gradients.scale(maxNorm / norm);
        return norm;
    }

    public float getMaxNorm() {
        return maxNorm;
    }

    @Override
    public String toString() {
        return String.format("NormClipper(maxNorm=%.3f)", maxNorm);
    }
}

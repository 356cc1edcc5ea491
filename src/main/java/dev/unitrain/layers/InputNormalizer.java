package dev.unitrain.layers;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;

/**
 * Per-channel input normalization with running statistics.
 *
 * <p>The first {@code channels} features of every timestep are normalized; any further
 * features pass through unchanged. Training batches are normalized with their own
 * statistics (pooled over samples and timesteps) and fold them into the running estimate;
 * evaluation uses the running estimate only:
 * <pre>
 * running = (1 - momentum) * running + momentum * batch
 * y = (x - mean) / sqrt(var + eps)
 * </pre>
 */
public class InputNormalizer {

    public static final float DEFAULT_MOMENTUM = 0.1f;
    public static final float DEFAULT_EPSILON = 1e-5f;

    private final int featureWidth;
    private final int channels;
    private final float momentum;
    private final float epsilon;
    private final float[] runningMean;
    private final float[] runningVar;

    public InputNormalizer(int featureWidth, int channels) {
        this(featureWidth, channels, DEFAULT_MOMENTUM, DEFAULT_EPSILON);
    }

    public InputNormalizer(int featureWidth, int channels, float momentum, float epsilon) {
        if (channels <= 0 || channels > featureWidth)
            throw new IllegalArgumentException(String.format(
                "Normalization width must be in [1, %d]: %d", featureWidth, channels));
        if (momentum <= 0 || momentum > 1)
            throw new IllegalArgumentException("Momentum must be in (0, 1]: " + momentum);

        this.featureWidth = featureWidth;
        this.channels = channels;
        this.momentum = momentum;
        this.epsilon = epsilon;
        this.runningMean = new float[channels];
        this.runningVar = new float[channels];
        Arrays.fill(runningVar, 1f);
    }

    /**
     * Normalized copies of the rows; the inputs are left untouched.
     *
     * @param training use and record batch statistics instead of the running estimate
     */
    public float[][] normalize(float[][] rows, boolean training) {
        float[] mean = runningMean;
        float[] var = runningVar;

        if (training) {
            double[] sum = new double[channels];
            double[] sumSquares = new double[channels];
            long count = 0;
            for (float[] row : rows) {
                for (int offset = 0; offset < row.length; offset += featureWidth) {
                    for (int c = 0; c < channels; c++) {
                        float v = row[offset + c];
                        sum[c] += v;
                        sumSquares[c] += (double) v * v;
                    }
                    count++;
                }
            }

            if (count > 1) {
                mean = new float[channels];
                var = new float[channels];
                for (int c = 0; c < channels; c++) {
                    double m = sum[c] / count;
                    mean[c] = (float) m;
                    var[c] = (float) Math.max(sumSquares[c] / count - m * m, 0);
                    runningMean[c] = (1 - momentum) * runningMean[c] + momentum * mean[c];
                    runningVar[c] = (1 - momentum) * runningVar[c] + momentum * var[c];
                }
            }
        }

        float[] invStd = new float[channels];
        for (int c = 0; c < channels; c++)
            invStd[c] = (float) (1.0 / Math.sqrt(var[c] + epsilon));

        float[][] result = new float[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            float[] out = rows[i].clone();
            for (int offset = 0; offset < out.length; offset += featureWidth) {
                for (int c = 0; c < channels; c++)
                    out[offset + c] = (out[offset + c] - mean[c]) * invStd[c];
            }
            result[i] = out;
        }
        return result;
    }

    public int getChannels() {
        return channels;
    }

    public float[] getRunningMean() {
        return runningMean.clone();
    }

    public float[] getRunningVar() {
        return runningVar.clone();
    }

    public void writeTo(DataOutputStream out) throws IOException {
        out.writeInt(channels);
        for (int c = 0; c < channels; c++) {
            out.writeFloat(runningMean[c]);
            out.writeFloat(runningVar[c]);
        }
    }

    public void readFrom(DataInputStream in) throws IOException {
        int stored = in.readInt();
        if (stored != channels)
            throw new IOException(String.format(
                "Normalizer width mismatch: checkpoint has %d channels, model has %d", stored, channels));
        for (int c = 0; c < channels; c++) {
            runningMean[c] = in.readFloat();
            runningVar[c] = in.readFloat();
        }
    }
}

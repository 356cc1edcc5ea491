package dev.unitrain.common;

import java.util.List;

public final class Utils {

    private Utils() {}

    /**
     * Index of the largest value; the first index wins on ties.
     */
    public static int argmax(float[] values) {
        if (values == null || values.length == 0)
            throw new IllegalArgumentException("Values cannot be null or empty");

        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best])
                best = i;
        }
        return best;
    }

    /**
     * Numerically stable softmax into {@code output}.
     */
    public static void softmax(float[] logits, float[] output) {
        float max = logits[0];
        for (int i = 1; i < logits.length; i++)
            max = Math.max(max, logits[i]);

        float sum = 0;
        for (int i = 0; i < logits.length; i++) {
            output[i] = (float) Math.exp(logits[i] - max);
            sum += output[i];
        }
        for (int i = 0; i < logits.length; i++)
            output[i] /= sum;
    }

    public static float[] softmax(float[] logits) {
        float[] output = new float[logits.length];
        softmax(logits, output);
        return output;
    }

    public static float sigmoid(float x) {
        return (float) (1.0 / (1.0 + Math.exp(-x)));
    }

    public static float[] column(float[][] rows, int column) {
        float[] result = new float[rows.length];
        for (int i = 0; i < rows.length; i++)
            result[i] = rows[i][column];
        return result;
    }

    /**
     * Row-wise concatenation of batches collected over a phase.
     */
    public static float[][] concatRows(List<float[][]> parts) {
        int total = 0;
        for (float[][] part : parts)
            total += part.length;

        float[][] result = new float[total][];
        int offset = 0;
        for (float[][] part : parts) {
            System.arraycopy(part, 0, result, offset, part.length);
            offset += part.length;
        }
        return result;
    }

    public static float[] concat(List<float[]> parts) {
        int total = 0;
        for (float[] part : parts)
            total += part.length;

        float[] result = new float[total];
        int offset = 0;
        for (float[] part : parts) {
            System.arraycopy(part, 0, result, offset, part.length);
            offset += part.length;
        }
        return result;
    }
}

package dev.unitrain.losses;

/**
 * Mean Squared Error (MSE) loss function.
 *
 * <p>Loss: MSE = (1/n) * sum((output[i] - label[i])^2)
 * <p>Derivative: dMSE/doutput[i] = (2/n) * (output[i] - label[i])
 */
public final class MseLoss implements Loss {

    public static final MseLoss INSTANCE = new MseLoss();

    private MseLoss() {} // Private constructor for singleton

    @Override
    public float loss(float[][] outputs, float[] labels) {
        checkShape(outputs, labels);
        double sum = 0;
        for (int i = 0; i < outputs.length; i++) {
            double diff = outputs[i][0] - labels[i];
            sum += diff * diff;
        }
        return (float) (sum / outputs.length);
    }

    @Override
    public float[][] derivatives(float[][] outputs, float[] labels) {
        checkShape(outputs, labels);
        float[][] derivatives = new float[outputs.length][1];
        float scale = 2.0f / outputs.length;
        for (int i = 0; i < outputs.length; i++)
            derivatives[i][0] = scale * (outputs[i][0] - labels[i]);
        return derivatives;
    }

    /**
     * MSE between two aligned value arrays.
     */
    public static float meanSquaredError(float[] predictions, float[] labels) {
        if (predictions.length != labels.length)
            throw new IllegalArgumentException(String.format(
                "Predictions and labels must have same length: %d != %d", predictions.length, labels.length));
        if (predictions.length == 0)
            return Float.NaN;

        double sum = 0;
        for (int i = 0; i < predictions.length; i++) {
            double diff = predictions[i] - labels[i];
            sum += diff * diff;
        }
        return (float) (sum / predictions.length);
    }

    private static void checkShape(float[][] outputs, float[] labels) {
        if (outputs.length != labels.length)
            throw new IllegalArgumentException(String.format(
                "Outputs and labels must have same length: %d != %d", outputs.length, labels.length));
        if (outputs.length == 0)
            throw new IllegalArgumentException("Cannot compute loss of an empty batch");
    }
}

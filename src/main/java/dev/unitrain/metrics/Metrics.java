package dev.unitrain.metrics;

/**
 * Factory for the common metrics.
 */
public final class Metrics {

    private Metrics() {}

    /**
     * The backend loss passed through unchanged; lower is better.
     */
    public static Metric loss(boolean saveModel) {
        return new Metric("loss", Direction.LOWER_IS_BETTER, saveModel, true, (loss, predictions, labels) -> loss);
    }

    /**
     * Share of predictions equal to their label.
     */
    public static Metric accuracy() {
        return new Metric("accuracy", Direction.HIGHER_IS_BETTER, false, Metrics::accuracy);
    }

    public static Metric meanAbsoluteError() {
        return new Metric("mae", Direction.LOWER_IS_BETTER, false, Metrics::meanAbsoluteError);
    }

    /**
     * Unweighted mean of per-class F1 over the classes present in the batch's labels
     * or predictions.
     */
    public static Metric macroF1(int numClasses) {
        if (numClasses < 2)
            throw new IllegalArgumentException("Macro F1 needs at least two classes: " + numClasses);
        return new Metric("macro_f1", Direction.HIGHER_IS_BETTER, false,
                          (loss, predictions, labels) -> macroF1(predictions, labels, numClasses));
    }

    static double accuracy(float loss, float[] predictions, float[] labels) {
        int correct = 0;
        for (int i = 0; i < predictions.length; i++) {
            if (Math.round(predictions[i]) == Math.round(labels[i]))
                correct++;
        }
        return (double) correct / predictions.length;
    }

    static double meanAbsoluteError(float loss, float[] predictions, float[] labels) {
        double sum = 0;
        for (int i = 0; i < predictions.length; i++)
            sum += Math.abs(predictions[i] - labels[i]);
        return sum / predictions.length;
    }

    static double macroF1(float[] predictions, float[] labels, int numClasses) {
        ConfusionMatrix matrix = ConfusionMatrix.of(predictions, labels, numClasses);
        double sum = 0;
        int present = 0;
        for (int k = 0; k < numClasses; k++) {
            int truePositive = matrix.get(k, k);
            int actual = matrix.actualCount(k);
            int predicted = matrix.predictedCount(k);
            if (actual == 0 && predicted == 0)
                continue;
            sum += 2.0 * truePositive / (actual + predicted);
            present++;
        }
        return present == 0 ? 0.0 : sum / present;
    }
}

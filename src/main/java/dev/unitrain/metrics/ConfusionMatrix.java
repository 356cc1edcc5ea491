package dev.unitrain.metrics;

import java.util.Arrays;
import java.util.List;

/**
 * Counts of (actual, predicted) class pairs.
 */
public final class ConfusionMatrix {

    private final int[][] counts;

    public ConfusionMatrix(int numClasses) {
        if (numClasses <= 0)
            throw new IllegalArgumentException("Number of classes must be positive: " + numClasses);
        this.counts = new int[numClasses][numClasses];
    }

    public static ConfusionMatrix of(float[] predictions, float[] labels, int numClasses) {
        if (predictions.length != labels.length)
            throw new IllegalArgumentException(String.format(
                "Predictions and labels must have same length: %d != %d", predictions.length, labels.length));
        ConfusionMatrix matrix = new ConfusionMatrix(numClasses);
        for (int i = 0; i < predictions.length; i++)
            matrix.add(Math.round(labels[i]), Math.round(predictions[i]));
        return matrix;
    }

    public void add(int actual, int predicted) {
        if (actual < 0 || actual >= counts.length || predicted < 0 || predicted >= counts.length)
            throw new IllegalArgumentException(String.format(
                "Class pair (%d, %d) outside [0, %d)", actual, predicted, counts.length));
        counts[actual][predicted]++;
    }

    public int get(int actual, int predicted) {
        return counts[actual][predicted];
    }

    public int numClasses() {
        return counts.length;
    }

    public int actualCount(int actual) {
        int sum = 0;
        for (int c : counts[actual])
            sum += c;
        return sum;
    }

    public int predictedCount(int predicted) {
        int sum = 0;
        for (int[] row : counts)
            sum += row[predicted];
        return sum;
    }

    public int total() {
        int sum = 0;
        for (int k = 0; k < counts.length; k++)
            sum += actualCount(k);
        return sum;
    }

    public double accuracy() {
        int total = total();
        if (total == 0)
            return Double.NaN;
        int correct = 0;
        for (int k = 0; k < counts.length; k++)
            correct += counts[k][k];
        return (double) correct / total;
    }

    public int[][] toArray() {
        int[][] copy = new int[counts.length][];
        for (int k = 0; k < counts.length; k++)
            copy[k] = counts[k].clone();
        return copy;
    }

    /**
     * Table with one row per actual class and one column per predicted class.
     */
    public String format(List<String> classLabels) {
        if (classLabels.size() != counts.length)
            throw new IllegalArgumentException("Need one label per class");

        int width = 8;
        for (String label : classLabels)
            width = Math.max(width, label.length() + 2);

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-" + width + "s", "actual\\pred"));
        for (String label : classLabels)
            sb.append(String.format("%" + width + "s", label));
        sb.append('\n');
        for (int k = 0; k < counts.length; k++) {
            sb.append(String.format("%-" + width + "s", classLabels.get(k)));
            for (int c : counts[k])
                sb.append(String.format("%" + width + "d", c));
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ConfusionMatrix[");
        for (int k = 0; k < counts.length; k++) {
            if (k > 0)
                sb.append(", ");
            sb.append(Arrays.toString(counts[k]));
        }
        return sb.append(']').toString();
    }
}

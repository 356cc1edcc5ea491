package dev.unitrain.losses;

import dev.unitrain.common.Utils;

/**
 * Softmax cross-entropy with one weight per class.
 *
 * <p>Outputs are logits; labels are class indices. The batch loss is the weighted mean
 * {@code sum(w[y_i] * -log(p_i[y_i])) / sum(w[y_i])}, so a batch's loss does not depend
 * on the absolute scale of the weights.
 *
 * <p>Derivative with respect to logit {@code k} of sample {@code i}:
 * {@code w[y_i] * (p_i[k] - onehot(y_i)[k]) / sum(w[y_j])}.
 */
public final class WeightedCrossEntropyLoss implements Loss {

    private static final float EPSILON = 1e-12f;

    private final float[] classWeights;

    public WeightedCrossEntropyLoss(float[] classWeights) {
        if (classWeights == null || classWeights.length < 2)
            throw new IllegalArgumentException("Need a weight for each of at least two classes");
        for (float w : classWeights) {
            if (w < 0 || Float.isNaN(w))
                throw new IllegalArgumentException("Class weights must be non-negative: " + w);
        }
        this.classWeights = classWeights.clone();
    }

    public int numClasses() {
        return classWeights.length;
    }

    public float weight(int classIndex) {
        return classWeights[classIndex];
    }

    @Override
    public float loss(float[][] outputs, float[] labels) {
        checkShape(outputs, labels);
        double weighted = 0;
        double totalWeight = 0;
        float[] probs = new float[classWeights.length];
        for (int i = 0; i < outputs.length; i++) {
            int label = label(labels[i]);
            Utils.softmax(outputs[i], probs);
            float w = classWeights[label];
            weighted += -w * Math.log(Math.max(probs[label], EPSILON));
            totalWeight += w;
        }
        return totalWeight > 0 ? (float) (weighted / totalWeight) : 0f;
    }

    @Override
    public float[][] derivatives(float[][] outputs, float[] labels) {
        checkShape(outputs, labels);
        double totalWeight = 0;
        for (float label : labels)
            totalWeight += classWeights[label(label)];

        float[][] derivatives = new float[outputs.length][classWeights.length];
        if (totalWeight <= 0)
            return derivatives;

        for (int i = 0; i < outputs.length; i++) {
            int label = label(labels[i]);
            float scale = (float) (classWeights[label] / totalWeight);
            Utils.softmax(outputs[i], derivatives[i]);
            derivatives[i][label] -= 1.0f;
            for (int k = 0; k < classWeights.length; k++)
                derivatives[i][k] *= scale;
        }
        return derivatives;
    }

    private int label(float value) {
        int label = (int) value;
        if (label != value || label < 0 || label >= classWeights.length)
            throw new IllegalArgumentException(String.format(
                "Label %s is not a class index in [0, %d)", value, classWeights.length));
        return label;
    }

    private void checkShape(float[][] outputs, float[] labels) {
        if (outputs.length != labels.length)
            throw new IllegalArgumentException(String.format(
                "Outputs and labels must have same length: %d != %d", outputs.length, labels.length));
        if (outputs.length == 0)
            throw new IllegalArgumentException("Cannot compute loss of an empty batch");
        if (outputs[0].length != classWeights.length)
            throw new IllegalArgumentException(String.format(
                "Expected %d logits per sample, got %d", classWeights.length, outputs[0].length));
    }
}

package dev.unitrain.losses;

import dev.unitrain.config.ConfigurationException;
import dev.unitrain.config.TrainConfig;

import java.util.List;

/**
 * Chooses the loss bound to a backend from the task type.
 */
public final class Criterion {

    private Criterion() {}

    /**
     * Mean-squared error for regression; cross-entropy weighted by {@code lossWeight}
     * for classification.
     *
     * @throws ConfigurationException if a classification config has a different number
     *         of class labels and loss weights
     */
    public static Loss select(TrainConfig config) {
        if (!config.isClassification())
            return MseLoss.INSTANCE;

        List<String> labels = config.getClassLabels();
        List<Float> weights = config.getLossWeight();
        if (labels.size() != weights.size())
            throw new ConfigurationException(String.format(
                "loss_weight needs one entry per class: %d class labels but %d weights",
                labels.size(), weights.size()));

        float[] classWeights = new float[weights.size()];
        for (int i = 0; i < classWeights.length; i++)
            classWeights[i] = weights.get(i);
        return new WeightedCrossEntropyLoss(classWeights);
    }
}

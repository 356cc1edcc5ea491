package dev.unitrain.backend;

import dev.unitrain.Phase;
import dev.unitrain.config.TrainConfig;

/**
 * Backend trained iteratively, one batch per call.
 *
 * <p>A {@link Phase#TRAIN} call updates parameters and marks the model fitted; a
 * {@link Phase#VAL} call only evaluates. Neither ever stops training on its own.
 */
public abstract class GradientModel extends ModelBackend {

    protected GradientModel(TrainConfig config) {
        super(config);
    }

    @Override
    public final Kind kind() {
        return Kind.GRADIENT;
    }

    public final FitResult fit(float[][] inputs, float[] labels, Phase phase) {
        if (phase != Phase.TRAIN && phase != Phase.VAL)
            throw new IllegalArgumentException("Gradient models fit during train or val phases only, not " + phase);
        checkLabels(inputs, labels);

        FitResult result = fitBatch(inputs, labels, phase == Phase.TRAIN);
        if (phase == Phase.TRAIN)
            markFitted();
        return result;
    }

    /**
     * @param training update parameters after computing the loss
     */
    protected abstract FitResult fitBatch(float[][] inputs, float[] labels, boolean training);

    public abstract float getLearningRate();
}

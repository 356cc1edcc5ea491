package dev.unitrain.optimizers;

import java.util.List;

/**
 * Updates parameter values in place from their accumulated gradients.
 *
 * <p>Calls happen from the training thread only; gradients are fully reduced before
 * {@link #step} runs.
 */
public interface Optimizer {

    void step(List<Parameter> parameters, Gradients gradients);

    float getLearningRate();

    /**
     * Replace the learning rate used by subsequent steps. Accumulated state such as
     * momentum is kept.
     */
    void setLearningRate(float learningRate);

}

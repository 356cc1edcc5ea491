package dev.unitrain.optimizers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stochastic gradient descent with classical momentum and L2 weight decay.
 *
 * <pre>
 * g = gradient + weightDecay * param
 * v = momentum * v + g
 * param = param - learningRate * v
 * </pre>
 */
public class SgdOptimizer implements Optimizer {

    private volatile float learningRate;
    private final float momentum;
    private final float weightDecay;

    private final Map<Parameter, float[]> velocities = new ConcurrentHashMap<>();

    public SgdOptimizer(float learningRate) {
        this(learningRate, 0f, 0f);
    }

    public SgdOptimizer(float learningRate, float momentum, float weightDecay) {
        if (learningRate <= 0)
            throw new IllegalArgumentException("Learning rate must be positive: " + learningRate);
        if (momentum < 0 || momentum >= 1)
            throw new IllegalArgumentException("Momentum must be in [0, 1): " + momentum);
        if (weightDecay < 0)
            throw new IllegalArgumentException("Weight decay must be non-negative: " + weightDecay);

        this.learningRate = learningRate;
        this.momentum = momentum;
        this.weightDecay = weightDecay;
    }

    @Override
    public void step(List<Parameter> parameters, Gradients gradients) {
        float lr = learningRate;
        for (Parameter p : parameters) {
            float[] values = p.values();
            float[] grads = gradients.of(p);

            if (momentum == 0f) {
                for (int i = 0; i < values.length; i++)
                    values[i] -= lr * (grads[i] + weightDecay * values[i]);
                continue;
            }

            float[] velocity = velocities.computeIfAbsent(p, k -> new float[k.size()]);
            for (int i = 0; i < values.length; i++) {
                velocity[i] = momentum * velocity[i] + grads[i] + weightDecay * values[i];
                values[i] -= lr * velocity[i];
            }
        }
    }

    @Override
    public float getLearningRate() {
        return learningRate;
    }

    @Override
    public void setLearningRate(float learningRate) {
        if (learningRate <= 0)
            throw new IllegalArgumentException("Learning rate must be positive: " + learningRate);
        this.learningRate = learningRate;
    }

    public float getMomentum() {
        return momentum;
    }
}

package dev.unitrain.optimizers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adam (Adaptive Moment Estimation) optimizer with L2 weight decay folded into the gradient.
 *
 * <p><b>Adam Algorithm:</b>
 * <pre>
 * g   = gradient + weightDecay * param
 * m_t = β₁ * m_{t-1} + (1 - β₁) * g      // Momentum (moving average of gradients)
 * v_t = β₂ * v_{t-1} + (1 - β₂) * g²     // Velocity (moving average of squared gradients)
 * m̂_t = m_t / (1 - β₁^t)                 // Bias correction for momentum
 * v̂_t = v_t / (1 - β₂^t)                 // Bias correction for velocity
 * param = param - α * m̂_t / (√v̂_t + ε)   // Parameter update
 * </pre>
 */
public class AdamOptimizer implements Optimizer {

    private volatile float learningRate;
    private final float beta1;        // Momentum decay rate
    private final float beta2;        // Velocity decay rate
    private final float epsilon;      // Small constant to avoid division by zero
    private final float weightDecay;

    private final Map<Parameter, AdamState> states = new ConcurrentHashMap<>();

    /**
     * Adam with β₁ = 0.9, β₂ = 0.999, ε = 1e-8 and no weight decay.
     */
    public AdamOptimizer(float learningRate) {
        this(learningRate, 0.9f, 0.999f, 1e-8f, 0f);
    }

    public AdamOptimizer(float learningRate, float weightDecay) {
        this(learningRate, 0.9f, 0.999f, 1e-8f, weightDecay);
    }

    public AdamOptimizer(float learningRate, float beta1, float beta2, float epsilon, float weightDecay) {
        if (learningRate <= 0)
            throw new IllegalArgumentException("Learning rate must be positive: " + learningRate);
        if (beta1 < 0 || beta1 >= 1)
            throw new IllegalArgumentException("Beta1 must be in [0, 1): " + beta1);
        if (beta2 < 0 || beta2 >= 1)
            throw new IllegalArgumentException("Beta2 must be in [0, 1): " + beta2);
        if (epsilon <= 0)
            throw new IllegalArgumentException("Epsilon must be positive: " + epsilon);
        if (weightDecay < 0)
            throw new IllegalArgumentException("Weight decay must be non-negative: " + weightDecay);

        this.learningRate = learningRate;
        this.beta1 = beta1;
        this.beta2 = beta2;
        this.epsilon = epsilon;
        this.weightDecay = weightDecay;
    }

    @Override
    public void step(List<Parameter> parameters, Gradients gradients) {
        float lr = learningRate;
        for (Parameter p : parameters) {
            AdamState state = states.computeIfAbsent(p, k -> new AdamState(k.size()));
            state.timeStep++;

            float biasCorrection1 = (float) (1 - Math.pow(beta1, state.timeStep));
            float biasCorrection2 = (float) (1 - Math.pow(beta2, state.timeStep));

            float[] values = p.values();
            float[] grads = gradients.of(p);
            for (int i = 0; i < values.length; i++) {
                float g = grads[i] + weightDecay * values[i];
                state.momentum[i] = beta1 * state.momentum[i] + (1 - beta1) * g;
                state.velocity[i] = beta2 * state.velocity[i] + (1 - beta2) * g * g;

                float mHat = state.momentum[i] / biasCorrection1;
                float vHat = state.velocity[i] / biasCorrection2;
                values[i] -= lr * mHat / ((float) Math.sqrt(vHat) + epsilon);
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

    private static final class AdamState {
        final float[] momentum;
        final float[] velocity;
        long timeStep;

        AdamState(int size) {
            this.momentum = new float[size];
            this.velocity = new float[size];
        }
    }
}

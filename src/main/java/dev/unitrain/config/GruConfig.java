package dev.unitrain.config;

/**
 * Hyperparameters of the GRU sequence model.
 *
 * <p>Defaults match a mid-sized recurrent classifier: three bidirectional layers of
 * 400 units, Adam at 1e-3 and gradients clipped at a global norm of 400.
 */
public class GruConfig {
    public final int hiddenSize;
    public final int numLayers;
    public final boolean bidirectional;
    public final boolean inputNormalization;
    public final OptimizerType optimizer;
    public final float learningRate;
    public final float momentum;
    public final float weightDecay;
    public final float maxNorm;
    public final int numThreads;

    private GruConfig(Builder builder) {
        this.hiddenSize = builder.hiddenSize;
        this.numLayers = builder.numLayers;
        this.bidirectional = builder.bidirectional;
        this.inputNormalization = builder.inputNormalization;
        this.optimizer = builder.optimizer;
        this.learningRate = builder.learningRate;
        this.momentum = builder.momentum;
        this.weightDecay = builder.weightDecay;
        this.maxNorm = builder.maxNorm;
        this.numThreads = builder.numThreads;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static GruConfig defaults() {
        return builder().build();
    }

    public static class Builder {
        private int hiddenSize = 400;
        private int numLayers = 3;
        private boolean bidirectional = true;
        private boolean inputNormalization = true;
        private OptimizerType optimizer = OptimizerType.ADAM;
        private float learningRate = 1e-3f;
        private float momentum = 0.9f;
        private float weightDecay = 0.0f;
        private float maxNorm = 400f;
        private int numThreads = 4;

        public Builder hiddenSize(int hiddenSize) {
            if (hiddenSize <= 0)
                throw new ConfigurationException("Hidden size must be positive: " + hiddenSize);
            this.hiddenSize = hiddenSize;
            return this;
        }

        public Builder numLayers(int numLayers) {
            if (numLayers <= 0)
                throw new ConfigurationException("Number of GRU layers must be positive: " + numLayers);
            this.numLayers = numLayers;
            return this;
        }

        public Builder bidirectional(boolean bidirectional) {
            this.bidirectional = bidirectional;
            return this;
        }

        public Builder inputNormalization(boolean inputNormalization) {
            this.inputNormalization = inputNormalization;
            return this;
        }

        public Builder optimizer(OptimizerType optimizer) {
            this.optimizer = optimizer;
            return this;
        }

        public Builder learningRate(float learningRate) {
            if (learningRate <= 0)
                throw new ConfigurationException("Learning rate must be positive: " + learningRate);
            this.learningRate = learningRate;
            return this;
        }

        public Builder momentum(float momentum) {
            if (momentum < 0 || momentum >= 1)
                throw new ConfigurationException("Momentum must be in [0, 1): " + momentum);
            this.momentum = momentum;
            return this;
        }

        public Builder weightDecay(float weightDecay) {
            if (weightDecay < 0)
                throw new ConfigurationException("Weight decay must be non-negative: " + weightDecay);
            this.weightDecay = weightDecay;
            return this;
        }

        /**
         * Global gradient norm above which gradients are rescaled; 0 disables clipping.
         */
        public Builder maxNorm(float maxNorm) {
            if (maxNorm < 0)
                throw new ConfigurationException("Max norm must be non-negative: " + maxNorm);
            this.maxNorm = maxNorm;
            return this;
        }

        /**
         * Worker threads used when the model runs on the accelerator device.
         */
        public Builder numThreads(int numThreads) {
            if (numThreads <= 0)
                throw new ConfigurationException("Thread count must be positive: " + numThreads);
            this.numThreads = numThreads;
            return this;
        }

        public GruConfig build() {
            return new GruConfig(this);
        }
    }
}

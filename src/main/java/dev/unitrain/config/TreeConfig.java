package dev.unitrain.config;

/**
 * Hyperparameters of the boosted tree ensemble.
 */
public class TreeConfig {
    public final int nEstimators;
    public final int maxDepth;
    public final int minDataInLeaf;
    public final float learningRate;
    public final float regAlpha;     // L1 on leaf values
    public final float regLambda;    // L2 on leaf values
    public final float subsample;
    public final float featureFraction;
    public final boolean earlyStopping;
    public final int earlyStoppingRounds;

    private TreeConfig(Builder builder) {
        this.nEstimators = builder.nEstimators;
        this.maxDepth = builder.maxDepth;
        this.minDataInLeaf = builder.minDataInLeaf;
        this.learningRate = builder.learningRate;
        this.regAlpha = builder.regAlpha;
        this.regLambda = builder.regLambda;
        this.subsample = builder.subsample;
        this.featureFraction = builder.featureFraction;
        this.earlyStopping = builder.earlyStopping;
        this.earlyStoppingRounds = builder.earlyStoppingRounds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TreeConfig defaults() {
        return builder().build();
    }

    public static class Builder {
        private int nEstimators = 200;
        private int maxDepth = 5;
        private int minDataInLeaf = 50;
        private float learningRate = 0.1f;
        private float regAlpha = 0.5f;
        private float regLambda = 0.5f;
        private float subsample = 0.8f;
        private float featureFraction = 0.8f;
        private boolean earlyStopping = false;
        private int earlyStoppingRounds = 20;

        public Builder nEstimators(int nEstimators) {
            if (nEstimators <= 0)
                throw new ConfigurationException("Estimator count must be positive: " + nEstimators);
            this.nEstimators = nEstimators;
            return this;
        }

        public Builder maxDepth(int maxDepth) {
            if (maxDepth <= 0)
                throw new ConfigurationException("Max depth must be positive: " + maxDepth);
            this.maxDepth = maxDepth;
            return this;
        }

        public Builder minDataInLeaf(int minDataInLeaf) {
            if (minDataInLeaf <= 0)
                throw new ConfigurationException("Minimum leaf size must be positive: " + minDataInLeaf);
            this.minDataInLeaf = minDataInLeaf;
            return this;
        }

        public Builder learningRate(float learningRate) {
            if (learningRate <= 0 || learningRate > 1)
                throw new ConfigurationException("Boosting learning rate must be in (0, 1]: " + learningRate);
            this.learningRate = learningRate;
            return this;
        }

        public Builder regAlpha(float regAlpha) {
            if (regAlpha < 0)
                throw new ConfigurationException("reg_alpha must be non-negative: " + regAlpha);
            this.regAlpha = regAlpha;
            return this;
        }

        public Builder regLambda(float regLambda) {
            if (regLambda < 0)
                throw new ConfigurationException("reg_lambda must be non-negative: " + regLambda);
            this.regLambda = regLambda;
            return this;
        }

        public Builder subsample(float subsample) {
            if (subsample <= 0 || subsample > 1)
                throw new ConfigurationException("Subsample rate must be in (0, 1]: " + subsample);
            this.subsample = subsample;
            return this;
        }

        public Builder featureFraction(float featureFraction) {
            if (featureFraction <= 0 || featureFraction > 1)
                throw new ConfigurationException("Feature fraction must be in (0, 1]: " + featureFraction);
            this.featureFraction = featureFraction;
            return this;
        }

        /**
         * Hand the validation split to the ensemble so it can stop adding rounds
         * once the held-out loss stops improving.
         */
        public Builder earlyStopping(boolean earlyStopping) {
            this.earlyStopping = earlyStopping;
            return this;
        }

        public Builder earlyStoppingRounds(int rounds) {
            if (rounds <= 0)
                throw new ConfigurationException("Early stopping rounds must be positive: " + rounds);
            this.earlyStoppingRounds = rounds;
            return this;
        }

        public TreeConfig build() {
            return new TreeConfig(this);
        }
    }
}

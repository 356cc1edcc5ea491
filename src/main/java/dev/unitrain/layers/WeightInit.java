package dev.unitrain.layers;

import java.util.random.RandomGenerator;

/**
 * Weight initialization strategies.
 */
public final class WeightInit {

    private WeightInit() {}

    /**
     * Xavier/Glorot uniform: U(-limit, limit) with limit = sqrt(6 / (fanIn + fanOut)).
     */
    public static void xavier(float[] weights, int fanIn, int fanOut, RandomGenerator random) {
        float limit = (float) Math.sqrt(6.0 / (fanIn + fanOut));
        for (int i = 0; i < weights.length; i++)
            weights[i] = (random.nextFloat() * 2 - 1) * limit;
    }
}

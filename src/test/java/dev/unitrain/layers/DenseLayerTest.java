package dev.unitrain.layers;

import dev.unitrain.common.SeedContext;
import dev.unitrain.optimizers.Gradients;
import dev.unitrain.optimizers.Parameter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DenseLayerTest {

    @Test
    void testForwardAndBackward() {
        DenseLayer layer = new DenseLayer("d", 2, 2, new SeedContext(0).generator("test"));
        List<Parameter> params = layer.parameters();
        for (int i = 0; i < params.size(); i++)
            params.get(i).register(i);

        float[] w = params.get(0).values();
        float[] b = params.get(1).values();
        // W[k * out + j]
        w[0] = 1f; w[1] = 2f;
        w[2] = 3f; w[3] = 4f;
        b[0] = 0.5f; b[1] = -0.5f;

        float[] input = {1f, -1f};
        assertArrayEquals(new float[] {-1.5f, -2.5f}, layer.forward(input), 1e-6f);

        Gradients grads = new Gradients(params);
        float[] dInput = layer.backward(input, new float[] {1f, 2f}, grads);
        assertArrayEquals(new float[] {5f, 11f}, dInput, 1e-6f);
        assertArrayEquals(new float[] {1f, 2f, -1f, -2f}, grads.of(params.get(0)), 1e-6f);
        assertArrayEquals(new float[] {1f, 2f}, grads.of(params.get(1)), 1e-6f);
    }

    @Test
    void testXavierRange() {
        float[] weights = new float[1000];
        WeightInit.xavier(weights, 10, 20, new SeedContext(1).generator("init"));
        float limit = (float) Math.sqrt(6.0 / 30);
        boolean anyNonZero = false;
        for (float w : weights) {
            assertTrue(Math.abs(w) <= limit);
            anyNonZero |= w != 0f;
        }
        assertTrue(anyNonZero);
    }

    @Test
    void testRejectsWrongInputWidth() {
        DenseLayer layer = new DenseLayer("d", 3, 1, new SeedContext(0).generator("test"));
        assertThrows(IllegalArgumentException.class, () -> layer.forward(new float[2]));
        assertThrows(IllegalArgumentException.class, () -> new DenseLayer("d", 0, 1, new SeedContext(0).generator("test")));
    }
}

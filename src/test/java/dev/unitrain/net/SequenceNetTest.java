package dev.unitrain.net;

import dev.unitrain.common.SeedContext;
import dev.unitrain.config.GruConfig;
import dev.unitrain.data.DataShape;
import dev.unitrain.optimizers.Gradients;
import dev.unitrain.optimizers.Parameter;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class SequenceNetTest {

    private static GruConfig smallConfig(boolean bidirectional, int layers) {
        return GruConfig.builder()
            .hiddenSize(3)
            .numLayers(layers)
            .bidirectional(bidirectional)
            .inputNormalization(true)
            .build();
    }

    private static float[] randomRow(RandomGenerator random, int n) {
        float[] row = new float[n];
        for (int i = 0; i < n; i++)
            row[i] = random.nextFloat() * 2 - 1;
        return row;
    }

    private static float loss(SequenceNet net, float[] row, float[] weights) {
        float[] out = net.forward(row).output();
        double sum = 0;
        for (int i = 0; i < out.length; i++)
            sum += out[i] * weights[i];
        return (float) sum;
    }

    @Test
    void testParametersRegisteredInOrder() {
        SequenceNet net = new SequenceNet(DataShape.sequence(2, 4), smallConfig(true, 2), 3,
                                          new SeedContext(0).generator("gru.init"));
        // 2 layers x 2 directions x 6 tensors + dense weight and bias
        assertEquals(2 * 2 * 6 + 2, net.parameters().size());
        for (int i = 0; i < net.parameters().size(); i++)
            assertEquals(i, net.parameters().get(i).index());
        assertEquals(3, net.getOutputSize());
    }

    @Test
    void testStackedBidirectionalBackwardMatchesFiniteDifferences() {
        RandomGenerator random = new SeedContext(9).generator("net.check");
        SequenceNet net = new SequenceNet(DataShape.sequence(2, 3), smallConfig(true, 2), 2, random);
        float[] row = randomRow(random, 6);
        float[] weights = {0.7f, -1.3f};

        Gradients grads = net.newGradients();
        net.backward(net.forward(row), weights, grads);

        float eps = 1e-2f;
        for (Parameter p : net.parameters()) {
            float[] values = p.values();
            float[] analytic = grads.of(p);
            // every third entry keeps the check quick
            for (int i = 0; i < values.length; i += 3) {
                float original = values[i];
                values[i] = original + eps;
                float plus = loss(net, row, weights);
                values[i] = original - eps;
                float minus = loss(net, row, weights);
                values[i] = original;

                float numeric = (plus - minus) / (2 * eps);
                assertEquals(numeric, analytic[i], 2e-3f + 0.02f * Math.abs(numeric), p.name() + "[" + i + "]");
            }
        }
    }

    @Test
    void testRowWidthValidated() {
        SequenceNet net = new SequenceNet(DataShape.sequence(2, 4), smallConfig(false, 1), 1,
                                          new SeedContext(0).generator("gru.init"));
        assertThrows(IllegalArgumentException.class, () -> net.normalize(new float[][] {new float[7]}, false));
        float[][] normalized = net.normalize(new float[][] {new float[8], new float[8]}, false);
        assertEquals(2, normalized.length);
        assertEquals(1, net.forward(normalized[1]).output().length);
    }

    @Test
    void testWeightsRoundTripIntoSameArchitecture() throws IOException {
        DataShape shape = DataShape.sequence(2, 3);
        SequenceNet source = new SequenceNet(shape, smallConfig(true, 1), 2, new SeedContext(1).generator("gru.init"));
        source.normalize(new float[][] {randomRow(new SeedContext(2).generator("x"), 6),
                                        randomRow(new SeedContext(3).generator("x"), 6)}, true);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        source.writeTo(new DataOutputStream(bytes));

        SequenceNet target = new SequenceNet(shape, smallConfig(true, 1), 2, new SeedContext(99).generator("gru.init"));
        target.readFrom(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));

        float[][] rows = {randomRow(new SeedContext(4).generator("x"), 6)};
        assertArrayEquals(source.forward(source.normalize(rows, false)[0]).output(),
                          target.forward(target.normalize(rows, false)[0]).output());

        SequenceNet other = new SequenceNet(shape, smallConfig(false, 1), 2, new SeedContext(1).generator("gru.init"));
        IOException e = assertThrows(IOException.class,
            () -> other.readFrom(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray()))));
        assertTrue(e.getMessage().contains("does not match"));
    }
}

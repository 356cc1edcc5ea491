package dev.unitrain.backend;

import dev.unitrain.Phase;
import dev.unitrain.common.SeedContext;
import dev.unitrain.config.GruConfig;
import dev.unitrain.config.OptimizerType;
import dev.unitrain.config.TaskType;
import dev.unitrain.config.TrainConfig;
import dev.unitrain.data.DataShape;
import dev.unitrain.serialization.CheckpointLoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.random.RandomGenerator;

import static org.junit.jupiter.api.Assertions.*;

class SequenceModelTest {

    private static final DataShape SHAPE = DataShape.sequence(2, 3);

    @TempDir
    Path tempDir;

    private TrainConfig config(TaskType task, int numThreads, boolean normalize) {
        return config(task, numThreads, normalize, OptimizerType.ADAM);
    }

    private TrainConfig config(TaskType task, int numThreads, boolean normalize, OptimizerType optimizer) {
        TrainConfig.Builder builder = TrainConfig.builder()
            .taskType(task)
            .modelPath(tempDir.resolve("models/gru.ckpt"))
            .epochs(1).batchSize(16).seed(0)
            .silent(true)
            .gru(GruConfig.builder()
                .hiddenSize(8)
                .numLayers(1)
                .bidirectional(false)
                .inputNormalization(normalize)
                .optimizer(optimizer)
                .learningRate(0.02f)
                .maxNorm(5f)
                .numThreads(numThreads)
                .build());
        if (task == TaskType.CLASSIFY)
            builder.classLabels(List.of("negative", "positive")).lossWeight(List.of(1f, 1f));
        else
            builder.classLabels(List.of("value"));
        return builder.build();
    }

    /** Class 1 when the first feature is positive at every timestep, class 0 when negative. */
    private static float[][] signRows(RandomGenerator random, float[] labels) {
        float[][] rows = new float[labels.length][6];
        for (int i = 0; i < labels.length; i++) {
            float sign = random.nextBoolean() ? 1f : -1f;
            labels[i] = sign > 0 ? 1f : 0f;
            for (int t = 0; t < 3; t++) {
                rows[i][t * 2] = sign * (0.5f + 0.5f * random.nextFloat());
                rows[i][t * 2 + 1] = random.nextFloat() * 2 - 1;
            }
        }
        return rows;
    }

    private static float[][] slice(float[][] rows, int from, int to) {
        return Arrays.copyOfRange(rows, from, to);
    }

    @Test
    void testLearnsSeparableSequences() {
        RandomGenerator random = new SeedContext(1).generator("data");
        float[] labels = new float[64];
        float[][] rows = signRows(random, labels);

        try (SequenceModel model = new SequenceModel(config(TaskType.CLASSIFY, 1, false), SHAPE, new SeedContext(0))) {
            float firstLoss = Float.NaN;
            float lastLoss = Float.NaN;
            for (int epoch = 0; epoch < 60; epoch++) {
                for (int b = 0; b < 64; b += 16) {
                    FitResult result = model.fit(slice(rows, b, b + 16), Arrays.copyOfRange(labels, b, b + 16), Phase.TRAIN);
                    if (Float.isNaN(firstLoss))
                        firstLoss = result.loss();
                    lastLoss = result.loss();
                    assertEquals(16, result.predictions().length);
                }
            }
            assertTrue(lastLoss < firstLoss, "loss should fall: " + firstLoss + " -> " + lastLoss);

            float[] predictions = model.predict(rows);
            int correct = 0;
            for (int i = 0; i < predictions.length; i++) {
                if (predictions[i] == labels[i])
                    correct++;
            }
            assertTrue(correct >= 61, "accuracy too low: " + correct + "/64");
        }
    }

    @Test
    void testValidationFitLeavesParametersAlone() {
        RandomGenerator random = new SeedContext(2).generator("data");
        float[] labels = new float[8];
        float[][] rows = signRows(random, labels);

        try (SequenceModel model = new SequenceModel(config(TaskType.CLASSIFY, 1, true), SHAPE, new SeedContext(0))) {
            float[] before = model.getNet().parameters().get(0).values().clone();
            FitResult result = model.fit(rows, labels, Phase.VAL);
            assertFalse(Float.isNaN(result.loss()));
            assertArrayEquals(before, model.getNet().parameters().get(0).values());
            assertFalse(model.isFitted(), "a validation pass does not fit the model");

            model.fit(rows, labels, Phase.TRAIN);
            assertTrue(model.isFitted());
            assertFalse(Arrays.equals(before, model.getNet().parameters().get(0).values()));
        }
    }

    @Test
    void testFitRejectsOtherPhasesAndBadBatches() {
        try (SequenceModel model = new SequenceModel(config(TaskType.REGRESS, 1, false), SHAPE, new SeedContext(0))) {
            assertThrows(IllegalArgumentException.class, () -> model.fit(new float[][] {new float[6]}, new float[] {1f}, Phase.TEST));
            assertThrows(IllegalArgumentException.class, () -> model.fit(new float[][] {new float[6]}, new float[] {1f, 2f}, Phase.TRAIN));
            assertThrows(IllegalArgumentException.class, () -> model.fit(new float[0][], new float[0], Phase.TRAIN));
            assertThrows(IllegalArgumentException.class, () -> model.fit(new float[][] {new float[5]}, new float[] {1f}, Phase.TRAIN));
        }
    }

    @Test
    void testUnfittedModelRefusesPredictAndSave() {
        try (SequenceModel model = new SequenceModel(config(TaskType.REGRESS, 1, false), SHAPE, new SeedContext(0))) {
            assertThrows(ModelNotFittedException.class, () -> model.predict(new float[][] {new float[6]}));
            assertThrows(ModelNotFittedException.class, model::saveModel);
            assertFalse(Files.exists(model.getModelPath()));
        }
    }

    @Test
    void testAnnealDividesLearningRate() {
        try (SequenceModel model = new SequenceModel(config(TaskType.REGRESS, 1, false), SHAPE, new SeedContext(0))) {
            model.annealLr(2f);
            assertEquals(0.01f, model.getLearningRate(), 1e-7f);
            model.annealLr(1.1f);
            assertEquals(0.01f / 1.1f, model.getLearningRate(), 1e-7f);
            assertThrows(IllegalArgumentException.class, () -> model.annealLr(0f));
        }
    }

    @Test
    void testCheckpointRestoresPredictions() throws IOException {
        RandomGenerator random = new SeedContext(3).generator("data");
        float[] labels = new float[16];
        float[][] rows = signRows(random, labels);

        float[] expected;
        try (SequenceModel model = new SequenceModel(config(TaskType.REGRESS, 1, true), SHAPE, new SeedContext(0))) {
            for (int i = 0; i < 5; i++)
                model.fit(rows, labels, Phase.TRAIN);
            model.annealLr(4f);
            model.saveModel();
            expected = model.predict(rows);
            assertTrue(Files.exists(model.getModelPath()));
        }

        try (SequenceModel restored = new SequenceModel(config(TaskType.REGRESS, 1, true), SHAPE, new SeedContext(77))) {
            restored.loadModel();
            assertTrue(restored.isFitted());
            assertArrayEquals(expected, restored.predict(rows));
            assertEquals(0.02f / 4f, restored.getLearningRate(), 1e-7f);
        }
    }

    @Test
    void testMissingCheckpointFailsToLoad() {
        try (SequenceModel model = new SequenceModel(config(TaskType.REGRESS, 1, false), SHAPE, new SeedContext(0))) {
            CheckpointLoadException e = assertThrows(CheckpointLoadException.class, model::loadModel);
            assertEquals(model.getModelPath(), e.getPath());
            assertFalse(model.isFitted());
        }
    }

    @Test
    void testAcceleratorMatchesCpu() {
        RandomGenerator random = new SeedContext(4).generator("data");
        float[] labels = new float[20];
        float[][] rows = signRows(random, labels);

        TrainConfig config = config(TaskType.REGRESS, 3, true, OptimizerType.SGD);
        try (SequenceModel cpu = new SequenceModel(config, SHAPE, new SeedContext(0));
             SequenceModel accelerated = new SequenceModel(config, SHAPE, new SeedContext(0))) {
            assertTrue(accelerated.supportsAccelerator());
            accelerated.placeOn(Device.ACCELERATOR);
            assertEquals(Device.ACCELERATOR, accelerated.device());
            assertEquals(Device.CPU, cpu.device());

            FitResult a = cpu.fit(rows, labels, Phase.TRAIN);
            FitResult b = accelerated.fit(rows, labels, Phase.TRAIN);
            assertEquals(a.loss(), b.loss(), 1e-6f);
            assertArrayEquals(a.predictions(), b.predictions(), 1e-6f);

            // gradients summed in a different order differ only by rounding
            for (int i = 0; i < 3; i++) {
                cpu.fit(rows, labels, Phase.TRAIN);
                accelerated.fit(rows, labels, Phase.TRAIN);
            }
            assertArrayEquals(cpu.predict(rows), accelerated.predict(rows), 1e-3f);
        }
    }
}

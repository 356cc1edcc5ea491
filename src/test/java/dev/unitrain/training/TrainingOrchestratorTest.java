package dev.unitrain.training;

import dev.unitrain.Phase;
import dev.unitrain.backend.BatchFitModel;
import dev.unitrain.backend.Device;
import dev.unitrain.backend.FitResult;
import dev.unitrain.backend.GradientModel;
import dev.unitrain.config.TaskType;
import dev.unitrain.config.TrainConfig;
import dev.unitrain.data.ArrayDataSource;
import dev.unitrain.data.DataShape;
import dev.unitrain.data.PrefetchingDataSource;
import dev.unitrain.metrics.Metrics;
import dev.unitrain.metrics.MetricsRegistry;
import dev.unitrain.serialization.CheckpointLoadException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TrainingOrchestratorTest {

    private static final DataShape SHAPE = DataShape.tabular(2);

    @TempDir
    Path tempDir;

    private TrainConfig.Builder baseConfig(TaskType task) {
        TrainConfig.Builder builder = TrainConfig.builder()
            .taskType(task)
            .modelPath(tempDir.resolve("run/model.ckpt"))
            .epochs(3).batchSize(4).seed(0)
            .learningAnneal(2f)
            .silent(true);
        if (task == TaskType.CLASSIFY)
            builder.classLabels(List.of("a", "b", "c")).lossWeight(List.of(1f, 1f, 1f));
        else
            builder.classLabels(List.of("y"));
        return builder;
    }

    /** Rows whose first column is {@code i % classes}, labelled with the same value. */
    private static ArrayDataSource source(int n, int batchSize, int classes, boolean labeled) {
        float[][] rows = new float[n][2];
        float[] labels = new float[n];
        for (int i = 0; i < n; i++) {
            rows[i][0] = i % classes;
            rows[i][1] = i;
            labels[i] = i % classes;
        }
        return new ArrayDataSource(rows, labeled ? labels : null, batchSize, SHAPE);
    }

    private static float[] firstColumn(float[][] inputs) {
        float[] column = new float[inputs.length];
        for (int i = 0; i < inputs.length; i++)
            column[i] = inputs[i][0];
        return column;
    }

    /** Gradient backend replaying scripted per-batch losses and predicting the first column. */
    private static final class ScriptedGradientModel extends GradientModel {
        private final Deque<Float> trainLosses = new ArrayDeque<>();
        private final Deque<Float> valLosses = new ArrayDeque<>();
        private float learningRate = 1f;
        int saves;
        int anneals;
        int epochUpdates;

        ScriptedGradientModel(TrainConfig config, float[] trainLosses, float[] valLosses) {
            super(config);
            for (float loss : trainLosses)
                this.trainLosses.add(loss);
            for (float loss : valLosses)
                this.valLosses.add(loss);
        }

        void markTrained() {
            markFitted();
        }

        @Override
        protected FitResult fitBatch(float[][] inputs, float[] labels, boolean training) {
            float loss = training ? trainLosses.removeFirst() : valLosses.removeFirst();
            return new FitResult(loss, labels.clone());
        }

        @Override
        protected float[] predictRows(float[][] inputs) {
            return firstColumn(inputs);
        }

        @Override
        public void annealLr(float factor) {
            anneals++;
            learningRate /= factor;
        }

        @Override
        public void updateByEpoch(Phase phase) {
            if (phase == Phase.TRAIN)
                epochUpdates++;
        }

        @Override
        public float getLearningRate() {
            return learningRate;
        }

        @Override
        public void saveModel() {
            requireFitted("save model");
            saves++;
        }

        @Override
        public void writeTo(DataOutputStream out, int version) throws IOException {
            out.writeFloat(learningRate);
        }

        @Override
        public void readFrom(DataInputStream in, int version) throws IOException {
            learningRate = in.readFloat();
        }

        @Override
        public int getTypeId() {
            return 1000;
        }
    }

    /** Batch-fit backend recording what it was handed. */
    private static final class RecordingBatchModel extends BatchFitModel {
        private final boolean heldOut;
        int fits;
        int evaluations;
        int saves;
        float[][] fitInputs;
        float[][] heldOutInputs;

        RecordingBatchModel(TrainConfig config, boolean heldOut) {
            super(config);
            this.heldOut = heldOut;
        }

        @Override
        public boolean wantsHeldOut() {
            return heldOut;
        }

        @Override
        protected float fitAll(float[][] inputs, float[] labels, float[][] heldOutInputs, float[] heldOutLabels) {
            fits++;
            this.fitInputs = inputs;
            this.heldOutInputs = heldOutInputs;
            return 0.25f;
        }

        @Override
        protected float evaluateRows(float[][] inputs, float[] labels) {
            evaluations++;
            return 0.5f;
        }

        @Override
        protected float[] predictRows(float[][] inputs) {
            return firstColumn(inputs);
        }

        @Override
        public void saveModel() {
            saves++;
        }

        @Override
        public void writeTo(DataOutputStream out, int version) {
        }

        @Override
        public void readFrom(DataInputStream in, int version) {
        }

        @Override
        public int getTypeId() {
            return 1001;
        }
    }

    private static final class CapturingLogger implements MetricsLogger {
        final List<Integer> epochs = new ArrayList<>();
        final List<Map<String, Double>> updates = new ArrayList<>();
        boolean closed;

        @Override
        public void update(int epoch, Map<String, Double> values) {
            epochs.add(epoch);
            updates.add(new LinkedHashMap<>(values));
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    @Test
    void testGradientEpochLoop() throws IOException {
        TrainConfig config = baseConfig(TaskType.CLASSIFY).build();
        // 10 train rows in batches of 4 make 3 batches per epoch, 4 val rows make 1
        ScriptedGradientModel model = new ScriptedGradientModel(config,
            new float[] {1.0f, 1.0f, 1.0f, 0.9f, 0.9f, 0.9f, 0.8f, 0.8f, 0.8f},
            new float[] {0.5f, 0.6f, 0.4f});
        CapturingLogger logger = new CapturingLogger();

        try (TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
                .train(source(10, 4, 3, true))
                .val(source(4, 4, 3, true))
                .metrics(new MetricsRegistry(Metrics.loss(true), Metrics.accuracy()))
                .logger(logger)
                .backend(model)
                .build()) {
            orchestrator.train();

            assertEquals(2, model.saves, "saves after val epochs 0 and 2 only");
            assertEquals(3, model.anneals);
            assertEquals(3, model.epochUpdates);
            assertEquals(1f / 8f, model.getLearningRate(), 1e-7f);
            assertTrue(model.isFitted());

            assertEquals(List.of(0, 0, 1, 1, 2, 2), logger.epochs);
            assertEquals(List.of("train_loss", "train_accuracy"), List.copyOf(logger.updates.get(0).keySet()));
            assertEquals(1.0, logger.updates.get(0).get("train_loss"), 1e-6);
            assertEquals(1.0, logger.updates.get(0).get("train_accuracy"), 1e-12);
            assertEquals(0.6, logger.updates.get(3).get("val_loss"), 1e-6);
            assertEquals(0.4, orchestrator.getMetrics().get("loss").best(Phase.VAL), 1e-6);
            assertEquals(0.8, orchestrator.getMetrics().get("loss").best(Phase.TRAIN), 1e-6);
        }
        assertTrue(logger.closed);
    }

    @Test
    void testFailedEpochStopsPrefetchThread() throws IOException, InterruptedException {
        TrainConfig config = baseConfig(TaskType.CLASSIFY).build();
        // no scripted losses, so the first batch fails
        ScriptedGradientModel model = new ScriptedGradientModel(config, new float[0], new float[0]);

        try (TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
                .train(new PrefetchingDataSource(source(400, 4, 3, true), 1))
                .val(source(4, 4, 3, true))
                .backend(model)
                .build()) {
            assertThrows(RuntimeException.class, orchestrator::train);
        }

        for (Thread thread : Thread.getAllStackTraces().keySet()) {
            if (thread.getName().equals("batch-prefetch")) {
                thread.join(5000);
                assertFalse(thread.isAlive());
            }
        }
    }

    @Test
    void testBatchFitRunsOneEpoch() throws IOException {
        TrainConfig config = baseConfig(TaskType.CLASSIFY).epochs(5).build();
        RecordingBatchModel model = new RecordingBatchModel(config, true);
        CapturingLogger logger = new CapturingLogger();

        try (TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
                .train(source(10, 4, 3, true))
                .val(source(6, 4, 3, true))
                .logger(logger)
                .backend(model)
                .build()) {
            orchestrator.train();
        }

        assertEquals(1, model.fits);
        assertEquals(1, model.evaluations);
        assertEquals(1, model.saves);
        assertEquals(10, model.fitInputs.length);
        for (int i = 0; i < 10; i++)
            assertEquals(i, model.fitInputs[i][1], "rows concatenated in delivery order");
        assertEquals(6, model.heldOutInputs.length);

        assertEquals(List.of(0, 0), logger.epochs);
        assertEquals(0.25, logger.updates.get(0).get("train_loss"), 1e-6);
        assertEquals(0.5, logger.updates.get(1).get("val_loss"), 1e-6);
        assertEquals(1.0, logger.updates.get(1).get("val_accuracy"), 1e-12);
    }

    @Test
    void testBatchFitWithoutHeldOut() throws IOException {
        TrainConfig config = baseConfig(TaskType.REGRESS).build();
        RecordingBatchModel model = new RecordingBatchModel(config, false);
        try (TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
                .train(source(8, 4, 3, true))
                .val(source(4, 4, 3, true))
                .backend(model)
                .build()) {
            orchestrator.train();
        }
        assertEquals(1, model.fits);
        assertNull(model.heldOutInputs);
    }

    @Test
    void testClassificationTest() throws IOException {
        TrainConfig config = baseConfig(TaskType.CLASSIFY).build();
        ScriptedGradientModel model = new ScriptedGradientModel(config, new float[0], new float[0]);
        model.markTrained();

        try (TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
                .test(source(10, 4, 3, true))
                .backend(model)
                .build()) {
            TestResult result = orchestrator.test(false);

            assertEquals(10, result.size());
            for (int i = 0; i < 10; i++)
                assertEquals(i % 3, result.predictions()[i]);
            assertArrayEquals(result.predictions(), result.labels());
            assertArrayEquals(new int[][] {{4, 0, 0}, {0, 3, 0}, {0, 0, 3}}, result.confusionMatrix().toArray());

            assertEquals(1.0, result.averages().get("test_accuracy"), 1e-12);
            assertEquals(1.0, result.averages().get("test_macro_f1"), 1e-12);
            assertTrue(Double.isNaN(result.averages().get("test_loss")), "no loss without logits");
        }
    }

    @Test
    void testRegressionTestUsesSquaredError() throws IOException {
        TrainConfig config = baseConfig(TaskType.REGRESS).build();
        ScriptedGradientModel model = new ScriptedGradientModel(config, new float[0], new float[0]);
        model.markTrained();

        float[][] rows = new float[5][2];
        float[] labels = new float[5];
        for (int i = 0; i < 5; i++) {
            rows[i][0] = i;
            labels[i] = i + 2;
        }
        try (TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
                .test(new ArrayDataSource(rows, labels, 2, SHAPE))
                .backend(model)
                .build()) {
            TestResult result = orchestrator.test(false);
            assertNull(result.confusionMatrix());
            assertEquals(4.0, result.averages().get("test_loss"), 1e-6);
            assertEquals(2.0, result.averages().get("test_mae"), 1e-6);
        }
    }

    @Test
    void testLoadBestWithoutCheckpointFails() {
        TrainConfig config = baseConfig(TaskType.CLASSIFY).build();
        ScriptedGradientModel model = new ScriptedGradientModel(config, new float[0], new float[0]);
        TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
            .test(source(4, 4, 3, true))
            .backend(model)
            .build();

        assertTrue(Files.isDirectory(config.getModelPath().getParent()), "model directory created up front");
        assertThrows(CheckpointLoadException.class, () -> orchestrator.test(true));
        assertThrows(CheckpointLoadException.class, () -> orchestrator.infer(true));
    }

    @Test
    void testInferKeepsOrderAndIgnoresLabels() throws IOException {
        TrainConfig config = baseConfig(TaskType.REGRESS).build();
        ScriptedGradientModel model = new ScriptedGradientModel(config, new float[0], new float[0]);
        model.markTrained();

        try (TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
                .test(source(7, 3, 100, true))
                .backend(model)
                .build()) {
            assertArrayEquals(new float[] {0, 1, 2, 3, 4, 5, 6}, orchestrator.infer(false));
            assertArrayEquals(new float[] {0, 1, 2, 3, 4}, orchestrator.infer(source(5, 2, 100, false), false));
            assertThrows(IllegalArgumentException.class, () -> {
                try (TrainingOrchestrator unlabeled = TrainingOrchestrator.builder(config)
                        .test(source(5, 2, 100, false))
                        .backend(model)
                        .build()) {
                    unlabeled.test(false);
                }
            });
        }
    }

    @Test
    void testMissingSourcesAndAcceleratorFallback() {
        TrainConfig config = baseConfig(TaskType.REGRESS).useAccelerator(true).build();
        RecordingBatchModel model = new RecordingBatchModel(config, false);
        TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
            .train(source(4, 4, 3, true))
            .backend(model)
            .build();

        assertEquals(Device.CPU, orchestrator.getDevice());
        assertThrows(IllegalStateException.class, orchestrator::train);
        assertThrows(IllegalStateException.class, () -> orchestrator.test(false));
        assertThrows(IllegalArgumentException.class, () -> TrainingOrchestrator.builder(config).build());
        assertThrows(IllegalArgumentException.class, () -> TrainingOrchestrator.builder(null));
    }
}

package dev.unitrain.training;

import dev.unitrain.Phase;
import dev.unitrain.backend.BatchFitModel;
import dev.unitrain.backend.Device;
import dev.unitrain.backend.FitResult;
import dev.unitrain.backend.GradientModel;
import dev.unitrain.backend.ModelBackend;
import dev.unitrain.backend.ModelBackends;
import dev.unitrain.common.SeedContext;
import dev.unitrain.common.Utils;
import dev.unitrain.config.TrainConfig;
import dev.unitrain.data.Batch;
import dev.unitrain.data.BatchIterator;
import dev.unitrain.data.DataSource;
import dev.unitrain.losses.MseLoss;
import dev.unitrain.metrics.ConfusionMatrix;
import dev.unitrain.metrics.Metric;
import dev.unitrain.metrics.MetricsRegistry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Drives training, evaluation and inference of one backend.
 *
 * <p><b>Training:</b> for every epoch a TRAIN phase then a VAL phase. Gradient backends
 * are fitted batch by batch; batch-fit backends receive the whole split in one call, and
 * since they fit in one shot they run a single epoch whatever the configured count. At the
 * end of every phase the metric averages are printed and logged, each metric updates its
 * best, a checkpoint is written when a save-triggering metric improved during VAL, the
 * phase's meters are reset, and after TRAIN the learning rate is annealed.
 *
 * <pre>{@code
 * try (TrainingOrchestrator orchestrator = TrainingOrchestrator.builder(config)
 *         .train(trainSource)
 *         .val(valSource)
 *         .test(testSource)
 *         .logger(new JsonLinesMetricsLogger(Path.of("outputs/metrics.jsonl")))
 *         .build()) {
 *     orchestrator.train();
 *     TestResult result = orchestrator.test(true);
 * }
 * }</pre>
 *
 * <p>All work happens on the calling thread, one fit or predict call at a time.
 */
public class TrainingOrchestrator implements AutoCloseable {

    private final TrainConfig config;
    private final SeedContext seeds;
    private final DataSource trainSource;
    private final DataSource valSource;
    private final DataSource testSource;
    private final ModelBackend backend;
    private final MetricsRegistry metrics;
    private final MetricsLogger logger;
    private final ProgressPrinter progress;
    private final Device device;

    private TrainingOrchestrator(Builder builder) {
        this.config = builder.config;
        this.seeds = new SeedContext(config.getSeed());
        this.trainSource = builder.train;
        this.valSource = builder.val;
        this.testSource = builder.test;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsRegistry.defaults(config);
        this.logger = builder.logger;
        this.progress = new ProgressPrinter(config.isSilent());

        createModelDirectory(config.getModelPath());

        if (builder.backend != null) {
            this.backend = builder.backend;
        } else {
            DataSource shapeSource = trainSource != null ? trainSource : testSource;
            if (shapeSource == null)
                throw new IllegalArgumentException("A train or test data source is needed to size the model");
            this.backend = ModelBackends.create(config, shapeSource.shape(), seeds);
        }

        this.device = config.isUseAccelerator() && backend.supportsAccelerator() ? Device.ACCELERATOR : Device.CPU;
        if (config.isUseAccelerator() && device == Device.CPU)
            System.err.printf("Warning: accelerator requested but %s runs on CPU only%n", backend.getClass().getSimpleName());
        backend.placeOn(device);

        progress.message("Using %s backend on %s (%s)", config.getModelKind().key(), device, seeds);
    }

    public static Builder builder(TrainConfig config) {
        return new Builder(config);
    }

    private static void createModelDirectory(Path modelPath) {
        Path parent = modelPath.toAbsolutePath().getParent();
        if (parent == null)
            return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create model directory " + parent, e);
        }
    }

    // ===============================
    // TRAINING
    // ===============================

    /**
     * Run every epoch's TRAIN and VAL phases.
     *
     * @throws IOException if writing a checkpoint or logging metrics fails
     */
    public void train() throws IOException {
        requireSource(trainSource, Phase.TRAIN);
        requireSource(valSource, Phase.VAL);

        int epochs = backend.kind() == ModelBackend.Kind.BATCH_FIT ? 1 : config.getEpochs();
        for (int epoch = 0; epoch < epochs; epoch++) {
            for (Phase phase : new Phase[] {Phase.TRAIN, Phase.VAL}) {
                try (SimpleTimer timer = new SimpleTimer(phase.key() + " epoch " + epoch, progress.isVerbose())) {
                    switch (backend.kind()) {
                        case GRADIENT -> runGradientPhase((GradientModel) backend, epoch, phase);
                        case BATCH_FIT -> runBatchFitPhase((BatchFitModel) backend, epoch, phase);
                    }
                }
                endPhase(epoch, phase);
            }
        }
    }

    private void runGradientPhase(GradientModel model, int epoch, Phase phase) {
        DataSource source = sourceFor(phase);
        int numBatches = source.numBatches();
        int index = 0;
        Iterator<Batch> batches = source.iterator();
        try {
            while (batches.hasNext()) {
                Batch batch = batches.next();
                FitResult result = model.fit(batch.inputs(), batch.labels(), phase);
                metrics.update(phase, result.loss(), result.predictions(), batch.labels());
                progress.batch(phase, epoch, ++index, numBatches, metrics);
            }
        } finally {
            BatchIterator.release(batches);
        }
    }

    private void runBatchFitPhase(BatchFitModel model, int epoch, Phase phase) {
        Split split = materialize(sourceFor(phase), phase);
        float loss;
        if (phase == Phase.TRAIN) {
            if (model.wantsHeldOut()) {
                Split heldOut = materialize(valSource, Phase.VAL);
                loss = model.fit(split.inputs, split.labels, heldOut.inputs, heldOut.labels);
            } else {
                loss = model.fit(split.inputs, split.labels);
            }
        } else {
            loss = model.evaluate(split.inputs, split.labels);
        }
        metrics.update(phase, loss, model.predict(split.inputs), split.labels);
        progress.batch(phase, epoch, 1, 1, metrics);
    }

    private void endPhase(int epoch, Phase phase) throws IOException {
        Map<String, Double> averages = metrics.averages(phase);
        progress.phaseSummary(phase, epoch, averages);
        if (logger != null)
            logger.update(epoch, averages);

        Metric improvedSaveMetric = null;
        for (Metric metric : metrics) {
            boolean improved = metric.updateBest(phase);
            if (improved && metric.isSaveModel() && phase == Phase.VAL && improvedSaveMetric == null)
                improvedSaveMetric = metric;
        }
        if (improvedSaveMetric != null) {
            backend.saveModel();
            progress.checkpoint(backend.getModelPath(), phase.key() + "_" + improvedSaveMetric.getName(),
                                improvedSaveMetric.best(phase));
        }
        metrics.reset(phase);

        if (phase == Phase.TRAIN) {
            backend.annealLr(config.getLearningAnneal());
            backend.updateByEpoch(phase);
        }
    }

    // ===============================
    // TEST / INFER
    // ===============================

    /**
     * Predict every test batch and score the predictions.
     *
     * @param loadBest reload the checkpoint at the model path first
     * @throws dev.unitrain.serialization.CheckpointLoadException if {@code loadBest} is set
     *         and the checkpoint is missing or unusable
     */
    public TestResult test(boolean loadBest) throws IOException {
        requireSource(testSource, Phase.TEST);
        if (loadBest)
            backend.loadModel();

        PredictionBuffer buffer = collectPredictions(testSource, true);
        float[] predictions = buffer.predictions();
        float[] labels = buffer.labels();

        metrics.reset(Phase.TEST);
        ConfusionMatrix confusion = null;
        if (predictions.length > 0) {
            if (config.isClassification()) {
                confusion = ConfusionMatrix.of(predictions, labels, config.getClassLabels().size());
                for (Metric metric : metrics) {
                    // no logits survive the predict path, so loss-based metrics have nothing to score
                    if (!metric.isLossBased())
                        metric.update(Phase.TEST, Float.NaN, predictions, labels);
                }
            } else {
                metrics.update(Phase.TEST, MseLoss.meanSquaredError(predictions, labels), predictions, labels);
            }
        }

        Map<String, Double> averages = metrics.averages(Phase.TEST);
        progress.phaseSummary(Phase.TEST, 0, averages);
        if (confusion != null)
            progress.message("%s", confusion.format(config.getClassLabels()));
        return new TestResult(predictions, labels, confusion, metrics, averages);
    }

    /**
     * Predictions for the test source, ignoring any labels it carries.
     */
    public float[] infer(boolean loadBest) throws IOException {
        requireSource(testSource, Phase.INFER);
        return infer(testSource, loadBest);
    }

    /**
     * Predictions for every row of {@code source}, in delivery order.
     */
    public float[] infer(DataSource source, boolean loadBest) throws IOException {
        if (loadBest)
            backend.loadModel();
        return collectPredictions(source, false).predictions();
    }

    private PredictionBuffer collectPredictions(DataSource source, boolean withLabels) {
        PredictionBuffer buffer = new PredictionBuffer(source.numBatches(), source.batchSize(), withLabels);
        int index = 0;
        Iterator<Batch> batches = source.iterator();
        try {
            while (batches.hasNext()) {
                Batch batch = batches.next();
                if (withLabels && !batch.isLabeled())
                    throw new IllegalArgumentException("Test batch " + index + " has no labels");
                buffer.put(index++, backend.predict(batch.inputs()), withLabels ? batch.labels() : null);
            }
        } finally {
            BatchIterator.release(batches);
        }
        return buffer;
    }

    // ===============================
    // HELPERS
    // ===============================

    private static final class Split {
        final float[][] inputs;
        final float[] labels;

        Split(float[][] inputs, float[] labels) {
            this.inputs = inputs;
            this.labels = labels;
        }
    }

    private static Split materialize(DataSource source, Phase phase) {
        List<float[][]> inputs = new ArrayList<>();
        List<float[]> labels = new ArrayList<>();
        Iterator<Batch> batches = source.iterator();
        try {
            while (batches.hasNext()) {
                Batch batch = batches.next();
                if (!batch.isLabeled())
                    throw new IllegalArgumentException(phase.key() + " data must be labeled");
                inputs.add(batch.inputs());
                labels.add(batch.labels());
            }
        } finally {
            BatchIterator.release(batches);
        }
        return new Split(Utils.concatRows(inputs), Utils.concat(labels));
    }

    private DataSource sourceFor(Phase phase) {
        return switch (phase) {
            case TRAIN -> trainSource;
            case VAL -> valSource;
            case TEST, INFER -> testSource;
        };
    }

    private static void requireSource(DataSource source, Phase phase) {
        if (source == null)
            throw new IllegalStateException("No data source configured for the " + phase.key() + " phase");
    }

    public ModelBackend getBackend() {
        return backend;
    }

    public MetricsRegistry getMetrics() {
        return metrics;
    }

    public Device getDevice() {
        return device;
    }

    public SeedContext getSeeds() {
        return seeds;
    }

    public TrainConfig getConfig() {
        return config;
    }

    @Override
    public void close() throws IOException {
        try {
            backend.close();
        } finally {
            if (logger != null)
                logger.close();
        }
    }

    // ===============================
    // BUILDER
    // ===============================

    public static class Builder {
        private final TrainConfig config;
        private DataSource train;
        private DataSource val;
        private DataSource test;
        private MetricsRegistry metrics;
        private MetricsLogger logger;
        private ModelBackend backend;

        private Builder(TrainConfig config) {
            if (config == null)
                throw new IllegalArgumentException("Config cannot be null");
            this.config = config;
        }

        public Builder train(DataSource train) {
            this.train = train;
            return this;
        }

        public Builder val(DataSource val) {
            this.val = val;
            return this;
        }

        public Builder test(DataSource test) {
            this.test = test;
            return this;
        }

        /**
         * Metrics to track; defaults to {@link MetricsRegistry#defaults}.
         */
        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder logger(MetricsLogger logger) {
            this.logger = logger;
            return this;
        }

        /**
         * Use this backend instead of creating one from the config.
         */
        public Builder backend(ModelBackend backend) {
            this.backend = backend;
            return this;
        }

        public TrainingOrchestrator build() {
            return new TrainingOrchestrator(this);
        }
    }
}

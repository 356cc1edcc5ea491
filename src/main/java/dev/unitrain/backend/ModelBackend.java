package dev.unitrain.backend;

import dev.unitrain.Phase;
import dev.unitrain.config.TrainConfig;
import dev.unitrain.losses.Criterion;
import dev.unitrain.losses.Loss;
import dev.unitrain.serialization.CheckpointSerializer;
import dev.unitrain.serialization.Checkpointable;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A predictive model together with its loss criterion, fitted state and persistence.
 *
 * <p>Backends come in two variants identified by {@link #kind()}:
 * <ul>
 *   <li>{@link GradientModel} is fitted batch by batch, epoch after epoch</li>
 *   <li>{@link BatchFitModel} is fitted once over a whole materialized split</li>
 * </ul>
 * Callers dispatch on the kind and cast to the variant to reach its {@code fit}.
 * Everything else ({@link #predict}, {@link #saveModel}, {@link #loadModel},
 * {@link #annealLr}) is shared.
 *
 * <p>A backend is unfitted until its first training fit or a successful load;
 * until then {@link #predict} and {@link #saveModel} throw {@link ModelNotFittedException}.
 */
public abstract class ModelBackend implements Checkpointable, AutoCloseable {

    public enum Kind {
        GRADIENT,
        BATCH_FIT
    }

    protected final TrainConfig config;
    protected final Loss criterion;
    private boolean fitted;
    private Device device = Device.CPU;

    /**
     * @throws dev.unitrain.config.ConfigurationException if the class labels and loss
     *         weights of a classification config disagree in length
     */
    protected ModelBackend(TrainConfig config) {
        this.config = config;
        this.criterion = Criterion.select(config);
    }

    public abstract Kind kind();

    /**
     * One prediction per input row: a class index for classification, a value for regression.
     */
    public final float[] predict(float[][] inputs) {
        requireFitted("predict");
        return predictRows(inputs);
    }

    protected abstract float[] predictRows(float[][] inputs);

    /**
     * Divide the learning rate by {@code factor}; a no-op for backends without one.
     */
    public abstract void annealLr(float factor);

    /**
     * Hook run after a training phase completes.
     */
    public void updateByEpoch(Phase phase) {
    }

    public boolean supportsAccelerator() {
        return false;
    }

    public void placeOn(Device device) {
        if (device == Device.ACCELERATOR && !supportsAccelerator())
            throw new IllegalArgumentException(getClass().getSimpleName() + " cannot run on the accelerator");
        this.device = device;
    }

    public Device device() {
        return device;
    }

    public void saveModel() throws IOException {
        requireFitted("save model");
        CheckpointSerializer.save(this, getModelPath());
    }

    /**
     * Restore the checkpoint at the configured model path and mark the backend fitted.
     *
     * @throws dev.unitrain.serialization.CheckpointLoadException if the checkpoint is
     *         missing or does not belong to this backend
     */
    public void loadModel() throws IOException {
        CheckpointSerializer.load(this, getModelPath());
        fitted = true;
    }

    public Path getModelPath() {
        return config.getModelPath();
    }

    public boolean isFitted() {
        return fitted;
    }

    public Loss getCriterion() {
        return criterion;
    }

    public TrainConfig getConfig() {
        return config;
    }

    protected void markFitted() {
        this.fitted = true;
    }

    protected void requireFitted(String operation) {
        if (!fitted)
            throw new ModelNotFittedException(operation);
    }

    protected static void checkLabels(float[][] inputs, float[] labels) {
        if (inputs.length == 0)
            throw new IllegalArgumentException("Cannot fit an empty batch");
        if (labels == null || labels.length != inputs.length)
            throw new IllegalArgumentException(String.format(
                "Inputs and labels must have same length: %d != %d",
                inputs.length, labels == null ? 0 : labels.length));
    }

    /**
     * Release resources owned by the backend, such as its worker pool.
     */
    @Override
    public void close() {
    }
}

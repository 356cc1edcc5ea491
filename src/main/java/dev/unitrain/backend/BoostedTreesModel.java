package dev.unitrain.backend;

import dev.unitrain.common.SeedContext;
import dev.unitrain.common.Utils;
import dev.unitrain.config.TrainConfig;
import dev.unitrain.config.TreeConfig;
import dev.unitrain.serialization.SerializationConstants;
import dev.unitrain.trees.BoostedEnsemble;
import dev.unitrain.trees.GradientBooster;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Batch-fit backend around a {@link GradientBooster} ensemble of Weka trees.
 */
public class BoostedTreesModel extends BatchFitModel {

    private final TreeConfig trees;
    private final int featureWidth;
    private final GradientBooster booster;
    private BoostedEnsemble ensemble;
    private GradientBooster.Result lastFit;

    /**
     * @param featureWidth number of columns in every flattened input row
     */
    public BoostedTreesModel(TrainConfig config, int featureWidth, SeedContext seeds) {
        super(config);
        if (featureWidth <= 0)
            throw new IllegalArgumentException("Feature width must be positive: " + featureWidth);
        this.trees = config.getTrees();
        this.featureWidth = featureWidth;
        this.booster = new GradientBooster(trees, criterion, classWeights(config), seeds, !config.isSilent());
    }

    private static float[] classWeights(TrainConfig config) {
        if (!config.isClassification())
            return null;
        List<Float> weights = config.getLossWeight();
        float[] result = new float[weights.size()];
        for (int i = 0; i < result.length; i++)
            result[i] = weights.get(i);
        return result;
    }

    @Override
    public boolean wantsHeldOut() {
        return trees.earlyStopping;
    }

    @Override
    protected float fitAll(float[][] inputs, float[] labels, float[][] heldOutInputs, float[] heldOutLabels) {
        checkWidth(inputs);
        if (heldOutInputs != null)
            checkWidth(heldOutInputs);

        lastFit = booster.fit(inputs, labels, heldOutInputs, heldOutLabels);
        ensemble = lastFit.ensemble();
        if (!config.isSilent())
            System.out.printf("Boosting: %d rounds fitted, %d kept, score %.6f%n",
                              lastFit.roundsTrained(), ensemble.numRounds(), lastFit.score());
        return lastFit.score();
    }

    @Override
    protected float evaluateRows(float[][] inputs, float[] labels) {
        checkWidth(inputs);
        return criterion.loss(ensemble.rawScores(inputs), labels);
    }

    @Override
    protected float[] predictRows(float[][] inputs) {
        checkWidth(inputs);
        float[][] scores = ensemble.rawScores(inputs);
        float[] predictions = new float[scores.length];
        for (int i = 0; i < scores.length; i++)
            predictions[i] = config.isClassification() ? Utils.argmax(scores[i]) : scores[i][0];
        return predictions;
    }

    private void checkWidth(float[][] inputs) {
        for (float[] row : inputs) {
            if (row.length != featureWidth)
                throw new IllegalArgumentException(String.format(
                    "Expected rows of %d features, got %d", featureWidth, row.length));
        }
    }

    /**
     * Details of the most recent fit, or {@code null} before the first one.
     */
    public GradientBooster.Result getLastFit() {
        return lastFit;
    }

    public BoostedEnsemble getEnsemble() {
        return ensemble;
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_BOOSTED_TREES_MODEL;
    }

    @Override
    public void writeTo(DataOutputStream out, int version) throws IOException {
        out.writeInt(featureWidth);
        ensemble.writeTo(out);
    }

    @Override
    public void readFrom(DataInputStream in, int version) throws IOException {
        int storedWidth = in.readInt();
        if (storedWidth != featureWidth)
            throw new IOException(String.format(
                "Checkpoint was fitted on %d features, model expects %d", storedWidth, featureWidth));
        BoostedEnsemble loaded = BoostedEnsemble.readFrom(in);
        if (loaded.numOutputs() != config.getOutputSize())
            throw new IOException(String.format(
                "Checkpoint has %d outputs, model expects %d", loaded.numOutputs(), config.getOutputSize()));
        ensemble = loaded;
    }
}

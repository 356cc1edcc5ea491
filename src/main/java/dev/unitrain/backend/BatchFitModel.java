package dev.unitrain.backend;

import dev.unitrain.config.TrainConfig;

/**
 * Backend fitted in one call over a whole training split.
 *
 * <p>The model iterates internally. When a held-out pair is supplied it may stop early on
 * its own, and the returned score is the best held-out loss reached; without one it is the
 * final training loss.
 */
public abstract class BatchFitModel extends ModelBackend {

    protected BatchFitModel(TrainConfig config) {
        super(config);
    }

    @Override
    public final Kind kind() {
        return Kind.BATCH_FIT;
    }

    public final float fit(float[][] inputs, float[] labels) {
        return fit(inputs, labels, null, null);
    }

    /**
     * @param heldOutInputs rows for internal early stopping, or {@code null}
     * @param heldOutLabels labels of the held-out rows, or {@code null}
     * @return the fit score
     */
    public final float fit(float[][] inputs, float[] labels, float[][] heldOutInputs, float[] heldOutLabels) {
        checkLabels(inputs, labels);
        if ((heldOutInputs == null) != (heldOutLabels == null))
            throw new IllegalArgumentException("Held-out inputs and labels must be given together");
        if (heldOutInputs != null)
            checkLabels(heldOutInputs, heldOutLabels);

        float score = fitAll(inputs, labels, heldOutInputs, heldOutLabels);
        markFitted();
        return score;
    }

    protected abstract float fitAll(float[][] inputs, float[] labels, float[][] heldOutInputs, float[] heldOutLabels);

    /**
     * Criterion loss of the fitted model on the given rows.
     */
    public final float evaluate(float[][] inputs, float[] labels) {
        requireFitted("evaluate");
        checkLabels(inputs, labels);
        return evaluateRows(inputs, labels);
    }

    protected abstract float evaluateRows(float[][] inputs, float[] labels);

    /**
     * Whether {@link #fit} should be handed the validation split as its held-out pair.
     */
    public boolean wantsHeldOut() {
        return false;
    }

    @Override
    public final void annealLr(float factor) {
        // fitted in one shot, nothing to anneal
    }
}

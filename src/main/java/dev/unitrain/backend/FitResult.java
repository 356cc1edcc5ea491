package dev.unitrain.backend;

/**
 * Outcome of one per-batch fit call: the batch loss and one prediction per input row.
 */
public record FitResult(float loss, float[] predictions) {
}

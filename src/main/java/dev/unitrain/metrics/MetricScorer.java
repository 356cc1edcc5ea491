package dev.unitrain.metrics;

/**
 * Per-batch value of a metric.
 */
@FunctionalInterface
public interface MetricScorer {

    /**
     * @param loss the batch loss reported by the backend
     * @param predictions one prediction per sample
     * @param labels one label per sample
     */
    double score(float loss, float[] predictions, float[] labels);
}

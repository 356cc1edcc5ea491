package dev.unitrain.training;

import dev.unitrain.metrics.ConfusionMatrix;
import dev.unitrain.metrics.MetricsRegistry;

import java.util.Map;

/**
 * Outcome of a test pass.
 *
 * @param predictions one prediction per test sample, in delivery order
 * @param labels the matching labels
 * @param confusionMatrix actual-vs-predicted counts for classification, {@code null} for regression
 * @param metrics the registry whose TEST-phase meters hold this pass
 * @param averages TEST-phase averages keyed {@code test_<metric>}
 */
public record TestResult(float[] predictions, float[] labels, ConfusionMatrix confusionMatrix,
                         MetricsRegistry metrics, Map<String, Double> averages) {

    public int size() {
        return predictions.length;
    }
}

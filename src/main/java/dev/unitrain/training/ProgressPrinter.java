package dev.unitrain.training;

import dev.unitrain.Phase;
import dev.unitrain.metrics.Metric;
import dev.unitrain.metrics.MetricsRegistry;

import java.nio.file.Path;
import java.util.Map;

/**
 * Console output of a run. Everything is suppressed when silent.
 */
public final class ProgressPrinter {

    private final boolean silent;

    public ProgressPrinter(boolean silent) {
        this.silent = silent;
    }

    public boolean isVerbose() {
        return !silent;
    }

    /**
     * {@code train epoch: [0][3/10]	loss 0.5123 (0.5400)	accuracy 0.7500 (0.7200)}
     * showing each metric's last batch value and its running average.
     */
    public void batch(Phase phase, int epoch, int batch, int numBatches, MetricsRegistry metrics) {
        if (silent)
            return;
        StringBuilder line = new StringBuilder();
        line.append(String.format("%s epoch: [%d][%d/%d]", phase.key(), epoch, batch, numBatches));
        for (Metric metric : metrics)
            line.append(String.format("\t%s %.4f (%.4f)", metric.getName(),
                                      metric.meter(phase).getValue(), metric.average(phase)));
        System.out.println(line);
    }

    public void phaseSummary(Phase phase, int epoch, Map<String, Double> averages) {
        if (silent)
            return;
        StringBuilder line = new StringBuilder();
        line.append(String.format("%s epoch %d", phase.key(), epoch));
        for (Map.Entry<String, Double> entry : averages.entrySet())
            line.append(String.format(" - %s: %.6f", entry.getKey(), entry.getValue()));
        System.out.println(line);
    }

    public void checkpoint(Path path, String metric, double value) {
        if (silent)
            return;
        System.out.printf("Model checkpoint saved: %s (%s improved to %.6f)%n", path, metric, value);
    }

    public void message(String format, Object... args) {
        if (silent)
            return;
        System.out.printf(format + "%n", args);
    }
}

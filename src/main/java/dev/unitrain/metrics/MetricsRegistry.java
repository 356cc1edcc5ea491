package dev.unitrain.metrics;

import dev.unitrain.Phase;
import dev.unitrain.config.TrainConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered collection of metrics updated together.
 */
public final class MetricsRegistry implements Iterable<Metric> {

    private final Map<String, Metric> metrics = new LinkedHashMap<>();

    public MetricsRegistry(Metric... metrics) {
        for (Metric metric : metrics)
            add(metric);
    }

    /**
     * Save-triggering loss, plus accuracy and macro F1 for classification or mean absolute
     * error for regression.
     */
    public static MetricsRegistry defaults(TrainConfig config) {
        if (config.isClassification())
            return new MetricsRegistry(Metrics.loss(true), Metrics.accuracy(),
                                       Metrics.macroF1(config.getClassLabels().size()));
        return new MetricsRegistry(Metrics.loss(true), Metrics.meanAbsoluteError());
    }

    public MetricsRegistry add(Metric metric) {
        if (metrics.containsKey(metric.getName()))
            throw new IllegalArgumentException("Duplicate metric name: " + metric.getName());
        metrics.put(metric.getName(), metric);
        return this;
    }

    public void update(Phase phase, float loss, float[] predictions, float[] labels) {
        for (Metric metric : metrics.values())
            metric.update(phase, loss, predictions, labels);
    }

    /**
     * Current averages keyed {@code <phase>_<metric>}, in registration order.
     */
    public Map<String, Double> averages(Phase phase) {
        Map<String, Double> result = new LinkedHashMap<>();
        for (Metric metric : metrics.values())
            result.put(phase.key() + "_" + metric.getName(), metric.average(phase));
        return result;
    }

    public void reset(Phase phase) {
        for (Metric metric : metrics.values())
            metric.reset(phase);
    }

    public Metric get(String name) {
        Metric metric = metrics.get(name);
        if (metric == null)
            throw new IllegalArgumentException("No metric named " + name + " (have " + metrics.keySet() + ")");
        return metric;
    }

    public boolean contains(String name) {
        return metrics.containsKey(name);
    }

    public List<Metric> asList() {
        return Collections.unmodifiableList(new ArrayList<>(metrics.values()));
    }

    public int size() {
        return metrics.size();
    }

    @Override
    public Iterator<Metric> iterator() {
        return Collections.unmodifiableCollection(metrics.values()).iterator();
    }
}

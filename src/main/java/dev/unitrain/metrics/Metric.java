package dev.unitrain.metrics;

import dev.unitrain.Phase;

import java.util.EnumMap;
import java.util.Map;

/**
 * A named statistic tracked separately for every phase.
 *
 * <p>A save-triggering metric causes a checkpoint whenever its validation average
 * improves on its best.
 */
public final class Metric {

    private final String name;
    private final Direction direction;
    private final boolean saveModel;
    private final boolean lossBased;
    private final MetricScorer scorer;
    private final Map<Phase, AverageMeter> meters = new EnumMap<>(Phase.class);

    public Metric(String name, Direction direction, boolean saveModel, MetricScorer scorer) {
        this(name, direction, saveModel, false, scorer);
    }

    /**
     * @param lossBased whether the value is derived from the backend loss rather than
     *        from predictions and labels
     */
    public Metric(String name, Direction direction, boolean saveModel, boolean lossBased, MetricScorer scorer) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Metric name cannot be empty");
        this.name = name;
        this.direction = direction;
        this.saveModel = saveModel;
        this.lossBased = lossBased;
        this.scorer = scorer;
        for (Phase phase : Phase.values())
            meters.put(phase, new AverageMeter());
    }

    /**
     * Score one batch and fold it into the phase average, weighted by batch size.
     */
    public void update(Phase phase, float loss, float[] predictions, float[] labels) {
        if (predictions.length != labels.length)
            throw new IllegalArgumentException(String.format(
                "Predictions and labels must have same length: %d != %d", predictions.length, labels.length));
        if (predictions.length == 0)
            return;
        meters.get(phase).update(scorer.score(loss, predictions, labels), predictions.length);
    }

    public boolean updateBest(Phase phase) {
        return meters.get(phase).updateBest(direction);
    }

    public void reset(Phase phase) {
        meters.get(phase).reset();
    }

    public double average(Phase phase) {
        return meters.get(phase).average();
    }

    public double best(Phase phase) {
        return meters.get(phase).getBest();
    }

    public AverageMeter meter(Phase phase) {
        return meters.get(phase);
    }

    public String getName() {
        return name;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isSaveModel() {
        return saveModel;
    }

    public boolean isLossBased() {
        return lossBased;
    }

    @Override
    public String toString() {
        return "Metric[" + name + ", " + direction + (saveModel ? ", saves" : "") + "]";
    }
}

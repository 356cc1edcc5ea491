package dev.unitrain.trees;

import dev.unitrain.common.SeedContext;
import dev.unitrain.common.Utils;
import dev.unitrain.config.TreeConfig;
import dev.unitrain.losses.Loss;
import weka.classifiers.trees.REPTree;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Gradient boosting with Weka {@link REPTree} regression trees as base learners.
 *
 * <p><b>Per round:</b>
 * <pre>
 * g, h   = first and second derivative of the loss at the current scores
 * rows   = Bernoulli(subsample) sample of the training rows
 * for each output k:
 *     cols = random featureFraction share of the columns
 *     tree = REPTree fitted on (rows, cols) with target -g[k]
 *     leaf = -soft(sum g, regAlpha) / (sum h + regLambda)   over the rows in each leaf
 * score[k] += learningRate * leaf(row)
 * </pre>
 *
 * <p>Regression boosts squared error from the target mean (g = score - y, h = 1).
 * Classification boosts one tree per class per round on the class-weighted softmax
 * gradient (g = w_y (p - onehot), h = w_y p (1 - p)) starting from the weighted class prior.
 *
 * <p>With a held-out pair the held-out loss is measured after every round; boosting stops
 * after {@link TreeConfig#earlyStoppingRounds} rounds without improvement and the ensemble
 * is cut back to its best round.
 */
public final class GradientBooster {

    private static final double MIN_PRIOR = 1e-6;

    /**
     * @param score best held-out loss when a held-out pair was given, else the final training loss
     * @param roundsTrained rounds fitted before stopping
     * @param bestRound zero-based round the ensemble was truncated to, or the last round
     */
    public record Result(BoostedEnsemble ensemble, float score, int roundsTrained, int bestRound, boolean stoppedEarly) {
    }

    private final TreeConfig config;
    private final Loss criterion;
    private final int numOutputs;
    private final float[] classWeights;
    private final RandomGenerator random;
    private final int treeSeed;
    private final boolean verbose;

    /**
     * @param classWeights per-class loss weights for classification, {@code null} for regression
     */
    public GradientBooster(TreeConfig config, Loss criterion, float[] classWeights, SeedContext seeds, boolean verbose) {
        this.config = config;
        this.criterion = criterion;
        this.classWeights = classWeights == null ? null : classWeights.clone();
        this.numOutputs = classWeights == null ? 1 : classWeights.length;
        this.random = seeds.generator("trees.sampling");
        this.treeSeed = seeds.intSeed("trees.reptree");
        this.verbose = verbose;
    }

    /**
     * @throws IllegalArgumentException if a classification label is not a class index
     * @throws IllegalStateException if the held-out loss was never finite, leaving no round to keep
     */
    public Result fit(float[][] rows, float[] labels, float[][] heldOutRows, float[] heldOutLabels) {
        checkLabels(labels, "Training");
        if (heldOutLabels != null)
            checkLabels(heldOutLabels, "Held-out");
        int n = rows.length;
        float[] base = baseScores(labels);
        float[][] scores = repeat(base, n);
        float[][] heldOutScores = heldOutRows == null ? null : repeat(base, heldOutRows.length);
        EarlyStopping stopping = heldOutRows == null ? null : new EarlyStopping(config.earlyStoppingRounds);

        List<TreeStage[]> rounds = new ArrayList<>();
        double[][] gradients = new double[numOutputs][n];
        double[][] hessians = new double[numOutputs][n];
        boolean stoppedEarly = false;

        for (int round = 0; round < config.nEstimators; round++) {
            computeDerivatives(scores, labels, gradients, hessians);
            int[] sample = subsample(n);

            TreeStage[] stages = new TreeStage[numOutputs];
            for (int k = 0; k < numOutputs; k++)
                stages[k] = fitStage(rows, sample, k, gradients[k], hessians[k], round);

            addRound(stages, rows, scores);
            if (heldOutScores != null)
                addRound(stages, heldOutRows, heldOutScores);
            rounds.add(stages);

            if (stopping != null && stopping.update(round, criterion.loss(heldOutScores, heldOutLabels))) {
                stoppedEarly = true;
                break;
            }
        }

        int roundsTrained = rounds.size();
        float score;
        int bestRound;
        if (stopping != null) {
            bestRound = stopping.getBestRound();
            if (bestRound < 0)
                throw new IllegalStateException("Held-out loss was never finite over " + roundsTrained + " rounds");
            score = stopping.getBestLoss();
            rounds = new ArrayList<>(rounds.subList(0, bestRound + 1));
            if (verbose && stoppedEarly)
                System.out.printf("Early stopping: no held-out improvement for %d rounds, keeping best round %d of %d (loss %.6f)%n",
                                  config.earlyStoppingRounds, bestRound + 1, roundsTrained, score);
        } else {
            bestRound = roundsTrained - 1;
            score = criterion.loss(scores, labels);
        }

        return new Result(new BoostedEnsemble(base, config.learningRate, rounds), score, roundsTrained, bestRound, stoppedEarly);
    }

    private void checkLabels(float[] labels, String which) {
        if (classWeights == null)
            return;
        for (int i = 0; i < labels.length; i++) {
            float label = labels[i];
            if (label != Math.rint(label) || label < 0 || label >= numOutputs)
                throw new IllegalArgumentException(which + " label " + label + " at row " + i
                                                   + " is not a class index in [0, " + numOutputs + ")");
        }
    }

    private float[] baseScores(float[] labels) {
        float[] base = new float[numOutputs];
        if (classWeights == null) {
            double sum = 0;
            for (float label : labels)
                sum += label;
            base[0] = (float) (sum / labels.length);
            return base;
        }

        double[] mass = new double[numOutputs];
        double total = 0;
        for (float label : labels) {
            int y = (int) label;
            mass[y] += classWeights[y];
            total += classWeights[y];
        }
        for (int k = 0; k < numOutputs; k++)
            base[k] = (float) Math.log(Math.max(total > 0 ? mass[k] / total : 1.0 / numOutputs, MIN_PRIOR));
        return base;
    }

    private void computeDerivatives(float[][] scores, float[] labels, double[][] gradients, double[][] hessians) {
        if (classWeights == null) {
            for (int i = 0; i < scores.length; i++) {
                gradients[0][i] = scores[i][0] - labels[i];
                hessians[0][i] = 1.0;
            }
            return;
        }

        float[] probs = new float[numOutputs];
        for (int i = 0; i < scores.length; i++) {
            int y = (int) labels[i];
            float w = classWeights[y];
            Utils.softmax(scores[i], probs);
            for (int k = 0; k < numOutputs; k++) {
                double p = probs[k];
                gradients[k][i] = w * (p - (k == y ? 1.0 : 0.0));
                hessians[k][i] = w * p * (1.0 - p);
            }
        }
    }

    private TreeStage fitStage(float[][] rows, int[] sample, int output, double[] g, double[] h, int round) {
        int[] features = chooseFeatures(rows[0].length);

        double[] targets = new double[g.length];
        for (int i = 0; i < g.length; i++)
            targets[i] = -g[i];
        Instances frame = WekaFrames.frame(rows, sample, features, targets);

        REPTree tree = new REPTree();
        tree.setMaxDepth(config.maxDepth);
        tree.setMinNum(config.minDataInLeaf);
        tree.setNoPruning(true);
        tree.setSeed(treeSeed + round * numOutputs + output);
        try {
            tree.buildClassifier(frame);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to fit tree " + output + " of round " + round, e);
        }

        // re-weight each leaf with the regularized Newton step over the sampled rows it holds
        Map<Integer, Double> leafValues = new HashMap<>();
        TreeStage stage = new TreeStage(tree, output, features, leafValues);
        Map<Integer, double[]> sums = new HashMap<>();
        for (int row : sample) {
            double[] acc = sums.computeIfAbsent(stage.leaf(rows[row]), k -> new double[2]);
            acc[0] += g[row];
            acc[1] += h[row];
        }
        for (Map.Entry<Integer, double[]> leaf : sums.entrySet())
            leafValues.put(leaf.getKey(), leafWeight(leaf.getValue()[0], leaf.getValue()[1]));
        return stage;
    }

    private double leafWeight(double gradientSum, double hessianSum) {
        double shrunk = Math.signum(gradientSum) * Math.max(Math.abs(gradientSum) - config.regAlpha, 0.0);
        double denominator = hessianSum + config.regLambda;
        return denominator > 0 ? -shrunk / denominator : 0.0;
    }

    private void addRound(TreeStage[] stages, float[][] rows, float[][] scores) {
        for (TreeStage stage : stages) {
            int k = stage.output();
            for (int i = 0; i < rows.length; i++)
                scores[i][k] += (float) (config.learningRate * stage.predict(rows[i]));
        }
    }

    private int[] subsample(int n) {
        if (config.subsample >= 1.0f)
            return subsampleAll(n);

        int[] picked = new int[n];
        int count = 0;
        for (int i = 0; i < n; i++) {
            if (random.nextFloat() < config.subsample)
                picked[count++] = i;
        }
        if (count == 0)
            return subsampleAll(n);
        return Arrays.copyOf(picked, count);
    }

    private static int[] subsampleAll(int n) {
        int[] all = new int[n];
        for (int i = 0; i < n; i++)
            all[i] = i;
        return all;
    }

    private int[] chooseFeatures(int width) {
        int count = Math.max(1, Math.round(config.featureFraction * width));
        int[] columns = new int[width];
        for (int i = 0; i < width; i++)
            columns[i] = i;
        if (count >= width)
            return columns;

        // partial Fisher-Yates
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(width - i);
            int tmp = columns[i];
            columns[i] = columns[j];
            columns[j] = tmp;
        }
        int[] chosen = Arrays.copyOf(columns, count);
        Arrays.sort(chosen);
        return chosen;
    }

    private static float[][] repeat(float[] base, int n) {
        float[][] scores = new float[n][];
        for (int i = 0; i < n; i++)
            scores[i] = base.clone();
        return scores;
    }
}

package dev.unitrain.backend;

import dev.unitrain.common.Parallelization;
import dev.unitrain.common.Parallelization.WorkRange;
import dev.unitrain.common.SeedContext;
import dev.unitrain.common.Utils;
import dev.unitrain.config.GruConfig;
import dev.unitrain.config.TrainConfig;
import dev.unitrain.data.DataShape;
import dev.unitrain.net.SequenceNet;
import dev.unitrain.optimizers.AdamOptimizer;
import dev.unitrain.optimizers.Gradients;
import dev.unitrain.optimizers.NormClipper;
import dev.unitrain.optimizers.Optimizer;
import dev.unitrain.optimizers.SgdOptimizer;
import dev.unitrain.serialization.SerializationConstants;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Gradient backend around a {@link SequenceNet}.
 *
 * <p>Each training batch runs forward for every sample, computes the batch loss, runs
 * backward into gradient buffers, clips them to the configured global norm and takes one
 * optimizer step. On the accelerator the per-sample passes are spread over
 * {@link GruConfig#numThreads} workers, each with its own gradient buffer; the buffers are
 * summed in worker order so results do not depend on scheduling.
 */
public class SequenceModel extends GradientModel {

    private final SequenceNet net;
    private final Optimizer optimizer;
    private final NormClipper clipper;
    private final int numThreads;
    private ExecutorService executor;

    public SequenceModel(TrainConfig config, DataShape shape, SeedContext seeds) {
        super(config);
        GruConfig gru = config.getGru();
        this.net = new SequenceNet(shape, gru, config.getOutputSize(), seeds.generator("gru.init"));
        this.optimizer = createOptimizer(gru);
        this.clipper = new NormClipper(gru.maxNorm);
        this.numThreads = gru.numThreads;
    }

    private static Optimizer createOptimizer(GruConfig gru) {
        return switch (gru.optimizer) {
            case SGD -> new SgdOptimizer(gru.learningRate, gru.momentum, gru.weightDecay);
            case ADAM -> new AdamOptimizer(gru.learningRate, gru.weightDecay);
        };
    }

    @Override
    public boolean supportsAccelerator() {
        return true;
    }

    @Override
    public void placeOn(Device device) {
        super.placeOn(device);
        if (device == Device.ACCELERATOR && executor == null && numThreads > 1)
            executor = Executors.newFixedThreadPool(numThreads);
        else if (device == Device.CPU)
            shutdownExecutor();
    }

    @Override
    protected FitResult fitBatch(float[][] inputs, float[] labels, boolean training) {
        float[][] rows = net.normalize(inputs, training);
        SequenceNet.Pass[] passes = forwardAll(rows);

        float[][] outputs = new float[passes.length][];
        for (int i = 0; i < passes.length; i++)
            outputs[i] = passes[i].output();

        float loss = criterion.loss(outputs, labels);
        if (training) {
            float[][] outputGradients = criterion.derivatives(outputs, labels);
            Gradients gradients = backwardAll(passes, outputGradients);
            clipper.clipInPlace(gradients);
            optimizer.step(net.parameters(), gradients);
        }
        return new FitResult(loss, toPredictions(outputs));
    }

    @Override
    protected float[] predictRows(float[][] inputs) {
        SequenceNet.Pass[] passes = forwardAll(net.normalize(inputs, false));
        float[][] outputs = new float[passes.length][];
        for (int i = 0; i < passes.length; i++)
            outputs[i] = passes[i].output();
        return toPredictions(outputs);
    }

    private SequenceNet.Pass[] forwardAll(float[][] rows) {
        SequenceNet.Pass[] passes = new SequenceNet.Pass[rows.length];
        WorkRange[] ranges = Parallelization.splitWork(rows.length, executor == null ? 1 : numThreads);
        Runnable[] tasks = new Runnable[ranges.length];
        for (int r = 0; r < ranges.length; r++) {
            WorkRange range = ranges[r];
            tasks[r] = () -> {
                for (int i = range.start(); i < range.end(); i++)
                    passes[i] = net.forward(rows[i]);
            };
        }
        Parallelization.executeParallel(executor, tasks);
        return passes;
    }

    private Gradients backwardAll(SequenceNet.Pass[] passes, float[][] outputGradients) {
        WorkRange[] ranges = Parallelization.splitWork(passes.length, executor == null ? 1 : numThreads);
        Gradients[] partials = new Gradients[ranges.length];
        Runnable[] tasks = new Runnable[ranges.length];
        for (int r = 0; r < ranges.length; r++) {
            WorkRange range = ranges[r];
            Gradients partial = net.newGradients();
            partials[r] = partial;
            tasks[r] = () -> {
                for (int i = range.start(); i < range.end(); i++)
                    net.backward(passes[i], outputGradients[i], partial);
            };
        }
        Parallelization.executeParallel(executor, tasks);

        Gradients total = partials[0];
        for (int r = 1; r < partials.length; r++)
            total.add(partials[r]);
        return total;
    }

    private float[] toPredictions(float[][] outputs) {
        float[] predictions = new float[outputs.length];
        for (int i = 0; i < outputs.length; i++)
            predictions[i] = config.isClassification() ? Utils.argmax(outputs[i]) : outputs[i][0];
        return predictions;
    }

    @Override
    public void annealLr(float factor) {
        if (factor <= 0)
            throw new IllegalArgumentException("Anneal factor must be positive: " + factor);
        optimizer.setLearningRate(optimizer.getLearningRate() / factor);
    }

    @Override
    public float getLearningRate() {
        return optimizer.getLearningRate();
    }

    public SequenceNet getNet() {
        return net;
    }

    @Override
    public int getTypeId() {
        return SerializationConstants.TYPE_SEQUENCE_MODEL;
    }

    @Override
    public void writeTo(DataOutputStream out, int version) throws IOException {
        out.writeFloat(optimizer.getLearningRate());
        net.writeTo(out);
    }

    @Override
    public void readFrom(DataInputStream in, int version) throws IOException {
        float learningRate = in.readFloat();
        net.readFrom(in);
        optimizer.setLearningRate(learningRate);
    }

    @Override
    public void close() {
        shutdownExecutor();
    }

    private void shutdownExecutor() {
        if (executor == null)
            return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS))
                executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        executor = null;
    }
}

package dev.unitrain.optimizers;

import java.util.Arrays;
import java.util.List;

/**
 * Gradient accumulators for every parameter of a network, one slot per parameter index.
 *
 * <p>Workers that run backward passes in parallel each fill their own instance;
 * the instances are summed with {@link #add} before the optimizer step.
 */
public final class Gradients {

    private final float[][] buffers;

    public Gradients(List<Parameter> parameters) {
        this.buffers = new float[parameters.size()][];
        for (Parameter p : parameters)
            buffers[p.index()] = new float[p.size()];
    }

    public float[] of(Parameter parameter) {
        return buffers[parameter.index()];
    }

    public void add(Gradients other) {
        if (other.buffers.length != buffers.length)
            throw new IllegalArgumentException("Gradients belong to different networks");
        for (int p = 0; p < buffers.length; p++) {
            float[] mine = buffers[p];
            float[] theirs = other.buffers[p];
            for (int i = 0; i < mine.length; i++)
                mine[i] += theirs[i];
        }
    }

    public void scale(float factor) {
        for (float[] buffer : buffers) {
            for (int i = 0; i < buffer.length; i++)
                buffer[i] *= factor;
        }
    }

    public float globalNorm() {
        double sumSquares = 0;
        for (float[] buffer : buffers) {
            for (float g : buffer)
                sumSquares += (double) g * g;
        }
        return (float) Math.sqrt(sumSquares);
    }

    public void zero() {
        for (float[] buffer : buffers)
            Arrays.fill(buffer, 0f);
    }
}

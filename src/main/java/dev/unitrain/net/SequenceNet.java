package dev.unitrain.net;

import dev.unitrain.config.GruConfig;
import dev.unitrain.data.DataShape;
import dev.unitrain.layers.DenseLayer;
import dev.unitrain.layers.GruLayer;
import dev.unitrain.layers.InputNormalizer;
import dev.unitrain.optimizers.Gradients;
import dev.unitrain.optimizers.Parameter;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Stacked (optionally bidirectional) GRU network with a dense head over every timestep.
 *
 * <pre>
 * row [seqLen * featureWidth]
 *   -> InputNormalizer (optional)
 *   -> GRU layer 1 (forward + backward directions summed)
 *   -> ...
 *   -> GRU layer N
 *   -> Dense [seqLen * hiddenSize -> outputSize]
 * </pre>
 *
 * <p>Normalization runs once per batch through {@link #normalize}; the per-sample
 * {@link #forward}/{@link #backward} pair is stateless apart from the parameters and
 * may be called from several threads at once.
 */
public class SequenceNet {

    /**
     * Activations of one sample, kept for its backward pass.
     */
    public static final class Pass {
        private final GruLayer.Context[][] contexts;
        private final float[] headInput;
        private final float[] output;

        Pass(GruLayer.Context[][] contexts, float[] headInput, float[] output) {
            this.contexts = contexts;
            this.headInput = headInput;
            this.output = output;
        }

        public float[] output() {
            return output;
        }
    }

    private final DataShape shape;
    private final int hiddenSize;
    private final int outputSize;
    private final InputNormalizer normalizer;
    private final GruLayer[][] layers;
    private final DenseLayer head;
    private final List<Parameter> parameters;

    public SequenceNet(DataShape shape, GruConfig config, int outputSize, RandomGenerator random) {
        if (outputSize <= 0)
            throw new IllegalArgumentException("Output size must be positive: " + outputSize);

        this.shape = shape;
        this.hiddenSize = config.hiddenSize;
        this.outputSize = outputSize;
        this.normalizer = config.inputNormalization
            ? new InputNormalizer(shape.featureWidth(), shape.normWidth() > 0 ? shape.normWidth() : shape.featureWidth())
            : null;

        int directions = config.bidirectional ? 2 : 1;
        this.layers = new GruLayer[config.numLayers][directions];
        int inputSize = shape.featureWidth();
        for (int l = 0; l < config.numLayers; l++) {
            layers[l][0] = new GruLayer("gru" + l + ".fwd", inputSize, hiddenSize, false, random);
            if (config.bidirectional)
                layers[l][1] = new GruLayer("gru" + l + ".bwd", inputSize, hiddenSize, true, random);
            inputSize = hiddenSize;
        }
        this.head = new DenseLayer("head", hiddenSize * shape.seqLen(), outputSize, random);

        List<Parameter> all = new ArrayList<>();
        for (GruLayer[] layer : layers) {
            for (GruLayer direction : layer)
                all.addAll(direction.parameters());
        }
        all.addAll(head.parameters());
        for (int i = 0; i < all.size(); i++)
            all.get(i).register(i);
        this.parameters = Collections.unmodifiableList(all);
    }

    public float[][] normalize(float[][] rows, boolean training) {
        for (float[] row : rows) {
            if (row.length != shape.rowWidth())
                throw new IllegalArgumentException(String.format(
                    "Expected rows of %d values (%d x %d), got %d",
                    shape.rowWidth(), shape.seqLen(), shape.featureWidth(), row.length));
        }
        return normalizer == null ? rows : normalizer.normalize(rows, training);
    }

    public Pass forward(float[] row) {
        GruLayer.Context[][] contexts = new GruLayer.Context[layers.length][];
        float[] activations = row;
        for (int l = 0; l < layers.length; l++) {
            GruLayer[] layer = layers[l];
            contexts[l] = new GruLayer.Context[layer.length];
            float[] summed = null;
            for (int d = 0; d < layer.length; d++) {
                GruLayer.Context ctx = layer[d].forward(activations);
                contexts[l][d] = ctx;
                if (summed == null) {
                    summed = ctx.output.clone();
                } else {
                    for (int i = 0; i < summed.length; i++)
                        summed[i] += ctx.output[i];
                }
            }
            activations = summed;
        }
        return new Pass(contexts, activations, head.forward(activations));
    }

    /**
     * Accumulate the gradients of one sample into {@code gradients}.
     *
     * @param outputGradient gradient of the batch loss with respect to this sample's outputs
     */
    public void backward(Pass pass, float[] outputGradient, Gradients gradients) {
        float[] upstream = head.backward(pass.headInput, outputGradient, gradients);
        for (int l = layers.length - 1; l >= 0; l--) {
            GruLayer[] layer = layers[l];
            float[] inputGradient = null;
            for (int d = 0; d < layer.length; d++) {
                float[] grad = layer[d].backward(pass.contexts[l][d], upstream, gradients);
                if (inputGradient == null) {
                    inputGradient = grad;
                } else {
                    for (int i = 0; i < inputGradient.length; i++)
                        inputGradient[i] += grad[i];
                }
            }
            upstream = inputGradient;
        }
    }

    public List<Parameter> parameters() {
        return parameters;
    }

    public Gradients newGradients() {
        return new Gradients(parameters);
    }

    public int getOutputSize() {
        return outputSize;
    }

    public DataShape getShape() {
        return shape;
    }

    public void writeTo(DataOutputStream out) throws IOException {
        out.writeInt(shape.featureWidth());
        out.writeInt(shape.seqLen());
        out.writeInt(hiddenSize);
        out.writeInt(layers.length);
        out.writeBoolean(layers[0].length == 2);
        out.writeInt(outputSize);

        out.writeInt(parameters.size());
        for (Parameter p : parameters) {
            float[] values = p.values();
            out.writeInt(values.length);
            for (float v : values)
                out.writeFloat(v);
        }

        out.writeBoolean(normalizer != null);
        if (normalizer != null)
            normalizer.writeTo(out);
    }

    /**
     * Load weights saved by {@link #writeTo} into this network, which must have been
     * built with the same architecture.
     */
    public void readFrom(DataInputStream in) throws IOException {
        int featureWidth = in.readInt();
        int seqLen = in.readInt();
        int storedHidden = in.readInt();
        int storedLayers = in.readInt();
        boolean storedBidirectional = in.readBoolean();
        int storedOutputs = in.readInt();
        if (featureWidth != shape.featureWidth() || seqLen != shape.seqLen() || storedHidden != hiddenSize
                || storedLayers != layers.length || storedBidirectional != (layers[0].length == 2)
                || storedOutputs != outputSize) {
            throw new IOException(String.format(
                "Checkpoint architecture (features=%d, seqLen=%d, hidden=%d, layers=%d, bidirectional=%b, outputs=%d) "
                    + "does not match the configured network (features=%d, seqLen=%d, hidden=%d, layers=%d, bidirectional=%b, outputs=%d)",
                featureWidth, seqLen, storedHidden, storedLayers, storedBidirectional, storedOutputs,
                shape.featureWidth(), shape.seqLen(), hiddenSize, layers.length, layers[0].length == 2, outputSize));
        }

        int count = in.readInt();
        if (count != parameters.size())
            throw new IOException("Parameter count mismatch: " + count + " != " + parameters.size());
        for (Parameter p : parameters) {
            int length = in.readInt();
            if (length != p.size())
                throw new IOException("Size mismatch for " + p.name() + ": " + length + " != " + p.size());
            float[] values = p.values();
            for (int i = 0; i < length; i++)
                values[i] = in.readFloat();
        }

        boolean hasNormalizer = in.readBoolean();
        if (hasNormalizer != (normalizer != null))
            throw new IOException("Checkpoint input normalization setting does not match the configured network");
        if (normalizer != null)
            normalizer.readFrom(in);
    }
}

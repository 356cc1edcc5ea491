package dev.unitrain.layers;

import dev.unitrain.common.Utils;
import dev.unitrain.optimizers.Gradients;
import dev.unitrain.optimizers.Parameter;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Gated Recurrent Unit (GRU) layer emitting the hidden state of every timestep.
 *
 * <p><b>Per-timestep computation:</b>
 * <pre>
 * z_t = σ(W_z * [x_t, h_{t-1}] + b_z)             // update gate
 * r_t = σ(W_r * [x_t, h_{t-1}] + b_r)             // reset gate
 * n_t = tanh(W_n * [x_t, r_t ⊙ h_{t-1}] + b_n)     // candidate state
 * h_t = (1 - z_t) ⊙ h_{t-1} + z_t ⊙ n_t
 * </pre>
 *
 * <p>A reversed layer walks the sequence from the last timestep to the first; its outputs
 * are still laid out in original time order so both directions can be summed position
 * by position.
 *
 * <p>Input and output rows are time-major: {@code input[t * inputSize + i]} and
 * {@code output[t * hiddenSize + j]}. Gate weights are stored row-major by concatenated
 * input, {@code W[k * hiddenSize + j]} with {@code k} over {@code inputSize + hiddenSize}.
 *
 * <p>Forward and backward hold no per-call state in the layer, so different samples can
 * be processed concurrently as long as each caller accumulates into its own
 * {@link Gradients}.
 */
public class GruLayer {

    /**
     * Everything backpropagation through time needs from one forward pass.
     * Arrays are indexed by processing step, which differs from time index for reversed layers.
     */
    public static final class Context {
        final int seqLen;
        final float[][] inputs;        // [step][inputSize]
        final float[][] hiddenStates;  // [step + 1][hiddenSize], includes h_0
        final float[][] updateGates;   // [step][hiddenSize]
        final float[][] resetGates;    // [step][hiddenSize]
        final float[][] candidates;    // [step][hiddenSize]
        final float[][] resetHidden;   // r_t ⊙ h_{t-1}
        public final float[] output;   // [seqLen * hiddenSize], time order

        Context(int seqLen, int inputSize, int hiddenSize) {
            this.seqLen = seqLen;
            this.inputs = new float[seqLen][inputSize];
            this.hiddenStates = new float[seqLen + 1][hiddenSize];
            this.updateGates = new float[seqLen][hiddenSize];
            this.resetGates = new float[seqLen][hiddenSize];
            this.candidates = new float[seqLen][hiddenSize];
            this.resetHidden = new float[seqLen][hiddenSize];
            this.output = new float[seqLen * hiddenSize];
        }
    }

    private final int inputSize;
    private final int hiddenSize;
    private final int totalInputSize;
    private final boolean reverse;

    private final Parameter updateWeights;     // W_z
    private final Parameter resetWeights;      // W_r
    private final Parameter candidateWeights;  // W_n
    private final Parameter updateBias;        // b_z
    private final Parameter resetBias;         // b_r
    private final Parameter candidateBias;     // b_n

    public GruLayer(String name, int inputSize, int hiddenSize, boolean reverse, RandomGenerator random) {
        if (inputSize <= 0)
            throw new IllegalArgumentException("Input size must be positive: " + inputSize);
        if (hiddenSize <= 0)
            throw new IllegalArgumentException("Hidden size must be positive: " + hiddenSize);

        this.inputSize = inputSize;
        this.hiddenSize = hiddenSize;
        this.totalInputSize = inputSize + hiddenSize;
        this.reverse = reverse;

        this.updateWeights = new Parameter(name + ".w_z", totalInputSize * hiddenSize);
        this.resetWeights = new Parameter(name + ".w_r", totalInputSize * hiddenSize);
        this.candidateWeights = new Parameter(name + ".w_n", totalInputSize * hiddenSize);
        this.updateBias = new Parameter(name + ".b_z", hiddenSize);
        this.resetBias = new Parameter(name + ".b_r", hiddenSize);
        this.candidateBias = new Parameter(name + ".b_n", hiddenSize);

        WeightInit.xavier(updateWeights.values(), totalInputSize, hiddenSize, random);
        WeightInit.xavier(resetWeights.values(), totalInputSize, hiddenSize, random);
        WeightInit.xavier(candidateWeights.values(), totalInputSize, hiddenSize, random);
    }

    public Context forward(float[] input) {
        if (input.length == 0 || input.length % inputSize != 0)
            throw new IllegalArgumentException(String.format(
                "Input length %d is not a positive multiple of input size %d", input.length, inputSize));

        int seqLen = input.length / inputSize;
        Context ctx = new Context(seqLen, inputSize, hiddenSize);
        float[] concat = new float[totalInputSize];

        for (int step = 0; step < seqLen; step++) {
            int t = timeIndex(step, seqLen);
            float[] x = ctx.inputs[step];
            float[] prevHidden = ctx.hiddenStates[step];
            float[] z = ctx.updateGates[step];
            float[] r = ctx.resetGates[step];
            float[] n = ctx.candidates[step];
            float[] rh = ctx.resetHidden[step];
            float[] hidden = ctx.hiddenStates[step + 1];

            System.arraycopy(input, t * inputSize, x, 0, inputSize);

            // Gates: [x_t, h_{t-1}]
            System.arraycopy(x, 0, concat, 0, inputSize);
            System.arraycopy(prevHidden, 0, concat, inputSize, hiddenSize);
            preActivations(concat, updateWeights.values(), updateBias.values(), z);
            preActivations(concat, resetWeights.values(), resetBias.values(), r);
            for (int j = 0; j < hiddenSize; j++) {
                z[j] = Utils.sigmoid(z[j]);
                r[j] = Utils.sigmoid(r[j]);
                rh[j] = r[j] * prevHidden[j];
            }

            // Candidate: [x_t, r_t ⊙ h_{t-1}]
            System.arraycopy(rh, 0, concat, inputSize, hiddenSize);
            preActivations(concat, candidateWeights.values(), candidateBias.values(), n);
            for (int j = 0; j < hiddenSize; j++) {
                n[j] = (float) Math.tanh(n[j]);
                hidden[j] = (1 - z[j]) * prevHidden[j] + z[j] * n[j];
            }

            System.arraycopy(hidden, 0, ctx.output, t * hiddenSize, hiddenSize);
        }
        return ctx;
    }

    /**
     * Backpropagation through time for one sample.
     *
     * @param outputGradient gradient with respect to {@link Context#output}, time order
     * @return gradient with respect to the input row, time order
     */
    public float[] backward(Context ctx, float[] outputGradient, Gradients gradients) {
        int seqLen = ctx.seqLen;
        float[] inputGradient = new float[seqLen * inputSize];

        float[] wz = updateWeights.values();
        float[] wr = resetWeights.values();
        float[] wn = candidateWeights.values();
        float[] dWz = gradients.of(updateWeights);
        float[] dWr = gradients.of(resetWeights);
        float[] dWn = gradients.of(candidateWeights);
        float[] dBz = gradients.of(updateBias);
        float[] dBr = gradients.of(resetBias);
        float[] dBn = gradients.of(candidateBias);

        float[] nextHiddenGrad = new float[hiddenSize];
        float[] dh = new float[hiddenSize];
        float[] dzPre = new float[hiddenSize];
        float[] drPre = new float[hiddenSize];
        float[] dnPre = new float[hiddenSize];
        float[] dPrevHidden = new float[hiddenSize];

        for (int step = seqLen - 1; step >= 0; step--) {
            int t = timeIndex(step, seqLen);
            float[] x = ctx.inputs[step];
            float[] prevHidden = ctx.hiddenStates[step];
            float[] z = ctx.updateGates[step];
            float[] r = ctx.resetGates[step];
            float[] n = ctx.candidates[step];
            float[] rh = ctx.resetHidden[step];

            for (int j = 0; j < hiddenSize; j++) {
                dh[j] = outputGradient[t * hiddenSize + j] + nextHiddenGrad[j];
                float dn = dh[j] * z[j];
                float dz = dh[j] * (n[j] - prevHidden[j]);
                dnPre[j] = dn * (1 - n[j] * n[j]);
                dzPre[j] = dz * z[j] * (1 - z[j]);
                dPrevHidden[j] = dh[j] * (1 - z[j]);
            }

            int xOffset = t * inputSize;

            // Candidate path: inputs [x_t, r_t ⊙ h_{t-1}]
            for (int j = 0; j < hiddenSize; j++)
                dBn[j] += dnPre[j];
            for (int k = 0; k < inputSize; k++) {
                int row = k * hiddenSize;
                float sum = 0;
                for (int j = 0; j < hiddenSize; j++) {
                    dWn[row + j] += x[k] * dnPre[j];
                    sum += wn[row + j] * dnPre[j];
                }
                inputGradient[xOffset + k] += sum;
            }
            for (int m = 0; m < hiddenSize; m++) {
                int row = (inputSize + m) * hiddenSize;
                float dResetHidden = 0;
                for (int j = 0; j < hiddenSize; j++) {
                    dWn[row + j] += rh[m] * dnPre[j];
                    dResetHidden += wn[row + j] * dnPre[j];
                }
                float dr = dResetHidden * prevHidden[m];
                drPre[m] = dr * r[m] * (1 - r[m]);
                dPrevHidden[m] += dResetHidden * r[m];
            }

            // Gate paths: inputs [x_t, h_{t-1}]
            for (int j = 0; j < hiddenSize; j++) {
                dBz[j] += dzPre[j];
                dBr[j] += drPre[j];
            }
            for (int k = 0; k < totalInputSize; k++) {
                float c = k < inputSize ? x[k] : prevHidden[k - inputSize];
                int row = k * hiddenSize;
                float sum = 0;
                for (int j = 0; j < hiddenSize; j++) {
                    dWz[row + j] += c * dzPre[j];
                    dWr[row + j] += c * drPre[j];
                    sum += wz[row + j] * dzPre[j] + wr[row + j] * drPre[j];
                }
                if (k < inputSize)
                    inputGradient[xOffset + k] += sum;
                else
                    dPrevHidden[k - inputSize] += sum;
            }

            System.arraycopy(dPrevHidden, 0, nextHiddenGrad, 0, hiddenSize);
        }
        return inputGradient;
    }

    private void preActivations(float[] concat, float[] weights, float[] bias, float[] out) {
        System.arraycopy(bias, 0, out, 0, hiddenSize);
        for (int k = 0; k < totalInputSize; k++) {
            float c = concat[k];
            if (c == 0f)
                continue;
            int row = k * hiddenSize;
            for (int j = 0; j < hiddenSize; j++)
                out[j] += c * weights[row + j];
        }
    }

    private int timeIndex(int step, int seqLen) {
        return reverse ? seqLen - 1 - step : step;
    }

    public List<Parameter> parameters() {
        return List.of(updateWeights, resetWeights, candidateWeights, updateBias, resetBias, candidateBias);
    }

    public int getInputSize() {
        return inputSize;
    }

    public int getHiddenSize() {
        return hiddenSize;
    }

    public boolean isReverse() {
        return reverse;
    }
}

package dev.unitrain.layers;

import dev.unitrain.optimizers.Gradients;
import dev.unitrain.optimizers.Parameter;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Fully connected linear layer: {@code y[j] = b[j] + sum_k x[k] * W[k][j]}.
 *
 * <p>Weights are stored row-major by input, {@code W[k * outputSize + j]}.
 */
public class DenseLayer {

    private final int inputSize;
    private final int outputSize;
    private final Parameter weights;
    private final Parameter biases;

    public DenseLayer(String name, int inputSize, int outputSize, RandomGenerator random) {
        if (inputSize <= 0 || outputSize <= 0)
            throw new IllegalArgumentException(String.format(
                "Dense layer sizes must be positive: %d -> %d", inputSize, outputSize));
        this.inputSize = inputSize;
        this.outputSize = outputSize;
        this.weights = new Parameter(name + ".weight", inputSize * outputSize);
        this.biases = new Parameter(name + ".bias", outputSize);
        WeightInit.xavier(weights.values(), inputSize, outputSize, random);
    }

    public float[] forward(float[] input) {
        if (input.length != inputSize)
            throw new IllegalArgumentException(String.format(
                "Dense layer expects %d inputs, got %d", inputSize, input.length));

        float[] w = weights.values();
        float[] output = biases.values().clone();
        for (int k = 0; k < inputSize; k++) {
            float x = input[k];
            if (x == 0f)
                continue;
            int row = k * outputSize;
            for (int j = 0; j < outputSize; j++)
                output[j] += x * w[row + j];
        }
        return output;
    }

    /**
     * Accumulate parameter gradients for one sample and return the gradient with
     * respect to the input.
     */
    public float[] backward(float[] input, float[] outputGradient, Gradients gradients) {
        float[] w = weights.values();
        float[] dW = gradients.of(weights);
        float[] dB = gradients.of(biases);
        float[] inputGradient = new float[inputSize];

        for (int j = 0; j < outputSize; j++)
            dB[j] += outputGradient[j];

        for (int k = 0; k < inputSize; k++) {
            int row = k * outputSize;
            float x = input[k];
            float sum = 0;
            for (int j = 0; j < outputSize; j++) {
                dW[row + j] += x * outputGradient[j];
                sum += w[row + j] * outputGradient[j];
            }
            inputGradient[k] = sum;
        }
        return inputGradient;
    }

    public List<Parameter> parameters() {
        return List.of(weights, biases);
    }

    public int getInputSize() {
        return inputSize;
    }

    public int getOutputSize() {
        return outputSize;
    }
}

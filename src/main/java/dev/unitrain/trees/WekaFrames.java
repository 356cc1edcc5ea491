package dev.unitrain.trees;

import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.Utils;

import java.util.ArrayList;

/**
 * Converts float rows into Weka datasets over a subset of feature columns.
 *
 * <p>Every frame has numeric attributes {@code f0..f(k-1)} for the selected columns followed
 * by a numeric {@code target} class attribute.
 */
final class WekaFrames {

    private WekaFrames() {}

    static Instances header(int numFeatures) {
        ArrayList<Attribute> attributes = new ArrayList<>(numFeatures + 1);
        for (int i = 0; i < numFeatures; i++)
            attributes.add(new Attribute("f" + i));
        attributes.add(new Attribute("target"));

        Instances header = new Instances("residuals", attributes, 0);
        header.setClassIndex(numFeatures);
        return header;
    }

    /**
     * Training frame of the given rows with {@code targets[row]} as the class value.
     */
    static Instances frame(float[][] rows, int[] rowIndices, int[] features, double[] targets) {
        Instances data = new Instances(header(features.length), rowIndices.length);
        for (int row : rowIndices) {
            double[] values = new double[features.length + 1];
            for (int f = 0; f < features.length; f++)
                values[f] = rows[row][features[f]];
            values[features.length] = targets[row];
            data.add(new DenseInstance(1.0, values));
        }
        return data;
    }

    /**
     * Unlabeled instance for prediction, attached to {@code header}.
     */
    static Instance instance(float[] row, int[] features, Instances header) {
        double[] values = new double[features.length + 1];
        for (int f = 0; f < features.length; f++)
            values[f] = row[features[f]];
        values[features.length] = Utils.missingValue();

        Instance instance = new DenseInstance(1.0, values);
        instance.setDataset(header);
        return instance;
    }
}

package dev.unitrain.trees;

import weka.classifiers.trees.REPTree;
import weka.core.Instances;
import weka.core.SerializationHelper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * One regression tree of the ensemble, contributing to a single output.
 *
 * <p>The Weka tree decides which leaf a row falls into. Leaves are identified by their node
 * index in {@link REPTree#getMembershipValues}, which numbers nodes breadth first, so the
 * deepest node a row reaches has the highest index on its path. The value added to the
 * score is the regularized leaf value recorded for that index when the tree was fitted;
 * a leaf no fitted row reached contributes nothing.
 */
final class TreeStage {

    private final REPTree tree;
    private final int output;
    private final int[] features;
    private final Map<Integer, Double> leafValues;
    private Instances header;

    TreeStage(REPTree tree, int output, int[] features, Map<Integer, Double> leafValues) {
        this.tree = tree;
        this.output = output;
        this.features = features;
        this.leafValues = leafValues;
    }

    int output() {
        return output;
    }

    int[] features() {
        return features;
    }

    int leaf(float[] row) {
        if (header == null)
            header = WekaFrames.header(features.length);
        double[] membership;
        try {
            membership = tree.getMembershipValues(WekaFrames.instance(row, features, header));
        } catch (Exception e) {
            throw new IllegalStateException("Tree prediction failed", e);
        }
        for (int node = membership.length - 1; node >= 0; node--) {
            if (membership[node] > 0)
                return node;
        }
        throw new IllegalStateException("Row reached no node of the tree");
    }

    double predict(float[] row) {
        Double value = leafValues.get(leaf(row));
        return value != null ? value : 0.0;
    }

    int numLeaves() {
        return leafValues.size();
    }

    void writeTo(DataOutputStream out) throws IOException {
        out.writeInt(output);
        out.writeInt(features.length);
        for (int f : features)
            out.writeInt(f);

        out.writeInt(leafValues.size());
        for (Map.Entry<Integer, Double> leaf : leafValues.entrySet()) {
            out.writeDouble(leaf.getKey());
            out.writeDouble(leaf.getValue());
        }

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            SerializationHelper.write(bytes, tree);
        } catch (Exception e) {
            throw new IOException("Failed to serialize tree", e);
        }
        out.writeInt(bytes.size());
        bytes.writeTo(out);
    }

    static TreeStage readFrom(DataInputStream in) throws IOException {
        int output = in.readInt();
        int[] features = new int[in.readInt()];
        for (int i = 0; i < features.length; i++)
            features[i] = in.readInt();

        int leaves = in.readInt();
        Map<Integer, Double> leafValues = new HashMap<>();
        for (int i = 0; i < leaves; i++)
            leafValues.put(in.readInt(), in.readDouble());

        byte[] treeBytes = new byte[in.readInt()];
        in.readFully(treeBytes);
        try {
            REPTree tree = (REPTree) SerializationHelper.read(new ByteArrayInputStream(treeBytes));
            return new TreeStage(tree, output, features, leafValues);
        } catch (Exception e) {
            throw new IOException("Failed to deserialize tree", e);
        }
    }
}

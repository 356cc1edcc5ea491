package dev.unitrain.trees;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fitted boosting ensemble: a base score per output plus rounds of shrunken tree stages.
 *
 * <p>Raw score of output {@code k}: {@code base[k] + learningRate * sum(stage.predict(row))}
 * over the stages of every round that target {@code k}.
 */
public final class BoostedEnsemble {

    private final float[] baseScores;
    private final float learningRate;
    private final List<TreeStage[]> rounds;

    BoostedEnsemble(float[] baseScores, float learningRate, List<TreeStage[]> rounds) {
        this.baseScores = baseScores.clone();
        this.learningRate = learningRate;
        this.rounds = new ArrayList<>(rounds);
    }

    public int numOutputs() {
        return baseScores.length;
    }

    public int numRounds() {
        return rounds.size();
    }

    public float getLearningRate() {
        return learningRate;
    }

    List<TreeStage[]> rounds() {
        return Collections.unmodifiableList(rounds);
    }

    public float[][] rawScores(float[][] rows) {
        float[][] scores = new float[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            float[] score = baseScores.clone();
            for (TreeStage[] round : rounds) {
                for (TreeStage stage : round)
                    score[stage.output()] += (float) (learningRate * stage.predict(rows[i]));
            }
            scores[i] = score;
        }
        return scores;
    }

    public void writeTo(DataOutputStream out) throws IOException {
        out.writeInt(baseScores.length);
        for (float base : baseScores)
            out.writeFloat(base);
        out.writeFloat(learningRate);

        out.writeInt(rounds.size());
        for (TreeStage[] round : rounds) {
            out.writeInt(round.length);
            for (TreeStage stage : round)
                stage.writeTo(out);
        }
    }

    public static BoostedEnsemble readFrom(DataInputStream in) throws IOException {
        float[] baseScores = new float[in.readInt()];
        for (int i = 0; i < baseScores.length; i++)
            baseScores[i] = in.readFloat();
        float learningRate = in.readFloat();

        int numRounds = in.readInt();
        List<TreeStage[]> rounds = new ArrayList<>(numRounds);
        for (int r = 0; r < numRounds; r++) {
            TreeStage[] round = new TreeStage[in.readInt()];
            for (int s = 0; s < round.length; s++)
                round[s] = TreeStage.readFrom(in);
            rounds.add(round);
        }
        return new BoostedEnsemble(baseScores, learningRate, rounds);
    }
}

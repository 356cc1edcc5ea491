package dev.unitrain.trees;

/**
 * Tracks a held-out loss per boosting round and signals when it stops improving.
 *
 * <p>A round improves when its loss is strictly below the best so far. Boosting stops once
 * {@code patience} consecutive rounds pass without improvement.
 */
public final class EarlyStopping {

    private final int patience;
    private float bestLoss = Float.POSITIVE_INFINITY;
    private int bestRound = -1;
    private int roundsWithoutImprovement;

    public EarlyStopping(int patience) {
        if (patience <= 0)
            throw new IllegalArgumentException("Patience must be positive");
        this.patience = patience;
    }

    /**
     * @return true if boosting should stop after this round
     */
    public boolean update(int round, float loss) {
        if (loss < bestLoss) {
            bestLoss = loss;
            bestRound = round;
            roundsWithoutImprovement = 0;
            return false;
        }
        roundsWithoutImprovement++;
        return roundsWithoutImprovement >= patience;
    }

    public float getBestLoss() {
        return bestLoss;
    }

    /**
     * Zero-based index of the best round, or -1 before any round was recorded.
     */
    public int getBestRound() {
        return bestRound;
    }

    public int getRoundsWithoutImprovement() {
        return roundsWithoutImprovement;
    }
}

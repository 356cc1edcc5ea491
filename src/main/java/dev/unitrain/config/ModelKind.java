package dev.unitrain.config;

/**
 * Concrete model family behind a backend.
 */
public enum ModelKind {
    /** Stacked GRU sequence network trained batch by batch. */
    GRU("gru"),
    /** Gradient-boosted regression trees fitted once over the whole training split. */
    BOOSTED_TREES("boosted_trees");

    private final String key;

    ModelKind(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static ModelKind parse(String value) {
        String normalized = value.trim().toLowerCase();
        for (ModelKind kind : values()) {
            if (kind.key.equals(normalized))
                return kind;
        }
        throw new ConfigurationException("Unsupported model type: " + value
            + " (expected 'gru' or 'boosted_trees')");
    }
}

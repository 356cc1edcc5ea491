package dev.unitrain.backend;

import dev.unitrain.common.SeedContext;
import dev.unitrain.config.TrainConfig;
import dev.unitrain.data.DataShape;

/**
 * Creates the backend a config asks for.
 */
public final class ModelBackends {

    private ModelBackends() {}

    public static ModelBackend create(TrainConfig config, DataShape shape, SeedContext seeds) {
        return switch (config.getModelKind()) {
            case GRU -> new SequenceModel(config, shape, seeds);
            case BOOSTED_TREES -> new BoostedTreesModel(config, shape.rowWidth(), seeds);
        };
    }
}

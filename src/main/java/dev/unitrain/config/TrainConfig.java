package dev.unitrain.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Immutable settings of one run, validated once when built.
 *
 * <p>Built either programmatically:
 * <pre>{@code
 * TrainConfig config = TrainConfig.builder()
 *     .taskType(TaskType.CLASSIFY)
 *     .classLabels(List.of("none", "seizure"))
 *     .lossWeight(List.of(1.0f, 4.0f))
 *     .modelPath(Path.of("outputs/models/gru.ckpt"))
 *     .epochs(20).batchSize(32).seed(0)
 *     .useAccelerator(false).learningAnneal(1.1f).silent(true)
 *     .gru(GruConfig.builder().hiddenSize(64).numLayers(2).build())
 *     .build();
 * }</pre>
 * or from a {@code .properties} file through {@link #fromFile(Path)}, which reports every
 * missing required key in one {@link ConfigurationException}.
 */
public class TrainConfig {

    // Property keys
    public static final String TASK_TYPE = "task_type";
    public static final String CLASS_LABELS = "class_labels";
    public static final String CLASS_NAMES = "class_names";
    public static final String LOSS_WEIGHT = "loss_weight";
    public static final String MODEL_PATH = "model_path";
    public static final String EPOCHS = "epochs";
    public static final String BATCH_SIZE = "batch_size";
    public static final String SEED = "seed";
    public static final String CUDA = "cuda";
    public static final String LEARNING_ANNEAL = "learning_anneal";
    public static final String SILENT = "silent";
    public static final String MODEL_TYPE = "model_type";

    private final TaskType taskType;
    private final ModelKind modelKind;
    private final List<String> classLabels;
    private final List<Float> lossWeight;
    private final Path modelPath;
    private final int epochs;
    private final int batchSize;
    private final long seed;
    private final boolean useAccelerator;
    private final float learningAnneal;
    private final boolean silent;
    private final GruConfig gru;
    private final TreeConfig trees;

    private TrainConfig(Builder builder) {
        this.taskType = builder.taskType;
        this.modelKind = builder.modelKind;
        this.classLabels = Collections.unmodifiableList(new ArrayList<>(builder.classLabels));
        this.lossWeight = builder.lossWeight == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(builder.lossWeight));
        this.modelPath = builder.modelPath;
        this.epochs = builder.epochs;
        this.batchSize = builder.batchSize;
        this.seed = builder.seed;
        this.useAccelerator = builder.useAccelerator;
        this.learningAnneal = builder.learningAnneal;
        this.silent = builder.silent;
        this.gru = builder.gru != null ? builder.gru : GruConfig.defaults();
        this.trees = builder.trees != null ? builder.trees : TreeConfig.defaults();
    }

    public TaskType getTaskType() { return taskType; }
    public boolean isClassification() { return taskType == TaskType.CLASSIFY; }
    public ModelKind getModelKind() { return modelKind; }
    public List<String> getClassLabels() { return classLabels; }
    public List<Float> getLossWeight() { return lossWeight; }
    public Path getModelPath() { return modelPath; }
    public int getEpochs() { return epochs; }
    public int getBatchSize() { return batchSize; }
    public long getSeed() { return seed; }
    public boolean isUseAccelerator() { return useAccelerator; }
    public float getLearningAnneal() { return learningAnneal; }
    public boolean isSilent() { return silent; }
    public GruConfig getGru() { return gru; }
    public TreeConfig getTrees() { return trees; }

    /**
     * Number of model outputs: one score per class, or a single value for regression.
     */
    public int getOutputSize() {
        return isClassification() ? classLabels.size() : 1;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ===============================
    // PROPERTIES LOADING
    // ===============================

    public static TrainConfig fromFile(Path path) throws IOException {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    public static TrainConfig fromProperties(Properties props) {
        List<String> missing = new ArrayList<>();
        for (String key : List.of(TASK_TYPE, MODEL_PATH, EPOCHS, BATCH_SIZE, SEED, CUDA, LEARNING_ANNEAL, SILENT)) {
            if (!has(props, key))
                missing.add(key);
        }
        if (!has(props, CLASS_LABELS) && !has(props, CLASS_NAMES))
            missing.add(CLASS_LABELS);

        // loss_weight is only required once we know the task classifies
        TaskType taskType = has(props, TASK_TYPE) ? TaskType.parse(props.getProperty(TASK_TYPE)) : null;
        if (taskType == TaskType.CLASSIFY && !has(props, LOSS_WEIGHT))
            missing.add(LOSS_WEIGHT);

        if (!missing.isEmpty())
            throw ConfigurationException.missingKeys(missing);

        ModelKind kind = has(props, MODEL_TYPE) ? ModelKind.parse(props.getProperty(MODEL_TYPE)) : ModelKind.GRU;
        String labels = has(props, CLASS_LABELS) ? props.getProperty(CLASS_LABELS) : props.getProperty(CLASS_NAMES);

        Builder builder = builder()
            .taskType(taskType)
            .modelKind(kind)
            .classLabels(splitList(labels))
            .modelPath(Path.of(props.getProperty(MODEL_PATH).trim()))
            .epochs(parseInt(props, EPOCHS))
            .batchSize(parseInt(props, BATCH_SIZE))
            .seed(parseLong(props, SEED))
            .useAccelerator(parseBoolean(props, CUDA))
            .learningAnneal(parseFloat(props, LEARNING_ANNEAL))
            .silent(parseBoolean(props, SILENT));

        if (has(props, LOSS_WEIGHT)) {
            List<Float> weights = new ArrayList<>();
            for (String part : splitList(props.getProperty(LOSS_WEIGHT))) {
                weights.add(parseFloat(LOSS_WEIGHT, part));
            }
            builder.lossWeight(weights);
        }

        if (kind == ModelKind.GRU)
            builder.gru(gruFromProperties(props));
        else
            builder.trees(treesFromProperties(props));

        return builder.build();
    }

    private static GruConfig gruFromProperties(Properties props) {
        GruConfig.Builder gru = GruConfig.builder();
        if (has(props, "rnn_hidden_size")) gru.hiddenSize(parseInt(props, "rnn_hidden_size"));
        if (has(props, "rnn_n_layers")) gru.numLayers(parseInt(props, "rnn_n_layers"));
        if (has(props, "bidirectional")) gru.bidirectional(parseBoolean(props, "bidirectional"));
        if (has(props, "batch_norm")) gru.inputNormalization(parseBoolean(props, "batch_norm"));
        if (has(props, "optimizer")) gru.optimizer(OptimizerType.parse(props.getProperty("optimizer")));
        if (has(props, "lr")) gru.learningRate(parseFloat(props, "lr"));
        if (has(props, "momentum")) gru.momentum(parseFloat(props, "momentum"));
        if (has(props, "weight_decay")) gru.weightDecay(parseFloat(props, "weight_decay"));
        if (has(props, "max_norm")) gru.maxNorm(parseFloat(props, "max_norm"));
        if (has(props, "n_jobs")) gru.numThreads(parseInt(props, "n_jobs"));
        return gru.build();
    }

    private static TreeConfig treesFromProperties(Properties props) {
        TreeConfig.Builder trees = TreeConfig.builder();
        if (has(props, "n_estimators")) trees.nEstimators(parseInt(props, "n_estimators"));
        if (has(props, "max_depth")) trees.maxDepth(parseInt(props, "max_depth"));
        if (has(props, "min_data_in_leaf")) trees.minDataInLeaf(parseInt(props, "min_data_in_leaf"));
        if (has(props, "lr")) trees.learningRate(parseFloat(props, "lr"));
        if (has(props, "reg_alpha")) trees.regAlpha(parseFloat(props, "reg_alpha"));
        if (has(props, "reg_lambda")) trees.regLambda(parseFloat(props, "reg_lambda"));
        if (has(props, "subsample")) trees.subsample(parseFloat(props, "subsample"));
        if (has(props, "feature_fraction")) trees.featureFraction(parseFloat(props, "feature_fraction"));
        if (has(props, "early_stopping")) trees.earlyStopping(parseBoolean(props, "early_stopping"));
        if (has(props, "early_stopping_rounds")) trees.earlyStoppingRounds(parseInt(props, "early_stopping_rounds"));
        return trees.build();
    }

    private static boolean has(Properties props, String key) {
        String value = props.getProperty(key);
        return value != null && !value.isBlank();
    }

    private static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty())
                result.add(trimmed);
        }
        return result;
    }

    private static int parseInt(Properties props, String key) {
        try {
            return Integer.parseInt(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Key '" + key + "' must be an integer: " + props.getProperty(key), e);
        }
    }

    private static long parseLong(Properties props, String key) {
        try {
            return Long.parseLong(props.getProperty(key).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Key '" + key + "' must be an integer: " + props.getProperty(key), e);
        }
    }

    private static float parseFloat(Properties props, String key) {
        return parseFloat(key, props.getProperty(key));
    }

    private static float parseFloat(String key, String value) {
        try {
            return Float.parseFloat(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Key '" + key + "' must be a number: " + value, e);
        }
    }

    private static boolean parseBoolean(Properties props, String key) {
        String value = props.getProperty(key).trim();
        if (value.equalsIgnoreCase("true"))
            return true;
        if (value.equalsIgnoreCase("false"))
            return false;
        throw new ConfigurationException("Key '" + key + "' must be true or false: " + value);
    }

    // ===============================
    // BUILDER
    // ===============================

    public static class Builder {
        private TaskType taskType;
        private ModelKind modelKind = ModelKind.GRU;
        private List<String> classLabels;
        private List<Float> lossWeight;
        private Path modelPath;
        private int epochs = -1;
        private int batchSize = -1;
        private long seed;
        private boolean seedSet;
        private float learningAnneal = 1.1f;
        private boolean useAccelerator;
        private boolean silent;
        private GruConfig gru;
        private TreeConfig trees;

        public Builder taskType(TaskType taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder modelKind(ModelKind modelKind) {
            this.modelKind = modelKind;
            return this;
        }

        public Builder classLabels(List<String> classLabels) {
            this.classLabels = classLabels;
            return this;
        }

        public Builder lossWeight(List<Float> lossWeight) {
            this.lossWeight = lossWeight;
            return this;
        }

        public Builder modelPath(Path modelPath) {
            this.modelPath = modelPath;
            return this;
        }

        public Builder epochs(int epochs) {
            if (epochs <= 0)
                throw new ConfigurationException("Epochs must be positive: " + epochs);
            this.epochs = epochs;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0)
                throw new ConfigurationException("Batch size must be positive: " + batchSize);
            this.batchSize = batchSize;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            this.seedSet = true;
            return this;
        }

        public Builder useAccelerator(boolean useAccelerator) {
            this.useAccelerator = useAccelerator;
            return this;
        }

        /**
         * Divisor applied to the learning rate after every training phase.
         */
        public Builder learningAnneal(float learningAnneal) {
            if (learningAnneal <= 0)
                throw new ConfigurationException("Learning anneal must be positive: " + learningAnneal);
            this.learningAnneal = learningAnneal;
            return this;
        }

        public Builder silent(boolean silent) {
            this.silent = silent;
            return this;
        }

        public Builder gru(GruConfig gru) {
            this.gru = gru;
            return this;
        }

        public Builder trees(TreeConfig trees) {
            this.trees = trees;
            return this;
        }

        public TrainConfig build() {
            List<String> missing = new ArrayList<>();
            if (taskType == null) missing.add(TASK_TYPE);
            if (modelKind == null) missing.add(MODEL_TYPE);
            if (classLabels == null) missing.add(CLASS_LABELS);
            if (taskType == TaskType.CLASSIFY && lossWeight == null) missing.add(LOSS_WEIGHT);
            if (modelPath == null) missing.add(MODEL_PATH);
            if (epochs < 0) missing.add(EPOCHS);
            if (batchSize < 0) missing.add(BATCH_SIZE);
            if (!seedSet) missing.add(SEED);
            if (!missing.isEmpty())
                throw ConfigurationException.missingKeys(missing);

            if (taskType == TaskType.CLASSIFY) {
                if (classLabels.size() < 2)
                    throw new ConfigurationException("Classification needs at least two class labels: " + classLabels);
                if (classLabels.size() != lossWeight.size())
                    throw new ConfigurationException(String.format(
                        "loss_weight needs one entry per class: %d class labels but %d weights",
                        classLabels.size(), lossWeight.size()));
            }
            return new TrainConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("TrainConfig[task=%s, model=%s, classes=%s, epochs=%d, batchSize=%d, seed=%d, path=%s]",
            taskType, modelKind.key(), classLabels, epochs, batchSize, seed, modelPath);
    }
}

package dev.unitrain.config;

/**
 * What the model predicts: a class index or a continuous value.
 */
public enum TaskType {
    CLASSIFY,
    REGRESS;

    public static TaskType parse(String value) {
        for (TaskType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim()))
                return type;
        }
        throw new ConfigurationException("Task type must be 'classify' or 'regress': " + value);
    }
}

package dev.unitrain.config;

public enum OptimizerType {
    SGD,
    ADAM;

    public static OptimizerType parse(String value) {
        for (OptimizerType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim()))
                return type;
        }
        throw new ConfigurationException("Optimizer must be 'sgd' or 'adam': " + value);
    }
}

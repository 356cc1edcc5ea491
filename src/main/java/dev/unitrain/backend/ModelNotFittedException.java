package dev.unitrain.backend;

/**
 * A backend was asked to predict, evaluate or save before it was fitted or loaded.
 */
public class ModelNotFittedException extends IllegalStateException {

    public ModelNotFittedException(String operation) {
        super("Cannot " + operation + ": model has not been fitted or loaded from a checkpoint");
    }
}

package dev.unitrain.optimizers;

/**
 * A named block of trainable values.
 *
 * <p>The index is the parameter's slot in its network's {@link Gradients}; it is assigned
 * once when the network registers the parameter.
 */
public final class Parameter {

    private final String name;
    private final float[] values;
    private int index = -1;

    public Parameter(String name, int size) {
        this(name, new float[size]);
    }

    public Parameter(String name, float[] values) {
        if (values.length == 0)
            throw new IllegalArgumentException("Parameter " + name + " cannot be empty");
        this.name = name;
        this.values = values;
    }

    public String name() {
        return name;
    }

    public float[] values() {
        return values;
    }

    public int size() {
        return values.length;
    }

    public int index() {
        if (index < 0)
            throw new IllegalStateException("Parameter " + name + " is not registered with a network");
        return index;
    }

    public void register(int index) {
        if (this.index >= 0)
            throw new IllegalStateException("Parameter " + name + " is already registered at slot " + this.index);
        this.index = index;
    }

    @Override
    public String toString() {
        return name + "[" + values.length + "]";
    }
}

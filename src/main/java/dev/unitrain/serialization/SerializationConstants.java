package dev.unitrain.serialization;

/**
 * Constants for the checkpoint file format.
 */
public final class SerializationConstants {

    // File format identification
    public static final int MAGIC_NUMBER = 0x554E5452; // "UNTR"
    public static final int CURRENT_VERSION = 1;

    // Type IDs for checkpointed backends
    public static final int TYPE_SEQUENCE_MODEL = 1;
    public static final int TYPE_BOOSTED_TREES_MODEL = 2;

    // File structure markers
    public static final int SECTION_END = 0x1999;

    private SerializationConstants() {} // Prevent instantiation
}

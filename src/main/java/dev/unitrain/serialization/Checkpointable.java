package dev.unitrain.serialization;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * State that can be written to and restored from a checkpoint file.
 *
 * <p>Each implementation owns its binary format; {@link CheckpointSerializer} wraps it
 * in the shared header, compression and end marker.
 */
public interface Checkpointable {

    /**
     * Write this object's state in a format {@link #readFrom} understands.
     *
     * @param version serialization version for compatibility
     */
    void writeTo(DataOutputStream out, int version) throws IOException;

    /**
     * Restore state written by {@link #writeTo} into this instance.
     */
    void readFrom(DataInputStream in, int version) throws IOException;

    /**
     * Type identifier stored in the header; a checkpoint is only ever restored into an
     * object with the same type id.
     */
    int getTypeId();
}

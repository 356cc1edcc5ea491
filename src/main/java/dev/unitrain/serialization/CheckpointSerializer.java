package dev.unitrain.serialization;

import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Compressed checkpoint files.
 *
 * <p>Layout (inside a zstd stream):
 * <pre>
 * int   MAGIC_NUMBER
 * int   version
 * int   type id
 * long  timestamp
 * ...   state written by {@link Checkpointable#writeTo}
 * int   SECTION_END
 * </pre>
 *
 * <p>Writes go to a temporary file next to the target which then replaces the target in
 * one move, so a crash mid-write leaves the previous checkpoint (or none) in place and
 * never a truncated one.
 */
public final class CheckpointSerializer {

    // Compression level: 1=fast, 22=max compression, 3=good balance
    private static final int COMPRESSION_LEVEL = 3;
    private static final int BUFFER_SIZE = 64 * 1024;
    static final String TEMP_SUFFIX = ".tmp";

    private CheckpointSerializer() {}

    public static void save(Checkpointable state, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);

        Path temp = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try {
            try (OutputStream fileOut = Files.newOutputStream(temp);
                 BufferedOutputStream buffered = new BufferedOutputStream(fileOut, BUFFER_SIZE);
                 ZstdOutputStream zstdOut = new ZstdOutputStream(buffered, COMPRESSION_LEVEL);
                 DataOutputStream out = new DataOutputStream(zstdOut)) {

                writeHeader(out, state.getTypeId());
                state.writeTo(out, SerializationConstants.CURRENT_VERSION);
                out.writeInt(SerializationConstants.SECTION_END);
            }
            move(temp, path);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Restore {@code state} from the checkpoint at {@code path}.
     *
     * @throws CheckpointLoadException if the file is missing, was written for a different
     *         type, or cannot be parsed
     */
    public static void load(Checkpointable state, Path path) throws CheckpointLoadException {
        if (!Files.isRegularFile(path))
            throw new CheckpointLoadException(path, "Checkpoint not found");

        try (InputStream fileIn = Files.newInputStream(path);
             BufferedInputStream buffered = new BufferedInputStream(fileIn, BUFFER_SIZE);
             ZstdInputStream zstdIn = new ZstdInputStream(buffered);
             DataInputStream in = new DataInputStream(zstdIn)) {

            int version = validateHeader(in, path, state.getTypeId());
            state.readFrom(in, version);

            int endMarker = in.readInt();
            if (endMarker != SerializationConstants.SECTION_END)
                throw new CheckpointLoadException(path, "Invalid checkpoint: missing end marker");
        } catch (CheckpointLoadException e) {
            throw e;
        } catch (NoSuchFileException e) {
            throw new CheckpointLoadException(path, "Checkpoint not found", e);
        } catch (IOException e) {
            throw new CheckpointLoadException(path, "Unreadable checkpoint (" + e.getMessage() + ")", e);
        }
    }

    private static void move(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            System.err.printf("Warning: atomic move not supported for %s, replacing in place%n", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void writeHeader(DataOutputStream out, int typeId) throws IOException {
        out.writeInt(SerializationConstants.MAGIC_NUMBER);
        out.writeInt(SerializationConstants.CURRENT_VERSION);
        out.writeInt(typeId);
        out.writeLong(System.currentTimeMillis()); // Timestamp
    }

    private static int validateHeader(DataInputStream in, Path path, int expectedType) throws IOException {
        int magic = in.readInt();
        if (magic != SerializationConstants.MAGIC_NUMBER)
            throw new CheckpointLoadException(path, "Invalid checkpoint: wrong magic number");

        int version = in.readInt();
        if (version > SerializationConstants.CURRENT_VERSION)
            throw new CheckpointLoadException(path, "Unsupported checkpoint version " + version
                + " (current version: " + SerializationConstants.CURRENT_VERSION + ")");

        int typeId = in.readInt();
        if (typeId != expectedType)
            throw new CheckpointLoadException(path, String.format(
                "Checkpoint holds model type %d but type %d was expected", typeId, expectedType));

        in.readLong(); // timestamp, informational only
        return version;
    }
}

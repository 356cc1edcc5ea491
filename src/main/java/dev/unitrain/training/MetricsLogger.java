package dev.unitrain.training;

import java.io.Closeable;
import java.io.IOException;
import java.util.Map;

/**
 * Destination for averaged metric values at the end of every phase.
 *
 * <p>Keys are {@code <phase>_<metric>}, for example {@code val_loss}. A value is NaN when
 * its metric saw no samples in the phase.
 */
public interface MetricsLogger extends Closeable {

    void update(int epoch, Map<String, Double> values) throws IOException;

    @Override
    default void close() throws IOException {
    }
}

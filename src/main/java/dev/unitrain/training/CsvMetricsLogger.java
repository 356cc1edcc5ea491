package dev.unitrain.training;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Writes metrics in long format, one {@code epoch,metric,value} row per value, so train and
 * validation updates with different keys share one file.
 */
public class CsvMetricsLogger implements MetricsLogger {

    static final String HEADER = "epoch,metric,value";

    private final BufferedWriter writer;

    /**
     * Create (or truncate) the file and write the header.
     */
    public CsvMetricsLogger(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        writer.write(HEADER);
        writer.newLine();
        writer.flush();
    }

    @Override
    public void update(int epoch, Map<String, Double> values) throws IOException {
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            double value = entry.getValue();
            writer.write(String.format(Locale.ROOT, "%d,%s,%s", epoch, entry.getKey(),
                                       Double.isNaN(value) ? "" : String.format(Locale.ROOT, "%.6f", value)));
            writer.newLine();
        }
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}

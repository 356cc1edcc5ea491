package dev.unitrain.training;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.Map;

/**
 * Appends one JSON object per update to a file:
 * <pre>
 * {"epoch": 0, "train_loss": 0.693147, "train_accuracy": 0.500000}
 * </pre>
 * NaN and infinite values are written as {@code null}.
 */
public class JsonLinesMetricsLogger implements MetricsLogger {

    private final Path path;
    private final BufferedWriter writer;

    public JsonLinesMetricsLogger(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        this.path = path;
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                                              StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public void update(int epoch, Map<String, Double> values) throws IOException {
        StringBuilder json = new StringBuilder();
        json.append("{\"epoch\": ").append(epoch);
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            json.append(", \"").append(escape(entry.getKey())).append("\": ");
            double value = entry.getValue();
            if (Double.isNaN(value) || Double.isInfinite(value))
                json.append("null");
            else
                json.append(String.format(Locale.ROOT, "%.6f", value));
        }
        json.append('}');

        writer.write(json.toString());
        writer.newLine();
        writer.flush();
    }

    private static String escape(String key) {
        return key.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}

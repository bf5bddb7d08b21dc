package work.cinit.trace.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Pretty-printed JSON form of an {@link ExtractionResult}.
 */
public final class TraceDocument {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private TraceDocument() {}

    public static String toJson(ExtractionResult result) {
        try {
            return WRITER.writeValueAsString(result.toSerializableMap());
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize traces", ex);
        }
    }

    public static void write(ExtractionResult result, Path path) {
        try {
            var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJson(result) + System.lineSeparator());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to write traces: " + path, ex);
        }
    }
}

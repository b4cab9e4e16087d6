package work.marlowe.kernel.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Shared Jackson mappers. Integers are always read as {@link java.math.BigInteger} so amounts and timestamps keep
 * full precision.
 */
public final class MarloweJson {
    private static final ObjectMapper JSON = configure(new ObjectMapper());
    private static final ObjectMapper YAML = configure(new ObjectMapper(new YAMLFactory()));
    private static final ObjectWriter PRETTY = JSON.writerWithDefaultPrettyPrinter();

    private MarloweJson() {}

    public static ObjectMapper json() {
        return JSON;
    }

    public static JsonNode parse(String payload) {
        try {
            return JSON.readTree(payload);
        } catch (JsonProcessingException ex) {
            throw new CodecException("Invalid JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Reads a JSON or YAML document, picking the parser from the file extension.
     */
    public static JsonNode read(Path path) {
        var mapper = isYaml(path) ? YAML : JSON;
        try (InputStream in = Files.newInputStream(path)) {
            var node = mapper.readTree(in);
            if (node == null || node.isMissingNode()) {
                throw new CodecException("Empty document: " + path);
            }
            return node;
        } catch (IOException ex) {
            throw new CodecException("Failed to read " + path + ": " + ex.getMessage(), ex);
        }
    }

    public static String toPrettyString(JsonNode node) {
        try {
            return PRETTY.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new CodecException("Unable to serialize JSON: " + ex.getOriginalMessage(), ex);
        }
    }

    private static boolean isYaml(Path path) {
        var name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }
}

package work.lcod.uber.basis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lcod.uber.shared.UberException;

/**
 * Reads a resolved library map (JSON or YAML) produced by an external resolver.
 *
 * <p>Accepted shapes are {@code {"libs": {...}}} or the libs object itself, where each lib is
 * {@code {"paths": [...], "optional": false, "dependents": [...]}}.
 */
public final class BasisLoader {
    // YAML is a superset of JSON, so one mapper covers both formats.
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private BasisLoader() {}

    public static Map<String, LibraryNode> loadFromFile(Path file, Path projectRoot) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(YAML_MAPPER.readTree(in), projectRoot);
        } catch (IOException ex) {
            throw new UberException(UberException.CONFIG, "Failed to read basis: " + file + ": " + ex.getMessage(), ex);
        }
    }

    public static Map<String, LibraryNode> parse(String text, Path projectRoot) {
        try {
            return parse(YAML_MAPPER.readTree(text), projectRoot);
        } catch (IOException ex) {
            throw new UberException(UberException.CONFIG, "Invalid basis: " + ex.getMessage(), ex);
        }
    }

    private static Map<String, LibraryNode> parse(JsonNode root, Path projectRoot) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return new LinkedHashMap<>();
        }
        JsonNode libsNode = root.has("libs") ? root.get("libs") : root;
        if (!libsNode.isObject()) {
            throw new UberException(UberException.CONFIG, "Basis libs must be an object");
        }
        Map<String, LibraryNode> libs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = libsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            libs.put(field.getKey(), toNode(field.getKey(), field.getValue(), projectRoot));
        }
        return libs;
    }

    private static LibraryNode toNode(String coordinate, JsonNode node, Path projectRoot) {
        if (!node.isObject()) {
            throw new UberException(UberException.CONFIG, "Lib " + coordinate + " must be an object");
        }
        List<Path> paths = new ArrayList<>();
        for (String raw : textArray(coordinate, node, "paths")) {
            Path provided = Path.of(raw);
            paths.add(provided.isAbsolute() ? provided.normalize() : projectRoot.resolve(provided).normalize());
        }
        Set<String> dependents = new LinkedHashSet<>(textArray(coordinate, node, "dependents"));
        boolean optional = node.path("optional").asBoolean(false);
        return new LibraryNode(coordinate, paths, optional, dependents);
    }

    private static List<String> textArray(String coordinate, JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new UberException(UberException.CONFIG, "Lib " + coordinate + " field `" + field + "` must be an array");
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (item.isTextual() && !item.asText().isBlank()) {
                items.add(item.asText());
            }
        }
        return items;
    }
}

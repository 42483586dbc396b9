package work.lcod.uber.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.uber.shared.UberException;

/**
 * Contents of an {@code uber.toml} build-parameter file: a {@code [build]} table of settings
 * and a {@code [manifest]} table of attribute overrides.
 */
public record ParamsFile(Map<String, String> build, Map<String, String> manifest) {
    public static final String DEFAULT_NAME = "uber.toml";

    public ParamsFile {
        build = Collections.unmodifiableMap(new LinkedHashMap<>(build));
        manifest = Collections.unmodifiableMap(new LinkedHashMap<>(manifest));
    }

    public static ParamsFile empty() {
        return new ParamsFile(Map.of(), Map.of());
    }

    public static ParamsFile load(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UberException(UberException.CONFIG, "Unable to read " + file + ": " + ex.getMessage(), ex);
        }
        return parse(text, file.toString());
    }

    public static ParamsFile parse(String text, String origin) {
        TomlParseResult result = Toml.parse(text);
        if (result.hasErrors()) {
            throw new UberException(UberException.CONFIG, "Unable to parse " + origin + ": " + result.errors().get(0));
        }
        return new ParamsFile(flatten(result.getTable("build"), origin), flatten(result.getTable("manifest"), origin));
    }

    public String get(String key) {
        return build.get(key);
    }

    private static Map<String, String> flatten(TomlTable table, String origin) {
        Map<String, String> values = new LinkedHashMap<>();
        if (table == null) {
            return values;
        }
        for (Map.Entry<String, Object> entry : table.toMap().entrySet()) {
            Object value = entry.getValue();
            if (value instanceof TomlTable) {
                throw new UberException(UberException.CONFIG, "Nested table `" + entry.getKey() + "` is not supported in " + origin);
            }
            values.put(entry.getKey(), String.valueOf(value));
        }
        return values;
    }
}

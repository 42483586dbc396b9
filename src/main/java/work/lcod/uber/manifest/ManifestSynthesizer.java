package work.lcod.uber.manifest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.jar.Attributes;
import java.util.jar.Manifest;
import work.lcod.uber.shared.UberException;

/**
 * Builds the main attributes of the uberjar manifest.
 *
 * <p>Precedence, lowest first: fixed attributes, derived attributes ({@code Main-Class},
 * {@code Multi-Release}), caller overrides.
 */
public final class ManifestSynthesizer {
    public static final String DEFAULT_CREATED_BY = "work.lcod/lcod-uber";
    static final String MULTI_RELEASE_DIR = "META-INF/versions";

    private ManifestSynthesizer() {}

    public static Map<String, String> synthesize(
        Path workingDir,
        Optional<String> main,
        Map<String, String> overrides,
        String createdBy
    ) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("Manifest-Version", "1.0");
        attributes.put("Created-By", createdBy);
        attributes.put("Build-Jdk-Spec", System.getProperty("java.specification.version"));
        main.filter(value -> !value.isBlank())
            .ifPresent(value -> attributes.put("Main-Class", toBinaryName(value)));
        if (Files.isDirectory(workingDir.resolve(MULTI_RELEASE_DIR))) {
            attributes.put("Multi-Release", "true");
        }
        for (Map.Entry<String, String> override : overrides.entrySet()) {
            attributes.keySet().removeIf(name -> name.equalsIgnoreCase(override.getKey()));
            attributes.put(override.getKey(), override.getValue());
        }
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Namespace names use hyphens where class names need underscores: {@code my-app.core} becomes
     * {@code my_app.core}.
     */
    public static String toBinaryName(String main) {
        return main.replace('-', '_');
    }

    public static Manifest toManifest(Map<String, String> attributes) {
        Manifest manifest = new Manifest();
        Attributes main = manifest.getMainAttributes();
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            String value = attribute.getValue();
            if (value != null && value.chars().anyMatch(c -> c == '\r' || c == '\n' || c == 0)) {
                throw new UberException(UberException.CONFIG, "Manifest attribute " + attribute.getKey() + " contains a line break or NUL");
            }
            try {
                main.put(new Attributes.Name(attribute.getKey()), attribute.getValue());
            } catch (IllegalArgumentException ex) {
                throw new UberException(UberException.CONFIG, "Invalid manifest attribute name: " + attribute.getKey(), ex);
            }
        }
        return manifest;
    }
}

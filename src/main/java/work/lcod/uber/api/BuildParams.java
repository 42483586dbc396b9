package work.lcod.uber.api;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable build parameters: where the project lives and where build output goes.
 *
 * <p>Defaults are combined with caller overrides once, through {@link #withOverrides(Map)};
 * nothing here is shared or mutable.
 */
public record BuildParams(Path projectRoot, String targetDir, String classDir) {
    public static final String DEFAULT_TARGET_DIR = "target";
    public static final String DEFAULT_CLASS_DIR = "target/classes";

    public BuildParams {
        projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        Objects.requireNonNull(targetDir, "targetDir");
        Objects.requireNonNull(classDir, "classDir");
    }

    public static BuildParams defaults(Path projectRoot) {
        return new BuildParams(projectRoot, DEFAULT_TARGET_DIR, DEFAULT_CLASS_DIR);
    }

    /**
     * Applies {@code target-dir} and {@code class-dir} overrides; blank or absent values keep the
     * current setting.
     */
    public BuildParams withOverrides(Map<String, String> overrides) {
        return new BuildParams(
            projectRoot,
            pick(overrides.get("target-dir"), targetDir),
            pick(overrides.get("class-dir"), classDir)
        );
    }

    /**
     * Resolves {@code path} against the project root unless it is already absolute.
     */
    public Path resolvePath(String path) {
        Path provided = Path.of(path);
        return provided.isAbsolute() ? provided.normalize() : projectRoot.resolve(provided).normalize();
    }

    public Path resolvedClassDir() {
        return resolvePath(classDir);
    }

    public Path resolvedTargetDir() {
        return resolvePath(targetDir);
    }

    private static String pick(String override, String fallback) {
        return override == null || override.isBlank() ? fallback : override;
    }
}

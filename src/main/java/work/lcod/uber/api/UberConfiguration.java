package work.lcod.uber.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.uber.basis.LibraryNode;
import work.lcod.uber.manifest.ManifestSynthesizer;
import work.lcod.uber.merge.ConflictListener;

/**
 * Immutable input of one uberjar assembly.
 */
public record UberConfiguration(
    Map<String, LibraryNode> libs,
    Path classDir,
    Path uberFile,
    Optional<String> main,
    Map<String, String> manifest,
    String createdBy,
    ConflictListener conflictListener
) {
    public UberConfiguration {
        libs = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(libs, "libs")));
        Objects.requireNonNull(classDir, "classDir");
        Objects.requireNonNull(uberFile, "uberFile");
        Objects.requireNonNull(main, "main");
        manifest = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(manifest, "manifest")));
        Objects.requireNonNull(createdBy, "createdBy");
        Objects.requireNonNull(conflictListener, "conflictListener");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Map<String, LibraryNode> libs = new LinkedHashMap<>();
        private Path classDir;
        private Path uberFile;
        private Optional<String> main = Optional.empty();
        private final Map<String, String> manifest = new LinkedHashMap<>();
        private String createdBy = ManifestSynthesizer.DEFAULT_CREATED_BY;
        private ConflictListener conflictListener = ConflictListener.SILENT;

        public Builder libs(Map<String, LibraryNode> libs) {
            this.libs = new LinkedHashMap<>(libs);
            return this;
        }

        public Builder lib(LibraryNode lib) {
            this.libs.put(lib.coordinate(), lib);
            return this;
        }

        public Builder classDir(Path classDir) {
            this.classDir = classDir;
            return this;
        }

        public Builder uberFile(Path uberFile) {
            this.uberFile = uberFile;
            return this;
        }

        public Builder main(String main) {
            this.main = Optional.ofNullable(main).filter(value -> !value.isBlank());
            return this;
        }

        /**
         * Adds a manifest override; the value is converted to text ({@code null} becomes empty).
         */
        public Builder manifestAttribute(String name, Object value) {
            this.manifest.put(name, value == null ? "" : String.valueOf(value));
            return this;
        }

        public Builder manifest(Map<String, ?> attributes) {
            attributes.forEach(this::manifestAttribute);
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder conflictListener(ConflictListener conflictListener) {
            this.conflictListener = conflictListener;
            return this;
        }

        public UberConfiguration build() {
            return new UberConfiguration(libs, classDir, uberFile, main, manifest, createdBy, conflictListener);
        }
    }
}

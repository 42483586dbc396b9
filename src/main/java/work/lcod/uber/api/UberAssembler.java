package work.lcod.uber.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.uber.archive.JarPackager;
import work.lcod.uber.basis.LibraryNode;
import work.lcod.uber.basis.OptionalPruner;
import work.lcod.uber.manifest.ManifestSynthesizer;
import work.lcod.uber.merge.ArchiveExtractor;
import work.lcod.uber.shared.FileTrees;
import work.lcod.uber.shared.UberException;

/**
 * Merges the libraries of a resolved basis plus compiled output into one executable jar.
 *
 * <p>Sources are exploded into a private temporary directory in basis order, the compiled
 * output last. The directory is removed when assembly finishes, whether it succeeded or not.
 * Concurrent calls are independent as long as they target different jars.
 */
public final class UberAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(UberAssembler.class);

    private final Path tempRoot;

    public UberAssembler() {
        this(null);
    }

    /**
     * @param tempRoot directory that receives the working directories, or {@code null} for the
     *     system default
     */
    public UberAssembler(Path tempRoot) {
        this.tempRoot = tempRoot;
    }

    public AssemblyReport assemble(UberConfiguration configuration) {
        Path workingDir = createWorkingDirectory();
        try {
            return assembleInto(workingDir, configuration);
        } finally {
            try {
                FileTrees.deleteRecursively(workingDir);
            } catch (IOException ex) {
                LOG.warn("Unable to delete working directory {}: {}", workingDir, ex.getMessage());
            }
        }
    }

    private AssemblyReport assembleInto(Path workingDir, UberConfiguration configuration) {
        Map<String, LibraryNode> kept = OptionalPruner.prune(configuration.libs());
        List<String> pruned = new ArrayList<>();
        for (String coordinate : configuration.libs().keySet()) {
            if (!kept.containsKey(coordinate)) {
                pruned.add(coordinate);
            }
        }
        if (!pruned.isEmpty()) {
            LOG.debug("Pruned optional libs {}", pruned);
        }

        List<Path> sources = resolveSources(kept, configuration.classDir());
        Path uberFile = configuration.uberFile().toAbsolutePath().normalize();
        try {
            FileTrees.ensureParent(uberFile);
        } catch (IOException ex) {
            throw new UberException(UberException.ARCHIVE_WRITE, "Unable to create parent of " + uberFile + ": " + ex.getMessage(), ex);
        }

        ArchiveExtractor extractor = new ArchiveExtractor(workingDir, configuration.conflictListener());
        for (Path source : sources) {
            extractor.extract(source);
        }

        Map<String, String> attributes = ManifestSynthesizer.synthesize(
            workingDir,
            configuration.main(),
            configuration.manifest(),
            configuration.createdBy()
        );
        int files = JarPackager.write(uberFile, ManifestSynthesizer.toManifest(attributes), workingDir);
        LOG.info("Wrote {} ({} files, {} conflicts)", uberFile, files, extractor.conflicts());

        return new AssemblyReport(
            uberFile,
            sources,
            new ArrayList<>(kept.keySet()),
            pruned,
            files,
            extractor.conflicts(),
            attributes
        );
    }

    /**
     * Library paths in basis order, then the compiled output. Local classes come last so that
     * reader descriptors from the project merge over those of its dependencies.
     */
    static List<Path> resolveSources(Map<String, LibraryNode> libs, Path classDir) {
        List<Path> sources = new ArrayList<>();
        for (LibraryNode lib : libs.values()) {
            sources.addAll(lib.paths());
        }
        if (Files.isDirectory(classDir)) {
            sources.add(classDir);
        } else {
            LOG.debug("No compiled output at {}", classDir);
        }
        return sources;
    }

    private Path createWorkingDirectory() {
        try {
            return tempRoot == null ? Files.createTempDirectory("uber") : Files.createTempDirectory(tempRoot, "uber");
        } catch (IOException ex) {
            throw new UberException(UberException.MERGE_WRITE, "Unable to create working directory: " + ex.getMessage(), ex);
        }
    }
}

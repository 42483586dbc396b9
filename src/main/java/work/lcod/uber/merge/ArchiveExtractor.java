package work.lcod.uber.merge;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Objects;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.uber.shared.FileTrees;
import work.lcod.uber.shared.UberException;

/**
 * Merges library sources (jar archives or exploded directories) into one working directory.
 *
 * <p>Entries are handled one at a time. Excluded paths are dropped, new paths are copied
 * verbatim with their timestamp, and paths that already exist are resolved: reader
 * descriptors are merged, anything else keeps the copy written first. Every conflict is
 * reported to the {@link ConflictListener}.
 *
 * <p>Instances are bound to a single working directory and are not thread-safe.
 */
public final class ArchiveExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(ArchiveExtractor.class);
    private static final int BUFFER_SIZE = 8192;

    private final Path workingDir;
    private final ConflictListener conflictListener;
    private int filesWritten;
    private int conflicts;

    public ArchiveExtractor(Path workingDir, ConflictListener conflictListener) {
        this.workingDir = Objects.requireNonNull(workingDir, "workingDir").toAbsolutePath().normalize();
        this.conflictListener = Objects.requireNonNull(conflictListener, "conflictListener");
    }

    public void extract(Path source) {
        try {
            if (Files.isDirectory(source)) {
                extractDirectory(source);
            } else if (Files.isRegularFile(source)) {
                extractArchive(source);
            } else {
                throw new UberException(UberException.SOURCE_READ, "Source does not exist: " + source);
            }
        } catch (IOException ex) {
            throw new UberException(UberException.MERGE_WRITE, "Failed to merge " + source + ": " + ex.getMessage(), ex);
        }
    }

    public int filesWritten() {
        return filesWritten;
    }

    public int conflicts() {
        return conflicts;
    }

    private void extractArchive(Path archive) throws IOException {
        LOG.debug("Exploding archive {}", archive);
        byte[] buffer = new byte[BUFFER_SIZE];
        try (ZipArchiveInputStream zip = openArchive(archive)) {
            ZipArchiveEntry entry;
            while ((entry = nextEntry(zip, archive)) != null) {
                String name = stripLeadingSlashes(entry.getName());
                if (name.isEmpty()) {
                    continue;
                }
                Path target = resolveTarget(name, archive);
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                long time = entry.getTime();
                mergeEntry(name, target, zip, time == -1 ? null : FileTime.fromMillis(time), archive, buffer);
            }
        }
    }

    private void extractDirectory(Path dir) throws IOException {
        LOG.debug("Copying directory {}", dir);
        byte[] buffer = new byte[BUFFER_SIZE];
        List<Path> paths;
        try {
            paths = FileTrees.listSorted(dir);
        } catch (IOException ex) {
            throw readFailure(dir, ex);
        }
        for (Path path : paths) {
            String name = FileTrees.entryName(dir, path);
            Path target = resolveTarget(name, dir);
            if (Files.isDirectory(path)) {
                Files.createDirectories(target);
                continue;
            }
            FileTime time;
            InputStream in;
            try {
                time = Files.getLastModifiedTime(path);
                in = new BufferedInputStream(Files.newInputStream(path));
            } catch (IOException ex) {
                throw readFailure(path, ex);
            }
            try (in) {
                mergeEntry(name, target, in, time, dir, buffer);
            }
        }
    }

    private void mergeEntry(String name, Path target, InputStream in, FileTime time, Path source, byte[] buffer)
        throws IOException {
        if (EntryRules.isExcluded(name)) {
            LOG.trace("Excluding {} from {}", name, source);
            return;
        }
        FileTrees.ensureParent(target);
        if (!Files.exists(target)) {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target))) {
                copy(in, out, buffer, source);
            }
            if (time != null) {
                Files.setLastModifiedTime(target, time);
            }
            filesWritten++;
            return;
        }

        conflicts++;
        if (EntryRules.isReaderDescriptor(name)) {
            ByteArrayOutputStream incoming = new ByteArrayOutputStream(1024);
            copy(in, incoming, buffer, source);
            String existing = Files.readString(target, StandardCharsets.UTF_8);
            String merged = ReaderDescriptors.merge(existing, incoming.toString(StandardCharsets.UTF_8), name);
            Files.writeString(target, merged, StandardCharsets.UTF_8);
            conflictListener.onConflict(new MergeConflict(name, source, MergeConflict.Resolution.MERGED_READERS));
        } else {
            conflictListener.onConflict(new MergeConflict(name, source, MergeConflict.Resolution.KEPT_EXISTING));
        }
    }

    // Zip entries may carry absolute names; they land relative to the working directory.
    static String stripLeadingSlashes(String name) {
        int start = 0;
        while (start < name.length() && name.charAt(start) == '/') {
            start++;
        }
        return name.substring(start);
    }

    private Path resolveTarget(String name, Path source) {
        Path target = workingDir.resolve(name).normalize();
        if (!target.startsWith(workingDir)) {
            throw new UberException(UberException.UNSAFE_ENTRY, "Refusing to extract " + name + " from " + source);
        }
        return target;
    }

    private static void copy(InputStream in, OutputStream out, byte[] buffer, Path source) throws IOException {
        int size;
        while ((size = read(in, buffer, source)) != -1) {
            out.write(buffer, 0, size);
        }
    }

    private static int read(InputStream in, byte[] buffer, Path source) {
        try {
            return in.read(buffer);
        } catch (IOException ex) {
            throw readFailure(source, ex);
        }
    }

    private static ZipArchiveInputStream openArchive(Path archive) {
        try {
            return new ZipArchiveInputStream(new BufferedInputStream(Files.newInputStream(archive)), "UTF-8", true, true);
        } catch (IOException ex) {
            throw readFailure(archive, ex);
        }
    }

    private static ZipArchiveEntry nextEntry(ZipArchiveInputStream zip, Path archive) {
        try {
            return zip.getNextZipEntry();
        } catch (IOException ex) {
            throw readFailure(archive, ex);
        }
    }

    private static UberException readFailure(Path source, IOException ex) {
        return new UberException(UberException.SOURCE_READ, "Failed to read " + source + ": " + ex.getMessage(), ex);
    }
}

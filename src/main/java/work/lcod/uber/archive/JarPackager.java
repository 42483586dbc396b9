package work.lcod.uber.archive;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.jar.JarFile;
import java.util.jar.Manifest;
import org.apache.commons.compress.archivers.jar.JarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import work.lcod.uber.shared.FileTrees;
import work.lcod.uber.shared.UberException;

/**
 * Streams a merged working directory into a jar, manifest first.
 */
public final class JarPackager {
    private static final String META_INF = "META-INF";

    private JarPackager() {}

    /**
     * Writes {@code uberFile} and returns the number of file entries copied from {@code workingDir}
     * (the manifest not included).
     */
    public static int write(Path uberFile, Manifest manifest, Path workingDir) {
        int files = 0;
        try (JarArchiveOutputStream jar = new JarArchiveOutputStream(new BufferedOutputStream(Files.newOutputStream(uberFile)))) {
            jar.setEncoding("UTF-8");
            long now = System.currentTimeMillis();
            putDirectory(jar, META_INF + "/", now);
            ZipArchiveEntry manifestEntry = new ZipArchiveEntry(JarFile.MANIFEST_NAME);
            manifestEntry.setTime(now);
            jar.putArchiveEntry(manifestEntry);
            manifest.write(jar);
            jar.closeArchiveEntry();

            for (Path path : FileTrees.listSorted(workingDir)) {
                String name = FileTrees.entryName(workingDir, path);
                long modified = Files.getLastModifiedTime(path).toMillis();
                if (Files.isDirectory(path)) {
                    if (!META_INF.equals(name)) {
                        putDirectory(jar, name + "/", modified);
                    }
                    continue;
                }
                if (JarFile.MANIFEST_NAME.equals(name)) {
                    continue;
                }
                ZipArchiveEntry entry = new ZipArchiveEntry(name);
                entry.setTime(modified);
                jar.putArchiveEntry(entry);
                Files.copy(path, jar);
                jar.closeArchiveEntry();
                files++;
            }
            jar.finish();
        } catch (IOException ex) {
            throw new UberException(UberException.ARCHIVE_WRITE, "Failed to write " + uberFile + ": " + ex.getMessage(), ex);
        }
        return files;
    }

    private static void putDirectory(JarArchiveOutputStream jar, String name, long time) throws IOException {
        ZipArchiveEntry entry = new ZipArchiveEntry(name);
        entry.setTime(time);
        jar.putArchiveEntry(entry);
        jar.closeArchiveEntry();
    }
}

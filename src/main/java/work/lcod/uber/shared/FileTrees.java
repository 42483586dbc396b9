package work.lcod.uber.shared;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Filesystem helpers shared by the extractor and the archive writer.
 */
public final class FileTrees {
    private FileTrees() {}

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * Lists every path below {@code root} (the root itself excluded) in a stable, sorted order,
     * so parents always precede their children.
     */
    public static List<Path> listSorted(Path root) throws IOException {
        try (Stream<Path> stream = Files.walk(root)) {
            return stream
                .filter(path -> !path.equals(root))
                .sorted((a, b) -> entryName(root, a).compareTo(entryName(root, b)))
                .collect(Collectors.toCollection(ArrayList::new));
        }
    }

    /**
     * Archive-style name of {@code path} relative to {@code root}: forward slashes, no leading slash.
     */
    public static String entryName(Path root, Path path) {
        Path relative = root.relativize(path);
        List<String> segments = new ArrayList<>(relative.getNameCount());
        for (Path segment : relative) {
            segments.add(segment.toString());
        }
        return String.join("/", segments);
    }

    public static void ensureParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}

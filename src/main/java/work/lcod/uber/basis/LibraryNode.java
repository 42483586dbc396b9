package work.lcod.uber.basis;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One resolved library: where its content lives and who pulled it in.
 */
public record LibraryNode(String coordinate, List<Path> paths, boolean optional, Set<String> dependents) {
    public LibraryNode {
        Objects.requireNonNull(coordinate, "coordinate");
        paths = List.copyOf(Objects.requireNonNull(paths, "paths"));
        dependents = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(dependents, "dependents")));
    }

    public static LibraryNode required(String coordinate, List<Path> paths, Set<String> dependents) {
        return new LibraryNode(coordinate, paths, false, dependents);
    }

    public static LibraryNode optional(String coordinate, List<Path> paths, Set<String> dependents) {
        return new LibraryNode(coordinate, paths, true, dependents);
    }

    public boolean isRoot() {
        return dependents.isEmpty();
    }
}

package work.lcod.uber.merge;

import java.nio.file.Path;
import java.util.Objects;

/**
 * An entry whose target already existed, and what was done about it.
 */
public record MergeConflict(String path, Path source, Resolution resolution) {
    public MergeConflict {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(resolution, "resolution");
    }

    public enum Resolution {
        /** The previously written file was kept and the new entry discarded. */
        KEPT_EXISTING,
        /** Both reader descriptors were parsed and merged, later keys winning. */
        MERGED_READERS
    }
}

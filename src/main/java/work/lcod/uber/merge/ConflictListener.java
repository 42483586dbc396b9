package work.lcod.uber.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Observes entries that collided with a file already present in the working directory.
 */
@FunctionalInterface
public interface ConflictListener {
    ConflictListener SILENT = conflict -> {};

    void onConflict(MergeConflict conflict);

    static ConflictListener logging() {
        Logger log = LoggerFactory.getLogger(ConflictListener.class);
        return conflict -> {
            if (conflict.resolution() == MergeConflict.Resolution.KEPT_EXISTING) {
                log.warn("Conflict on {} from {}: keeping the first copy", conflict.path(), conflict.source());
            } else {
                log.info("Merged reader descriptor {} from {}", conflict.path(), conflict.source());
            }
        };
    }
}

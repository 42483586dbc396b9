package work.lcod.uber.merge;

import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Path rules applied to every entry merged into the working directory.
 */
public final class EntryRules {
    private static final List<Predicate<String>> EXCLUSIONS = List.of(
        fullMatch("(?:.*/)?project\\.clj"),
        fullMatch("META-INF/.*\\.(?:SF|RSA|DSA|MF)")
    );

    private static final Set<String> READER_DESCRIPTORS = Set.of("data_readers.clj", "data_readers.cljc");

    private EntryRules() {}

    /**
     * True when the entry must never reach the uberjar (project descriptors, signatures, manifests).
     */
    public static boolean isExcluded(String entryName) {
        for (Predicate<String> rule : EXCLUSIONS) {
            if (rule.test(entryName)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when the final segment names a reader descriptor whose content is merged on conflict.
     */
    public static boolean isReaderDescriptor(String entryName) {
        int slash = entryName.lastIndexOf('/');
        String fileName = slash >= 0 ? entryName.substring(slash + 1) : entryName;
        return READER_DESCRIPTORS.contains(fileName);
    }

    private static Predicate<String> fullMatch(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return name -> pattern.matcher(name).matches();
    }
}

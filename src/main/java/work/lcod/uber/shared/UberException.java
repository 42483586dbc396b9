package work.lcod.uber.shared;

/**
 * Failure raised while assembling an uberjar, tagged with a short machine-readable code.
 */
public final class UberException extends RuntimeException {
    public static final String SOURCE_READ = "source_read";
    public static final String MERGE_WRITE = "merge_write";
    public static final String READER_PARSE = "reader_parse";
    public static final String UNSAFE_ENTRY = "unsafe_entry";
    public static final String ARCHIVE_WRITE = "archive_write";
    public static final String INVALID_BASIS = "invalid_basis";
    public static final String CONFIG = "config";

    private final String code;

    public UberException(String code, String message) {
        super(message);
        this.code = code;
    }

    public UberException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}

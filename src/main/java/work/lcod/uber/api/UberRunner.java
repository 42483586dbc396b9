package work.lcod.uber.api;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import work.lcod.uber.shared.UberException;

/**
 * Public entry point for embedding the assembler; failures become a {@link UberResult}
 * instead of an exception.
 */
public final class UberRunner {
    private final UberAssembler assembler;

    public UberRunner() {
        this(new UberAssembler());
    }

    public UberRunner(UberAssembler assembler) {
        this.assembler = assembler;
    }

    public UberResult run(UberConfiguration configuration) {
        var started = Instant.now();
        try {
            var report = assembler.assemble(configuration);
            var metadata = new LinkedHashMap<String, Object>(report.toMetadata());
            metadata.put("durationMs", Duration.between(started, Instant.now()).toMillis());
            return UberResult.success(metadata, started);
        } catch (UberException ex) {
            return failure(ex.code(), ex, configuration, started);
        } catch (RuntimeException ex) {
            return failure("internal", ex, configuration, started);
        }
    }

    private UberResult failure(String code, Exception ex, UberConfiguration configuration, Instant started) {
        Map<String, Object> errorMeta = new LinkedHashMap<>();
        errorMeta.put("uberFile", configuration.uberFile().toString());
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace();
        }
        String message = ex.getMessage() == null || ex.getMessage().isBlank()
            ? ex.getClass().getSimpleName()
            : ex.getMessage();
        return UberResult.failure(code, message, errorMeta, started);
    }
}

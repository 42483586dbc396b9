package work.lcod.uber.api;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a successful assembly produced.
 */
public record AssemblyReport(
    Path uberFile,
    List<Path> sources,
    List<String> includedLibs,
    List<String> prunedLibs,
    int filesWritten,
    int conflicts,
    Map<String, String> manifest
) {
    public AssemblyReport {
        sources = List.copyOf(sources);
        includedLibs = List.copyOf(includedLibs);
        prunedLibs = List.copyOf(prunedLibs);
        manifest = Collections.unmodifiableMap(new LinkedHashMap<>(manifest));
    }

    public Map<String, Object> toMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("uberFile", uberFile.toString());
        metadata.put("sources", sources.stream().map(Path::toString).toList());
        metadata.put("includedLibs", includedLibs);
        metadata.put("prunedLibs", prunedLibs);
        metadata.put("filesWritten", filesWritten);
        metadata.put("conflicts", conflicts);
        metadata.put("manifest", manifest);
        return metadata;
    }
}

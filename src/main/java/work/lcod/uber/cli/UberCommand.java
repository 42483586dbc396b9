package work.lcod.uber.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.uber.api.BuildParams;
import work.lcod.uber.api.ParamsFile;
import work.lcod.uber.api.UberConfiguration;
import work.lcod.uber.api.UberResult;
import work.lcod.uber.api.UberRunner;
import work.lcod.uber.basis.BasisLoader;
import work.lcod.uber.merge.ConflictListener;

@CommandLine.Command(
    name = "lcod-uber",
    description = "Merge resolved libraries and compiled classes into one executable jar.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class UberCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-b", "--basis"},
        paramLabel = "FILE",
        description = "Resolved library map (JSON or YAML); falls back to `basis` in the params file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String basis;

    @CommandLine.Option(
        names = "--class-dir",
        description = "Compiled output directory (default: target/classes).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String classDir;

    @CommandLine.Option(
        names = {"-o", "--uber-file"},
        paramLabel = "JAR",
        description = "Output jar (default: <target-dir>/<project>-standalone.jar).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String uberFile;

    @CommandLine.Option(
        names = {"-m", "--main"},
        description = "Namespace or class used as Main-Class (hyphens become underscores).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String main;

    @CommandLine.Option(
        names = {"-M", "--manifest"},
        paramLabel = "NAME=VALUE",
        description = "Manifest attribute override; repeatable."
    )
    private Map<String, String> manifest = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--project-root",
        description = "Directory relative paths are resolved against (default: current directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String projectRoot;

    @CommandLine.Option(
        names = "--config",
        description = "Build parameter file (default: <project-root>/uber.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String config;

    @CommandLine.Option(
        names = "--warn-conflicts",
        description = "Log a warning for every conflicting entry that is dropped."
    )
    private boolean warnConflicts;

    @Override
    public Integer call() {
        Path root = projectRoot != null
            ? Paths.get(projectRoot).toAbsolutePath().normalize()
            : Paths.get("").toAbsolutePath();
        ParamsFile paramsFile = loadParamsFile(root);

        Map<String, String> buildOverrides = new LinkedHashMap<>(paramsFile.build());
        if (classDir != null) {
            buildOverrides.put("class-dir", classDir);
        }
        BuildParams params = BuildParams.defaults(root).withOverrides(buildOverrides);

        String basisPath = firstNonBlank(basis, paramsFile.get("basis"));
        if (basisPath == null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "A basis file is required (--basis or `basis` in the params file).");
        }
        Path basisFile = params.resolvePath(basisPath);
        if (!Files.isRegularFile(basisFile)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Basis file not found: " + basisFile);
        }

        Map<String, String> attributes = new LinkedHashMap<>(paramsFile.manifest());
        attributes.putAll(manifest);

        UberConfiguration.Builder builder = UberConfiguration.builder()
            .libs(BasisLoader.loadFromFile(basisFile, params.projectRoot()))
            .classDir(params.resolvedClassDir())
            .uberFile(resolveUberFile(params, paramsFile))
            .main(firstNonBlank(main, paramsFile.get("main")))
            .manifest(attributes)
            .conflictListener(warnConflicts ? ConflictListener.logging() : ConflictListener.SILENT);
        String createdBy = paramsFile.get("created-by");
        if (createdBy != null && !createdBy.isBlank()) {
            builder.createdBy(createdBy);
        }

        UberResult result = new UberRunner().run(builder.build());
        spec.commandLine().getOut().println(result.toPrettyJson());
        spec.commandLine().getOut().flush();
        return result.status().exitCode();
    }

    private ParamsFile loadParamsFile(Path root) {
        if (config != null) {
            Path file = Paths.get(config).toAbsolutePath().normalize();
            if (!Files.isRegularFile(file)) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Params file not found: " + file);
            }
            return ParamsFile.load(file);
        }
        Path candidate = root.resolve(ParamsFile.DEFAULT_NAME);
        return Files.isRegularFile(candidate) ? ParamsFile.load(candidate) : ParamsFile.empty();
    }

    private Path resolveUberFile(BuildParams params, ParamsFile paramsFile) {
        String configured = firstNonBlank(uberFile, paramsFile.get("uber-file"));
        if (configured != null) {
            return params.resolvePath(configured);
        }
        Path name = params.projectRoot().getFileName();
        String project = name != null ? name.toString() : "app";
        return params.resolvedTargetDir().resolve(project + "-standalone.jar");
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred;
        }
        return fallback != null && !fallback.isBlank() ? fallback : null;
    }
}

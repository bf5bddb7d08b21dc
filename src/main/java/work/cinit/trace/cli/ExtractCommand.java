package work.cinit.trace.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;
import work.cinit.trace.api.ExtractionConfiguration;
import work.cinit.trace.api.ExtractionRunner;
import work.cinit.trace.api.LogLevel;
import work.cinit.trace.api.RunResult;
import work.cinit.trace.shared.Listings;

@CommandLine.Command(
    name = "cinit-trace",
    description = "Extract the effect traces of C initialization routines.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ExtractCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--catalog"},
        required = true,
        description = "Fact catalog (YAML, or JSON by extension)."
    )
    private Path catalog;

    @CommandLine.Option(
        names = {"-t", "--trees"},
        required = true,
        description = "Parsed routine definitions (YAML, or JSON by extension)."
    )
    private Path trees;

    @CommandLine.Option(
        names = {"-s", "--settings"},
        description = "Extraction settings (TOML).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path settings;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the trace document here instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--listing",
        paramLabel = "ROUTINE",
        description = "Print the normalized listing of one routine and exit.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String listing;

    @Override
    public Integer call() {
        LogLevel logLevel = resolveLogLevel();
        Configurator.setRootLevel(logLevel.toLog4j());

        var configuration = ExtractionConfiguration.builder()
            .catalogFile(catalog)
            .treeFile(trees)
            .settingsFile(settings)
            .outputFile(output)
            .logLevel(logLevel)
            .build();
        var runner = new ExtractionRunner();
        var out = spec.commandLine().getOut();

        if (listing != null) {
            out.print(Listings.numbered(runner.listing(configuration, listing)));
            out.flush();
            return 0;
        }

        RunResult result = runner.run(configuration);
        if (result.status() == RunResult.Status.SUCCESS) {
            result.payload().ifPresent(out::println);
        } else {
            var err = spec.commandLine().getErr();
            err.println(spec.commandLine().getColorScheme().errorText(String.valueOf(result.metadata().get("error"))));
            if (result.metadata().get("listing") instanceof List<?> lines && !lines.isEmpty()) {
                err.print(Listings.numbered(lines.stream().map(String::valueOf).toList()));
            }
            err.flush();
        }
        out.flush();
        return result.status().exitCode();
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv("CINIT_LOG_LEVEL");
        }
        return LogLevel.from(candidate);
    }
}
